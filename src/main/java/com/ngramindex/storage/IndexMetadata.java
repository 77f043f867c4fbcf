package com.ngramindex.storage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 索引元数据，对应 .info 文本文件。
 *
 * 每行一个键，格式为 "key type value"，type 为 int 或 string。
 * 读取时保留未知键，写回时原样输出。
 */
public final class IndexMetadata {
    private static final String TYPE_INT = "int";
    private static final String TYPE_STRING = "string";

    private final Map<String, Object> entries = new LinkedHashMap<>();

    public void putLong(String key, long value) {
        entries.put(checkKey(key), value);
    }

    public void putString(String key, String value) {
        if (value == null || value.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("元数据取值不能为null或包含换行: key=" + key);
        }
        entries.put(checkKey(key), value);
    }

    public OptionalLong getLong(String key) {
        Object value = entries.get(key);
        return value instanceof Long ? OptionalLong.of((Long) value) : OptionalLong.empty();
    }

    public Optional<String> getString(String key) {
        Object value = entries.get(key);
        return value instanceof String ? Optional.of((String) value) : Optional.empty();
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return Map.copyOf(entries);
    }

    /**
     * 写出全部键值。
     */
    public void writeTo(Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, Object> entry : entries.entrySet()) {
                String type = entry.getValue() instanceof Long ? TYPE_INT : TYPE_STRING;
                writer.write(entry.getKey() + " " + type + " " + entry.getValue());
                writer.write('\n');
            }
        } catch (IOException exception) {
            throw new IOException("写入索引元数据失败: " + file, exception);
        }
    }

    /**
     * 读取元数据文件，空行被忽略。
     *
     * @throws IOException 文件缺失、行格式错误、类型未知或整数非法
     */
    public static IndexMetadata readFrom(Path file) throws IOException {
        IndexMetadata metadata = new IndexMetadata();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.split(" ", 3);
                if (parts.length < 3) {
                    throw new IOException("元数据行格式错误: line=" + lineNumber + ", file=" + file);
                }
                String key = parts[0];
                String type = parts[1];
                String value = parts[2];
                if (TYPE_INT.equals(type)) {
                    try {
                        metadata.entries.put(key, Long.parseLong(value.trim()));
                    } catch (NumberFormatException exception) {
                        throw new IOException("元数据整数非法: key=" + key + ", value=" + value, exception);
                    }
                } else if (TYPE_STRING.equals(type)) {
                    metadata.entries.put(key, value);
                } else {
                    throw new IOException("元数据类型未知: key=" + key + ", type=" + type + ", file=" + file);
                }
            }
        }
        return metadata;
    }

    private static String checkKey(String key) {
        if (key == null || key.isEmpty() || key.contains(" ") || key.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("元数据键非法: " + key);
        }
        return key;
    }
}
