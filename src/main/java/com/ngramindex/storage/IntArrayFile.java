package com.ngramindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 定长整数数组文件读写。
 *
 * 文件没有头部和长度前缀，内容为按顺序排列的 32 位小端无符号整数，元素个数由文件大小推出。
 * 内存中以 int 保存，取值必须落在 [0, Integer.MAX_VALUE] 内。
 */
public final class IntArrayFile {
    private static final int CHUNK_INTS = 16 * 1024;

    private IntArrayFile() {
    }

    /**
     * 将 values 的前 length 个元素写入文件，覆盖已有内容。
     *
     * @throws IOException 写入失败时抛出
     */
    public static void write(Path file, int[] values, int length) throws IOException {
        if (values == null) {
            throw new IllegalArgumentException("values不能为null");
        }
        if (length < 0 || length > values.length) {
            throw new IllegalArgumentException("length越界: " + length + ", 数组长度=" + values.length);
        }
        ByteBuffer buffer = ByteBuffer.allocate(CHUNK_INTS * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            int offset = 0;
            while (offset < length) {
                int count = Math.min(CHUNK_INTS, length - offset);
                buffer.clear();
                for (int index = offset; index < offset + count; index++) {
                    if (values[index] < 0) {
                        throw new IllegalArgumentException("不能写入负数: index=" + index + ", value=" + values[index]);
                    }
                    buffer.putInt(values[index]);
                }
                buffer.flip();
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                offset += count;
            }
        } catch (IOException exception) {
            throw new IOException("写入整数数组文件失败: " + file, exception);
        }
    }

    /**
     * 读取整个文件为 int 数组。
     *
     * @throws java.nio.file.NoSuchFileException 文件不存在
     * @throws IOException 文件长度不是 4 的倍数、元素超出范围或读取失败
     */
    public static int[] read(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size % Integer.BYTES != 0) {
                throw new IOException("整数数组文件长度不是4的倍数，可能已损坏: " + file + ", size=" + size);
            }
            long elementCount = size / Integer.BYTES;
            if (elementCount > Integer.MAX_VALUE - 8) {
                throw new IOException("整数数组文件过大: " + file + ", elements=" + elementCount);
            }
            int[] values = new int[(int) elementCount];
            ByteBuffer buffer = ByteBuffer.allocate(CHUNK_INTS * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
            int filled = 0;
            while (filled < values.length) {
                buffer.clear();
                int wanted = Math.min(CHUNK_INTS, values.length - filled) * Integer.BYTES;
                buffer.limit(wanted);
                while (buffer.hasRemaining()) {
                    if (channel.read(buffer) < 0) {
                        throw new EOFException("读取整数数组时遇到 EOF: " + file);
                    }
                }
                buffer.flip();
                while (buffer.hasRemaining()) {
                    int value = buffer.getInt();
                    if (value < 0) {
                        throw new IOException("整数数组元素超出范围: index=" + filled
                            + ", value=" + Integer.toUnsignedString(value) + ", file=" + file);
                    }
                    values[filled++] = value;
                }
            }
            return values;
        }
    }
}
