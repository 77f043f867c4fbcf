package com.ngramindex.storage;

import com.ngramindex.config.Constants;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * 符号表，在属性字符串与稠密整数ID之间双向映射。
 *
 * ID 按首次出现顺序分配；ID 0 固定为空串，同时作为句子边界标记。
 * 磁盘格式为 UTF-8 文本，每行一个符号，行号即ID。
 */
public final class SymbolTable {
    private static final int ABSENT = -1;

    private final ObjectArrayList<String> idToSymbol = new ObjectArrayList<>();
    private final Object2IntOpenHashMap<String> symbolToId = new Object2IntOpenHashMap<>();
    private volatile boolean locked;

    public SymbolTable() {
        symbolToId.defaultReturnValue(ABSENT);
        idToSymbol.add("");
        symbolToId.put("", Constants.SENTENCE_BOUNDARY);
    }

    /**
     * 返回符号的ID，若不存在则追加并分配新ID。
     *
     * @param symbol 属性字符串，不能包含换行符
     * @return 符号ID
     */
    public int intern(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("符号不能为null");
        }
        int existing = symbolToId.getInt(symbol);
        if (existing != ABSENT) {
            return existing;
        }
        if (locked) {
            throw new IllegalStateException("符号表已锁定，无法加入新符号: " + symbol);
        }
        if (symbol.indexOf('\n') >= 0 || symbol.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("符号不能包含换行符");
        }
        int id = idToSymbol.size();
        idToSymbol.add(symbol);
        symbolToId.put(symbol, id);
        return id;
    }

    /**
     * 按ID查找符号。
     *
     * @throws UnknownSymbolException ID从未分配
     */
    public String symbolOf(int id) {
        if (id < 0 || id >= idToSymbol.size()) {
            throw new UnknownSymbolException(id, idToSymbol.size());
        }
        return idToSymbol.get(id);
    }

    /**
     * 按符号查找ID，不修改符号表。
     */
    public OptionalInt idOf(String symbol) {
        int id = symbolToId.getInt(symbol);
        return id == ABSENT ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * 符号数量（含保留的空串）。
     */
    public int size() {
        return idToSymbol.size();
    }

    /**
     * 锁定符号表，之后只允许查询已有符号。
     */
    public void lock() {
        locked = true;
    }

    public boolean isLocked() {
        return locked;
    }

    /**
     * 按ID顺序写出全部符号，每个符号后跟换行。
     */
    public void writeTo(Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (String symbol : idToSymbol) {
                writer.write(symbol);
                writer.write('\n');
            }
        } catch (IOException exception) {
            throw new IOException("写入符号表失败: " + file, exception);
        }
    }

    /**
     * 从符号文件重建双向映射，返回的符号表已锁定。
     *
     * @throws IOException 文件缺失、首行非空或存在重复符号
     */
    public static SymbolTable readFrom(Path file) throws IOException {
        SymbolTable table = new SymbolTable();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String first = reader.readLine();
            if (first == null || !first.isEmpty()) {
                throw new IOException("符号表首行必须为空串: " + file);
            }
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                if (table.symbolToId.containsKey(line)) {
                    throw new IOException("符号表存在重复符号: line=" + lineNumber + ", file=" + file);
                }
                table.idToSymbol.add(line);
                table.symbolToId.put(line, lineNumber);
                lineNumber++;
            }
        }
        table.lock();
        return table;
    }
}
