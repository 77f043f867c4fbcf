package com.ngramindex.storage;

/**
 * 符号ID在符号表中不存在。通常意味着语料流与符号表文件不一致。
 */
public class UnknownSymbolException extends IndexOutOfBoundsException {
    private final int symbolId;
    private final int tableSize;

    public UnknownSymbolException(int symbolId, int tableSize) {
        super("符号ID越界: id=" + symbolId + ", 符号表大小=" + tableSize);
        this.symbolId = symbolId;
        this.tableSize = tableSize;
    }

    public int getSymbolId() {
        return symbolId;
    }

    public int getTableSize() {
        return tableSize;
    }
}
