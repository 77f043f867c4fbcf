package com.ngramindex.config;

/**
 * 全局常量定义
 *
 * 包含索引文件格式、n-gram 比较参数、属性分隔符、元数据键和线程参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== n-gram 参数 ====================
    /** n-gram 比较器最多比较的词数，超过该长度的后缀视为相等 */
    public static final int NGRAM_LIMIT = 16;
    /** 句子边界标记，同时也是空串的符号ID */
    public static final int SENTENCE_BOUNDARY = 0;
    /** 文本查询允许的最大词数 */
    public static final int MAX_QUERY_TOKENS = 64;

    // ==================== 属性分隔符 ====================
    /** 复合属性名分隔符，如 lemma+pos */
    public static final String COMPOSITE_SEPARATOR = "+";
    /** 复合属性值分隔符（ASCII GS），不得出现在任何属性值中 */
    public static final String ATTRIBUTE_SEPARATOR = "\u001D";
    /** 真实词元的空属性值在语料流中的占位符（ASCII US），空串保留给句子边界，不得出现在任何属性值中 */
    public static final String MISSING_VALUE = "\u001F";
    /** 命令行属性列表分隔符，如 lemma:pos */
    public static final String ATTRIBUTE_LIST_SEPARATOR = ":";

    // ==================== 文件扩展名 ====================
    /** 元数据文件 */
    public static final String INFO_EXTENSION = ".info";
    /** 语料流文件 */
    public static final String CORPUS_EXTENSION = ".corpus";
    /** 后缀序文件 */
    public static final String SUFFIX_EXTENSION = ".suffix";
    /** 符号表文件 */
    public static final String SYMBOLS_EXTENSION = ".symbols";

    // ==================== 元数据键 ====================
    public static final String CORPUS_SIZE_KEY = "corpus_size";
    public static final String SENTENCE_COUNT_KEY = "sentence_count";
    public static final String ATTRIBUTES_KEY = "attributes";

    // ==================== 日志参数 ====================
    /** 每写入多少个句子输出一次进度日志 */
    public static final int PROGRESS_LOG_INTERVAL = 100;

    // ==================== 线程参数 ====================
    /** 默认后缀序构建线程数 */
    public static final int DEFAULT_BUILD_THREADS = Runtime.getRuntime().availableProcessors();
    /** 后缀序构建线程数上限 */
    public static final int MAX_BUILD_THREADS = 64;
}
