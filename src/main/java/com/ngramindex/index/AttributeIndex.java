package com.ngramindex.index;

import com.ngramindex.config.Constants;
import com.ngramindex.storage.SymbolTable;
import it.unimi.dsi.fastutil.ints.IntComparators;
import it.unimi.dsi.fastutil.ints.IntHeapPriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 单个属性的索引：符号表 + 语料流 + 后缀序，对应磁盘上的 .symbols/.corpus/.suffix 三个文件。
 */
public final class AttributeIndex {
    private static final Logger logger = LoggerFactory.getLogger(AttributeIndex.class);

    private final String name;
    private final SymbolTable symbols;
    private final CorpusStream corpus;
    private SuffixOrder suffixOrder;

    /**
     * 创建空索引，用于写入语料。
     */
    public AttributeIndex(String name) {
        this(name, new SymbolTable(), new CorpusStream(), null);
    }

    private AttributeIndex(String name, SymbolTable symbols, CorpusStream corpus, SuffixOrder suffixOrder) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("属性名不能为空");
        }
        this.name = name;
        this.symbols = symbols;
        this.corpus = corpus;
        this.suffixOrder = suffixOrder;
    }

    public String name() {
        return name;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public CorpusStream corpus() {
        return corpus;
    }

    /**
     * 语料流长度（词元数 + 句子数）。
     */
    public int size() {
        return corpus.size();
    }

    public boolean isBuilt() {
        return suffixOrder != null;
    }

    /**
     * 将词元取值加入符号表并追加到语料流末尾。
     */
    public void appendWord(String word) {
        ensureWritable();
        if (word == null || word.isEmpty()) {
            throw new IllegalArgumentException("词元取值不能为空串，空串保留为句子边界: attribute=" + name);
        }
        corpus.append(symbols.intern(word));
    }

    public void appendSentenceBoundary() {
        ensureWritable();
        corpus.appendBoundary();
    }

    /**
     * 构建后缀序，之后索引只读。
     */
    public void buildSuffixArray() {
        long startNanos = System.nanoTime();
        suffixOrder = SuffixOrder.build(corpus);
        symbols.lock();
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("属性 {} 后缀序构建完成: positions={}, symbols={}, 用时 {}ms",
            name, corpus.size(), symbols.size(), elapsedMs);
    }

    public SuffixOrder suffixOrder() {
        ensureBuilt();
        return suffixOrder;
    }

    /**
     * 在整个后缀序中查找 ngram。
     *
     * @param ngram 非空且不含 0 的符号ID序列
     * @return 命中区间，区间大小即出现次数
     */
    public Optional<NgramRange> findNgramRange(int[] ngram) {
        validateNgram(ngram);
        ensureBuilt();
        return suffixOrder.findRange(corpus, ngram);
    }

    /**
     * 在后缀序的 [min, max] 范围内查找 ngram。
     */
    public Optional<NgramRange> findNgramRange(int[] ngram, int min, int max) {
        validateNgram(ngram);
        ensureBuilt();
        return suffixOrder.findRange(corpus, ngram, min, max);
    }

    /**
     * ngram 在语料中的出现次数。
     */
    public int count(int[] ngram) {
        return findNgramRange(ngram).map(NgramRange::count).orElse(0);
    }

    /**
     * 区间内各后缀在语料流中的起始位置，按后缀序排列。
     */
    public int[] positions(NgramRange range) {
        ensureBuilt();
        int[] result = new int[range.count()];
        for (int rank = range.first(); rank <= range.last(); rank++) {
            result[rank - range.first()] = suffixOrder.positionAt(rank);
        }
        return result;
    }

    /**
     * 区间内最靠前的至多 limit 个语料流位置，升序排列。
     * 以容量为 limit 的大顶堆筛选，不对整个区间排序。
     */
    public int[] firstPositions(NgramRange range, int limit) {
        ensureBuilt();
        if (limit <= 0) {
            return new int[0];
        }
        IntHeapPriorityQueue heap = new IntHeapPriorityQueue(Math.min(limit, range.count()),
            IntComparators.OPPOSITE_COMPARATOR);
        for (int rank = range.first(); rank <= range.last(); rank++) {
            int position = suffixOrder.positionAt(rank);
            if (heap.size() < limit) {
                heap.enqueue(position);
            } else if (position < heap.firstInt()) {
                heap.dequeueInt();
                heap.enqueue(position);
            }
        }
        int[] result = new int[heap.size()];
        for (int index = result.length - 1; index >= 0; index--) {
            result[index] = heap.dequeueInt();
        }
        return result;
    }

    /**
     * 将符号序列翻译为ID序列；任一符号不在符号表中时返回空。
     */
    public Optional<int[]> encode(List<String> words) {
        int[] ngram = new int[words.size()];
        for (int index = 0; index < ngram.length; index++) {
            String word = words.get(index);
            OptionalInt id = word.isEmpty() ? OptionalInt.empty() : symbols.idOf(word);
            if (id.isEmpty()) {
                return Optional.empty();
            }
            ngram[index] = id.getAsInt();
        }
        return Optional.of(ngram);
    }

    /**
     * 语料流位置上的符号。
     */
    public String symbolAt(int position) {
        return symbols.symbolOf(corpus.get(position));
    }

    /**
     * 将三个文件写到 basePath.name.* 下。
     */
    public void save(Path basePath) throws IOException {
        ensureBuilt();
        Path parent = basePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        corpus.writeTo(attributeFile(basePath, name, Constants.CORPUS_EXTENSION));
        suffixOrder.writeTo(attributeFile(basePath, name, Constants.SUFFIX_EXTENSION));
        symbols.writeTo(attributeFile(basePath, name, Constants.SYMBOLS_EXTENSION));
        logger.debug("属性 {} 已保存: {}", name, basePath);
    }

    /**
     * 从磁盘加载属性索引。
     *
     * @return 语料流文件不存在时为空，调用方据此决定是否回退到复合构建
     * @throws IOException 语料流文件存在但其余文件缺失或损坏
     */
    public static Optional<AttributeIndex> load(String name, Path basePath) throws IOException {
        Path corpusFile = attributeFile(basePath, name, Constants.CORPUS_EXTENSION);
        if (!Files.exists(corpusFile)) {
            return Optional.empty();
        }
        CorpusStream corpus = CorpusStream.readFrom(corpusFile);
        SuffixOrder suffixOrder = SuffixOrder.readFrom(attributeFile(basePath, name, Constants.SUFFIX_EXTENSION), corpus.size());
        SymbolTable symbols = SymbolTable.readFrom(attributeFile(basePath, name, Constants.SYMBOLS_EXTENSION));
        logger.info("已加载属性 {}: positions={}, symbols={}", name, corpus.size(), symbols.size());
        return Optional.of(new AttributeIndex(name, symbols, corpus, suffixOrder));
    }

    /**
     * 属性文件路径：basePath.name.extension
     */
    public static Path attributeFile(Path basePath, String name, String extension) {
        return basePath.resolveSibling(basePath.getFileName() + "." + name + extension);
    }

    private void validateNgram(int[] ngram) {
        if (ngram == null || ngram.length == 0) {
            throw new IllegalArgumentException("n-gram 不能为空");
        }
        for (int index = 0; index < ngram.length; index++) {
            if (ngram[index] <= Constants.SENTENCE_BOUNDARY) {
                throw new IllegalArgumentException("n-gram 不能包含句子边界或负数: index=" + index + ", id=" + ngram[index]);
            }
        }
    }

    private void ensureBuilt() {
        if (suffixOrder == null) {
            throw new IllegalStateException("属性 " + name + " 的后缀序尚未构建");
        }
    }

    private void ensureWritable() {
        if (suffixOrder != null) {
            throw new IllegalStateException("属性 " + name + " 已构建后缀序，不能再追加");
        }
    }
}
