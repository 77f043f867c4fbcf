package com.ngramindex.index;

import com.ngramindex.config.Constants;
import com.ngramindex.config.IndexConfig;
import com.ngramindex.storage.IndexMetadata;
import com.ngramindex.text.Attribute;
import com.ngramindex.text.Sentence;
import com.ngramindex.text.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 语料索引：属性名到属性索引的映射，加上全语料共享的元数据。
 *
 * 生命周期：新建后逐句 appendSentence，随后调用一次 buildSuffixArrays 并保存；
 * 之后作为只读副本使用，复合属性在首次 load 时按需拼接并落盘。
 */
public class Index {
    private static final Logger logger = LoggerFactory.getLogger(Index.class);

    private final Path basePath;
    private final List<Attribute> attributes;
    private final Map<String, AttributeIndex> arrays = new ConcurrentHashMap<>();
    private final IndexMetadata metadata;
    private long corpusSize;
    private long sentenceCount;

    private Index(Path basePath, List<Attribute> attributes, IndexMetadata metadata) {
        if (basePath == null || basePath.getFileName() == null) {
            throw new IllegalArgumentException("索引路径前缀非法: " + basePath);
        }
        if (attributes == null || attributes.isEmpty()) {
            throw new IllegalArgumentException("属性列表不能为空");
        }
        this.basePath = basePath;
        this.attributes = List.copyOf(attributes);
        this.metadata = metadata;
        this.corpusSize = metadata.getLong(Constants.CORPUS_SIZE_KEY).orElse(0L);
        this.sentenceCount = metadata.getLong(Constants.SENTENCE_COUNT_KEY).orElse(0L);
    }

    /**
     * 创建空索引，并为每个配置的属性准备可写的属性索引。
     */
    public static Index create(IndexConfig config) {
        Index index = new Index(config.getBasePath(), config.getAttributes(), new IndexMetadata());
        for (Attribute attribute : index.attributes) {
            index.arrays.put(attribute.attributeName(), new AttributeIndex(attribute.attributeName()));
        }
        return index;
    }

    /**
     * 打开已有索引：读取元数据，属性按需加载。
     *
     * @throws IOException .info 文件缺失或损坏
     */
    public static Index open(Path basePath) throws IOException {
        IndexMetadata metadata = IndexMetadata.readFrom(metadataFile(basePath));
        if (metadata.getLong(Constants.CORPUS_SIZE_KEY).isEmpty()) {
            throw new IOException("元数据缺少 " + Constants.CORPUS_SIZE_KEY + ": " + metadataFile(basePath));
        }
        List<Attribute> attributes = metadata.getString(Constants.ATTRIBUTES_KEY)
            .map(Index::parseAttributes)
            .orElseGet(() -> Arrays.asList(Attribute.values()));
        return new Index(basePath, attributes, metadata);
    }

    /**
     * 打开已有索引并使用调用方指定的属性列表。
     */
    public static Index open(Path basePath, List<Attribute> attributes) throws IOException {
        IndexMetadata metadata = IndexMetadata.readFrom(metadataFile(basePath));
        if (metadata.getLong(Constants.CORPUS_SIZE_KEY).isEmpty()) {
            throw new IOException("元数据缺少 " + Constants.CORPUS_SIZE_KEY + ": " + metadataFile(basePath));
        }
        return new Index(basePath, attributes, metadata);
    }

    /**
     * 解析以冒号分隔的属性列表，如 "lemma:pos"。
     */
    public static List<Attribute> parseAttributes(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("属性列表不能为空");
        }
        return Arrays.stream(text.split(Constants.ATTRIBUTE_LIST_SEPARATOR))
            .map(Attribute::fromName)
            .toList();
    }

    public Path getBasePath() {
        return basePath;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    public long getCorpusSize() {
        return corpusSize;
    }

    public long getSentenceCount() {
        return sentenceCount;
    }

    /**
     * 追加一个句子：每个属性依次写入各词元的取值，再写入句子边界。
     * 写入前先校验全部取值，被拒绝的句子不会改动任何属性的语料流。
     *
     * @throws IllegalArgumentException 取值包含换行符
     * @throws IllegalStateException 属性未驻留或已构建后缀序
     */
    public void appendSentence(Sentence sentence) {
        List<AttributeIndex> targets = new ArrayList<>(attributes.size());
        for (Attribute attribute : attributes) {
            AttributeIndex array = attribute(attribute.attributeName());
            if (array.isBuilt()) {
                throw new IllegalStateException("属性 " + array.name() + " 已构建后缀序，不能再追加句子");
            }
            for (Token token : sentence.tokens()) {
                String value = attribute.valueOf(token);
                if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
                    throw new IllegalArgumentException("句子 " + sentence.id() + " 的属性 " + attribute
                        + " 取值包含换行符");
                }
            }
            targets.add(array);
        }
        for (int index = 0; index < attributes.size(); index++) {
            Attribute attribute = attributes.get(index);
            AttributeIndex array = targets.get(index);
            for (Token token : sentence.tokens()) {
                String value = attribute.valueOf(token);
                array.appendWord(value.isEmpty() ? Constants.MISSING_VALUE : value);
            }
            array.appendSentenceBoundary();
        }
        corpusSize += sentence.size();
        sentenceCount++;
        if (sentenceCount % Constants.PROGRESS_LOG_INTERVAL == 0) {
            logger.debug("已处理 {} 个句子, {} 个词元", sentenceCount, corpusSize);
        }
    }

    /**
     * 使用默认线程数构建后缀序。
     */
    public void buildSuffixArrays() {
        buildSuffixArrays(Math.min(Constants.DEFAULT_BUILD_THREADS, Constants.MAX_BUILD_THREADS));
    }

    /**
     * 为所有驻留属性构建后缀序。各属性相互独立，按属性并行。
     *
     * @param threads 工作线程数，小于等于 1 时在当前线程顺序构建
     */
    public void buildSuffixArrays(int threads) {
        List<AttributeIndex> pending = arrays.values().stream()
            .filter(array -> !array.isBuilt())
            .toList();
        if (pending.isEmpty()) {
            return;
        }
        logger.info("开始构建后缀序: attributes={}, threads={}",
            pending.stream().map(AttributeIndex::name).toList(), threads);
        if (threads <= 1 || pending.size() == 1) {
            pending.forEach(AttributeIndex::buildSuffixArray);
            return;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, pending.size()));
        try {
            List<Future<?>> futures = new ArrayList<>(pending.size());
            for (AttributeIndex array : pending) {
                futures.add(executor.submit(array::buildSuffixArray));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("后缀序构建被中断", exception);
        } catch (ExecutionException exception) {
            throw new IllegalStateException("后缀序构建失败: " + exception.getCause().getMessage(), exception.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * 按需返回属性索引：已驻留直接返回；否则从磁盘加载；
     * 文件不存在且为复合属性时，递归加载两个分量并拼接，结果写回磁盘。
     *
     * @throws NoSuchFileException 简单属性文件不存在，或复合属性的某个分量不存在
     * @throws IOException 其他加载失败
     */
    public synchronized AttributeIndex load(String attributeName) throws IOException {
        AttributeIndex resident = arrays.get(attributeName);
        if (resident != null) {
            return resident;
        }
        Optional<AttributeIndex> stored = AttributeIndex.load(attributeName, basePath);
        if (stored.isPresent()) {
            arrays.put(attributeName, stored.get());
            return stored.get();
        }
        int separator = attributeName.lastIndexOf(Constants.COMPOSITE_SEPARATOR);
        if (separator <= 0 || separator == attributeName.length() - 1) {
            Path corpusFile = AttributeIndex.attributeFile(basePath, attributeName, Constants.CORPUS_EXTENSION);
            throw new NoSuchFileException(corpusFile.toString(), null, "属性索引文件不存在: " + attributeName);
        }
        AttributeIndex first = load(attributeName.substring(0, separator));
        AttributeIndex second = load(attributeName.substring(separator + 1));
        AttributeIndex fused = CompositeIndexBuilder.fuse(first, second);
        fused.save(basePath);
        logger.info("复合属性 {} 已写入磁盘", attributeName);
        arrays.put(attributeName, fused);
        return fused;
    }

    /**
     * 加载元数据以外全部配置的简单属性。
     */
    public void loadMain() throws IOException {
        for (Attribute attribute : attributes) {
            load(attribute.attributeName());
        }
    }

    /**
     * 保存元数据和全部配置的简单属性。
     */
    public void saveMain() throws IOException {
        saveMetadata();
        for (Attribute attribute : attributes) {
            save(attribute.attributeName());
        }
    }

    /**
     * 保存单个驻留属性。
     */
    public void save(String attributeName) throws IOException {
        attribute(attributeName).save(basePath);
    }

    public void saveMetadata() throws IOException {
        metadata.putLong(Constants.CORPUS_SIZE_KEY, corpusSize);
        metadata.putLong(Constants.SENTENCE_COUNT_KEY, sentenceCount);
        metadata.putString(Constants.ATTRIBUTES_KEY, attributes.stream()
            .map(Attribute::attributeName)
            .collect(Collectors.joining(Constants.ATTRIBUTE_LIST_SEPARATOR)));
        Path parent = basePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        metadata.writeTo(metadataFile(basePath));
    }

    /**
     * 返回驻留的属性索引。
     *
     * @throws IllegalStateException 属性从未加载或构建
     */
    public AttributeIndex attribute(String attributeName) {
        AttributeIndex array = arrays.get(attributeName);
        if (array == null) {
            throw new IllegalStateException("属性未加载: " + attributeName + "，请先调用 load");
        }
        return array;
    }

    public boolean isResident(String attributeName) {
        return arrays.containsKey(attributeName);
    }

    /**
     * 在指定属性上查找 ngram 区间。
     *
     * @throws IllegalStateException 属性未加载
     */
    public Optional<NgramRange> findNgramRange(String attributeName, int[] ngram) {
        return attribute(attributeName).findNgramRange(ngram);
    }

    /**
     * 在指定属性后缀序的 [min, max] 范围内查找 ngram 区间。
     *
     * @throws IllegalStateException 属性未加载
     * @throws IllegalArgumentException 范围越界或 ngram 非法
     */
    public Optional<NgramRange> findNgramRange(String attributeName, int[] ngram, int min, int max) {
        return attribute(attributeName).findNgramRange(ngram, min, max);
    }

    /**
     * 逐句重建语料。以第一个配置属性为引导，在每个位置上取出全部配置属性的符号，缺失占位符还原为空串。
     *
     * @throws IllegalStateException 有配置属性未驻留，或各属性语料流长度不一致
     */
    public Iterable<Sentence> iterateSentences() {
        Map<Attribute, AttributeIndex> sources = new EnumMap<>(Attribute.class);
        for (Attribute attribute : attributes) {
            sources.put(attribute, attribute(attribute.attributeName()));
        }
        AttributeIndex guide = sources.get(attributes.get(0));
        for (AttributeIndex source : sources.values()) {
            if (source.size() != guide.size()) {
                throw new IllegalStateException("属性语料流长度不一致: " + source.name() + "=" + source.size()
                    + ", " + guide.name() + "=" + guide.size());
            }
        }
        return () -> new SentenceIterator(guide, sources);
    }

    /**
     * 统计信息，索引大小为 basePath 前缀下全部文件之和。
     */
    public IndexStatus status() throws IOException {
        List<String> resident = arrays.keySet().stream().sorted().toList();
        List<String> configured = attributes.stream().map(Attribute::attributeName).toList();
        return new IndexStatus(corpusSize, sentenceCount, configured, resident, indexSizeBytes());
    }

    private long indexSizeBytes() throws IOException {
        Path directory = basePath.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return 0L;
        }
        String prefix = basePath.getFileName() + ".";
        long total = 0L;
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (file.getFileName().toString().startsWith(prefix) && Files.isRegularFile(file)) {
                    total += Files.size(file);
                }
            }
        }
        return total;
    }

    private static Path metadataFile(Path basePath) {
        return basePath.resolveSibling(basePath.getFileName() + Constants.INFO_EXTENSION);
    }

    /**
     * 沿引导属性的语料流前进，遇到 0 输出一个句子。
     */
    private static final class SentenceIterator implements Iterator<Sentence> {
        private final AttributeIndex guide;
        private final Map<Attribute, AttributeIndex> sources;
        private int position;
        private int nextId = 1;

        SentenceIterator(AttributeIndex guide, Map<Attribute, AttributeIndex> sources) {
            this.guide = guide;
            this.sources = sources;
        }

        @Override
        public boolean hasNext() {
            return position < guide.size();
        }

        @Override
        public Sentence next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<Token> tokens = new ArrayList<>();
            while (position < guide.size() && !guide.corpus().isBoundary(position)) {
                Map<Attribute, String> values = new EnumMap<>(Attribute.class);
                for (Map.Entry<Attribute, AttributeIndex> source : sources.entrySet()) {
                    String symbol = source.getValue().symbolAt(position);
                    values.put(source.getKey(), Constants.MISSING_VALUE.equals(symbol) ? "" : symbol);
                }
                tokens.add(Token.fromValues(values));
                position++;
            }
            // 跳过句子边界
            position++;
            return new Sentence(nextId++, tokens);
        }
    }
}
