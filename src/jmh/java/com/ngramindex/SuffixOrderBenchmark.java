package com.ngramindex;

import com.ngramindex.config.IndexConfig;
import com.ngramindex.index.AttributeIndex;
import com.ngramindex.index.CorpusStream;
import com.ngramindex.index.Index;
import com.ngramindex.index.SuffixOrder;
import com.ngramindex.query.QueryEngine;
import com.ngramindex.text.Attribute;
import com.ngramindex.text.Sentence;
import com.ngramindex.text.Token;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 后缀序构建与 n-gram 查询基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class SuffixOrderBenchmark {

    private static final String[] WORDS = {
        "the", "a", "of", "to", "in", "and", "take", "place", "index", "corpus",
        "search", "java", "suffix", "array", "query", "sentence", "word", "lemma"
    };

    @State(Scope.Thread)
    public static class BuildState {
        CorpusStream stream;

        @Setup
        public void setup() {
            AttributeIndex array = new AttributeIndex(Attribute.SURFACE.attributeName());
            Random random = new Random(42);
            // 约 20 万词元
            for (int sentence = 0; sentence < 10_000; sentence++) {
                int length = 5 + random.nextInt(30);
                for (int i = 0; i < length; i++) {
                    array.appendWord(WORDS[random.nextInt(WORDS.length)]);
                }
                array.appendSentenceBoundary();
            }
            stream = array.corpus();
        }
    }

    @Benchmark
    public SuffixOrder buildSuffixOrder(BuildState state) {
        return SuffixOrder.build(state.stream);
    }

    @State(Scope.Benchmark)
    public static class QueryState {
        Path tempDir;
        QueryEngine queryEngine;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            IndexConfig config = IndexConfig.defaults();
            config.setBasePath(tempDir.resolve("corpus"));
            config.setAttributes(List.of(Attribute.SURFACE, Attribute.LEMMA));
            Index index = Index.create(config);
            Random random = new Random(7);
            for (int id = 1; id <= 10_000; id++) {
                List<Token> tokens = new ArrayList<>();
                int length = 5 + random.nextInt(30);
                for (int i = 0; i < length; i++) {
                    String word = WORDS[random.nextInt(WORDS.length)];
                    tokens.add(new Token(word, word.toUpperCase(), "", ""));
                }
                index.appendSentence(new Sentence(id, tokens));
            }
            index.buildSuffixArrays(2);
            index.saveMain();
            queryEngine = new QueryEngine(index);
        }

        @TearDown
        public void tearDown() throws IOException {
            try (Stream<Path> files = Files.walk(tempDir)) {
                for (Path path : (Iterable<Path>) files.sorted(Comparator.reverseOrder())::iterator) {
                    Files.deleteIfExists(path);
                }
            }
        }
    }

    @Benchmark
    public int countUnigram(QueryState state) throws IOException {
        return state.queryEngine.count("the", 10).count();
    }

    @Benchmark
    public int countTrigram(QueryState state) throws IOException {
        return state.queryEngine.count("take place in", 10).count();
    }

    @Benchmark
    public int countComposite(QueryState state) throws IOException {
        return state.queryEngine.count("surface+lemma: take|TAKE place|PLACE", 10).count();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(SuffixOrderBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
