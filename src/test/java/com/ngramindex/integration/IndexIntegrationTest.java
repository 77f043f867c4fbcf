package com.ngramindex.integration;

import com.ngramindex.config.IndexConfig;
import com.ngramindex.index.AttributeIndex;
import com.ngramindex.index.Index;
import com.ngramindex.query.CountResult;
import com.ngramindex.query.QueryEngine;
import com.ngramindex.text.Attribute;
import com.ngramindex.text.MosesCorpusReader;
import com.ngramindex.text.Sentence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 索引集成测试
 *
 * 覆盖完整流程：读取语料 → 构建 → 保存 → 重新打开 → 计数查询 → 复合属性 → 还原语料
 */
class IndexIntegrationTest {

    private static final String CORPUS = String.join("\n",
        "# tiny factored corpus",
        "The|the|DT|NP meeting|meeting|NN|NP took|take|VBD|VP place|place|NN|NP .|.|.|O",
        "The|the|DT|NP concert|concert|NN|NP takes|take|VBZ|VP place|place|NN|NP today|today|NN|NP",
        "",
        "Take|take|VB|VP your|your|PRP$|NP place|place|NN|NP",
        "");

    @TempDir
    Path tempDir;

    private Path basePath;
    private List<Sentence> original;

    @BeforeEach
    void setUp() throws IOException {
        basePath = tempDir.resolve("bnc/corpus");
        original = new ArrayList<>();
        new MosesCorpusReader().read(new BufferedReader(new StringReader(CORPUS)), original::add);

        IndexConfig config = IndexConfig.defaults();
        config.setBasePath(basePath);
        config.setBuildThreads(2);
        Index index = Index.create(config);
        original.forEach(index::appendSentence);
        index.buildSuffixArrays(config.effectiveBuildThreads());
        index.saveMain();
    }

    @Test
    void testCountsAfterReopen() throws IOException {
        QueryEngine queryEngine = new QueryEngine(Index.open(basePath));

        assertEquals(3, queryEngine.count("lemma: take", 10).count());
        assertEquals(3, queryEngine.count("lemma: place", 10).count());
        assertEquals(2, queryEngine.count("lemma: take place", 10).count());
        assertEquals(1, queryEngine.count("Take", 10).count());
        assertEquals(2, queryEngine.count("surface: The", 10).count());
        assertEquals(0, queryEngine.count("surface: place The", 10).count());
    }

    @Test
    void testCompositeQueriesPersistFusedAttribute() throws IOException {
        QueryEngine queryEngine = new QueryEngine(Index.open(basePath));

        CountResult verbs = queryEngine.count("lemma+pos: take|VBZ place|NN", 10);
        assertEquals(1, verbs.count());
        assertTrue(Files.exists(tempDir.resolve("bnc/corpus.lemma+pos.corpus")));
        assertTrue(Files.exists(tempDir.resolve("bnc/corpus.lemma+pos.suffix")));
        assertTrue(Files.exists(tempDir.resolve("bnc/corpus.lemma+pos.symbols")));

        CountResult phrases = new QueryEngine(Index.open(basePath)).count("pos+syn: NN|NP", 10);
        assertEquals(6, phrases.count());
    }

    @Test
    void testReconstructedCorpusMatchesInput() throws IOException {
        Index index = Index.open(basePath);
        index.loadMain();

        List<Sentence> rebuilt = new ArrayList<>();
        index.iterateSentences().forEach(rebuilt::add);

        assertEquals(original, rebuilt);
    }

    @Test
    void testSuffixOrderAgreesWithBruteForceOnLargerCorpus() throws IOException {
        Path largeBase = tempDir.resolve("large/corpus");
        IndexConfig config = IndexConfig.defaults();
        config.setBasePath(largeBase);
        config.setAttributes(List.of(Attribute.SURFACE));
        Index index = Index.create(config);
        Random random = new Random(5);
        String[] vocabulary = {"a", "b", "c", "d"};
        List<String> flat = new ArrayList<>();
        for (int id = 1; id <= 300; id++) {
            StringBuilder line = new StringBuilder();
            int length = 1 + random.nextInt(12);
            for (int i = 0; i < length; i++) {
                String word = vocabulary[random.nextInt(vocabulary.length)];
                line.append(word).append(' ');
                flat.add(word);
            }
            flat.add("");
            new MosesCorpusReader().read(new BufferedReader(new StringReader(line.toString())), index::appendSentence);
        }
        index.buildSuffixArrays();
        index.saveMain();

        Index reopened = Index.open(largeBase);
        AttributeIndex surface = reopened.load("surface");
        for (List<String> ngram : List.of(List.of("a"), List.of("a", "b"), List.of("d", "d", "c"), List.of("c", "a", "b", "d"))) {
            int expected = 0;
            for (int start = 0; start + ngram.size() <= flat.size(); start++) {
                if (flat.subList(start, start + ngram.size()).equals(ngram)) {
                    expected++;
                }
            }
            assertEquals(expected, surface.count(surface.encode(ngram).orElseThrow()), ngram.toString());
        }
    }
}
