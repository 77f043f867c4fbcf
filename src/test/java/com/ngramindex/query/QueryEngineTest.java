package com.ngramindex.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ngramindex.config.IndexConfig;
import com.ngramindex.index.Index;
import com.ngramindex.text.Attribute;
import com.ngramindex.text.Sentence;
import com.ngramindex.text.Token;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QueryEngineTest {

    @TempDir
    Path tempDir;

    private QueryEngine queryEngine;

    @BeforeEach
    void setUp() throws IOException {
        IndexConfig config = IndexConfig.defaults();
        config.setBasePath(tempDir.resolve("corpus"));
        config.setAttributes(List.of(Attribute.SURFACE, Attribute.LEMMA, Attribute.POS));
        Index index = Index.create(config);
        index.appendSentence(new Sentence(1, List.of(
            new Token("The", "the", "DT", ""),
            new Token("meeting", "meeting", "NN", ""),
            new Token("took", "take", "VBD", ""),
            new Token("place", "place", "NN", ""))));
        index.appendSentence(new Sentence(2, List.of(
            new Token("It", "it", "PRP", ""),
            new Token("takes", "take", "VBZ", ""),
            new Token("place", "place", "NN", ""),
            new Token("today", "today", "NN", ""))));
        index.buildSuffixArrays(1);
        index.saveMain();
        queryEngine = new QueryEngine(Index.open(tempDir.resolve("corpus")));
    }

    @Test
    void testCountOnDefaultAttribute() throws IOException {
        CountResult result = queryEngine.count("place", 10);

        assertEquals("surface", result.attribute());
        assertEquals(2, result.count());
        assertEquals(List.of(3, 7), result.positions());
        assertTrue(result.found());
    }

    @Test
    void testCountOnLemma() throws IOException {
        CountResult result = queryEngine.count("lemma: take place", 10);

        assertEquals(2, result.count());
        assertEquals(List.of(2, 6), result.positions());
        assertEquals(List.of("take", "place"), result.words());
    }

    @Test
    void testCountOnCompositeAttribute() throws IOException {
        CountResult result = queryEngine.count("lemma+pos: take|VBD place|NN", 10);

        assertEquals(1, result.count());
        assertEquals(List.of(2), result.positions());
        assertEquals(List.of("take|VBD", "place|NN"), result.words());
    }

    @Test
    void testPositionsAreLimited() throws IOException {
        CountResult result = queryEngine.count("pos: NN", 2);

        assertEquals(4, result.count());
        assertEquals(List.of(1, 3), result.positions());
    }

    @Test
    void testUnknownWordCountsZero() throws IOException {
        CountResult result = queryEngine.count("lemma: take off", 10);

        assertFalse(result.found());
        assertEquals(0, result.count());
        assertEquals(-1, result.first());
        assertEquals(List.of(), result.positions());
    }

    @Test
    void testKnownWordsInAbsentOrderCountZero() throws IOException {
        CountResult result = queryEngine.count("place took", 10);

        assertEquals(0, result.count());
        assertEquals(-1, result.last());
    }

    @Test
    void testParsedQueryOverload() throws IOException {
        CountResult result = queryEngine.count(new NgramQuery("pos", List.of("VBZ", "NN")), 10);

        assertEquals("VBZ NN", result.query());
        assertEquals(1, result.count());
    }

    @Test
    void testMissingAttributeFails() {
        assertThrows(NoSuchFileException.class, () -> queryEngine.count("syn: VP", 10));
        assertThrows(NgramQueryException.class, () -> queryEngine.count("", 10));
    }
}
