package com.ngramindex.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ngramindex.config.Constants;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CompositeIndexBuilderTest {

    @Test
    @DisplayName("拼接: 复合属性名以 + 连接")
    void compositeNameJoinsWithPlus() {
        assertEquals("lemma+pos", CompositeIndexBuilder.compositeName("lemma", "pos"));
    }

    @Test
    @DisplayName("拼接: 每个位置的符号为两个分量以分隔符连接，边界保持不变")
    void fusedSymbolsJoinComponents() {
        AttributeIndex lemma = build("lemma", List.of("take", "place"), List.of("take", "part"));
        AttributeIndex pos = build("pos", List.of("VB", "NN"), List.of("VB", "NN"));

        AttributeIndex fused = CompositeIndexBuilder.fuse(lemma, pos);

        assertEquals("lemma+pos", fused.name());
        assertEquals(lemma.size(), fused.size());
        assertTrue(fused.isBuilt());
        assertEquals("take" + Constants.ATTRIBUTE_SEPARATOR + "VB", fused.symbolAt(0));
        assertEquals("part" + Constants.ATTRIBUTE_SEPARATOR + "NN", fused.symbolAt(4));
        assertTrue(fused.corpus().isBoundary(2));
        assertTrue(fused.corpus().isBoundary(5));
    }

    @Test
    @DisplayName("拼接: 复合 n-gram 的计数等于两个分量同时匹配的位置数")
    void fusedCountsMatchJointOccurrences() {
        AttributeIndex lemma = build("lemma", List.of("run", "fast", "run"), List.of("run", "home"));
        AttributeIndex pos = build("pos", List.of("VB", "RB", "NN"), List.of("VB", "NN"));
        AttributeIndex fused = CompositeIndexBuilder.fuse(lemma, pos);

        int runVerb = fused.encode(List.of("run" + Constants.ATTRIBUTE_SEPARATOR + "VB")).orElseThrow()[0];
        int runNoun = fused.encode(List.of("run" + Constants.ATTRIBUTE_SEPARATOR + "NN")).orElseThrow()[0];

        assertEquals(3, lemma.count(lemma.encode(List.of("run")).orElseThrow()));
        assertEquals(2, fused.count(new int[] {runVerb}));
        assertEquals(1, fused.count(new int[] {runNoun}));
    }

    @Test
    @DisplayName("拼接: 长度或边界不一致时报错")
    void rejectsMismatchedStreams() {
        AttributeIndex lemma = build("lemma", List.of("a", "b"), List.of("c"));
        AttributeIndex shorter = build("pos", List.of("X"), List.of("Y"));
        AttributeIndex shifted = build("pos", List.of("X"), List.of("Y", "Z"));

        assertThrows(IllegalArgumentException.class, () -> CompositeIndexBuilder.fuse(lemma, shorter));
        assertThrows(IllegalArgumentException.class, () -> CompositeIndexBuilder.fuse(lemma, shifted));
    }

    private static AttributeIndex build(String name, List<String> first, List<String> second) {
        AttributeIndex array = new AttributeIndex(name);
        first.forEach(array::appendWord);
        array.appendSentenceBoundary();
        second.forEach(array::appendWord);
        array.appendSentenceBoundary();
        array.buildSuffixArray();
        return array;
    }
}
