package com.ngramindex.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AttributeTest {

    @ParameterizedTest
    @DisplayName("fromName: 大小写不敏感")
    @CsvSource({"surface,SURFACE", "Lemma,LEMMA", " POS ,POS", "syn,SYN"})
    void fromNameIgnoresCase(String name, Attribute expected) {
        assertEquals(expected, Attribute.fromName(name));
    }

    @Test
    @DisplayName("fromName: 未知属性名报错")
    void fromNameRejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> Attribute.fromName("lemma+pos"));
        assertThrows(IllegalArgumentException.class, () -> Attribute.fromName(null));
    }

    @Test
    @DisplayName("valueOf: 按属性取出词元取值")
    void valueOfReadsTokenField() {
        Token token = new Token("took", "take", "VBD", "VP");

        assertEquals("took", Attribute.SURFACE.valueOf(token));
        assertEquals("take", Attribute.LEMMA.valueOf(token));
        assertEquals("VBD", Attribute.POS.valueOf(token));
        assertEquals("VP", token.get(Attribute.SYN));
        assertEquals("pos", Attribute.POS.toString());
    }

    @Test
    @DisplayName("Token: 缺失取值为空串，不允许保留分隔符")
    void tokenNormalizesMissingValues() {
        Token token = Token.fromValues(Map.of(Attribute.LEMMA, "be"));

        assertEquals("", token.surface());
        assertEquals("be", token.lemma());
        assertEquals("", token.pos());
        assertThrows(IllegalArgumentException.class, () -> new Token("a\u001Db", "", "", ""));
        assertThrows(IllegalArgumentException.class, () -> new Token("", "\u001F", "", ""));
        assertEquals("_", new Token("_", "_", "", "").surface());
    }
}
