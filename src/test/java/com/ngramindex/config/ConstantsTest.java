package com.ngramindex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals(16, Constants.NGRAM_LIMIT);
        assertEquals(0, Constants.SENTENCE_BOUNDARY);
        assertEquals(64, Constants.MAX_QUERY_TOKENS);

        assertEquals("+", Constants.COMPOSITE_SEPARATOR);
        assertEquals("\u001D", Constants.ATTRIBUTE_SEPARATOR);
        assertEquals("\u001F", Constants.MISSING_VALUE);
        assertEquals(":", Constants.ATTRIBUTE_LIST_SEPARATOR);

        assertEquals(".info", Constants.INFO_EXTENSION);
        assertEquals(".corpus", Constants.CORPUS_EXTENSION);
        assertEquals(".suffix", Constants.SUFFIX_EXTENSION);
        assertEquals(".symbols", Constants.SYMBOLS_EXTENSION);
        assertEquals("corpus_size", Constants.CORPUS_SIZE_KEY);

        assertTrue(Constants.DEFAULT_BUILD_THREADS >= 1);
        assertEquals(64, Constants.MAX_BUILD_THREADS);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
