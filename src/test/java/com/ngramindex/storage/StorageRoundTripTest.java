package com.ngramindex.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * 存储层文件格式测试，覆盖整数数组/符号表/元数据的读写与损坏检测。
 */
class StorageRoundTripTest {

    @TempDir
    Path tempDir;

    /**
     * 验证整数数组文件为无头部的 32 位小端序列。
     */
    @Test
    void intArrayFileIsHeaderlessLittleEndian() throws IOException {
        Path file = tempDir.resolve("values.corpus");
        IntArrayFile.write(file, new int[] {1, 258, 0, 99}, 3);

        byte[] bytes = Files.readAllBytes(file);
        assertArrayEquals(new byte[] {1, 0, 0, 0, 2, 1, 0, 0, 0, 0, 0, 0}, bytes);
        assertArrayEquals(new int[] {1, 258, 0}, IntArrayFile.read(file));
    }

    /**
     * 验证跨越多个缓冲块的大数组读写一致。
     */
    @Test
    void intArrayFileRoundTripAcrossChunks() throws IOException {
        Path file = tempDir.resolve("large.suffix");
        Random random = new Random(17);
        int[] values = new int[40_000];
        for (int index = 0; index < values.length; index++) {
            values[index] = random.nextInt(Integer.MAX_VALUE);
        }

        IntArrayFile.write(file, values, values.length);

        assertEquals(values.length * 4L, Files.size(file));
        assertArrayEquals(values, IntArrayFile.read(file));
    }

    @Test
    void intArrayFileRejectsCorruptLength() throws IOException {
        Path file = tempDir.resolve("broken.corpus");
        Files.write(file, new byte[] {1, 0, 0, 0, 7});

        assertThrows(IOException.class, () -> IntArrayFile.read(file));
    }

    @Test
    void intArrayFileRejectsValuesBeyondIntRange() throws IOException {
        Path file = tempDir.resolve("overflow.corpus");
        Files.write(file, new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});

        assertThrows(IOException.class, () -> IntArrayFile.read(file));
        assertThrows(IllegalArgumentException.class,
            () -> IntArrayFile.write(tempDir.resolve("negative.corpus"), new int[] {-1}, 1));
    }

    @Test
    void missingIntArrayFileThrowsNoSuchFile() {
        assertThrows(NoSuchFileException.class, () -> IntArrayFile.read(tempDir.resolve("absent.corpus")));
    }

    /**
     * 验证符号文件为每行一个符号，首行为空串。
     */
    @Test
    void symbolTableRoundTrip() throws IOException {
        SymbolTable table = new SymbolTable();
        table.intern("the");
        table.intern("naïve");
        table.intern("take\u001DVB");
        Path file = tempDir.resolve("corpus.lemma.symbols");

        table.writeTo(file);

        assertEquals("\nthe\nnaïve\ntake\u001DVB\n", Files.readString(file, StandardCharsets.UTF_8));
        SymbolTable loaded = SymbolTable.readFrom(file);
        assertTrue(loaded.isLocked());
        assertEquals(4, loaded.size());
        assertEquals("naïve", loaded.symbolOf(2));
        assertEquals(3, loaded.idOf("take\u001DVB").getAsInt());
    }

    @Test
    void symbolTableRejectsNonEmptyFirstLineAndDuplicates() throws IOException {
        Path badHeader = tempDir.resolve("bad-header.symbols");
        Files.writeString(badHeader, "the\ncat\n");
        Path duplicated = tempDir.resolve("duplicated.symbols");
        Files.writeString(duplicated, "\ncat\ncat\n");

        assertThrows(IOException.class, () -> SymbolTable.readFrom(badHeader));
        assertThrows(IOException.class, () -> SymbolTable.readFrom(duplicated));
    }

    /**
     * 验证元数据 key type value 行格式。
     */
    @Test
    void metadataRoundTrip() throws IOException {
        IndexMetadata metadata = new IndexMetadata();
        metadata.putLong("corpus_size", 12345L);
        metadata.putString("attributes", "surface:lemma");
        metadata.putString("title", "British National Corpus");
        Path file = tempDir.resolve("corpus.info");

        metadata.writeTo(file);

        assertEquals("corpus_size int 12345\nattributes string surface:lemma\ntitle string British National Corpus\n",
            Files.readString(file, StandardCharsets.UTF_8));
        IndexMetadata loaded = IndexMetadata.readFrom(file);
        assertEquals(OptionalLong.of(12345L), loaded.getLong("corpus_size"));
        assertEquals(Optional.of("British National Corpus"), loaded.getString("title"));
        assertEquals(OptionalLong.empty(), loaded.getLong("title"));
        assertTrue(loaded.contains("attributes"));
        assertFalse(loaded.contains("sentence_count"));
        assertEquals(metadata.asMap(), loaded.asMap());
    }

    @Test
    void metadataRejectsMalformedLines() throws IOException {
        Path unknownType = tempDir.resolve("unknown-type.info");
        Files.writeString(unknownType, "corpus_size float 1.5\n");
        Path badInt = tempDir.resolve("bad-int.info");
        Files.writeString(badInt, "corpus_size int many\n");
        Path shortLine = tempDir.resolve("short.info");
        Files.writeString(shortLine, "corpus_size int\n");

        assertThrows(IOException.class, () -> IndexMetadata.readFrom(unknownType));
        assertThrows(IOException.class, () -> IndexMetadata.readFrom(badInt));
        assertThrows(IOException.class, () -> IndexMetadata.readFrom(shortLine));
    }
}
