package com.guardian.rag.chunk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class WordWindowChunkerTest {

    @Nested
    @DisplayName("Windowing")
    class WindowingTests {

        @Test
        void testOverlappingWindows() {
            WordWindowChunker chunker = new WordWindowChunker(4, 2);

            List<String> chunks = chunker.chunk("A B C D E F");

            assertEquals(List.of("A B C D", "C D E F"), chunks);
        }

        @Test
        void testShortTextIsOneChunk() {
            WordWindowChunker chunker = new WordWindowChunker(800, 120);

            assertEquals(List.of("only a few words"), chunker.chunk("only a few words"));
        }

        @Test
        void testEmptyTextHasNoChunks() {
            WordWindowChunker chunker = new WordWindowChunker(10, 2);

            assertTrue(chunker.chunk("").isEmpty());
            assertTrue(chunker.chunk("   \n\t ").isEmpty());
            assertTrue(chunker.chunk(null).isEmpty());
        }

        @Test
        void testLastWindowEndsOnLastWord() {
            WordWindowChunker chunker = new WordWindowChunker(5, 1);
            String text = words(12);

            List<String> chunks = chunker.chunk(text);

            assertEquals(List.of("w0 w1 w2 w3 w4", "w4 w5 w6 w7 w8", "w8 w9 w10 w11"), chunks);
        }

        @Test
        @DisplayName("Consecutive chunks share exactly 'overlap' words")
        void testOverlapProperty() {
            int size = 7;
            int overlap = 3;
            WordWindowChunker chunker = new WordWindowChunker(size, overlap);

            List<String> chunks = chunker.chunk(words(40));

            assertTrue(chunks.size() > 1);
            for (int i = 0; i + 1 < chunks.size(); i++) {
                List<String> current = Arrays.asList(chunks.get(i).split(" "));
                List<String> next = Arrays.asList(chunks.get(i + 1).split(" "));
                assertEquals(size, current.size());
                assertEquals(current.subList(size - overlap, size), next.subList(0, overlap));
            }
        }

        @Test
        void testZeroOverlapPartitionsText() {
            WordWindowChunker chunker = new WordWindowChunker(3, 0);

            List<String> chunks = chunker.chunk(words(7));

            assertEquals(List.of("w0 w1 w2", "w3 w4 w5", "w6"), chunks);
            assertEquals(words(7), String.join(" ", chunks));
        }
    }

    @Nested
    @DisplayName("Normalization and configuration")
    class ConfigTests {

        @Test
        void testWhitespaceIsCollapsed() {
            assertEquals("a b c", WordWindowChunker.normalize("  a\n\n b\t\u0000c  "));
        }

        @Test
        void testOverlapMustBeSmallerThanSize() {
            assertThrows(IllegalArgumentException.class, () -> new WordWindowChunker(4, 4));
            assertThrows(IllegalArgumentException.class, () -> new WordWindowChunker(4, 5));
            assertThrows(IllegalArgumentException.class, () -> new WordWindowChunker(4, -1));
            assertThrows(IllegalArgumentException.class, () -> new WordWindowChunker(0, 0));
        }

        @Test
        void testGetters() {
            WordWindowChunker chunker = new WordWindowChunker(800, 120);
            assertEquals(800, chunker.getSize());
            assertEquals(120, chunker.getOverlap());
        }
    }

    private static String words(int n) {
        return IntStream.range(0, n).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    }
}
