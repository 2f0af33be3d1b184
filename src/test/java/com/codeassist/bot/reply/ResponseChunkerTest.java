package com.codeassist.bot.reply;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResponseChunkerTest {

    @Test
    void hardCutsAtMaxLength() {
        assertEquals(List.of("abc", "def", "gh"), ResponseChunker.split("abcdefgh", 3));
    }

    @Test
    void shortTextIsASingleChunk() {
        assertEquals(List.of("hello"), ResponseChunker.split("hello", 5));
        assertEquals(List.of(""), ResponseChunker.split("", 5));
        assertEquals(List.of(""), ResponseChunker.split(null, 5));
    }

    @Test
    void chunksReassembleToInputAndRespectLimit() {
        String text = "line one\nline two\n".repeat(700);
        ResponseChunker chunker = new ResponseChunker();

        List<String> chunks = chunker.split(text);

        assertEquals(String.join("", chunks), text);
        assertEquals((text.length() + 4095) / 4096, chunks.size());
        assertTrue(chunks.stream().allMatch(chunk -> chunk.length() <= ResponseChunker.DEFAULT_MAX_LENGTH));
    }

    @Test
    void ignoresWordBoundaries() {
        assertEquals(List.of("hello wo", "rld"), ResponseChunker.split("hello world", 8));
    }

    @Test
    void neverSplitsASurrogatePair() {
        String text = "ab\uD83E\uDD16cd";

        List<String> chunks = ResponseChunker.split(text, 3);

        assertEquals(List.of("ab", "\uD83E\uDD16c", "d"), chunks);
        for (String chunk : chunks) {
            assertTrue(chunk.length() <= 3);
            assertEquals(chunk, new String(chunk.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
        }
    }

    @Test
    void emojiHeavyReplyReassemblesAfterEncoding() {
        String text = "\u2705 done \uD83D\uDE80".repeat(300);

        StringBuilder decoded = new StringBuilder();
        for (String chunk : ResponseChunker.split(text, 2000)) {
            assertTrue(chunk.length() <= 2000);
            decoded.append(new String(chunk.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
        }

        assertEquals(text, decoded.toString());
    }

    @Test
    void rejectsNonPositiveLength() {
        assertThrows(IllegalArgumentException.class, () -> ResponseChunker.split("abc", 0));
        assertThrows(IllegalArgumentException.class, () -> new ResponseChunker(-1));
    }
}
