package com.codeassist.bot.reply;

import java.util.ArrayList;
import java.util.List;

/**
 * Hard-cuts a reply into consecutive slices of at most {@code maxLength}
 * UTF-16 units. Concatenating the slices gives back the input exactly.
 * A cut that would land inside a surrogate pair moves one unit earlier,
 * unless that would leave the slice empty.
 */
public final class ResponseChunker {
    public static final int DEFAULT_MAX_LENGTH = 4096;

    private final int maxLength;

    public ResponseChunker() {
        this(DEFAULT_MAX_LENGTH);
    }

    public ResponseChunker(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0");
        }
        this.maxLength = maxLength;
    }

    public List<String> split(String text) {
        return split(text, maxLength);
    }

    public static List<String> split(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0");
        }
        String value = text == null ? "" : text;
        if (value.length() <= maxLength) {
            return List.of(value);
        }
        List<String> chunks = new ArrayList<>((value.length() + maxLength - 1) / maxLength + 1);
        int start = 0;
        while (start < value.length()) {
            int end = Math.min(value.length(), start + maxLength);
            if (end < value.length() && end - start > 1
                    && Character.isHighSurrogate(value.charAt(end - 1))
                    && Character.isLowSurrogate(value.charAt(end))) {
                // keep the pair together, the transport cannot encode half of it
                end--;
            }
            chunks.add(value.substring(start, end));
            start = end;
        }
        return List.copyOf(chunks);
    }
}
