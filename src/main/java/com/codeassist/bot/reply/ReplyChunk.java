package com.codeassist.bot.reply;

/**
 * One outbound message. A {@link RenderMode#MARKDOWN} chunk may be downgraded
 * to plain text by the transport if it cannot be rendered.
 */
public record ReplyChunk(String text, RenderMode mode) {
    public static ReplyChunk plain(String text) {
        return new ReplyChunk(text, RenderMode.PLAIN);
    }
}
