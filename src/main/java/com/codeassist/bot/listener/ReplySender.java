package com.codeassist.bot.listener;

import com.codeassist.bot.reply.RenderMode;
import com.codeassist.bot.reply.ReplyChunk;
import java.util.List;
import java.util.function.Function;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.requests.RestAction;
import net.dv8tion.jda.api.utils.MarkdownSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends reply chunks one after another so they arrive in order. A markdown
 * chunk Discord refuses is sent once more with formatting stripped.
 */
final class ReplySender {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReplySender.class);

    private final Function<String, RestAction<Message>> sendAction;

    ReplySender(Function<String, RestAction<Message>> sendAction) {
        this.sendAction = sendAction;
    }

    void sendAll(List<ReplyChunk> chunks) {
        sendFrom(chunks, 0);
    }

    private void sendFrom(List<ReplyChunk> chunks, int index) {
        if (index >= chunks.size()) {
            return;
        }
        ReplyChunk chunk = chunks.get(index);
        sendAction.apply(chunk.text()).queue(
                sent -> sendFrom(chunks, index + 1),
                error -> {
                    if (chunk.mode() == RenderMode.MARKDOWN) {
                        LOGGER.warn("Markdown chunk {} rejected, resending as plain text", index, error);
                        sendAction.apply(MarkdownSanitizer.sanitize(chunk.text())).queue(
                                sent -> sendFrom(chunks, index + 1),
                                retryError -> LOGGER.error("Failed to send chunk {} of {}", index, chunks.size(),
                                        retryError)
                        );
                    } else {
                        LOGGER.error("Failed to send chunk {} of {}", index, chunks.size(), error);
                    }
                }
        );
    }
}
