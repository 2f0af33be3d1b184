package com.codeassist.bot.relay;

import com.codeassist.bot.generation.GenerationClient;
import com.codeassist.bot.generation.GenerationException;
import com.codeassist.bot.generation.GenerationMode;
import com.codeassist.bot.language.MessageCatalog;
import com.codeassist.bot.language.MessageKey;
import com.codeassist.bot.reply.CodeResponseFormatter;
import com.codeassist.bot.reply.RenderMode;
import com.codeassist.bot.reply.ReplyChunk;
import com.codeassist.bot.reply.ResponseChunker;
import com.codeassist.bot.router.InboundMessage;
import com.codeassist.bot.router.RequestRouter;
import com.codeassist.bot.router.RouterDecision;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one inbound message end to end: route it, call the generator when
 * the router admits it, and cut the reply into transport-sized chunks.
 *
 * Routing runs on the caller's thread; the generator call runs on the
 * supplied executor. A failed generation is answered with a localized error
 * and never touches the limiter again.
 */
public class ChatRelayService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatRelayService.class);

    private final RequestRouter router;
    private final GenerationClient generationClient;
    private final MessageCatalog messages;
    private final ResponseChunker chunker;
    private final ExecutorService executor;
    private final Clock clock;

    public ChatRelayService(
            RequestRouter router,
            GenerationClient generationClient,
            MessageCatalog messages,
            ResponseChunker chunker,
            ExecutorService executor,
            Clock clock
    ) {
        this.router = router;
        this.generationClient = generationClient;
        this.messages = messages;
        this.chunker = chunker;
        this.executor = executor;
        this.clock = clock;
    }

    public CompletableFuture<List<ReplyChunk>> handle(InboundMessage message) {
        RouterDecision decision = router.route(message, clock.instant());
        if (!decision.requiresGeneration()) {
            return CompletableFuture.completedFuture(noticeChunks(decision));
        }
        return CompletableFuture.supplyAsync(() -> generateReply(decision), executor);
    }

    /**
     * Localized generic error, for transport-level failures outside the
     * generator call.
     */
    public List<ReplyChunk> errorReply(InboundMessage message) {
        return chunk(
                messages.get(MessageKey.ERROR, router.declaredLanguage(message)),
                RenderMode.PLAIN
        );
    }

    List<ReplyChunk> generateReply(RouterDecision decision) {
        boolean build = decision.classification().intent().isBuild();
        try {
            String raw = generationClient.generate(
                    decision.enhancedPrompt(),
                    build ? GenerationMode.CODE : GenerationMode.QUESTION
            );
            if (build) {
                return chunk(CodeResponseFormatter.format(raw), RenderMode.MARKDOWN);
            }
            return chunk(raw, RenderMode.PLAIN);
        } catch (GenerationException error) {
            LOGGER.error("Generation failed for {} request", decision.classification().intent(), error);
            MessageKey key = build ? MessageKey.CODE_FAILED : MessageKey.ANSWER_FAILED;
            return chunk(messages.get(key, decision.language()), RenderMode.PLAIN);
        }
    }

    private List<ReplyChunk> noticeChunks(RouterDecision decision) {
        RenderMode mode = switch (decision.outcome()) {
            case INFO, USAGE -> RenderMode.MARKDOWN;
            case IDENTITY, DENIED, GENERATE -> RenderMode.PLAIN;
        };
        return chunk(decision.notice(), mode);
    }

    private List<ReplyChunk> chunk(String text, RenderMode mode) {
        return chunker.split(text).stream()
                .map(part -> new ReplyChunk(part, mode))
                .toList();
    }
}
