package com.codeassist.bot.router;

import com.codeassist.bot.intent.Intent;
import com.codeassist.bot.intent.IntentClassifier;
import com.codeassist.bot.intent.IntentMatch;
import com.codeassist.bot.language.Language;
import com.codeassist.bot.language.LanguageClassifier;
import com.codeassist.bot.language.MessageCatalog;
import com.codeassist.bot.language.MessageKey;
import com.codeassist.bot.ratelimit.SlidingWindowRateLimiter;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission and classification for one inbound message.
 *
 * Informational commands and usage errors never touch the limiter. Creator
 * questions are answered for free, even when the user's quota is exhausted.
 * Everything else consumes exactly one limiter slot before it is classified.
 */
public class RequestRouter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RequestRouter.class);
    private static final int PREVIEW_LENGTH = 50;

    private final SlidingWindowRateLimiter rateLimiter;
    private final LanguageClassifier languageClassifier;
    private final IntentClassifier intentClassifier;
    private final MessageCatalog messages;
    private final PromptTemplates prompts;
    private final String modelName;
    private final boolean debugMode;

    public RequestRouter(
            SlidingWindowRateLimiter rateLimiter,
            LanguageClassifier languageClassifier,
            IntentClassifier intentClassifier,
            MessageCatalog messages,
            PromptTemplates prompts,
            String modelName,
            boolean debugMode
    ) {
        this.rateLimiter = rateLimiter;
        this.languageClassifier = languageClassifier;
        this.intentClassifier = intentClassifier;
        this.messages = messages;
        this.prompts = prompts;
        this.modelName = modelName;
        this.debugMode = debugMode;
    }

    public RouterDecision route(String userKey, String text, String declaredLocale, Instant now) {
        return route(InboundMessage.freeForm(userKey, text, declaredLocale), now);
    }

    public RouterDecision route(InboundMessage message, Instant now) {
        Language declared = declaredLanguage(message);
        return message.commandInvocation()
                .map(invocation -> routeCommand(message, invocation, declared, now))
                .orElseGet(() -> routeFreeForm(message, declared, now));
    }

    public Language declaredLanguage(InboundMessage message) {
        return languageClassifier.detectFromLocale(message.declaredLocale());
    }

    private RouterDecision routeCommand(
            InboundMessage message,
            CommandInvocation invocation,
            Language declared,
            Instant now
    ) {
        BotCommand command = invocation.command();
        if (!command.generates()) {
            return RouterDecision.info(declared, infoText(command, message.userKey(), declared, now));
        }
        if (!invocation.hasArgument()) {
            return RouterDecision.usage(declared, messages.get(command.messageKey(), declared));
        }
        if (!rateLimiter.check(message.userKey(), now)) {
            return deny(message.userKey(), declared, now);
        }
        ClassificationResult classification = new ClassificationResult(
                languageClassifier.detectFromText(invocation.argument()),
                command.intent()
        );
        logRoute(message, "/" + command.commandName(), classification);
        return RouterDecision.generate(
                classification,
                prompts.build(classification.intent(), classification.language(), invocation.argument())
        );
    }

    private RouterDecision routeFreeForm(InboundMessage message, Language declared, Instant now) {
        String text = message.text().strip();
        if (text.isEmpty()) {
            return RouterDecision.info(declared, messages.get(MessageKey.HELP, declared));
        }
        if (intentClassifier.isCreatorQuestion(text)) {
            Language language = languageClassifier.detectFromText(text);
            logRoute(message, "creator", null);
            return RouterDecision.identity(language, messages.get(MessageKey.CREATOR, language));
        }
        if (!rateLimiter.check(message.userKey(), now)) {
            return deny(message.userKey(), declared, now);
        }
        IntentMatch match = intentClassifier.classify(text);
        Intent intent = match.intent();
        ClassificationResult classification = new ClassificationResult(
                languageClassifier.detectFromText(text),
                intent
        );
        logRoute(message, match.rule() + (match.matchedTerm() == null ? "" : " '" + match.matchedTerm() + "'"),
                classification);
        return RouterDecision.generate(classification, prompts.build(intent, classification.language(), text));
    }

    private RouterDecision deny(String userKey, Language declared, Instant now) {
        Duration retryAfter = rateLimiter.resetTime(userKey, now);
        long seconds = Math.max(1L, (retryAfter.toMillis() + 999L) / 1000L);
        String notice = messages.format(MessageKey.RATE_LIMIT, declared, Map.of("seconds", seconds));
        return RouterDecision.denied(declared, notice, retryAfter);
    }

    private String infoText(BotCommand command, String userKey, Language declared, Instant now) {
        if (command != BotCommand.STATUS) {
            return messages.get(command.messageKey(), declared);
        }
        return messages.format(MessageKey.STATUS, declared, Map.of(
                "model", modelName,
                "remaining", rateLimiter.remaining(userKey, now),
                "max", rateLimiter.maxRequests(),
                "window", rateLimiter.window().toSeconds()
        ));
    }

    private void logRoute(InboundMessage message, String reason, ClassificationResult classification) {
        if (!debugMode && !LOGGER.isDebugEnabled()) {
            return;
        }
        String line = "Routed message from {} | reason={} | classification={} | preview=\"{}\"";
        Object[] args = {message.userKey(), reason, classification, preview(message.text())};
        if (debugMode) {
            LOGGER.info(line, args);
        } else {
            LOGGER.debug(line, args);
        }
    }

    private static String preview(String text) {
        String normalized = text.strip().replaceAll("\\s+", " ");
        if (normalized.length() <= PREVIEW_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, PREVIEW_LENGTH - 3) + "...";
    }
}
