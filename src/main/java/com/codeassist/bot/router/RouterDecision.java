package com.codeassist.bot.router;

import com.codeassist.bot.language.Language;
import java.time.Duration;

/**
 * Result of routing one inbound message. {@link Outcome#GENERATE} carries a
 * classification and the prompt to forward; every other outcome carries a
 * localized notice to send back as-is.
 */
public record RouterDecision(
        Outcome outcome,
        Language language,
        ClassificationResult classification,
        String enhancedPrompt,
        String notice,
        Duration retryAfter
) {
    public enum Outcome {
        IDENTITY,
        INFO,
        USAGE,
        DENIED,
        GENERATE
    }

    public static RouterDecision identity(Language language, String answer) {
        return new RouterDecision(Outcome.IDENTITY, language, null, null, answer, Duration.ZERO);
    }

    public static RouterDecision info(Language language, String text) {
        return new RouterDecision(Outcome.INFO, language, null, null, text, Duration.ZERO);
    }

    public static RouterDecision usage(Language language, String hint) {
        return new RouterDecision(Outcome.USAGE, language, null, null, hint, Duration.ZERO);
    }

    public static RouterDecision denied(Language language, String notice, Duration retryAfter) {
        return new RouterDecision(Outcome.DENIED, language, null, null, notice, retryAfter);
    }

    public static RouterDecision generate(ClassificationResult classification, String enhancedPrompt) {
        return new RouterDecision(
                Outcome.GENERATE,
                classification.language(),
                classification,
                enhancedPrompt,
                null,
                Duration.ZERO
        );
    }

    public boolean allowed() {
        return outcome != Outcome.DENIED;
    }

    public boolean requiresGeneration() {
        return outcome == Outcome.GENERATE;
    }
}
