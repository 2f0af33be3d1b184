package com.codeassist.bot.router;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.codeassist.bot.intent.Intent;
import com.codeassist.bot.intent.IntentClassifier;
import com.codeassist.bot.language.Language;
import com.codeassist.bot.language.LanguageClassifier;
import com.codeassist.bot.language.MessageCatalog;
import com.codeassist.bot.ratelimit.SlidingWindowRateLimiter;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestRouterTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private SlidingWindowRateLimiter limiter;
    private RequestRouter router;

    @BeforeEach
    void setUp() {
        limiter = new SlidingWindowRateLimiter(2, Duration.ofSeconds(60));
        router = new RequestRouter(
                limiter,
                new LanguageClassifier(),
                new IntentClassifier(),
                new MessageCatalog("/messages.json"),
                new PromptTemplates("/prompts.json"),
                "gemini-test",
                false
        );
    }

    @Test
    void buildRequestIsRoutedWithGeneralIntent() {
        RouterDecision decision = router.route("u1", "write a python script to rename files", "en-US", NOW);

        assertEquals(RouterDecision.Outcome.GENERATE, decision.outcome());
        assertEquals(Intent.GENERAL, decision.classification().intent());
        assertEquals(Language.ENGLISH, decision.language());
        assertTrue(decision.enhancedPrompt().endsWith("User Request: write a python script to rename files"));
        assertEquals(1, limiter.remaining("u1", NOW));
    }

    @Test
    void bengaliTextIsClassifiedAsBengaliRegardlessOfLocale() {
        RouterDecision decision = router.route("u1", "রিকার্শন কাকে বলে", "en-US", NOW);

        assertEquals(Language.BENGALI, decision.language());
        assertEquals(Intent.ASK, decision.classification().intent());
        assertTrue(decision.enhancedPrompt().endsWith("Question: রিকার্শন কাকে বলে"));
    }

    @Test
    void deniedOnceQuotaIsSpentWithLocalizedNotice() {
        router.route("u1", "hello there", null, NOW);
        router.route("u1", "hello again", null, NOW.plusSeconds(10));

        RouterDecision decision = router.route("u1", "one more", "bn-BD", NOW.plusSeconds(20));

        assertFalse(decision.allowed());
        assertEquals(Duration.ofSeconds(40), decision.retryAfter());
        assertTrue(decision.notice().contains("40 সেকেন্ড"));
        assertNull(decision.classification());
    }

    @Test
    void creatorQuestionIsAnsweredEvenWhenQuotaIsSpent() {
        router.route("u1", "hello", null, NOW);
        router.route("u1", "hello", null, NOW);

        RouterDecision decision = router.route("u1", "Who made you?", null, NOW);

        assertEquals(RouterDecision.Outcome.IDENTITY, decision.outcome());
        assertEquals("I was created by Rafsan Maruf.", decision.notice());
        assertEquals(0, limiter.remaining("u1", NOW));
    }

    @Test
    void creatorQuestionDoesNotConsumeASlot() {
        RouterDecision decision = router.route("u1", "তোমাকে কে তৈরি করেছে?", null, NOW);

        assertEquals(Language.BENGALI, decision.language());
        assertEquals("আমাকে Rafsan Maruf তৈরি করেছেন।", decision.notice());
        assertEquals(2, limiter.remaining("u1", NOW));
    }

    @Test
    void commandWithoutArgumentReturnsUsageWithoutConsumingASlot() {
        RouterDecision decision = router.route(InboundMessage.parse("u1", "/code", null), NOW);

        assertEquals(RouterDecision.Outcome.USAGE, decision.outcome());
        assertTrue(decision.notice().contains("/code"));
        assertEquals(2, limiter.remaining("u1", NOW));
    }

    @Test
    void generatingCommandUsesItsOwnIntent() {
        RouterDecision decision = router.route(InboundMessage.parse("u1", "/db library loans", null), NOW);

        assertEquals(Intent.DATABASE, decision.classification().intent());
        assertTrue(decision.enhancedPrompt().contains("Create a database system"));
        assertEquals(1, limiter.remaining("u1", NOW));
    }

    @Test
    void askCommandForcesQuestionPathEvenForCodeWords() {
        RouterDecision decision = router.route(InboundMessage.parse("u1", "/ask what is a python class", null), NOW);

        assertEquals(Intent.ASK, decision.classification().intent());
        assertTrue(decision.enhancedPrompt().endsWith("Question: what is a python class"));
    }

    @Test
    void infoCommandsAreNeverLimited() {
        router.route("u1", "hello", null, NOW);
        router.route("u1", "hello", null, NOW);

        RouterDecision help = router.route(InboundMessage.parse("u1", "/help", null), NOW);
        RouterDecision status = router.route(InboundMessage.parse("u1", "/status", null), NOW);

        assertEquals(RouterDecision.Outcome.INFO, help.outcome());
        assertEquals(RouterDecision.Outcome.INFO, status.outcome());
        assertTrue(status.notice().contains("gemini-test"));
        assertTrue(status.notice().contains("0/2"));
    }

    @Test
    void blankTextGetsHelpWithoutConsumingASlot() {
        RouterDecision decision = router.route("u1", "   ", null, NOW);

        assertEquals(RouterDecision.Outcome.INFO, decision.outcome());
        assertEquals(2, limiter.remaining("u1", NOW));
    }
}
