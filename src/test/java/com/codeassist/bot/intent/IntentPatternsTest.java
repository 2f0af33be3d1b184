package com.codeassist.bot.intent;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class IntentPatternsTest {

    @Test
    void wordPatternRespectsLetterBoundaries() {
        Pattern ai = IntentPatterns.compileWordPattern("ai");

        assertTrue(ai.matcher("learn ai today").find());
        assertTrue(ai.matcher("(ai)").find());
        assertFalse(ai.matcher("explain this").find());
        assertFalse(ai.matcher("ai2").find());
    }

    @Test
    void multiWordTermsToleratePluralAndExtraWhitespace() {
        Pattern pattern = IntentPatterns.compileWordPattern("smart contract");

        assertTrue(pattern.matcher("deploy smart   contracts now").find());
        assertFalse(pattern.matcher("smartcontract").find());
    }

    @Test
    void blankTermNeverMatches() {
        assertFalse(IntentPatterns.compileWordPattern("  ").matcher("anything").find());
    }
}
