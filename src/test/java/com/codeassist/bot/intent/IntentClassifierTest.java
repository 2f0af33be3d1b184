package com.codeassist.bot.intent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class IntentClassifierTest {
    private final IntentClassifier classifier = new IntentClassifier();

    @Test
    void conceptQuestionWithoutCodeVocabularyIsNotABuildRequest() {
        IntentMatch match = classifier.classify("explain what is recursion");

        assertEquals(IntentMatch.Rule.CONCEPT_QUESTION, match.rule());
        assertFalse(match.isBuildRequest());
        assertEquals(Intent.ASK, match.intent());
    }

    @Test
    void strongKeywordOverridesConceptQuestion() {
        IntentMatch match = classifier.classify("explain what is a function and write code for it");

        assertTrue(match.isBuildRequest());
        assertEquals(Intent.GENERAL, match.intent());
    }

    @Test
    void conceptQuestionNamingACodeNounIsABuildRequest() {
        IntentMatch match = classifier.classify("why is my script slow");

        assertEquals(IntentMatch.Rule.CONCEPT_WITH_CODE_NOUN, match.rule());
        assertEquals("script", match.matchedTerm());
    }

    @Test
    void syntaxFragmentsAreBuildRequests() {
        assertEquals(IntentMatch.Rule.SYNTAX, classifier.classify("def foo(x): return x").rule());
        assertEquals(IntentMatch.Rule.SYNTAX, classifier.classify("why does x == y fail").rule());
        assertTrue(classifier.isBuildRequest("const total = items.reduce((a, b) => a + b)"));
    }

    @Test
    void syntaxFragmentMatchesAtEndOfMessage() {
        assertTrue(classifier.isBuildRequest("what does async"));
    }

    @Test
    void englishVocabularyMatchesWholeWordsOnly() {
        assertTrue(classifier.isBuildRequest("build me a todo app"));
        assertTrue(classifier.isBuildRequest("tips for docker containers"));
        assertTrue(classifier.isBuildRequest("recommend some APIs"));
        assertFalse(classifier.isBuildRequest("tell me about the rain in spain"));
    }

    @Test
    void inflectedVocabularyIsABuildRequest() {
        String[] samples = {
                "help me with programming homework",
                "i am developing a game",
                "building a chatbot for my shop",
                "i need help coding a bot",
                "can you be my programmer today",
                "writing a parser by hand"
        };
        for (String sample : samples) {
            IntentMatch match = classifier.classify(sample);
            assertEquals(IntentMatch.Rule.VOCABULARY, match.rule(), sample);
            assertTrue(match.isBuildRequest(), sample);
        }
    }

    @Test
    void bengaliVocabularyMatchesAsSubstring() {
        IntentMatch match = classifier.classify("পাইথনে একটি ক্যালকুলেটর বানাও");

        assertEquals(IntentMatch.Rule.VOCABULARY, match.rule());
        assertTrue(match.isBuildRequest());
    }

    @Test
    void bengaliConceptQuestionWithoutCodeNounIsAQuestion() {
        IntentMatch match = classifier.classify("সূর্যগ্রহণ কেন হয়");

        assertEquals(IntentMatch.Rule.CONCEPT_QUESTION, match.rule());
        assertFalse(match.isBuildRequest());
    }

    @Test
    void creatorQuestionWinsOverEverything() {
        IntentMatch match = classifier.classify("who created this code bot { }");

        assertTrue(match.isCreatorQuestion());
        assertFalse(match.isBuildRequest());
        assertTrue(classifier.isCreatorQuestion("তোমাকে কে তৈরি করেছে?"));
    }

    @Test
    void plainChatHasNoSignal() {
        IntentMatch match = classifier.classify("good morning");

        assertEquals(IntentMatch.Rule.NO_SIGNAL, match.rule());
        assertEquals(Intent.ASK, match.intent());
    }

    @Test
    void caseAndSurroundingWhitespaceDoNotChangeTheResult() {
        String[] samples = {
                "Explain what is recursion",
                "WRITE PYTHON CODE",
                "Who Made You?",
                "def add(a, b)",
                "good morning"
        };
        for (String sample : samples) {
            IntentMatch base = classifier.classify(sample);
            assertEquals(base, classifier.classify(sample.toUpperCase(Locale.ROOT)), sample);
            assertEquals(base, classifier.classify(sample.toLowerCase(Locale.ROOT)), sample);
            assertEquals(base, classifier.classify("  " + sample + " \n\t"), sample);
        }
    }
}
