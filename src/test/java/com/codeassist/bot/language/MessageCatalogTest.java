package com.codeassist.bot.language;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageCatalogTest {
    private final MessageCatalog catalog = new MessageCatalog("/messages.json");

    @Test
    void everyKeyHasTextInBothLanguages() {
        for (MessageKey key : MessageKey.values()) {
            assertNotNull(catalog.get(key, Language.ENGLISH));
            assertNotNull(catalog.get(key, Language.BENGALI));
        }
    }

    @Test
    void creatorAnswerIsLocalized() {
        assertEquals("I was created by Rafsan Maruf.", catalog.get(MessageKey.CREATOR, Language.ENGLISH));
        assertEquals("আমাকে Rafsan Maruf তৈরি করেছেন।", catalog.get(MessageKey.CREATOR, Language.BENGALI));
    }

    @Test
    void formatReplacesPlaceholders() {
        String notice = catalog.format(MessageKey.RATE_LIMIT, Language.ENGLISH, Map.of("seconds", 42));

        assertTrue(notice.contains("42 seconds"));
        assertFalse(notice.contains("{seconds}"));
    }

    @Test
    void missingResourceFailsFast() {
        assertThrows(IllegalStateException.class, () -> new MessageCatalog("/no-such-messages.json"));
    }
}
