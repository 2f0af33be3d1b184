package com.codeassist.bot.language;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;

/**
 * Localized system texts. Every key must have an English entry; a missing
 * Bengali entry falls back to English.
 */
public class MessageCatalog {
    private final Map<MessageKey, Map<String, String>> messages;

    public MessageCatalog(String resourcePath) {
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Map<String, String>> raw;
        try (InputStream stream = getClass().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IllegalStateException("Message resource not found: " + resourcePath);
            }
            raw = mapper.readValue(stream, new TypeReference<>() {});
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load messages from " + resourcePath, ex);
        }
        this.messages = new EnumMap<>(MessageKey.class);
        for (MessageKey key : MessageKey.values()) {
            Map<String, String> translations = raw.get(key.resourceKey());
            if (translations == null || translations.get(Language.ENGLISH.code()) == null) {
                throw new IllegalStateException("Missing English text for message '" + key.resourceKey() + "'");
            }
            messages.put(key, Map.copyOf(translations));
        }
    }

    public String get(MessageKey key, Language language) {
        Map<String, String> translations = messages.get(key);
        String text = translations.get(language.code());
        return text != null ? text : translations.get(Language.ENGLISH.code());
    }

    public String format(MessageKey key, Language language, Map<String, ?> values) {
        String text = get(key, language);
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            text = text.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return text;
    }
}
