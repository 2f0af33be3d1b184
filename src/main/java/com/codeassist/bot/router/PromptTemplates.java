package com.codeassist.bot.router;

import com.codeassist.bot.intent.Intent;
import com.codeassist.bot.language.Language;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Instruction templates wrapped around the user's text before it is sent to
 * the generator: one system instruction for code, one for questions, and a
 * per-intent instruction for every build intent.
 */
public class PromptTemplates {
    private static final String CODE_SYSTEM = "code";
    private static final String QUESTION_SYSTEM = "question";

    record TemplateFile(
            Map<String, Map<String, String>> system,
            Map<String, Map<String, String>> intents
    ) {}

    private final TemplateFile templates;

    public PromptTemplates(String resourcePath) {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream stream = getClass().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IllegalStateException("Prompt resource not found: " + resourcePath);
            }
            templates = mapper.readValue(stream, TemplateFile.class);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load prompt templates from " + resourcePath, ex);
        }
        requireEnglish(templates.system(), CODE_SYSTEM);
        requireEnglish(templates.system(), QUESTION_SYSTEM);
        for (Intent intent : Intent.values()) {
            if (intent.isBuild()) {
                requireEnglish(templates.intents(), intent.templateKey());
            }
        }
    }

    public String build(Intent intent, Language language, String userText) {
        if (!intent.isBuild()) {
            return pick(templates.system(), QUESTION_SYSTEM, language) + "\n\nQuestion: " + userText;
        }
        return pick(templates.system(), CODE_SYSTEM, language)
                + "\n\n"
                + pick(templates.intents(), intent.templateKey(), language)
                + "\n\nUser Request: " + userText;
    }

    private static String pick(Map<String, Map<String, String>> table, String key, Language language) {
        Map<String, String> translations = table.get(key);
        String text = translations.get(language.code());
        return text != null ? text : translations.get(Language.ENGLISH.code());
    }

    private static void requireEnglish(Map<String, Map<String, String>> table, String key) {
        if (table == null || table.get(key) == null || table.get(key).get(Language.ENGLISH.code()) == null) {
            throw new IllegalStateException("Missing English prompt template '" + key + "'");
        }
    }
}
