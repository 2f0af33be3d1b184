package com.codeassist.bot.language;

/**
 * Decides between English and Bengali.
 *
 * Text detection is a script-presence test: one code point from the Bengali
 * block (U+0980..U+09FF) anywhere in the message makes the whole message
 * Bengali. The declared locale is only used for system messages sent before
 * any user text is known.
 */
public final class LanguageClassifier {
    private static final int BENGALI_BLOCK_START = 0x0980;
    private static final int BENGALI_BLOCK_END = 0x09FF;

    public Language detectFromLocale(String localeTag) {
        if (localeTag != null && localeTag.startsWith(Language.BENGALI.code())) {
            return Language.BENGALI;
        }
        return Language.ENGLISH;
    }

    public Language detectFromText(String text) {
        if (text == null || text.isEmpty()) {
            return Language.ENGLISH;
        }
        boolean bengali = text.codePoints()
                .anyMatch(codePoint -> codePoint >= BENGALI_BLOCK_START && codePoint <= BENGALI_BLOCK_END);
        return bengali ? Language.BENGALI : Language.ENGLISH;
    }
}
