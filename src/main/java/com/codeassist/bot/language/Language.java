package com.codeassist.bot.language;

public enum Language {
    ENGLISH("en"),
    BENGALI("bn");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
