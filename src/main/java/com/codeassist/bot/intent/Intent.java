package com.codeassist.bot.intent;

public enum Intent {
    CODE("code", true),
    APP("app", true),
    WEB("web", true),
    AI("ai", true),
    ML("ml", true),
    MOBILE("mobile", true),
    DATABASE("database", true),
    API("api", true),
    ASK("ask", false),
    GENERAL("general", true);

    private final String templateKey;
    private final boolean build;

    Intent(String templateKey, boolean build) {
        this.templateKey = templateKey;
        this.build = build;
    }

    public String templateKey() {
        return templateKey;
    }

    /**
     * True for intents answered with generated code, false for open questions.
     */
    public boolean isBuild() {
        return build;
    }
}
