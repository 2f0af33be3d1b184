package com.codeassist.bot.language;

public enum MessageKey {
    WELCOME("welcome"),
    HELP("help"),
    LANGUAGE_INFO("language_info"),
    STATUS("status"),
    RATE_LIMIT("rate_limit"),
    ERROR("error"),
    CREATOR("creator"),
    CODE_FAILED("code_failed"),
    ANSWER_FAILED("answer_failed"),
    CODE_USAGE("code_usage"),
    APP_USAGE("app_usage"),
    WEB_USAGE("web_usage"),
    AI_USAGE("ai_usage"),
    ML_USAGE("ml_usage"),
    MOBILE_USAGE("mobile_usage"),
    DB_USAGE("db_usage"),
    API_USAGE("api_usage"),
    ASK_USAGE("ask_usage");

    private final String resourceKey;

    MessageKey(String resourceKey) {
        this.resourceKey = resourceKey;
    }

    public String resourceKey() {
        return resourceKey;
    }
}
