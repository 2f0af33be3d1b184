package com.codeassist.bot.router;

import com.codeassist.bot.intent.Intent;
import com.codeassist.bot.language.MessageKey;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum BotCommand {
    START("start", "Start the bot / বট শুরু করুন", null, MessageKey.WELCOME),
    HELP("help", "Show help / সাহায্য দেখুন", null, MessageKey.HELP),
    LANG("lang", "Language info / ভাষার তথ্য", null, MessageKey.LANGUAGE_INFO),
    STATUS("status", "Bot status / বট স্ট্যাটাস", null, MessageKey.STATUS),
    CODE("code", "Generate code / কোড তৈরি করুন", Intent.CODE, MessageKey.CODE_USAGE),
    APP("app", "Create app code / অ্যাপ কোড তৈরি করুন", Intent.APP, MessageKey.APP_USAGE),
    WEB("web", "Create website code / ওয়েবসাইট কোড তৈরি করুন", Intent.WEB, MessageKey.WEB_USAGE),
    AI("ai", "AI/ML projects / AI/ML প্রোজেক্ট", Intent.AI, MessageKey.AI_USAGE),
    ML("ml", "Machine learning / মেশিন লার্নিং", Intent.ML, MessageKey.ML_USAGE),
    MOBILE("mobile", "Mobile app dev / মোবাইল অ্যাপ", Intent.MOBILE, MessageKey.MOBILE_USAGE),
    DB("db", "Database design / ডাটাবেস ডিজাইন", Intent.DATABASE, MessageKey.DB_USAGE),
    API("api", "API development / API ডেভেলপমেন্ট", Intent.API, MessageKey.API_USAGE),
    ASK("ask", "Ask any question / যেকোনো প্রশ্ন করুন", Intent.ASK, MessageKey.ASK_USAGE);

    private final String commandName;
    private final String description;
    private final Intent intent;
    private final MessageKey messageKey;

    BotCommand(String commandName, String description, Intent intent, MessageKey messageKey) {
        this.commandName = commandName;
        this.description = description;
        this.intent = intent;
        this.messageKey = messageKey;
    }

    public String commandName() {
        return commandName;
    }

    public String description() {
        return description;
    }

    /**
     * Intent forwarded to the generator, or null for informational commands.
     */
    public Intent intent() {
        return intent;
    }

    /**
     * Usage hint for generating commands, reply text for informational ones.
     */
    public MessageKey messageKey() {
        return messageKey;
    }

    public boolean generates() {
        return intent != null;
    }

    public static Optional<BotCommand> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(command -> command.commandName.equals(normalized))
                .findFirst();
    }
}
