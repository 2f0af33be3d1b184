package com.codeassist.bot.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

public record BotConfig(
        String discordToken,
        String geminiApiKey,
        String geminiModel,
        String geminiEndpoint,
        String guildId,
        int rateLimitPerUser,
        Duration rateLimitWindow,
        Duration sweepInterval,
        int maxMessageLength,
        Duration requestTimeout,
        boolean debugMode
) {
    private static final Pattern ENV_KEY_PATTERN = Pattern.compile("[A-Z0-9_]+");
    private static final String DEFAULT_MODEL = "gemini-2.5-flash";
    private static final String DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta";

    public static BotConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        return fromLookup(key -> {
            String value = dotenv.get(key);
            if (value == null || value.isBlank()) {
                return System.getenv(key);
            }
            return value;
        });
    }

    static BotConfig fromLookup(UnaryOperator<String> env) {
        String token = getRequired(env, "DISCORD_TOKEN");
        String apiKey = getRequired(env, "GEMINI_API_KEY");

        return new BotConfig(
                token,
                apiKey,
                getOrDefault(env, "GEMINI_MODEL", DEFAULT_MODEL),
                stripTrailingSlash(getOrDefault(env, "GEMINI_ENDPOINT", DEFAULT_ENDPOINT)),
                getOptional(env, "GUILD_ID"),
                parsePositiveInt(env, "RATE_LIMIT_PER_USER", 10),
                Duration.ofSeconds(parsePositiveInt(env, "RATE_LIMIT_WINDOW", 60)),
                Duration.ofSeconds(parsePositiveInt(env, "RATE_LIMIT_SWEEP_INTERVAL", 300)),
                parsePositiveInt(env, "MAX_MESSAGE_LENGTH", 4096),
                Duration.ofSeconds(parsePositiveInt(env, "REQUEST_TIMEOUT", 30)),
                Boolean.parseBoolean(getOrDefault(env, "DEBUG_MODE", "false").trim())
        );
    }

    private static String getRequired(UnaryOperator<String> env, String key) {
        String value = getOptional(env, key);
        if (value == null) {
            throw new IllegalStateException(safeKey(key) + " must be set in the environment");
        }
        return value;
    }

    private static String getOptional(UnaryOperator<String> env, String key) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static String getOrDefault(UnaryOperator<String> env, String key, String defaultValue) {
        String value = getOptional(env, key);
        return value == null ? defaultValue : value;
    }

    private static int parsePositiveInt(UnaryOperator<String> env, String key, int defaultValue) {
        String value = getOptional(env, key);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException error) {
            throw new IllegalStateException(safeKey(key) + " must be a whole number, got '" + value + "'", error);
        }
        if (parsed <= 0) {
            throw new IllegalStateException(safeKey(key) + " must be positive, got " + parsed);
        }
        return parsed;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String safeKey(String key) {
        return ENV_KEY_PATTERN.matcher(key).matches() ? key : "required environment variable";
    }
}
