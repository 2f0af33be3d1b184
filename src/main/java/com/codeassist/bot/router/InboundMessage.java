package com.codeassist.bot.router;

import java.util.Optional;

/**
 * Transport-neutral inbound message.
 *
 * @param userKey opaque user identifier used as the rate limit key
 * @param text full message text, or the argument text for a command
 * @param declaredLocale locale reported by the transport, may be null
 * @param command parsed command, null for free-form text
 */
public record InboundMessage(String userKey, String text, String declaredLocale, CommandInvocation command) {
    private static final String COMMAND_PREFIX = "/";

    public InboundMessage {
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("userKey cannot be blank");
        }
        text = text == null ? "" : text;
    }

    public static InboundMessage freeForm(String userKey, String text, String declaredLocale) {
        return new InboundMessage(userKey, text, declaredLocale, null);
    }

    public static InboundMessage command(String userKey, BotCommand command, String argument, String declaredLocale) {
        CommandInvocation invocation = new CommandInvocation(command, argument);
        return new InboundMessage(userKey, invocation.argument(), declaredLocale, invocation);
    }

    /**
     * Treats {@code /name rest...} as a command when {@code name} is known and
     * everything else as free-form text.
     */
    public static InboundMessage parse(String userKey, String rawText, String declaredLocale) {
        String text = rawText == null ? "" : rawText.strip();
        if (text.startsWith(COMMAND_PREFIX)) {
            int split = indexOfWhitespace(text);
            String name = split < 0 ? text.substring(1) : text.substring(1, split);
            String argument = split < 0 ? "" : text.substring(split);
            Optional<BotCommand> command = BotCommand.fromName(name);
            if (command.isPresent()) {
                return command(userKey, command.get(), argument, declaredLocale);
            }
        }
        return freeForm(userKey, text, declaredLocale);
    }

    public Optional<CommandInvocation> commandInvocation() {
        return Optional.ofNullable(command);
    }

    private static int indexOfWhitespace(String text) {
        for (int index = 0; index < text.length(); index++) {
            if (Character.isWhitespace(text.charAt(index))) {
                return index;
            }
        }
        return -1;
    }
}
