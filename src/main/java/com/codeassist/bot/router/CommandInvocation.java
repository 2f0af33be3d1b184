package com.codeassist.bot.router;

public record CommandInvocation(BotCommand command, String argument) {
    public CommandInvocation {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        argument = argument == null ? "" : argument.strip();
    }

    public boolean hasArgument() {
        return !argument.isEmpty();
    }
}
