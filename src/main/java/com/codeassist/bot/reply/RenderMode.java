package com.codeassist.bot.reply;

public enum RenderMode {
    MARKDOWN,
    PLAIN
}
