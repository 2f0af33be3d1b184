package com.codeassist.bot.router;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class InboundMessageTest {

    @Test
    void parsesKnownCommandWithArgument() {
        InboundMessage message = InboundMessage.parse("u1", "/code   sort a list in java ", "en-US");

        CommandInvocation invocation = message.commandInvocation().orElseThrow();
        assertEquals(BotCommand.CODE, invocation.command());
        assertEquals("sort a list in java", invocation.argument());
        assertEquals("sort a list in java", message.text());
    }

    @Test
    void commandNameIsCaseInsensitive() {
        InboundMessage message = InboundMessage.parse("u1", "/HELP", null);

        assertEquals(BotCommand.HELP, message.commandInvocation().orElseThrow().command());
        assertFalse(message.commandInvocation().orElseThrow().hasArgument());
    }

    @Test
    void unknownCommandIsFreeFormText() {
        InboundMessage message = InboundMessage.parse("u1", "/shrug what now", null);

        assertTrue(message.commandInvocation().isEmpty());
        assertEquals("/shrug what now", message.text());
    }

    @Test
    void blankUserKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> InboundMessage.freeForm(" ", "hi", null));
    }
}
