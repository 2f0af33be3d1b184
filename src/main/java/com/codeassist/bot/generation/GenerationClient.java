package com.codeassist.bot.generation;

public interface GenerationClient {
    /**
     * Sends a fully assembled prompt to the model and returns its trimmed text.
     *
     * @throws GenerationException if the call fails, times out or yields no text
     */
    String generate(String prompt, GenerationMode mode) throws GenerationException;
}
