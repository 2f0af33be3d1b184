package com.codeassist.bot.generation;

public enum GenerationMode {
    CODE(0.3d, 8192),
    QUESTION(0.7d, 4096);

    private final double temperature;
    private final int maxOutputTokens;

    GenerationMode(double temperature, int maxOutputTokens) {
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
    }

    public double temperature() {
        return temperature;
    }

    public int maxOutputTokens() {
        return maxOutputTokens;
    }
}
