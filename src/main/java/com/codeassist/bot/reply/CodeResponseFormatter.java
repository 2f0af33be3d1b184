package com.codeassist.bot.reply;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Wraps runs of code-looking lines in fenced blocks when a generated reply
 * arrived without any. Replies that already contain a fence pass through
 * untouched apart from trimming.
 */
public final class CodeResponseFormatter {
    private static final String FENCE = "```";

    private static final List<Pattern> CODE_LINE_PATTERNS = List.of(
            // declarations and imports
            Pattern.compile("^(def|class|function|var|let|const|import|from|package|#include)\\b"),
            // assignments
            Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_.]*\\s*=[^=]"),
            // control flow
            Pattern.compile("^(if|for|while|switch|catch)\\s*\\("),
            Pattern.compile("^(try|else|finally)\\s*[:{]"),
            // calls that make up the whole line
            Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_.]*\\(.*\\)\\s*;?$"),
            // statement and block endings
            Pattern.compile("[{};]$"),
            // markup
            Pattern.compile("^</?[a-zA-Z][a-zA-Z0-9]*[\\s>/]"),
            // comments
            Pattern.compile("^(//|/\\*|\\*/|#!)"),
            // output statements
            Pattern.compile("(console\\.|print\\(|System\\.out|echo\\s)")
    );

    private CodeResponseFormatter() {
    }

    public static String format(String response) {
        if (response == null) {
            return "";
        }
        String trimmed = response.strip();
        if (trimmed.contains(FENCE)) {
            return trimmed;
        }
        String[] lines = trimmed.split("\n", -1);
        List<String> formatted = new ArrayList<>(lines.length + 4);
        boolean inCodeBlock = false;
        for (String line : lines) {
            boolean codeLine = isCodeLine(line);
            if (codeLine && !inCodeBlock) {
                formatted.add(FENCE + detectLanguage(line));
                formatted.add(line);
                inCodeBlock = true;
            } else if (inCodeBlock && (line.isBlank() || codeLine)) {
                formatted.add(line);
            } else if (inCodeBlock) {
                formatted.add(FENCE);
                formatted.add("");
                formatted.add(line);
                inCodeBlock = false;
            } else {
                formatted.add(line);
            }
        }
        if (inCodeBlock) {
            formatted.add(FENCE);
        }
        return String.join("\n", formatted);
    }

    static boolean isCodeLine(String line) {
        String stripped = line == null ? "" : line.strip();
        if (stripped.isEmpty()) {
            return false;
        }
        return CODE_LINE_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(stripped).find());
    }

    static String detectLanguage(String line) {
        String lower = line.strip().toLowerCase(Locale.ROOT);
        if (lower.contains("public class") || lower.contains("system.out") || lower.startsWith("package ")) {
            return "java";
        }
        if (lower.contains("#include") || lower.contains("cout <<")) {
            return "cpp";
        }
        if (lower.startsWith("<html") || lower.startsWith("<!doctype") || lower.startsWith("<div")) {
            return "html";
        }
        if (lower.startsWith("select ") || lower.startsWith("insert into") || lower.startsWith("create table")) {
            return "sql";
        }
        if (lower.startsWith("#!/bin/bash") || lower.startsWith("echo ")) {
            return "bash";
        }
        if (lower.startsWith("def ") || lower.startsWith("import ") || lower.startsWith("from ")
                || lower.contains("print(")) {
            return "python";
        }
        if (lower.startsWith("function") || lower.startsWith("const ") || lower.startsWith("let ")
                || lower.contains("console.")) {
            return "javascript";
        }
        if (lower.startsWith("body {") || lower.matches("^[.#][a-z][\\w-]*\\s*\\{$")) {
            return "css";
        }
        return "";
    }
}
