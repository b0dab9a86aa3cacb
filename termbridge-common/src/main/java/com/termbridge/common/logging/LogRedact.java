package com.termbridge.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks SSH credentials in text before it reaches a log line.
 *
 * <p>
 * Covers JSON credential fields, {@code KEY=value} style assignments, CLI
 * password flags and PEM private-key blocks.
 */
public final class LogRedact {

    private LogRedact() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 4;
    private static final int KEEP_END = 2;

    private static final Pattern PEM_BLOCK = Pattern.compile(
            "-----BEGIN [A-Z0-9 ]*PRIVATE KEY-----[\\s\\S]+?-----END [A-Z0-9 ]*PRIVATE KEY-----");

    private static final List<Pattern> VALUE_PATTERNS = List.of(
            Pattern.compile("\"(?:password|passphrase|privateKey|secret|token)\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b[A-Z0-9_]*(?:PASSWORD|PASSPHRASE|SECRET|TOKEN|KEY)\\b\\s*[=:]\\s*[\"']?([^\\s\"']+)"),
            Pattern.compile("--(?:password|passphrase|secret|token)\\s+[\"']?([^\\s\"']+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:password|passphrase)=([^\\s,}]+)", Pattern.CASE_INSENSITIVE));

    /**
     * Redact credentials in arbitrary text. Null and empty input is returned
     * unchanged.
     */
    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = PEM_BLOCK.matcher(text).replaceAll(m -> Matcher.quoteReplacement(redactPemBlock(m.group())));
        for (Pattern pattern : VALUE_PATTERNS) {
            result = maskGroup(result, pattern);
        }
        return result;
    }

    /**
     * Redact only when enabled by configuration.
     */
    public static String redact(String text, boolean enabled) {
        return enabled ? redact(text) : text;
    }

    /**
     * Mask a single secret, keeping a short prefix and suffix of long values.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }

    private static String maskGroup(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String full = matcher.group();
            String secret = matcher.group(1);
            String replacement = full;
            if (secret != null && !secret.isEmpty() && !secret.startsWith("-----BEGIN")
                    && !secret.contains("…redacted…")) {
                int start = matcher.start(1) - matcher.start();
                replacement = full.substring(0, start) + maskToken(secret) + full.substring(start + secret.length());
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String redactPemBlock(String block) {
        String[] lines = block.split("\\r?\\n|\\\\n");
        if (lines.length < 2) {
            return "***";
        }
        return lines[0] + "…redacted…" + lines[lines.length - 1];
    }
}
