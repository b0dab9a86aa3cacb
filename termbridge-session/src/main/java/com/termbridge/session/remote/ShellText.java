package com.termbridge.session.remote;

import java.util.regex.Pattern;

/**
 * Turns raw terminal output into result text: no escape sequences, LF line
 * endings, no trailing newline.
 */
final class ShellText {

    private static final Pattern ANSI = Pattern.compile(
            "\u001b\\[[0-?]*[ -/]*[@-~]|\u001b\\][^\u0007\u001b]*(?:\u0007|\u001b\\\\)|\u001b[@-Z\\\\-_]");

    private ShellText() {
    }

    static String clean(CharSequence raw) {
        String text = ANSI.matcher(raw).replaceAll("");
        text = text.replace("\r\n", "\n").replace("\u0007", "");
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
