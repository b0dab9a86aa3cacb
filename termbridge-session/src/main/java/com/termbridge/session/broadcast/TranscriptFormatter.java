package com.termbridge.session.broadcast;

/**
 * Builds the synthetic prompt-plus-command line shown ahead of a command's
 * output, e.g. {@code [alice@web1 ~/src]$ ls -la}.
 */
public final class TranscriptFormatter {

    private TranscriptFormatter() {
    }

    public static String prompt(String username, String host, String workingDirectory, String homeDirectory) {
        return "[" + username + "@" + host + " " + displayDirectory(workingDirectory, homeDirectory) + "]$ ";
    }

    /**
     * Prompt and command text ending in CRLF. Line breaks inside a multi-line
     * command become CRLF as well.
     */
    public static String echoLine(String prompt, String command) {
        LineEndingNormalizer normalizer = new LineEndingNormalizer();
        String text = normalizer.normalize(command.stripTrailing());
        return prompt + text + normalizer.finish() + (text.isEmpty() ? "\r\n" : "");
    }

    static String displayDirectory(String workingDirectory, String homeDirectory) {
        if (workingDirectory == null || workingDirectory.isEmpty()) {
            return "~";
        }
        if (homeDirectory != null && !homeDirectory.isEmpty() && !homeDirectory.equals("/")) {
            if (workingDirectory.equals(homeDirectory)) {
                return "~";
            }
            if (workingDirectory.startsWith(homeDirectory + "/")) {
                return "~" + workingDirectory.substring(homeDirectory.length());
            }
        }
        return workingDirectory;
    }
}
