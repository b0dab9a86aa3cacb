package com.termbridge.session.broadcast;

/**
 * Rewrites a command's output stream to CRLF line endings.
 *
 * <p>
 * Stateful per command: a CR at the end of one chunk is held until the next
 * chunk shows whether it starts a CRLF pair. A lone CR (progress bars) is
 * kept as is.
 */
public class LineEndingNormalizer {

    private boolean pendingCr;
    private boolean emittedAny;
    private boolean endsWithLineBreak;

    public String normalize(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(chunk.length() + 8);
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (c == '\r') {
                if (pendingCr) {
                    out.append('\r');
                }
                pendingCr = true;
            } else if (c == '\n') {
                out.append("\r\n");
                pendingCr = false;
            } else {
                if (pendingCr) {
                    out.append('\r');
                    pendingCr = false;
                }
                out.append(c);
            }
        }
        if (out.length() > 0) {
            emittedAny = true;
            endsWithLineBreak = out.charAt(out.length() - 1) == '\n';
        }
        return out.toString();
    }

    /**
     * Text that closes the stream: the line break that keeps the next prompt
     * off the last output line, or nothing when no output was produced or it
     * already ended with one.
     */
    public String finish() {
        if (pendingCr) {
            pendingCr = false;
            emittedAny = true;
            endsWithLineBreak = true;
            return "\r\n";
        }
        if (emittedAny && !endsWithLineBreak) {
            endsWithLineBreak = true;
            return "\r\n";
        }
        return "";
    }
}
