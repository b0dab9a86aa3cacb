package com.termbridge.session.remote;

/**
 * Strips completion markers out of one output stream, passing everything
 * before them through. Markers split across chunks are held back until they
 * can be decided.
 */
final class MarkerScanner {

    private final String opening;
    private final boolean statusMarker;
    private final StringBuilder pending = new StringBuilder();
    private boolean complete;
    private String fields;

    /**
     * @param statusMarker true to finish on the stdout marker carrying exit code
     *                     and directory; false to finish on the bare marker
     */
    MarkerScanner(String token, boolean statusMarker) {
        this.opening = CompletionMarker.opening(token);
        this.statusMarker = statusMarker;
    }

    /**
     * Feed a chunk and return the text that belongs to the command's output.
     */
    String feed(String chunk) {
        if (complete) {
            return "";
        }
        pending.append(chunk);
        StringBuilder out = new StringBuilder();
        while (true) {
            int start = pending.indexOf(opening);
            if (start < 0) {
                int hold = partialOpeningLength();
                out.append(pending, 0, pending.length() - hold);
                pending.delete(0, pending.length() - hold);
                return out.toString();
            }
            int end = pending.indexOf(String.valueOf(CompletionMarker.RS), start + opening.length());
            out.append(pending, 0, start);
            if (end < 0) {
                pending.delete(0, start);
                return out.toString();
            }
            String body = pending.substring(start + opening.length(), end);
            pending.delete(0, end + 1);
            if (body.isEmpty()) {
                // a bare marker on stdout is the stderr marker of a PTY session
                if (!statusMarker) {
                    return finish(out);
                }
            } else if (statusMarker) {
                fields = body.trim();
                return finish(out);
            }
        }
    }

    boolean isComplete() {
        return complete;
    }

    /**
     * "exit pwd" text of the status marker, or null.
     */
    String fields() {
        return fields;
    }

    int exitCode() {
        if (fields == null) {
            return -1;
        }
        String code = fields.split(" ", 2)[0];
        try {
            return Integer.parseInt(code);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    String workingDirectory() {
        if (fields == null) {
            return null;
        }
        String[] parts = fields.split(" ", 2);
        return parts.length > 1 ? parts[1] : null;
    }

    private String finish(StringBuilder out) {
        complete = true;
        pending.setLength(0);
        return out.toString();
    }

    private int partialOpeningLength() {
        int max = Math.min(pending.length(), opening.length() - 1);
        String tail = pending.substring(pending.length() - max);
        for (int k = max; k > 0; k--) {
            if (tail.regionMatches(max - k, opening, 0, k)) {
                return k;
            }
        }
        return 0;
    }
}
