package com.termbridge.session.remote;

import java.util.UUID;

/**
 * In-band completion markers appended after every command written to the
 * shell.
 *
 * <p>
 * A bare {@code RS "TB" token RS} goes to stderr and then the status marker
 * {@code RS "TB" token exit pwd RS} to stdout, so both streams are known to be
 * flushed when the two markers have been seen. With a PTY both land on stdout
 * and the status marker is always the last thing the command prints. The shell
 * only ever sees the octal escape {@code \036}, so an echoed command line
 * cannot contain a marker.
 */
final class CompletionMarker {

    static final char RS = '\u001e';

    private CompletionMarker() {
    }

    static String newToken() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * Shell line that prints both markers for {@code token}.
     */
    static String trailer(String token) {
        return "__tb_rc=$?; printf '\\036TB %s\\036' '" + token + "' >&2; "
                + "printf '\\036TB %s %d %s\\036' '" + token + "' \"$__tb_rc\" \"$PWD\"; unset __tb_rc";
    }

    static String opening(String token) {
        return RS + "TB " + token;
    }
}
