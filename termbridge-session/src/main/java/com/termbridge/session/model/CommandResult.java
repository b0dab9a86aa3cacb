package com.termbridge.session.model;

/**
 * Outcome of one remote command. A non-zero exit code is a normal result.
 */
public record CommandResult(String stdout, String stderr, int exitCode) {

    /** Placeholder for commands that have not finished yet. */
    public static final CommandResult PENDING = new CommandResult("", "", -1);

    public boolean isPending() {
        return this.equals(PENDING);
    }
}
