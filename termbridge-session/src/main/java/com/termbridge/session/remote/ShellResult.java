package com.termbridge.session.remote;

/**
 * Completed command as seen by the transport.
 *
 * @param workingDirectory shell working directory after the command ran
 */
public record ShellResult(String stdout, String stderr, int exitCode, String workingDirectory) {
}
