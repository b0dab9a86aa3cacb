package com.termbridge.session.remote;

public enum ShellStream {
    STDOUT, STDERR
}
