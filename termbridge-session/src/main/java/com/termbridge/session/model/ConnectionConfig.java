package com.termbridge.session.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Fully resolved connection settings for one session. Key material arrives
 * already loaded; nothing here touches the filesystem.
 */
@Value
@Builder
public class ConnectionConfig {

    /** Caller-assigned session name. */
    String name;
    String host;
    @Builder.Default
    int port = 22;
    String username;
    @ToString.Exclude
    String password;
    /** PEM/OpenSSH private key text. */
    @ToString.Exclude
    String privateKey;
    @ToString.Exclude
    String passphrase;

    public boolean hasPrivateKey() {
        return privateKey != null && !privateKey.isBlank();
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }
}
