package com.termbridge.session.remote;

import com.termbridge.session.error.ConnectionFailedException;
import com.termbridge.session.model.ConnectionConfig;

/**
 * Opens remote shells. The production implementation speaks SSH; tests plug
 * in an in-memory fake.
 */
public interface RemoteConnector {

    /**
     * Connect, authenticate and start a ready-to-use shell.
     *
     * @throws ConnectionFailedException with AUTHENTICATION_FAILED,
     *                                   HOST_UNREACHABLE or CONNECT_TIMEOUT
     */
    RemoteShell connect(ConnectionConfig config, TransportListener listener);
}
