/*
 * Copyright (c) 2016 VMware, Inc. All Rights Reserved.
 *
 * This product is licensed to you under the Apache License, Version 2.0 (the "License").
 * You may not use this product except in compliance with the License.
 *
 * This product may include a number of subcomponents with separate copyright notices
 * and license terms. Your use of these subcomponents is subject to the terms and
 * conditions of the subcomponent's license, as noted in the LICENSE file.
 */

package com.vmware.sshpool.ssh;

import java.io.IOException;
import java.net.Socket;
import java.util.logging.Logger;

/**
 * {@link Transport} over a connected TCP socket
 */
public class SocketTransport implements Transport {
    private static final Logger logger = Logger.getLogger(SocketTransport.class.getName());

    private final String host;
    private final int port;
    private final Socket socket;

    public SocketTransport(String host, int port, Socket socket) {
        this.host = host;
        this.port = port;
        this.socket = socket;
    }

    public Socket getSocket() {
        return socket;
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public int getPort() {
        return port;
    }

    @Override
    public boolean isClosed() {
        return socket.isClosed();
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException x) {
            logger.warning("Failed to close socket to " + this + ": " + x.getMessage());
        }
    }

    @Override
    public String toString() {
        return "SocketTransport [" + host + ":" + port + "]";
    }
}
