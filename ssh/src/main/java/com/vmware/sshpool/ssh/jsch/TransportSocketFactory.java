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

package com.vmware.sshpool.ssh.jsch;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

import com.jcraft.jsch.SocketFactory;

/**
 * Hands an already connected socket to JSch instead of letting it dial its own
 */
class TransportSocketFactory implements SocketFactory {
    private final Socket socket;

    TransportSocketFactory(Socket socket) {
        this.socket = socket;
    }

    @Override
    public Socket createSocket(String host, int port) throws IOException {
        if (socket.isClosed()) {
            throw new IOException("Transport to " + host + ":" + port + " is closed");
        }
        return socket;
    }

    @Override
    public InputStream getInputStream(Socket socket) throws IOException {
        return socket.getInputStream();
    }

    @Override
    public OutputStream getOutputStream(Socket socket) throws IOException {
        return socket.getOutputStream();
    }
}
