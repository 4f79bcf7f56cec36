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

import java.util.logging.Logger;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;

import com.vmware.sshpool.common.util.Deadline;
import com.vmware.sshpool.ssh.SshClient;
import com.vmware.sshpool.ssh.SshPoolException;
import com.vmware.sshpool.ssh.SshSession;
import com.vmware.sshpool.ssh.Transport;

/**
 * {@link SshClient} backed by a connected JSch Session
 */
public class JSchClient implements SshClient {
    private static final Logger logger = Logger.getLogger(JSchClient.class.getName());

    private final Session session;
    private final Transport transport;
    private final long execPollIntervalMillis;

    public JSchClient(Session session, Transport transport, long execPollIntervalMillis) {
        this.session = session;
        this.transport = transport;
        this.execPollIntervalMillis = execPollIntervalMillis;
    }

    @Override
    public Transport getTransport() {
        return transport;
    }

    @Override
    public boolean isConnected() {
        return session.isConnected() && !transport.isClosed();
    }

    /**
     * Creates an exec channel without any network round trip, so the deadline is not used here.
     * JSch sends the channel open request together with the command, which makes
     * {@link SshSession#run} the first call that talks to the server.
     *
     * Only a connection that is already known to be down is detected: the JSch session is
     * disconnected or the transport is closed. A half-open TCP connection goes unnoticed until
     * the command is run, and that failure is not seen by the pool.
     *
     * @param deadline
     *            ignored
     * @throws SshPoolException
     *             if the connection is down or JSch refuses to create the channel
     */
    @Override
    public SshSession openSession(Deadline deadline) throws SshPoolException {
        if (!isConnected()) {
            throw new SshPoolException("SSH connection is down: " + transport);
        }
        try {
            ChannelExec channel = (ChannelExec) session.openChannel("exec");
            return new JSchExecSession(channel, execPollIntervalMillis);
        } catch (JSchException x) {
            throw new SshPoolException("Failed to open channel on " + transport + ": "
                    + x.getMessage(), x);
        }
    }

    @Override
    public void close() {
        safeDisconnect(session);
        transport.close();
    }

    /**
     * Session's disconnect method catches all exceptions, so this is just in case it changes in the
     * future
     */
    private static void safeDisconnect(Session session) {
        try {
            if (session.isConnected()) {
                session.disconnect();
            }

        } catch (Exception x) {
            logger.warning("Failed to disconnect session: " + x.getMessage());
        }
    }

    @Override
    public String toString() {
        return "JSchClient [" + transport + "]";
    }
}
