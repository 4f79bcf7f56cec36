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
import java.util.logging.Logger;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;

import org.bouncycastle.util.encoders.Base64;

import com.vmware.sshpool.common.util.AssertUtil;
import com.vmware.sshpool.common.util.Deadline;
import com.vmware.sshpool.ssh.SocketTransport;
import com.vmware.sshpool.ssh.SocketTransportDialer;
import com.vmware.sshpool.ssh.SshClient;
import com.vmware.sshpool.ssh.SshClientFactory;
import com.vmware.sshpool.ssh.SshCredentials;
import com.vmware.sshpool.ssh.SshPoolException;
import com.vmware.sshpool.ssh.Transport;

/**
 * Establishes SSH connections with JSch over sockets dialed by a
 * {@link com.vmware.sshpool.ssh.TransportDialer}
 */
public class JSchClientFactory implements SshClientFactory {
    private static final Logger logger = Logger.getLogger(JSchClientFactory.class.getName());

    static {
        JSchLogging.install();
    }

    private final long handshakeTimeoutMillis;
    private final long execPollIntervalMillis;

    public JSchClientFactory() {
        this(SocketTransportDialer.DEFAULT_CONNECT_TIMEOUT_MILLIS,
                JSchExecSession.DEFAULT_POLL_INTERVAL_MILLIS);
    }

    /**
     * @param handshakeTimeoutMillis
     *            handshake timeout used when no deadline is given, 0 for none
     * @param execPollIntervalMillis
     *            interval between checks for command completion
     */
    public JSchClientFactory(long handshakeTimeoutMillis, long execPollIntervalMillis) {
        AssertUtil.assertNotNegative(handshakeTimeoutMillis, "handshakeTimeoutMillis");
        AssertUtil.assertTrue(execPollIntervalMillis > 0, "execPollIntervalMillis must be positive");
        this.handshakeTimeoutMillis = handshakeTimeoutMillis;
        this.execPollIntervalMillis = execPollIntervalMillis;
    }

    @Override
    public SshClient connect(Transport transport, SshCredentials credentials, Deadline deadline)
            throws IOException {
        AssertUtil.assertNotNull(credentials, "credentials");
        if (!(transport instanceof SocketTransport)) {
            throw new IllegalArgumentException("JSch requires a socket transport, got "
                    + transport);
        }
        SocketTransport socketTransport = (SocketTransport) transport;

        Session session = createSession(socketTransport, credentials);
        try {
            session.connect(deadline.toSocketTimeoutMillis(handshakeTimeoutMillis));
        } catch (JSchException x) {
            throw new SshPoolException(String.format("Failed to connect to %s as %s: %s",
                    transport, credentials.getUser(), x.getMessage()), x);
        }

        logger.fine(String.format("Connected to %s as %s", transport, credentials.getUser()));
        return new JSchClient(session, socketTransport, execPollIntervalMillis);
    }

    private Session createSession(SocketTransport transport, SshCredentials credentials)
            throws SshPoolException {
        JSch jsch = new JSch();
        try {
            Session session = jsch.getSession(credentials.getUser(), transport.getHost(),
                    transport.getPort());
            session.setSocketFactory(new TransportSocketFactory(transport.getSocket()));

            byte[] privateKey = credentials.getPrivateKey();
            if (privateKey != null) {
                jsch.addIdentity(new PublicKeyIdentity(jsch, privateKey, null), null);
            }

            String password = credentials.getPassword();
            if (password != null) {
                session.setPassword(password);
            }
            session.setUserInfo(new PasswordUserInfo(password));

            String hostKey = credentials.getHostKey();
            if (hostKey != null) {
                session.setHostKeyRepository(new PinnedHostKeyRepository(jsch,
                        knownHostName(transport), Base64.decode(hostKey)));
                session.setConfig("StrictHostKeyChecking", "yes");
            } else {
                session.setConfig("StrictHostKeyChecking", "no");
            }

            return session;

        } catch (JSchException x) {
            throw new SshPoolException("Invalid credentials for " + transport + ": "
                    + x.getMessage(), x);
        }
    }

    /**
     * The host name JSch looks up in the known hosts, which includes the port when it's not the
     * default one
     */
    static String knownHostName(Transport transport) {
        if (transport.getPort() == SocketTransportDialer.DEFAULT_SSH_PORT) {
            return transport.getHost();
        }
        return "[" + transport.getHost() + "]:" + transport.getPort();
    }
}
