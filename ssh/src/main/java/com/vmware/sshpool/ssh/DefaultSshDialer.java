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
import java.util.logging.Logger;

import com.vmware.sshpool.common.util.AssertUtil;
import com.vmware.sshpool.common.util.Deadline;
import com.vmware.sshpool.ssh.jsch.JSchClientFactory;

/**
 * Dials a transport, then performs the SSH handshake over it
 */
public class DefaultSshDialer implements SshDialer {
    private static final Logger logger = Logger.getLogger(DefaultSshDialer.class.getName());

    private final TransportDialer transportDialer;
    private final SshClientFactory clientFactory;

    public DefaultSshDialer() {
        this(new SocketTransportDialer(), new JSchClientFactory());
    }

    public DefaultSshDialer(TransportDialer transportDialer) {
        this(transportDialer, new JSchClientFactory());
    }

    public DefaultSshDialer(TransportDialer transportDialer, SshClientFactory clientFactory) {
        AssertUtil.assertNotNull(transportDialer, "transportDialer");
        AssertUtil.assertNotNull(clientFactory, "clientFactory");
        this.transportDialer = transportDialer;
        this.clientFactory = clientFactory;
    }

    @Override
    public SshClient dial(String network, String address, SshCredentials credentials,
            Deadline deadline) throws IOException {
        Transport transport = transportDialer.dial(network, address, deadline);
        if (transport == null) {
            throw new SshPoolException("Transport dialer returned no connection for " + address);
        }

        try {
            return clientFactory.connect(transport, credentials, deadline);
        } catch (IOException | RuntimeException x) {
            logger.fine(String.format("SSH handshake with %s failed: %s", address,
                    x.getMessage()));
            transport.close();
            throw x;
        }
    }
}
