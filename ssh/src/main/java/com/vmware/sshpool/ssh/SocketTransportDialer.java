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
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.vmware.sshpool.common.util.AssertUtil;
import com.vmware.sshpool.common.util.Deadline;

/**
 * Dials plain TCP sockets. Supports the "tcp", "tcp4" and "tcp6" networks and addresses in the
 * form "host", "host:port" or "[ipv6]:port".
 */
public class SocketTransportDialer implements TransportDialer {
    private static final Logger logger = Logger.getLogger(SocketTransportDialer.class.getName());

    public static final int DEFAULT_SSH_PORT = 22;

    /**
     * Connect timeout used when the caller does not provide a deadline
     */
    public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = Long.getLong(
            "sshpool.connect.timeout.millis", TimeUnit.SECONDS.toMillis(30));

    private final long connectTimeoutMillis;

    public SocketTransportDialer() {
        this(DEFAULT_CONNECT_TIMEOUT_MILLIS);
    }

    public SocketTransportDialer(long connectTimeoutMillis) {
        AssertUtil.assertNotNegative(connectTimeoutMillis, "connectTimeoutMillis");
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    @Override
    public Transport dial(String network, String address, Deadline deadline) throws IOException {
        AssertUtil.assertNotNullOrEmpty(address, "address");
        HostAndPort hostAndPort = HostAndPort.parse(address);
        InetAddress inetAddress = resolve(network, hostAndPort.host);

        int timeout = deadline.toSocketTimeoutMillis(connectTimeoutMillis);
        logger.finest(String.format("Connecting to %s (%s) with timeout %d ms", address,
                inetAddress, timeout));

        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(inetAddress, hostAndPort.port), timeout);
            socket.setTcpNoDelay(true);
        } catch (IOException x) {
            socket.close();
            throw x;
        }
        return new SocketTransport(hostAndPort.host, hostAndPort.port, socket);
    }

    private static InetAddress resolve(String network, String host) throws UnknownHostException {
        if (network == null || "tcp".equals(network)) {
            return InetAddress.getByName(host);
        }

        Class<? extends InetAddress> family;
        if ("tcp4".equals(network)) {
            family = Inet4Address.class;
        } else if ("tcp6".equals(network)) {
            family = Inet6Address.class;
        } else {
            throw new IllegalArgumentException("Unsupported network: " + network);
        }

        for (InetAddress candidate : InetAddress.getAllByName(host)) {
            if (family.isInstance(candidate)) {
                return candidate;
            }
        }
        throw new UnknownHostException("No " + network + " address for " + host);
    }

    static class HostAndPort {
        final String host;
        final int port;

        HostAndPort(String host, int port) {
            this.host = host;
            this.port = port;
        }

        static HostAndPort parse(String address) {
            String host = address;
            String portString = null;

            if (address.startsWith("[")) {
                int end = address.indexOf(']');
                AssertUtil.assertTrue(end > 0, "Invalid address: " + address);
                host = address.substring(1, end);
                if (end + 1 < address.length()) {
                    AssertUtil.assertTrue(address.charAt(end + 1) == ':',
                            "Invalid address: " + address);
                    portString = address.substring(end + 2);
                }
            } else {
                int colon = address.lastIndexOf(':');
                // more than one colon is a bare IPv6 address without a port
                if (colon >= 0 && address.indexOf(':') == colon) {
                    host = address.substring(0, colon);
                    portString = address.substring(colon + 1);
                }
            }

            int port = DEFAULT_SSH_PORT;
            if (portString != null) {
                try {
                    port = Integer.parseInt(portString);
                } catch (NumberFormatException x) {
                    throw new IllegalArgumentException("Invalid port in address: " + address, x);
                }
                AssertUtil.assertTrue(port > 0 && port <= 0xFFFF, "Invalid port: " + port);
            }
            AssertUtil.assertTrue(!host.isEmpty(), "Missing host in address: " + address);
            return new HostAndPort(host, port);
        }
    }
}
