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
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import com.vmware.sshpool.common.util.AssertUtil;
import com.vmware.sshpool.common.util.Deadline;

/**
 * Hands out SSH sessions, sharing one connection between all requests with the same key.
 *
 * Only one dial per key is in flight at any time; concurrent requests for the key wait for its
 * outcome. A connection that fails to open a session is evicted and closed, and the request is
 * retried on a fresh connection until it succeeds or the configured timeout expires. A failed
 * dial is returned to the caller and not retried.
 *
 * Instances are thread safe.
 */
public class SshConnectionPool {
    private static final Logger logger = Logger.getLogger(SshConnectionPool.class.getName());

    /**
     * Default overall timeout for {@link #open(String, String, SshCredentials)}, 0 for none
     */
    public static final long DEFAULT_TIMEOUT_MILLIS = Long.getLong("sshpool.timeout.millis", 0);

    private final SshDialer dialer;
    private final ConnectionKeyProvider keyProvider;
    private final long timeoutMillis;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Guards the connection table and the shutdown flag. Never held during I/O.
     */
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PooledConnection> connections = new HashMap<>();
    private boolean shutdown;

    private SshConnectionPool(Builder builder) {
        this.dialer = builder.dialer != null ? builder.dialer
                : builder.transportDialer != null ? new DefaultSshDialer(builder.transportDialer)
                        : new DefaultSshDialer();
        this.keyProvider = builder.keyProvider != null ? builder.keyProvider
                : AddressUserKeyProvider.INSTANCE;
        this.timeoutMillis = builder.timeoutMillis;
        this.ownsExecutor = builder.executor == null;
        this.executor = ownsExecutor ? Executors.newCachedThreadPool(new SessionThreadFactory())
                : builder.executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /**
     * Open a new session on the given server, reusing an existing connection if possible.
     *
     * If no connection exists, or opening the session on the existing one fails, a new connection
     * is dialed. If dialing fails, the error from the dialer is thrown.
     *
     * @param network
     *            network kind, for example "tcp"
     * @param address
     *            server address, "host:port"
     * @param credentials
     *            authentication for the server; not modified
     * @return a session owned by the caller
     * @throws SshTimeoutException
     *             if a timeout is configured and no session could be opened in time
     * @throws IOException
     *             the dial error, or the last session failure once the timeout expired
     */
    public SshSession open(String network, String address, SshCredentials credentials)
            throws IOException {
        AssertUtil.assertNotNull(network, "network");
        AssertUtil.assertNotNull(address, "address");
        AssertUtil.assertNotNull(credentials, "credentials");
        checkNotShutdown();

        Deadline deadline = Deadline.after(timeoutMillis, TimeUnit.MILLISECONDS);
        String key = keyProvider.key(network, address, credentials);
        boolean firstAttempt = true;

        while (true) {
            PooledConnection connection = getConnection(key, network, address, credentials,
                    deadline);
            Exception dialError = connection.getDialError();
            if (dialError != null) {
                removeConnection(key, connection);
                throw rethrow(dialError);
            }

            // keep half of the budget for a redial if the first attempt fails
            Deadline attemptDeadline = firstAttempt ? deadline.halfRemaining() : deadline;
            firstAttempt = false;

            IOException failure;
            try {
                return openSession(connection, attemptDeadline);
            } catch (IOException x) {
                if (Thread.currentThread().isInterrupted()) {
                    // the caller gave up, the connection itself may be fine
                    throw x;
                }
                failure = x;
            } catch (RuntimeException x) {
                evict(key, connection);
                throw x;
            }

            logger.fine(String.format("Failed to open session on %s: %s", connection,
                    failure.getMessage()));
            evict(key, connection);

            if (deadline.isExpired()) {
                throw failure;
            }
        }
    }

    /**
     * Get the connection for the key, dialing it if there is none. Only one thread dials a given
     * key at a time; the others wait for its outcome, which may be a failure.
     */
    PooledConnection getConnection(String key, String network, String address,
            SshCredentials credentials, Deadline deadline) throws IOException {
        PooledConnection connection;
        boolean created = false;
        lock.lock();
        try {
            AssertUtil.assertState(!shutdown, "Pool was shut down");
            connection = connections.get(key);
            if (connection == null) {
                connection = new PooledConnection(key);
                connections.put(key, connection);
                created = true;
                logger.finest("Cached connections count: " + connections.size());
            }
        } finally {
            lock.unlock();
        }

        if (created) {
            dial(connection, network, address, credentials, deadline);
        } else {
            logger.finest("Reusing connection: " + connection);
            connection.awaitReady(deadline);
        }
        return connection;
    }

    /**
     * Remove the connection from the pool, but only if it is still the one stored under the key.
     * A newer connection installed by another thread is left alone.
     *
     * @return true if the connection was removed
     */
    boolean removeConnection(String key, PooledConnection connection) {
        lock.lock();
        try {
            if (connections.get(key) == connection) {
                connections.remove(key);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of connections (including ones still dialing) in the pool
     */
    public int getConnectionCount() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close all connections and reject new requests. Sessions already handed out are not closed.
     */
    public void shutdown() {
        List<PooledConnection> toClose;
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            toClose = new ArrayList<>(connections.values());
            connections.clear();
        } finally {
            lock.unlock();
        }

        logger.info("Shutting down SSH connection pool, closing " + toClose.size()
                + " connections");
        for (PooledConnection connection : toClose) {
            connection.close();
        }
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private void dial(PooledConnection connection, String network, String address,
            SshCredentials credentials, Deadline deadline) {
        logger.fine("Dialing new connection: " + connection);
        try {
            SshClient client = dialer.dial(network, address, credentials, deadline);
            if (client == null) {
                throw new SshPoolException("Dialer returned no client for " + address);
            }
            connection.complete(client, null);
        } catch (IOException | RuntimeException x) {
            logger.fine(String.format("Failed to dial %s: %s", connection, x.getMessage()));
            connection.complete(null, x);
        } catch (Error e) {
            connection.complete(null, new SshPoolException("Dial aborted for " + address, e));
            throw e;
        }
    }

    private SshSession openSession(PooledConnection connection, Deadline attemptDeadline)
            throws IOException {
        SshClient client = connection.getClient();
        if (!attemptDeadline.isSet()) {
            return client.openSession(attemptDeadline);
        }

        CompletableFuture<SshSession> attempt = CompletableFuture.supplyAsync(() -> {
            try {
                return client.openSession(attemptDeadline);
            } catch (IOException x) {
                throw new UncheckedIOException(x);
            }
        }, executor);

        try {
            return attempt.get(attemptDeadline.remaining(TimeUnit.NANOSECONDS),
                    TimeUnit.NANOSECONDS);
        } catch (TimeoutException x) {
            discardLateSession(attempt);
            throw new SshTimeoutException("Timed out opening session on " + connection);
        } catch (InterruptedException x) {
            Thread.currentThread().interrupt();
            discardLateSession(attempt);
            throw new InterruptedIOException("Interrupted opening session on " + connection);
        } catch (ExecutionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SshPoolException("Failed to open session on " + connection, cause);
        }
    }

    /**
     * The caller gave up on the attempt, but it keeps running. Close whatever it produces.
     */
    private static void discardLateSession(CompletableFuture<SshSession> attempt) {
        attempt.thenAccept(session -> {
            logger.fine("Closing session opened after its deadline: " + session);
            session.close();
        });
    }

    private void evict(String key, PooledConnection connection) {
        removeConnection(key, connection);
        connection.close();
    }

    private void checkNotShutdown() {
        lock.lock();
        try {
            AssertUtil.assertState(!shutdown, "Pool was shut down");
        } finally {
            lock.unlock();
        }
    }

    private static IOException rethrow(Exception dialError) {
        if (dialError instanceof RuntimeException) {
            throw (RuntimeException) dialError;
        }
        return (IOException) dialError;
    }

    /**
     * Builder for {@link SshConnectionPool}
     */
    public static class Builder {
        private SshDialer dialer;
        private TransportDialer transportDialer;
        private ConnectionKeyProvider keyProvider;
        private long timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
        private ExecutorService executor;

        /**
         * Replace the whole dial (network connection and SSH handshake)
         */
        public Builder withDialer(SshDialer dialer) {
            this.dialer = dialer;
            return this;
        }

        /**
         * Replace only the network connection; the SSH handshake is done with JSch. Ignored if
         * {@link #withDialer(SshDialer)} is also set.
         */
        public Builder withTransportDialer(TransportDialer transportDialer) {
            this.transportDialer = transportDialer;
            return this;
        }

        public Builder withKeyProvider(ConnectionKeyProvider keyProvider) {
            this.keyProvider = keyProvider;
            return this;
        }

        /**
         * Bound the total time of an open call; 0 means no bound
         */
        public Builder withTimeout(long timeout, TimeUnit unit) {
            AssertUtil.assertNotNegative(timeout, "timeout");
            this.timeoutMillis = unit.toMillis(timeout);
            return this;
        }

        /**
         * Executor running deadline bounded session open attempts. Not shut down with the pool.
         */
        public Builder withExecutor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public SshConnectionPool build() {
            return new SshConnectionPool(this);
        }
    }

    private static class SessionThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "ssh-pool-session-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
