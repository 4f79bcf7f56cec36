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

import java.io.InterruptedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import com.vmware.sshpool.common.util.AssertUtil;
import com.vmware.sshpool.common.util.Deadline;

/**
 * A pooled SSH connection, or the error that prevented it from being established.
 *
 * The outcome of the dial is recorded exactly once and then published to every thread waiting in
 * {@link #awaitReady(Deadline)}. After that the entry is immutable, except for being closed.
 */
public class PooledConnection {
    private static final Logger logger = Logger.getLogger(PooledConnection.class.getName());

    private final String key;
    private final long createdTimeMicros;
    private final CompletableFuture<PooledConnection> ready = new CompletableFuture<>();

    private SshClient client;
    private Exception dialError;
    private boolean closed;

    PooledConnection(String key) {
        this.key = key;
        this.createdTimeMicros = TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());
    }

    public String getKey() {
        return key;
    }

    public long getCreatedTimeMicros() {
        return createdTimeMicros;
    }

    /**
     * @return the client, or null if the dial failed or has not finished yet
     */
    public synchronized SshClient getClient() {
        return client;
    }

    /**
     * @return the error the dial failed with, or null
     */
    public synchronized Exception getDialError() {
        return dialError;
    }

    public boolean isReady() {
        return ready.isDone();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Record the outcome of the dial and wake up all waiters. Must be called exactly once.
     */
    void complete(SshClient client, Exception dialError) {
        AssertUtil.assertTrue((client == null) != (dialError == null),
                "Exactly one of client and dialError must be set");
        boolean closeClient;
        synchronized (this) {
            AssertUtil.assertState(!ready.isDone(), "Connection already completed: " + this);
            this.client = client;
            this.dialError = dialError;
            closeClient = closed && client != null;
        }

        if (closeClient) {
            // closed while the dial was in flight, e.g. by a pool shutdown
            logger.fine("Closing connection established after close: " + this);
            client.close();
        }
        ready.complete(this);
    }

    /**
     * Wait for the dial to finish. Returns immediately if it already has.
     *
     * @throws SshTimeoutException
     *             if the deadline passes first
     * @throws InterruptedIOException
     *             if the thread is interrupted while waiting
     */
    void awaitReady(Deadline deadline) throws SshTimeoutException, InterruptedIOException {
        if (ready.isDone()) {
            return;
        }

        try {
            if (deadline.isSet()) {
                ready.get(deadline.remaining(TimeUnit.NANOSECONDS), TimeUnit.NANOSECONDS);
            } else {
                ready.get();
            }
        } catch (TimeoutException x) {
            throw new SshTimeoutException("Timed out waiting for connection " + key);
        } catch (InterruptedException x) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for connection " + key);
        } catch (ExecutionException x) {
            // the future is never completed exceptionally
            throw new IllegalStateException(x.getCause());
        }
    }

    /**
     * Close the underlying client and transport. Only the first call has an effect.
     */
    public void close() {
        SshClient toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = client;
        }

        if (toClose != null) {
            logger.fine("Closing connection: " + this);
            toClose.close();
        }
    }

    @Override
    public String toString() {
        return "PooledConnection [key=" + key + ", createdTimeMicros=" + createdTimeMicros + "]";
    }
}
