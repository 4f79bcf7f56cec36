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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;

import org.apache.commons.io.output.NullOutputStream;

import com.vmware.sshpool.common.util.AssertUtil;
import com.vmware.sshpool.ssh.SshPoolException;
import com.vmware.sshpool.ssh.SshSession;

/**
 * Runs a single command over a JSch ChannelExec
 */
public class JSchExecSession implements SshSession {
    private static final Logger logger = Logger.getLogger(JSchExecSession.class.getName());

    /**
     * Time between checks for a command to complete
     */
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = Long.getLong(
            "sshpool.exec.poll.millis", 100);

    private final ChannelExec channel;
    private final long pollIntervalMillis;
    private final AtomicBoolean used = new AtomicBoolean();

    public JSchExecSession(ChannelExec channel, long pollIntervalMillis) {
        this.channel = channel;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    @Override
    public int run(String command, InputStream in, OutputStream out, OutputStream err)
            throws IOException {
        AssertUtil.assertNotNullOrEmpty(command, "command");
        AssertUtil.assertState(used.compareAndSet(false, true),
                "Session already used to run a command");

        channel.setCommand(command);
        channel.setInputStream(in != null ? in : new ByteArrayInputStream(new byte[0]));
        // the caller's streams stay open when the channel closes
        channel.setOutputStream(out != null ? out : NullOutputStream.NULL_OUTPUT_STREAM, true);
        channel.setErrStream(err != null ? err : NullOutputStream.NULL_OUTPUT_STREAM, true);

        try {
            channel.connect();
        } catch (JSchException x) {
            close();
            throw new SshPoolException("Failed to run command '" + command + "': "
                    + x.getMessage(), x);
        }

        try {
            while (!channel.isClosed()) {
                logger.finest("Command is running: " + command);
                Thread.sleep(pollIntervalMillis);
            }
        } catch (InterruptedException x) {
            Thread.currentThread().interrupt();
            close();
            throw new InterruptedIOException("Interrupted running command '" + command + "'");
        }

        logger.finest("Command is complete: " + command);
        int exitStatus = channel.getExitStatus();
        close();
        return exitStatus;
    }

    /**
     * Disconnect even if the channel was never connected, so JSch forgets about it.
     * ChannelExec's disconnect method catches all exceptions, so the catch is just in case it
     * changes in the future.
     */
    @Override
    public void close() {
        try {
            channel.disconnect();

        } catch (Exception x) {
            logger.warning("Failed to disconnect channel: " + x.getMessage());
        }
    }

}
