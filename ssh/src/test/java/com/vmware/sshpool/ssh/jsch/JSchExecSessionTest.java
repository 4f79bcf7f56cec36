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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;

import org.junit.Before;
import org.junit.Test;

import com.vmware.sshpool.ssh.SshPoolException;

public class JSchExecSessionTest {

    private ChannelExec channel;
    private JSchExecSession session;

    @Before
    public void setUp() {
        channel = mock(ChannelExec.class);
        session = new JSchExecSession(channel, 1);
    }

    @Test
    public void testRun() throws Exception {
        when(channel.isClosed()).thenReturn(false, false, true);
        when(channel.getExitStatus()).thenReturn(3);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int exitStatus = session.run("ls -l", null, out, err);

        assertEquals(3, exitStatus);
        verify(channel).setCommand("ls -l");
        verify(channel).setInputStream(any(InputStream.class));
        verify(channel).setOutputStream(out, true);
        verify(channel).setErrStream(err, true);
        verify(channel).connect();
        verify(channel).disconnect();
    }

    @Test
    public void testRunWithoutOutputStreams() throws Exception {
        when(channel.isClosed()).thenReturn(true);

        session.run("true", null, null, null);

        verify(channel).setOutputStream(any(OutputStream.class), eq(true));
        verify(channel).setErrStream(any(OutputStream.class), eq(true));
    }

    @Test(expected = IllegalStateException.class)
    public void testRunOnlyOnce() throws Exception {
        when(channel.isClosed()).thenReturn(true);

        session.run("true", null, null, null);
        session.run("true", null, null, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRunRequiresCommand() throws Exception {
        session.run("", null, null, null);
    }

    @Test
    public void testConnectFailure() throws Exception {
        JSchException connectError = new JSchException("channel is not opened.");
        doThrow(connectError).when(channel).connect();

        try {
            session.run("true", null, null, null);
            fail("expected connect failure");
        } catch (SshPoolException x) {
            assertSame(connectError, x.getCause());
        }
        verify(channel).disconnect();
    }

    @Test
    public void testCloseUnusedSession() {
        session.close();

        verify(channel).disconnect();
    }
}
