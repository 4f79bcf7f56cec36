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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.TimeUnit;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;

import org.junit.Before;
import org.junit.Test;

import com.vmware.sshpool.common.util.Deadline;
import com.vmware.sshpool.ssh.SshPoolException;
import com.vmware.sshpool.ssh.Transport;

public class JSchClientTest {

    private Session session;
    private Transport transport;
    private JSchClient client;

    @Before
    public void setUp() {
        session = mock(Session.class);
        transport = mock(Transport.class);
        client = new JSchClient(session, transport, 10);
    }

    @Test
    public void testOpenSession() throws Exception {
        when(session.isConnected()).thenReturn(true);
        when(session.openChannel("exec")).thenReturn(mock(ChannelExec.class));

        assertTrue(client.isConnected());
        assertNotNull(client.openSession(Deadline.NONE));
        assertSame(transport, client.getTransport());
    }

    @Test
    public void testOpenSessionDoesNotWaitOnDeadline() throws Exception {
        when(session.isConnected()).thenReturn(true);
        when(session.openChannel("exec")).thenReturn(mock(ChannelExec.class));
        Deadline expired = Deadline.after(1, TimeUnit.MILLISECONDS);
        Thread.sleep(20);

        // channel creation is local, the command's channel round trip happens in run()
        assertTrue(expired.isExpired());
        assertNotNull(client.openSession(expired));
        verify(session).openChannel("exec");
    }

    @Test
    public void testOpenSessionOnDeadConnection() throws Exception {
        when(session.isConnected()).thenReturn(false);

        assertFalse(client.isConnected());
        try {
            client.openSession(Deadline.NONE);
            fail("expected failure on a dead connection");
        } catch (SshPoolException x) {
            // expected
        }
        verify(session, never()).openChannel(anyString());
    }

    @Test
    public void testOpenSessionOnClosedTransport() throws Exception {
        when(session.isConnected()).thenReturn(true);
        when(transport.isClosed()).thenReturn(true);

        try {
            client.openSession(Deadline.NONE);
            fail("expected failure on a closed transport");
        } catch (SshPoolException x) {
            // expected
        }
    }

    @Test
    public void testOpenChannelFailure() throws Exception {
        JSchException channelError = new JSchException("channel is not opened.");
        when(session.isConnected()).thenReturn(true);
        when(session.openChannel("exec")).thenThrow(channelError);

        try {
            client.openSession(Deadline.NONE);
            fail("expected channel failure");
        } catch (SshPoolException x) {
            assertSame(channelError, x.getCause());
        }
    }

    @Test
    public void testClose() {
        when(session.isConnected()).thenReturn(true);

        client.close();

        verify(session).disconnect();
        verify(transport).close();
    }
}
