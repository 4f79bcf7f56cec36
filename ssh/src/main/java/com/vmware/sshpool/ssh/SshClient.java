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

import java.io.Closeable;
import java.io.IOException;

import com.vmware.sshpool.common.util.Deadline;

/**
 * An authenticated SSH connection which can open any number of sessions. Owns its
 * {@link Transport}.
 */
public interface SshClient extends Closeable {

    Transport getTransport();

    boolean isConnected();

    /**
     * Open a new session on this connection
     *
     * @param deadline
     *            the session should be opened before this deadline; implementations that cannot
     *            honor it may ignore it, the pool enforces it anyway
     * @throws IOException
     *             if the connection can no longer open sessions
     */
    SshSession openSession(Deadline deadline) throws IOException;

    /**
     * Disconnect and close the transport. Must be safe to call more than once.
     */
    @Override
    void close();
}
