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
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A single command execution channel. Owned by the caller who opened it; the pool never touches
 * it again.
 */
public interface SshSession extends Closeable {

    /**
     * Execute a command and wait for it to complete. A session runs a single command.
     *
     * @param command
     * @param in
     *            standard input for the command, may be null
     * @param out
     *            receives standard output, may be null; not closed by the session
     * @param err
     *            receives standard error, may be null; not closed by the session
     * @return the exit status of the command
     */
    int run(String command, InputStream in, OutputStream out, OutputStream err)
            throws IOException;

    @Override
    void close();
}
