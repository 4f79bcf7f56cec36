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

/**
 * A raw network connection an SSH client is established over
 */
public interface Transport extends Closeable {

    /**
     * @return the host name or address the transport is connected to
     */
    String getHost();

    int getPort();

    boolean isClosed();

    /**
     * Close the connection. Must be safe to call more than once.
     */
    @Override
    void close();
}
