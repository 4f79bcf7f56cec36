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

/**
 * Shortcuts for a process wide {@link SshConnectionPool} with the default configuration.
 * Applications that need control over the pool lifetime should build their own.
 */
public final class SshPools {

    private SshPools() {
    }

    private static class DefaultPoolHolder {
        private static final SshConnectionPool INSTANCE = SshConnectionPool.builder().build();
    }

    public static SshConnectionPool getDefault() {
        return DefaultPoolHolder.INSTANCE;
    }

    /**
     * Open a new session on the given server using the default pool
     *
     * @see SshConnectionPool#open(String, String, SshCredentials)
     */
    public static SshSession open(String network, String address, SshCredentials credentials)
            throws IOException {
        return getDefault().open(network, address, credentials);
    }
}
