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

import com.vmware.sshpool.common.util.Deadline;

/**
 * Opens raw network connections
 */
@FunctionalInterface
public interface TransportDialer {

    /**
     * Connect to the given address
     *
     * @param network
     *            network kind, for example "tcp"
     * @param address
     *            "host:port" or "host"
     * @param deadline
     *            connect deadline, {@link Deadline#NONE} for the dialer's own default
     */
    Transport dial(String network, String address, Deadline deadline) throws IOException;
}
