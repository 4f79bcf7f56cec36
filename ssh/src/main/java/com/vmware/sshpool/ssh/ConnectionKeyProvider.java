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

/**
 * Computes the key that decides which requests share a pooled connection. Two requests share a
 * connection if and only if their keys are equal.
 */
@FunctionalInterface
public interface ConnectionKeyProvider {

    String key(String network, String address, SshCredentials credentials);
}
