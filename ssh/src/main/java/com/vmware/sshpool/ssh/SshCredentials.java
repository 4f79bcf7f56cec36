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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Authentication parameters for an SSH connection
 *
 * This includes the user and its secrets, and optionally the expected host key of the server, but
 * not the destination itself (that is the address given to the pool).
 */
public class SshCredentials {
    private String user;
    private String password;
    private byte[] privateKey;
    private String hostKey;

    public String getUser() {
        return user;
    }

    public SshCredentials withUser(String user) {
        this.user = user;
        return this;
    }

    public String getPassword() {
        return password;
    }

    public SshCredentials withPassword(String password) {
        this.password = password;
        return this;
    }

    public byte[] getPrivateKey() {
        return privateKey == null ? null : privateKey.clone();
    }

    public SshCredentials withPrivateKey(byte[] privateKey) {
        this.privateKey = privateKey == null ? null : privateKey.clone();
        return this;
    }

    /**
     * @return the base64 encoded public host key the server must present, or null to accept any
     */
    public String getHostKey() {
        return hostKey;
    }

    public SshCredentials withHostKey(String hostKey) {
        this.hostKey = hostKey;
        return this;
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder()
                .append(user)
                .append(password)
                .append(privateKey)
                .append(hostKey)
                .toHashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SshCredentials other = (SshCredentials) obj;
        return new EqualsBuilder()
                .append(user, other.user)
                .append(password, other.password)
                .append(privateKey, other.privateKey)
                .append(hostKey, other.hostKey)
                .isEquals();
    }

    @Override
    public String toString() {
        // never print the secrets
        return "SshCredentials [user=" + user + ", hashCode=" + hashCode() + "]";
    }

}
