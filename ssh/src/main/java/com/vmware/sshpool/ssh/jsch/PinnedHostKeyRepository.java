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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import com.jcraft.jsch.HostKey;
import com.jcraft.jsch.HostKeyRepository;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.UserInfo;

import com.vmware.sshpool.common.SshUntrustedServerException;

/**
 * Host key repository trusting exactly one key for one known host name. Any other key, or the
 * same key presented for another host name, is rejected with an
 * {@link SshUntrustedServerException} describing what the server presented.
 *
 * Keys offered by JSch for learning are ignored, the pinned key is the only one ever trusted.
 */
class PinnedHostKeyRepository implements HostKeyRepository {
    private static final Logger logger = Logger.getLogger(PinnedHostKeyRepository.class
            .getName());

    static final String REPOSITORY_ID = "sshpool-pinned-host-key";

    private final JSch jsch;
    private final String knownHostName;
    private final byte[] pinnedKey;
    private final HostKey pinnedHostKey;

    /**
     * @param knownHostName
     *            host name as JSch looks it up, see {@link JSchClientFactory#knownHostName}
     * @param pinnedKey
     *            the raw public key blob
     * @throws JSchException
     *             if the key type cannot be recognized
     */
    PinnedHostKeyRepository(JSch jsch, String knownHostName, byte[] pinnedKey)
            throws JSchException {
        this.jsch = jsch;
        this.knownHostName = knownHostName;
        this.pinnedKey = pinnedKey.clone();
        this.pinnedHostKey = new HostKey(knownHostName, this.pinnedKey);
    }

    @Override
    public int check(String host, byte[] key) {
        if (knownHostName.equals(host) && Arrays.equals(pinnedKey, key)) {
            return OK;
        }
        throw untrusted(host, key);
    }

    private SshUntrustedServerException untrusted(String host, byte[] key) {
        HostKey presented;
        try {
            presented = new HostKey(host, key);
        } catch (JSchException x) {
            throw new IllegalStateException("Unsupported host key from " + host + ": "
                    + x.getMessage(), x);
        }

        Map<String, String> identification = new HashMap<>();
        identification.put(SshUntrustedServerException.HOST_PROP_NAME, host);
        identification.put(SshUntrustedServerException.KEY_TYPE_PROP_NAME, presented.getType());
        identification.put(SshUntrustedServerException.FINGERPRINT_PROP_NAME,
                presented.getFingerPrint(jsch));
        identification.put(SshUntrustedServerException.HOST_KEY_PROP_NAME, presented.getKey());
        return new SshUntrustedServerException(identification);
    }

    @Override
    public void add(HostKey hostkey, UserInfo ui) {
        logger.fine("Ignoring host key for " + hostkey.getHost() + ", only the pinned key for "
                + knownHostName + " is trusted");
    }

    @Override
    public void remove(String host, String type) {
    }

    @Override
    public void remove(String host, String type, byte[] key) {
    }

    @Override
    public String getKnownHostsRepositoryID() {
        return REPOSITORY_ID;
    }

    @Override
    public HostKey[] getHostKey() {
        return new HostKey[] { pinnedHostKey };
    }

    /**
     * @param type
     *            key type, or null for any
     */
    @Override
    public HostKey[] getHostKey(String host, String type) {
        if (knownHostName.equals(host)
                && (type == null || type.equals(pinnedHostKey.getType()))) {
            return getHostKey();
        }
        return new HostKey[0];
    }
}
