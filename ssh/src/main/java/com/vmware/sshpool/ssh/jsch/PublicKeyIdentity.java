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

import java.nio.charset.StandardCharsets;

import com.jcraft.jsch.Identity;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.KeyPair;

/**
 * Create an identity from an unencrypted SSH private key held in memory
 */
public class PublicKeyIdentity implements Identity {
    private static final String NAME = "in-memory-private-key";

    private final KeyPair keyPair;

    public PublicKeyIdentity(JSch jsch, byte[] privateKey, byte[] publicKey)
            throws JSchException {
        this.keyPair = KeyPair.load(jsch, privateKey, publicKey);
    }

    @Override
    public boolean setPassphrase(byte[] passphrase) throws JSchException {
        return false;
    }

    @Override
    public boolean isEncrypted() {
        return false;
    }

    @Override
    public byte[] getSignature(byte[] data) {
        return keyPair.getSignature(data);
    }

    @Override
    public byte[] getPublicKeyBlob() {
        return keyPair.getPublicKeyBlob();
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * The public key blob starts with the algorithm name as an SSH string (uint32 length and
     * bytes), for example "ssh-rsa" or "ecdsa-sha2-nistp256"
     */
    @Override
    public String getAlgName() {
        return algorithmName(getPublicKeyBlob());
    }

    static String algorithmName(byte[] blob) {
        if (blob == null || blob.length < 4) {
            throw new IllegalStateException("Invalid public key blob");
        }
        int length = ((blob[0] & 0xff) << 24) | ((blob[1] & 0xff) << 16)
                | ((blob[2] & 0xff) << 8) | (blob[3] & 0xff);
        if (length <= 0 || length > blob.length - 4) {
            throw new IllegalStateException("Invalid public key blob");
        }
        return new String(blob, 4, length, StandardCharsets.US_ASCII);
    }

    @Deprecated
    @Override
    public boolean decrypt() {
        throw new UnsupportedOperationException();
    }

    @Override
    public void clear() {
        keyPair.dispose();
    }
}
