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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.KeyPair;

import org.junit.Test;

public class PublicKeyIdentityTest {

    @Test
    public void testLoadRsaKey() throws Exception {
        JSch jsch = new JSch();
        KeyPair keyPair = KeyPair.genKeyPair(jsch, KeyPair.RSA, 2048);
        ByteArrayOutputStream privateKey = new ByteArrayOutputStream();
        keyPair.writePrivateKey(privateKey);

        PublicKeyIdentity identity = new PublicKeyIdentity(jsch, privateKey.toByteArray(),
                null);

        assertFalse(identity.isEncrypted());
        assertEquals("ssh-rsa", identity.getAlgName());
        assertArrayEquals(keyPair.getPublicKeyBlob(), identity.getPublicKeyBlob());
        assertNotNull(identity.getSignature("data".getBytes(StandardCharsets.UTF_8)));
        assertNotNull(identity.getName());
    }

    @Test
    public void testAlgorithmName() {
        byte[] name = "ecdsa-sha2-nistp256".getBytes(StandardCharsets.US_ASCII);
        byte[] blob = new byte[4 + name.length + 8];
        blob[3] = (byte) name.length;
        System.arraycopy(name, 0, blob, 4, name.length);

        assertEquals("ecdsa-sha2-nistp256", PublicKeyIdentity.algorithmName(blob));
    }

    @Test(expected = IllegalStateException.class)
    public void testAlgorithmNameTruncatedBlob() {
        PublicKeyIdentity.algorithmName(new byte[] { 0, 0, 0, 9, 'a' });
    }
}
