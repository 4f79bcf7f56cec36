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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

public class AddressUserKeyProviderTest {

    private final ConnectionKeyProvider keyProvider = AddressUserKeyProvider.INSTANCE;

    @Test
    public void testKeyFormat() {
        assertEquals("\"tcp\" \"host:22\" \"root\"",
                keyProvider.key("tcp", "host:22", user("root")));
    }

    @Test
    public void testSameIdentitySameKey() {
        SshCredentials withPassword = user("root").withPassword("secret");
        SshCredentials withOtherPassword = user("root").withPassword("other");

        // only the user identifies the credentials
        assertEquals(keyProvider.key("tcp", "host:22", withPassword),
                keyProvider.key("tcp", "host:22", withOtherPassword));
    }

    @Test
    public void testEachComponentMatters() {
        String key = keyProvider.key("tcp", "host:22", user("root"));
        assertNotEquals(key, keyProvider.key("tcp6", "host:22", user("root")));
        assertNotEquals(key, keyProvider.key("tcp", "host:2222", user("root")));
        assertNotEquals(key, keyProvider.key("tcp", "host:22", user("admin")));
    }

    @Test
    public void testEmbeddedSeparatorsDoNotCollide() {
        assertNotEquals(keyProvider.key("a b", "c", user("d")),
                keyProvider.key("a", "b c", user("d")));
        assertNotEquals(keyProvider.key("a\" \"b", "c", user("d")),
                keyProvider.key("a", "b\" \"c", user("d")));
        assertNotEquals(keyProvider.key("a\\", "b", user("c")),
                keyProvider.key("a", "\\b", user("c")));
    }

    @Test
    public void testNullUserDiffersFromLiteralNull() {
        assertNotEquals(keyProvider.key("tcp", "host", user(null)),
                keyProvider.key("tcp", "host", user("null")));
        assertEquals("\"tcp\" \"host\" null", keyProvider.key("tcp", "host", user(null)));
    }

    @Test
    public void testQuoteEscapes() {
        assertEquals("\"a\\\"b\"", AddressUserKeyProvider.quote("a\"b"));
        assertEquals("\"a\\\\b\"", AddressUserKeyProvider.quote("a\\b"));
        assertEquals("\"\"", AddressUserKeyProvider.quote(""));
    }

    private static SshCredentials user(String user) {
        return new SshCredentials().withUser(user);
    }
}
