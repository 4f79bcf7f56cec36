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

import org.apache.commons.lang3.StringUtils;

/**
 * Default key: distinct for every combination of network, address and user.
 *
 * Every component is quoted, so a separator or quote embedded in a value cannot make two
 * different combinations produce the same key.
 */
public class AddressUserKeyProvider implements ConnectionKeyProvider {

    public static final AddressUserKeyProvider INSTANCE = new AddressUserKeyProvider();

    private static final String[] SPECIAL_CHARS = { "\\", "\"" };
    private static final String[] ESCAPED_CHARS = { "\\\\", "\\\"" };

    @Override
    public String key(String network, String address, SshCredentials credentials) {
        String user = credentials == null ? null : credentials.getUser();
        return quote(network) + " " + quote(address) + " " + quote(user);
    }

    static String quote(String value) {
        if (value == null) {
            // unquoted, so it can't be confused with the string "null"
            return "null";
        }
        return StringUtils.wrap(StringUtils.replaceEach(value, SPECIAL_CHARS, ESCAPED_CHARS), '"');
    }
}
