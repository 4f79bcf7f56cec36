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

package com.vmware.sshpool.common.util;

/**
 * This class assists in asserting arguments. Violations are reported as
 * {@link IllegalArgumentException}, or {@link IllegalStateException} for {@link #assertState}.
 */
public class AssertUtil {

    public static final String PROPERTY_CANNOT_BE_EMPTY_MESSAGE_FORMAT = "%s cannot be empty";
    public static final String PROPERTY_CANNOT_BE_NEGATIVE_MESSAGE_FORMAT = "%s cannot be negative";

    public static void assertNotNull(Object value, String propertyName) {
        if (value == null) {
            throw new IllegalArgumentException("'" + propertyName + "' is required");
        }
    }

    public static void assertNotEmpty(String value, String propertyName) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(
                    String.format(PROPERTY_CANNOT_BE_EMPTY_MESSAGE_FORMAT, propertyName));
        }
    }

    public static void assertNotNullOrEmpty(String value, String propertyName) {
        assertNotNull(value, propertyName);
        assertNotEmpty(value, propertyName);
    }

    public static void assertNotNegative(long value, String propertyName) {
        if (value < 0) {
            throw new IllegalArgumentException(
                    String.format(PROPERTY_CANNOT_BE_NEGATIVE_MESSAGE_FORMAT, propertyName));
        }
    }

    public static void assertTrue(boolean condition, String errMsg) {
        if (!condition) {
            throw new IllegalArgumentException(errMsg);
        }
    }

    public static void assertState(boolean state, String errMsg) {
        if (!state) {
            throw new IllegalStateException(errMsg);
        }
    }
}
