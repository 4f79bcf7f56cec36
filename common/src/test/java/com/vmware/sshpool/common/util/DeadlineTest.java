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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class DeadlineTest {

    @Test
    public void zeroTimeoutMeansNoDeadlineTest() {
        Deadline deadline = Deadline.after(0, TimeUnit.SECONDS);

        assertSame(Deadline.NONE, deadline);
        assertFalse(deadline.isSet());
        assertFalse(deadline.isExpired());
        assertEquals(Long.MAX_VALUE, deadline.remaining(TimeUnit.MILLISECONDS));
        assertSame(Deadline.NONE, deadline.halfRemaining());
        assertEquals(250, deadline.toSocketTimeoutMillis(250));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeTimeoutTest() {
        Deadline.after(-1, TimeUnit.MILLISECONDS);
    }

    @Test
    public void remainingTest() {
        Deadline deadline = Deadline.after(1, TimeUnit.HOURS);

        assertTrue(deadline.isSet());
        assertFalse(deadline.isExpired());
        long remaining = deadline.remaining(TimeUnit.MINUTES);
        assertTrue("remaining: " + remaining, remaining >= 59 && remaining <= 60);
    }

    @Test
    public void halfRemainingTest() {
        Deadline deadline = Deadline.after(1, TimeUnit.HOURS);
        Deadline half = deadline.halfRemaining();

        assertTrue(half.isSet());
        long remaining = half.remaining(TimeUnit.MINUTES);
        assertTrue("remaining: " + remaining, remaining >= 29 && remaining <= 30);
    }

    @Test
    public void expiredTest() throws InterruptedException {
        Deadline deadline = Deadline.after(1, TimeUnit.MILLISECONDS);
        Thread.sleep(20);

        assertTrue(deadline.isExpired());
        assertEquals(0, deadline.remaining(TimeUnit.NANOSECONDS));
        assertTrue(deadline.halfRemaining().isExpired());
        assertEquals(1, deadline.toSocketTimeoutMillis(0));
    }

    @Test
    public void socketTimeoutIsCappedTest() {
        Deadline deadline = Deadline.after(365, TimeUnit.DAYS);

        assertEquals(Integer.MAX_VALUE, deadline.toSocketTimeoutMillis(0));
    }
}
