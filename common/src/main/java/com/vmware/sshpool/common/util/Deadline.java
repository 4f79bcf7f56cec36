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

import java.util.concurrent.TimeUnit;

/**
 * A point in time after which a blocking operation should give up.
 *
 * Based on {@link System#nanoTime()}, so it is immune to wall clock changes. The {@link #NONE}
 * deadline never expires.
 */
public final class Deadline {

    public static final Deadline NONE = new Deadline(0, false);

    private final long deadlineNanos;
    private final boolean set;

    private Deadline(long deadlineNanos, boolean set) {
        this.deadlineNanos = deadlineNanos;
        this.set = set;
    }

    /**
     * Create a deadline the given time from now. A zero timeout means no deadline at all.
     *
     * @param timeout
     * @param unit
     * @return the deadline, or {@link #NONE} if timeout is zero
     */
    public static Deadline after(long timeout, TimeUnit unit) {
        AssertUtil.assertNotNegative(timeout, "timeout");
        if (timeout == 0) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + unit.toNanos(timeout), true);
    }

    public boolean isSet() {
        return set;
    }

    public boolean isExpired() {
        return set && deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * @return remaining time in the given unit, never negative; {@link Long#MAX_VALUE} if not set
     */
    public long remaining(TimeUnit unit) {
        if (!set) {
            return Long.MAX_VALUE;
        }
        long remainingNanos = deadlineNanos - System.nanoTime();
        return remainingNanos <= 0 ? 0 : unit.convert(remainingNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * A deadline at the middle of the time remaining until this one. Used to keep part of the
     * budget for a retry.
     */
    public Deadline halfRemaining() {
        if (!set) {
            return NONE;
        }
        long now = System.nanoTime();
        long remainingNanos = Math.max(0, deadlineNanos - now);
        return new Deadline(now + remainingNanos / 2, true);
    }

    /**
     * Remaining time in millis as a JSch/socket style int timeout, where 0 means infinite. An
     * expired deadline maps to 1 so it is not mistaken for "no timeout".
     */
    public int toSocketTimeoutMillis(long defaultMillis) {
        long millis = set ? Math.max(1, remaining(TimeUnit.MILLISECONDS)) : defaultMillis;
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }

    @Override
    public String toString() {
        if (!set) {
            return "Deadline [none]";
        }
        return "Deadline [remainingMillis=" + remaining(TimeUnit.MILLISECONDS) + "]";
    }
}
