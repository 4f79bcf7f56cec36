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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.jcraft.jsch.JSch;

/**
 * Sends JSch's process wide log output to java.util.logging, under the logger named after
 * {@link JSch}
 */
public final class JSchLogging {

    /**
     * JUL levels indexed by JSch level, DEBUG to FATAL. JSch reports every handshake step at
     * INFO, which is FINE here.
     */
    private static final Level[] LEVELS = {
            Level.FINEST,
            Level.FINE,
            Level.WARNING,
            Level.SEVERE,
            Level.SEVERE };

    private static final AtomicBoolean installed = new AtomicBoolean();

    private JSchLogging() {
    }

    /**
     * Install the bridge as JSch's logger. Only the first call has an effect.
     */
    public static void install() {
        if (installed.compareAndSet(false, true)) {
            JSch.setLogger(new JulLogger(Logger.getLogger(JSch.class.getName())));
        }
    }

    static Level toJulLevel(int jschLevel) {
        if (jschLevel < com.jcraft.jsch.Logger.DEBUG || jschLevel >= LEVELS.length) {
            throw new IllegalArgumentException("Unexpected JSch logging level: " + jschLevel);
        }
        return LEVELS[jschLevel];
    }

    static class JulLogger implements com.jcraft.jsch.Logger {
        private final Logger logger;

        JulLogger(Logger logger) {
            this.logger = logger;
        }

        @Override
        public boolean isEnabled(int level) {
            return logger.isLoggable(toJulLevel(level));
        }

        @Override
        public void log(int level, String message) {
            logger.log(toJulLevel(level), message);
        }
    }
}
