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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.Test;

public class JSchLoggingTest {

    @Test
    public void testLevelMapping() {
        assertEquals(Level.FINEST, JSchLogging.toJulLevel(com.jcraft.jsch.Logger.DEBUG));
        assertEquals(Level.FINE, JSchLogging.toJulLevel(com.jcraft.jsch.Logger.INFO));
        assertEquals(Level.WARNING, JSchLogging.toJulLevel(com.jcraft.jsch.Logger.WARN));
        assertEquals(Level.SEVERE, JSchLogging.toJulLevel(com.jcraft.jsch.Logger.ERROR));
        assertEquals(Level.SEVERE, JSchLogging.toJulLevel(com.jcraft.jsch.Logger.FATAL));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownLevel() {
        JSchLogging.toJulLevel(42);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLevel() {
        JSchLogging.toJulLevel(-1);
    }

    @Test
    public void testIsEnabled() {
        Logger logger = Logger.getLogger(JSchLoggingTest.class.getName());
        logger.setLevel(Level.WARNING);
        JSchLogging.JulLogger julLogger = new JSchLogging.JulLogger(logger);

        assertTrue(julLogger.isEnabled(com.jcraft.jsch.Logger.ERROR));
        assertTrue(julLogger.isEnabled(com.jcraft.jsch.Logger.WARN));
        assertFalse(julLogger.isEnabled(com.jcraft.jsch.Logger.INFO));
        assertFalse(julLogger.isEnabled(com.jcraft.jsch.Logger.DEBUG));
    }

    @Test
    public void testInstallIsRepeatable() {
        JSchLogging.install();
        JSchLogging.install();
    }
}
