// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

/**
 * Installs the bundled {@code logging.properties} for command-line runs,
 * unless {@code java.util.logging.config.file} names another configuration.
 */
public final class LoggingSetup {

    public static final String RESOURCE = "/logging.properties";

    private LoggingSetup() {}

    public static void configure() throws IOException {
        if(System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = LoggingSetup.class.getResourceAsStream(RESOURCE)) {
            if(in != null) LogManager.getLogManager().readConfiguration(in);
        }
    }
}
