package org.pulsecheck.monitor.report;

import org.pulsecheck.monitor.api.report.PlatformInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Collects host and runtime identification strings.
 */
public final class PlatformInfoProvider {

    private static final Logger log = LoggerFactory.getLogger(PlatformInfoProvider.class);

    private PlatformInfoProvider() {
    }

    public static PlatformInfo current() {
        return new PlatformInfo(
            System.getProperty("os.name", "unknown"),
            System.getProperty("os.version", "unknown"),
            System.getProperty("os.arch", "unknown"),
            System.getProperty("java.version", "unknown"),
            System.getProperty("java.vendor", "unknown"),
            hostName(),
            Runtime.getRuntime().availableProcessors()
        );
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not determine host name, falling back to 'unknown': {}", e.getMessage());
            return "unknown";
        }
    }
}
