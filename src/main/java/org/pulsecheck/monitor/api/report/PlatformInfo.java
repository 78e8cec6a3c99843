package org.pulsecheck.monitor.api.report;

import java.util.Locale;

/**
 * Identification strings of the host and runtime.
 *
 * @param osName              Operating system name (e.g. "Linux").
 * @param osVersion           Operating system version.
 * @param architecture        CPU architecture (e.g. "amd64").
 * @param javaVersion         Java runtime version.
 * @param javaVendor          Java runtime vendor.
 * @param hostName            Host name, or "unknown" if it cannot be resolved.
 * @param availableProcessors Number of processors available to the JVM.
 */
public record PlatformInfo(
    String osName,
    String osVersion,
    String architecture,
    String javaVersion,
    String javaVendor,
    String hostName,
    int availableProcessors
) {

    public boolean isLinux() {
        return osName != null && osName.toLowerCase(Locale.ROOT).startsWith("linux");
    }

    public boolean isWindows() {
        return osName != null && osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }

    public boolean isMac() {
        return osName != null && osName.toLowerCase(Locale.ROOT).startsWith("mac");
    }
}
