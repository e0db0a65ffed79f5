package com.financemanager.common.dto;

import java.time.Instant;

/**
 * Runtime description of a running service instance.
 */
public class SystemInfoResponse {

    private String applicationName;
    private String version;
    private String javaVersion;
    private String osName;
    private String activeProfiles;
    private Instant timestamp;

    public SystemInfoResponse() {
    }

    public SystemInfoResponse(String applicationName, String version, String javaVersion,
                              String osName, String activeProfiles, Instant timestamp) {
        this.applicationName = applicationName;
        this.version = version;
        this.javaVersion = javaVersion;
        this.osName = osName;
        this.activeProfiles = activeProfiles;
        this.timestamp = timestamp;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public String getVersion() {
        return version;
    }

    public String getJavaVersion() {
        return javaVersion;
    }

    public String getOsName() {
        return osName;
    }

    public String getActiveProfiles() {
        return activeProfiles;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
