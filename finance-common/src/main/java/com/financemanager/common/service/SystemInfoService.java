package com.financemanager.common.service;

import com.financemanager.common.dto.SystemInfoResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class SystemInfoService {

    private final Environment environment;
    private final String applicationName;
    private final String version;

    public SystemInfoService(Environment environment,
                             @Value("${spring.application.name:finance-manager}") String applicationName,
                             @Value("${app.version:unknown}") String version) {
        this.environment = environment;
        this.applicationName = applicationName;
        this.version = version;
    }

    public SystemInfoResponse getSystemInfo() {
        String[] profiles = environment.getActiveProfiles();
        return new SystemInfoResponse(
                applicationName,
                version,
                System.getProperty("java.version"),
                System.getProperty("os.name") + " " + System.getProperty("os.version"),
                profiles.length == 0 ? "default" : String.join(",", profiles),
                Instant.now()
        );
    }
}
