package com.financemanager.common.controller;

import com.financemanager.common.dto.SystemInfoResponse;
import com.financemanager.common.service.SystemInfoService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service identity and liveness, exposed by every finance-manager service.
 */
@RestController
@RequestMapping("/api/v1/Environment")
@Tag(name = "Environment", description = "Service runtime information")
public class EnvironmentController {

    private final SystemInfoService systemInfoService;

    public EnvironmentController(SystemInfoService systemInfoService) {
        this.systemInfoService = systemInfoService;
    }

    @GetMapping("/info")
    @Operation(summary = "Runtime info", description = "Application name, version, JVM and OS of this instance")
    public ResponseEntity<SystemInfoResponse> info() {
        return ResponseEntity.ok(systemInfoService.getSystemInfo());
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public ResponseEntity<Map<String, Object>> health() {
        SystemInfoResponse info = systemInfoService.getSystemInfo();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("application", info.getApplicationName());
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }
}
