package com.xksgroup.mediadedup.controller;

import com.xksgroup.mediadedup.config.DedupProperties;
import com.xksgroup.mediadedup.repo.ScanJobRepository;
import com.xksgroup.mediadedup.service.helper.FfprobeHelper;
import com.xksgroup.mediadedup.service.scan.ScanJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("media-dedup/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Santé", description = "Vérifications de santé du service de détection des doublons")
public class HealthController {

    private final ScanJobRepository scanJobRepository;
    private final ScanJobService scanJobService;
    private final FfprobeHelper ffprobeHelper;
    private final DedupProperties properties;

    @GetMapping
    @Operation(
        summary = "Vérification de santé du système",
        description = "Vérifie la connectivité à la base de données, la disponibilité de ffprobe et indique si une analyse est en cours."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Le système est en bonne santé"),
        @ApiResponse(responseCode = "503", description = "La base de données est injoignable")
    })
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> checks = new LinkedHashMap<>();
        boolean databaseUp = isDatabaseUp();
        checks.put("database", databaseUp ? "PASS" : "FAIL");
        if (properties.getCatalog().isFfprobeEnabled()) {
            // ffprobe is optional, files are still grouped from their names without it
            checks.put("ffprobe", ffprobeHelper.isFfprobeAvailable() ? "PASS" : "WARN");
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", databaseUp ? "healthy" : "unhealthy");
        response.put("timestamp", LocalDateTime.now());
        response.put("service", "media-dedup");
        response.put("detectionEnabled", properties.isEnabled());
        response.put("dryRunMode", properties.isDryRunMode());
        response.put("scanRunning", scanJobService.isScanRunning());
        response.put("checks", checks);

        return databaseUp ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
    }

    private boolean isDatabaseUp() {
        try {
            scanJobRepository.count();
            return true;
        } catch (DataAccessException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
