package com.xksgroup.mediadedup.controller;

import com.xksgroup.mediadedup.model.dto.ScanJobDto;
import com.xksgroup.mediadedup.model.dto.StartScanRequest;
import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.model.scan.ScanJobStatus;
import com.xksgroup.mediadedup.service.scan.ScanJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("media-dedup/api/v1/scans")
@RequiredArgsConstructor
@Tag(name = "Analyses de doublons", description = "Lancer, suivre et annuler les analyses de doublons de la médiathèque")
public class ScanController {

    private final ScanJobService scanJobService;

    @PostMapping
    @Operation(
        summary = "Lancer une analyse de doublons",
        description = """
            Crée un job d'analyse et l'exécute en arrière-plan.
            Sans `collectionId`, toutes les collections du catalogue sont analysées l'une après l'autre.
            Une seule analyse peut tourner à la fois.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "202",
            description = "Analyse acceptée et démarrée en arrière-plan",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ScanJobDto.class),
                examples = @ExampleObject(
                    name = "Analyse acceptée",
                    value = """
                    {
                        "jobId": "scan-123e4567-e89b-12d3-a456-426614174000",
                        "collectionId": null,
                        "trigger": "manual",
                        "status": "waiting",
                        "statusMessage": "Waiting for a worker",
                        "progressPercentage": 0
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "409", description = "Une analyse est déjà en cours")
    })
    public ResponseEntity<ScanJobDto> startScan(@RequestBody(required = false) StartScanRequest request) {
        String collectionId = request != null ? request.getCollectionId() : null;

        ScanJob job = scanJobService.requestManualScan(collectionId);
        scanJobService.runJobAsync(job);

        log.info("Manual scan {} accepted", job.getJobId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ScanJobDto.fromJob(job));
    }

    @GetMapping
    @Operation(
        summary = "Lister les analyses",
        description = "Récupère une liste paginée des jobs d'analyse, du plus récent au plus ancien, avec filtrage optionnel par statut."
    )
    public ResponseEntity<Object> listScans(
            @Parameter(description = "Numéro de page (basé sur 0)", example = "0")
            @RequestParam(defaultValue = "0") int page,

            @Parameter(description = "Taille de la page", example = "20")
            @RequestParam(defaultValue = "20") int size,

            @Parameter(description = "Filtrer par statut du job", example = "COMPLETED")
            @RequestParam(required = false) ScanJobStatus status) {

        try {
            Page<ScanJobDto> dtoPage = scanJobService.listJobs(status, PageRequest.of(page, size))
                    .map(ScanJobDto::fromJob);
            return ResponseEntity.ok(dtoPage);

        } catch (Exception e) {
            log.error("Failed to retrieve scan jobs - Error: {}", e.getMessage(), e);
            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("error", "Failed to retrieve scan jobs");
            errorResponse.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
        }
    }

    @GetMapping("/{jobId}")
    @Operation(
        summary = "Obtenir une analyse par ID",
        description = "Récupère la progression, les compteurs et le statut d'un job d'analyse."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Job trouvé",
            content = @Content(schema = @Schema(implementation = ScanJobDto.class))),
        @ApiResponse(responseCode = "404", description = "Job introuvable")
    })
    public ResponseEntity<ScanJobDto> getScan(
            @Parameter(description = "Identifiant du job", example = "scan-123e4567-e89b-12d3-a456-426614174000")
            @PathVariable String jobId) {
        return ResponseEntity.ok(ScanJobDto.fromJob(scanJobService.getJob(jobId)));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(
        summary = "Annuler une analyse",
        description = """
            Demande l'arrêt d'une analyse en attente ou en cours.
            L'analyse s'arrête entre deux groupes et la collection en cours conserve ses résultats précédents.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Annulation demandée"),
        @ApiResponse(responseCode = "404", description = "Job introuvable"),
        @ApiResponse(responseCode = "409", description = "Le job est déjà terminé")
    })
    public ResponseEntity<Map<String, Object>> cancelScan(@PathVariable String jobId) {
        Map<String, Object> response = new HashMap<>();
        response.put("jobId", jobId);

        if (scanJobService.cancelJob(jobId)) {
            response.put("message", "Cancellation requested");
            return ResponseEntity.ok(response);
        }

        response.put("error", "Scan job cannot be cancelled");
        response.put("message", "Scan job is already in a final state");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }
}
