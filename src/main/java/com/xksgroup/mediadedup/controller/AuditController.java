package com.xksgroup.mediadedup.controller;

import com.xksgroup.mediadedup.model.DeletionAuditRecord;
import com.xksgroup.mediadedup.model.dto.DeletionAuditRequest;
import com.xksgroup.mediadedup.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("media-dedup/api/v1/audit")
@RequiredArgsConstructor
@Tag(name = "Journal des suppressions", description = "Historique en ajout seul des suppressions de versions en double")
public class AuditController {

    private final AuditService auditService;

    @PostMapping
    @Operation(
        summary = "Enregistrer une suppression",
        description = "Ajoute au journal le résultat d'une suppression de fichier, réussie ou non. Les entrées ne sont jamais modifiées."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Entrée ajoutée au journal"),
        @ApiResponse(responseCode = "400", description = "Champs obligatoires manquants")
    })
    public ResponseEntity<DeletionAuditRecord> record(@Valid @RequestBody DeletionAuditRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(auditService.record(request.toRecord()));
    }

    @GetMapping
    @Operation(
        summary = "Consulter le journal",
        description = """
            Retourne les entrées du journal, de la plus récente à la plus ancienne.
            Les bornes `from` et `to` (ISO-8601, incluses) sont optionnelles ; `month` (yyyy_MM) filtre un mois entier.
            """
    )
    public ResponseEntity<List<DeletionAuditRecord>> find(
            @Parameter(description = "Début de la période", example = "2024-01-01T00:00:00Z")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,

            @Parameter(description = "Fin de la période", example = "2024-01-31T23:59:59Z")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,

            @Parameter(description = "Mois au format yyyy_MM", example = "2024_01")
            @RequestParam(required = false) String month) {

        if (month != null && !month.isBlank()) {
            return ResponseEntity.ok(auditService.findByMonth(month));
        }
        return ResponseEntity.ok(auditService.find(from, to));
    }
}
