package com.xksgroup.mediadedup.controller;

import com.xksgroup.mediadedup.model.CollectionDuplicates;
import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.ReviewStatus;
import com.xksgroup.mediadedup.model.catalog.MediaCollection;
import com.xksgroup.mediadedup.model.dto.SelectPrimaryRequest;
import com.xksgroup.mediadedup.model.dto.UpdateStatusRequest;
import com.xksgroup.mediadedup.service.DuplicateGroupService;
import com.xksgroup.mediadedup.service.catalog.MediaCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("media-dedup/api/v1/collections")
@RequiredArgsConstructor
@Tag(name = "Doublons", description = "Consulter les groupes de doublons détectés et enregistrer les décisions de revue")
public class CollectionController {

    private final MediaCatalog catalog;
    private final DuplicateGroupService duplicateGroupService;

    @GetMapping
    @Operation(
        summary = "Lister les collections du catalogue",
        description = "Retourne les bibliothèques connues du catalogue, chacune pouvant être analysée séparément."
    )
    public ResponseEntity<List<MediaCollection>> listCollections() {
        return ResponseEntity.ok(catalog.listCollections());
    }

    @GetMapping("/{collectionId}/duplicates")
    @Operation(
        summary = "Groupes de doublons d'une collection",
        description = """
            Retourne le résultat de la dernière analyse terminée de la collection : les groupes de doublons,
            leurs versions classées par score de qualité et les métadonnées fusionnées.
            Une collection jamais analysée retourne une liste vide.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Groupes récupérés avec succès",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = CollectionDuplicates.class),
                examples = @ExampleObject(
                    name = "Un groupe",
                    value = """
                    {
                        "collectionId": "movies",
                        "scanJobId": "scan-123e4567-e89b-12d3-a456-426614174000",
                        "scannedAt": "2024-01-01T12:00:00Z",
                        "groups": [
                            {
                                "id": "5f0c6a8e-1b7a-4c1e-9d9f-0a1b2c3d4e5f",
                                "primaryVersionId": "a1",
                                "status": "PENDING",
                                "versions": [
                                    { "itemId": "a1", "qualityScore": 100, "resolution": "2160p" },
                                    { "itemId": "b2", "qualityScore": 51, "resolution": "1080p" }
                                ]
                            }
                        ]
                    }
                    """
                )
            )
        )
    })
    public ResponseEntity<CollectionDuplicates> getDuplicates(
            @PathVariable String collectionId,
            @Parameter(description = "Filtrer par statut de revue", example = "PENDING")
            @RequestParam(required = false) ReviewStatus status) {

        CollectionDuplicates document = duplicateGroupService.findDocument(collectionId)
                .orElseGet(() -> CollectionDuplicates.builder().collectionId(collectionId).build());

        if (status != null) {
            List<DuplicateGroup> filtered = document.getGroups().stream()
                    .filter(g -> g.getStatus() == status)
                    .collect(Collectors.toCollection(ArrayList::new));
            document.setGroups(filtered);
        }
        return ResponseEntity.ok(document);
    }

    @GetMapping("/{collectionId}/duplicates/{groupId}")
    @Operation(summary = "Obtenir un groupe de doublons", description = "Retourne un groupe avec ses versions classées et ses métadonnées fusionnées.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Groupe trouvé"),
        @ApiResponse(responseCode = "404", description = "Collection ou groupe introuvable")
    })
    public ResponseEntity<DuplicateGroup> getGroup(@PathVariable String collectionId, @PathVariable String groupId) {
        return ResponseEntity.ok(duplicateGroupService.findGroup(collectionId, groupId));
    }

    @PutMapping("/{collectionId}/duplicates/{groupId}/primary")
    @Operation(
        summary = "Choisir la version principale",
        description = """
            Désigne manuellement la version à conserver. Ce choix est prioritaire sur le classement
            par qualité et survit aux analyses suivantes tant que la version fait partie du groupe.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Version principale mise à jour"),
        @ApiResponse(responseCode = "400", description = "La version ne fait pas partie du groupe"),
        @ApiResponse(responseCode = "404", description = "Collection ou groupe introuvable")
    })
    public ResponseEntity<DuplicateGroup> selectPrimary(@PathVariable String collectionId,
                                                        @PathVariable String groupId,
                                                        @Valid @RequestBody SelectPrimaryRequest request) {
        return ResponseEntity.ok(duplicateGroupService.selectPrimary(collectionId, groupId, request.getItemId()));
    }

    @PutMapping("/{collectionId}/duplicates/{groupId}/status")
    @Operation(summary = "Mettre à jour le statut de revue", description = "Statuts possibles : PENDING, REVIEWED, RESOLVED, IGNORED.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Statut mis à jour"),
        @ApiResponse(responseCode = "400", description = "Statut invalide"),
        @ApiResponse(responseCode = "404", description = "Collection ou groupe introuvable")
    })
    public ResponseEntity<DuplicateGroup> updateStatus(@PathVariable String collectionId,
                                                       @PathVariable String groupId,
                                                       @Valid @RequestBody UpdateStatusRequest request) {
        return ResponseEntity.ok(duplicateGroupService.updateStatus(collectionId, groupId, request.getStatus()));
    }
}
