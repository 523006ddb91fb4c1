package com.xksgroup.mediadedup.controller;

import com.xksgroup.mediadedup.service.EventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(
        name = "Streaming des analyses",
        description = "Fournit des mises à jour en temps réel sur les analyses de doublons en utilisant Server-Sent Events (SSE)."
)
@RestController
@RequestMapping("media-dedup/api/v1")
@RequiredArgsConstructor
public class ScanEventsController {

    private final EventService eventService;

    @Operation(
            summary = "Diffuser la progression des analyses",
            description = """
                Cet endpoint utilise **Server-Sent Events (SSE)** pour diffuser en continu la progression
                des analyses de doublons actives.

                Événements émis :
                - `connected` à l'ouverture du flux
                - `scan-update` avec la liste des analyses actives
                - `scan-completed`, `scan-failed`, `scan-cancelled` à la fin d'une analyse

                Avec `jobId`, seuls les événements de ce job sont envoyés.
                """,
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Flux SSE démarré avec succès (Content-Type: text/event-stream)",
                            content = @Content(
                                    mediaType = "text/event-stream",
                                    schema = @Schema(implementation = String.class)
                            )
                    )
            }
    )
    @GetMapping(value = "/scans/events", produces = "text/event-stream")
    public SseEmitter streamScanEvents(@RequestParam(required = false, defaultValue = "") String jobId) {
        return eventService.subscribe(jobId);
    }
}
