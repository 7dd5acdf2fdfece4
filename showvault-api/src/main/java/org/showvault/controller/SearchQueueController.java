package org.showvault.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.showvault.model.dto.response.SearchQueueStatus;
import org.showvault.model.enums.SearchPriority;
import org.showvault.service.search.SearchQueueService;
import org.showvault.service.show.ShowSettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/search-queue")
@AllArgsConstructor
@Tag(name = "Search Queue", description = "Endpoints for inspecting and feeding the show search queue")
public class SearchQueueController {

    private final SearchQueueService searchQueueService;
    private final ShowSettingsService showSettingsService;

    @Operation(summary = "Get queue status of a show")
    @ApiResponse(responseCode = "200", description = "Status returned")
    @GetMapping("/{showId}")
    public ResponseEntity<SearchQueueStatus> getStatus(@Parameter(description = "ID of the show") @PathVariable long showId) {
        showSettingsService.loadForShow(showId);
        return ResponseEntity.ok(searchQueueService.status(showId));
    }

    @Operation(summary = "Queue a search for a show", description = "Paused shows are never queued. More urgent searches are served first.")
    @ApiResponse(responseCode = "200", description = "Status after the enqueue attempt")
    @PostMapping("/{showId}")
    public ResponseEntity<SearchQueueStatus> enqueue(
            @Parameter(description = "ID of the show") @PathVariable long showId,
            @Parameter(description = "Why the search was requested") @RequestParam(defaultValue = "manual") String reason,
            @Parameter(description = "How urgent the search is") @RequestParam(defaultValue = "NORMAL") SearchPriority priority) {
        showSettingsService.loadForShow(showId);
        searchQueueService.enqueue(showId, reason, priority);
        return ResponseEntity.ok(searchQueueService.status(showId));
    }
}
