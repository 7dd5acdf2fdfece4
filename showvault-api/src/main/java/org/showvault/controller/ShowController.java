package org.showvault.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.showvault.model.dto.ShowEditView;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.dto.request.CreateShowRequest;
import org.showvault.model.dto.request.ReleaseCheckRequest;
import org.showvault.model.dto.request.SceneExceptionRequest;
import org.showvault.model.dto.request.ShowEditForm;
import org.showvault.model.dto.response.ReleaseDecision;
import org.showvault.model.dto.response.ShowUpdateResult;
import org.showvault.service.search.ReleaseDecisionService;
import org.showvault.service.show.ShowEditFormParser;
import org.showvault.service.show.ShowSettingsService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/shows")
@AllArgsConstructor
@Tag(name = "Shows", description = "Endpoints for viewing and editing per-show settings")
public class ShowController {

    private final ShowSettingsService showSettingsService;
    private final ShowEditFormParser showEditFormParser;
    private final ReleaseDecisionService releaseDecisionService;

    @Operation(summary = "Get all shows", description = "Retrieve the settings of every show, ordered by name.")
    @ApiResponse(responseCode = "200", description = "Shows returned successfully")
    @GetMapping
    public ResponseEntity<List<ShowSettings>> getShows() {
        return ResponseEntity.ok(showSettingsService.getShows());
    }

    @Operation(summary = "Get a show by ID", description = "Retrieve the stored settings of a show.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Show settings returned successfully"),
            @ApiResponse(responseCode = "404", description = "Show not found")
    })
    @GetMapping("/{showId}")
    public ResponseEntity<ShowSettings> getShow(@Parameter(description = "ID of the show") @PathVariable long showId) {
        return ResponseEntity.ok(showSettingsService.loadForShow(showId));
    }

    @Operation(summary = "Get the edit view of a show", description = "Retrieve settings together with the hints needed to render the edit form.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Edit view returned successfully"),
            @ApiResponse(responseCode = "404", description = "Show not found")
    })
    @GetMapping("/{showId}/edit")
    public ResponseEntity<ShowEditView> getEditView(@Parameter(description = "ID of the show") @PathVariable long showId) {
        return ResponseEntity.ok(showSettingsService.getEditView(showId));
    }

    @Operation(summary = "Submit the show edit form",
            description = "Apply a form-encoded edit submission. Unchecked checkboxes are absent from the form and turn the option off.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Settings applied successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid field value or location"),
            @ApiResponse(responseCode = "404", description = "Show not found"),
            @ApiResponse(responseCode = "409", description = "Another update to the show is in progress")
    })
    @PostMapping(value = "/edit", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<ShowUpdateResult> submitEditForm(@RequestParam MultiValueMap<String, String> fields) {
        ShowEditForm form = ShowEditForm.of(fields);
        long showId = showEditFormParser.parseShowId(form);
        return ResponseEntity.ok(showSettingsService.applyUpdate(showId, form));
    }

    @Operation(summary = "Create a show", description = "Add a show using the global defaults for any omitted setting.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Show created successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid request or show already exists")
    })
    @PostMapping
    public ResponseEntity<ShowSettings> createShow(@Parameter(description = "Show creation request") @Validated @RequestBody CreateShowRequest request) {
        return ResponseEntity.ok(showSettingsService.createShow(request));
    }

    @Operation(summary = "Delete a show", description = "Remove a show and its scene exceptions.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Show deleted successfully"),
            @ApiResponse(responseCode = "404", description = "Show not found")
    })
    @DeleteMapping("/{showId}")
    public ResponseEntity<Void> deleteShow(@Parameter(description = "ID of the show") @PathVariable long showId) {
        showSettingsService.removeShow(showId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Add a scene exception", description = "Register an alternate release name for a show.")
    @ApiResponse(responseCode = "200", description = "Scene exception added")
    @PostMapping("/{showId}/scene-exceptions")
    public ResponseEntity<ShowSettings> addSceneException(
            @Parameter(description = "ID of the show") @PathVariable long showId,
            @Validated @RequestBody SceneExceptionRequest request) {
        return ResponseEntity.ok(showSettingsService.addSceneException(showId, request.getName()));
    }

    @Operation(summary = "Remove a scene exception")
    @ApiResponse(responseCode = "200", description = "Scene exception removed")
    @DeleteMapping("/{showId}/scene-exceptions")
    public ResponseEntity<ShowSettings> removeSceneException(
            @Parameter(description = "ID of the show") @PathVariable long showId,
            @Parameter(description = "Exception name to remove") @RequestParam String name) {
        return ResponseEntity.ok(showSettingsService.removeSceneException(showId, name));
    }

    @Operation(summary = "Check a release against a show",
            description = "Decide whether a release would be accepted for the show given its filters and quality selection.")
    @ApiResponse(responseCode = "200", description = "Decision returned")
    @PostMapping("/{showId}/release-check")
    public ResponseEntity<ReleaseDecision> checkRelease(
            @Parameter(description = "ID of the show") @PathVariable long showId,
            @Validated @RequestBody ReleaseCheckRequest request) {
        return ResponseEntity.ok(releaseDecisionService.evaluate(showId, request));
    }
}
