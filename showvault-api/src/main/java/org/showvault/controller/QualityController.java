package org.showvault.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.showvault.model.dto.QualityOptions;
import org.showvault.service.show.QualityOptionsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/qualities")
@AllArgsConstructor
@Tag(name = "Qualities", description = "Quality tiers and presets offered by the edit form")
public class QualityController {

    private final QualityOptionsService qualityOptionsService;

    @Operation(summary = "List quality tiers and presets")
    @ApiResponse(responseCode = "200", description = "Options returned")
    @GetMapping
    public ResponseEntity<QualityOptions> getQualityOptions() {
        return ResponseEntity.ok(qualityOptionsService.getQualityOptions());
    }
}
