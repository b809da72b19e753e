package com.bbthechange.tvguide.controller;

import com.bbthechange.tvguide.dto.SeedResultDTO;
import com.bbthechange.tvguide.service.SampleDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Sample data", description = "Catalog seeding")
public class SampleDataController extends BaseController {

    private final SampleDataService sampleDataService;

    public SampleDataController(SampleDataService sampleDataService) {
        this.sampleDataService = sampleDataService;
    }

    @PostMapping("/init-data")
    @Operation(summary = "Seed an empty catalog with sample channels",
               description = "No-op when the catalog already has channels.")
    public ResponseEntity<SeedResultDTO> initializeSampleData() {
        return ResponseEntity.ok(sampleDataService.initializeSampleData());
    }
}
