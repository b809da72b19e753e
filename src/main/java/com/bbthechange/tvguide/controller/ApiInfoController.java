package com.bbthechange.tvguide.controller;

import com.bbthechange.tvguide.dto.MessageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Info", description = "API identification")
public class ApiInfoController {

    static final String API_NAME = "Live TV Streaming API";
    static final String API_VERSION = "1.0.0";

    @GetMapping("/")
    @Operation(summary = "Identify the API")
    public ResponseEntity<MessageResponse> root() {
        return ResponseEntity.ok(new MessageResponse(API_NAME, API_VERSION));
    }
}
