package com.quicklook.server.controller;

import com.quicklook.server.service.FlatFieldService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/flats")
public class FlatController {

    private static final Logger logger = LoggerFactory.getLogger(FlatController.class);
    private final FlatFieldService flatService;

    public FlatController(FlatFieldService flatService) {
        this.flatService = flatService;
    }

    public static class LoadRequest {
        // Optional: falls back to the configured flat directory
        public String directory;
    }

    @PostMapping("/load")
    public ResponseEntity<?> load(@RequestBody(required = false) LoadRequest request) {
        String dir = request == null ? null : request.directory;
        try {
            flatService.startLoad(dir);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
        logger.info("Flat load requested from {}", dir == null ? "configured directory" : dir);
        return ResponseEntity.accepted().body(flatService.getStatus());
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        return ResponseEntity.ok(flatService.getStatus());
    }

    @PutMapping("/enabled")
    public ResponseEntity<?> setEnabled(@RequestBody PipelineController.ToggleRequest request) {
        if (request.enabled == null) {
            return ResponseEntity.badRequest().body("Missing enabled flag.");
        }
        flatService.setUseFlats(request.enabled);
        return ResponseEntity.ok(flatService.getStatus());
    }
}
