package com.quicklook.server.controller;

import com.quicklook.db.ExposureRecord;
import com.quicklook.server.service.LatestMosaicHolder;
import com.quicklook.server.service.MosaicPipelineService;
import com.quicklook.server.service.OperatorMessageLog;
import com.quicklook.server.service.TileSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);
    private final MosaicPipelineService pipeline;
    private final LatestMosaicHolder mosaicHolder;
    private final OperatorMessageLog messageLog;

    public PipelineController(MosaicPipelineService pipeline, LatestMosaicHolder mosaicHolder,
            OperatorMessageLog messageLog) {
        this.pipeline = pipeline;
        this.mosaicHolder = mosaicHolder;
        this.messageLog = messageLog;
    }

    public static class NotifyRequest {
        public String path;
    }

    public static class DropRequest {
        public List<String> paths;
    }

    public static class LoadExposureRequest {
        public String frameId;
    }

    public static class ToggleRequest {
        public Boolean enabled;
    }

    @PostMapping("/frames/notify")
    public ResponseEntity<?> notifyFile(@RequestBody NotifyRequest request) {
        if (request.path == null || request.path.trim().isEmpty()) {
            return ResponseEntity.badRequest().body("Missing path.");
        }
        pipeline.notifyFile(request.path.trim());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/frames/drop")
    public ResponseEntity<?> drop(@RequestBody DropRequest request) {
        if (request.paths == null || request.paths.isEmpty()) {
            return ResponseEntity.badRequest().body("No paths given.");
        }
        pipeline.dropFiles(request.paths);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/exposures/load")
    public ResponseEntity<?> loadExposure(@RequestBody LoadExposureRequest request) {
        if (request.frameId == null || request.frameId.trim().isEmpty()) {
            return ResponseEntity.badRequest().body("Missing frameId.");
        }
        List<String> paths;
        try {
            paths = pipeline.loadExposure(request.frameId);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
        if (paths.isEmpty()) {
            logger.warn("No frames on disk for exposure of {}", request.frameId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No frames found for " + request.frameId);
        }
        return ResponseEntity.accepted().body(paths);
    }

    @GetMapping("/exposures")
    public ResponseEntity<List<ExposureRecord>> listExposures(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(pipeline.listExposures(Math.max(1, Math.min(limit, 500))));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<?> status() {
        return ResponseEntity.ok(pipeline.getStatus());
    }

    @GetMapping("/pipeline/messages")
    public ResponseEntity<List<OperatorMessageLog.Message>> messages(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(messageLog.recent(Math.max(1, limit)));
    }

    @PutMapping("/pipeline/bias")
    public ResponseEntity<?> setBias(@RequestBody ToggleRequest request) {
        if (request.enabled == null) {
            return ResponseEntity.badRequest().body("Missing enabled flag.");
        }
        pipeline.setSubtractBias(request.enabled);
        return ResponseEntity.ok(pipeline.getStatus());
    }

    @GetMapping("/mosaic/current")
    public ResponseEntity<?> currentMosaic() {
        Optional<TileSummary> summary = mosaicHolder.getCurrentSummary();
        if (summary.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(summary.get());
    }
}
