package com.autonomous.commit.controller;

import com.autonomous.commit.service.CacheManager;
import com.autonomous.commit.service.TelemetryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/engine")
public class EngineController {

    @Autowired
    private TelemetryService telemetry;

    @Autowired
    private CacheManager cacheManager;

    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        return ResponseEntity.ok(telemetry.snapshot());
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(telemetry.health());
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache(@RequestParam(required = false) String prefix) {
        int removed = cacheManager.clearPrefix(prefix != null ? prefix : "");
        return ResponseEntity.ok(Map.of(
            "removed", removed,
            "summary", telemetry.formatCacheSummary()
        ));
    }

    @PostMapping("/memory/cleanup")
    public ResponseEntity<?> cleanupMemory() {
        long freed = cacheManager.forceMemoryCleanup();
        return ResponseEntity.ok(Map.of(
            "freed_bytes", freed,
            "summary", telemetry.formatMemorySummary()
        ));
    }
}
