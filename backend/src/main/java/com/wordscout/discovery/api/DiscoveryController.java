package com.wordscout.discovery.api;

import com.wordscout.discovery.cache.CacheStats;
import com.wordscout.discovery.cache.ResponseCache;
import com.wordscout.discovery.model.DiscoveryRunRequest;
import com.wordscout.discovery.model.DiscoveryRunResponse;
import com.wordscout.discovery.model.DiscoveryRunStatus;
import com.wordscout.discovery.model.KeywordRecord;
import com.wordscout.discovery.model.TaskFailure;
import com.wordscout.discovery.service.DiscoveryRunService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/discovery")
public class DiscoveryController {
    private final DiscoveryRunService runService;
    private final ResponseCache responseCache;

    public DiscoveryController(DiscoveryRunService runService, ResponseCache responseCache) {
        this.runService = runService;
        this.responseCache = responseCache;
    }

    @PostMapping("/runs")
    public ResponseEntity<DiscoveryRunResponse> startRun(@RequestBody(required = false) DiscoveryRunRequest request) {
        if (request == null || request.seedText().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "seeds are required");
        }
        return ResponseEntity.accepted().body(runService.start(request));
    }

    @PostMapping("/runs/resume")
    public ResponseEntity<DiscoveryRunResponse> resumeRun(@RequestBody(required = false) DiscoveryRunRequest request) {
        return ResponseEntity.accepted().body(runService.resumeFromCheckpoint(request));
    }

    @PostMapping("/pause")
    public DiscoveryRunStatus pause() {
        return runService.pause();
    }

    @PostMapping("/resume")
    public DiscoveryRunStatus resume() {
        return runService.resume();
    }

    @PostMapping("/stop")
    public DiscoveryRunStatus stop() {
        return runService.stop();
    }

    @GetMapping("/status")
    public DiscoveryRunStatus status() {
        return runService.status();
    }

    @GetMapping("/keywords")
    public List<KeywordRecord> keywords(@RequestParam(name = "limit", required = false) Integer limit) {
        if (limit != null && limit < 0) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be >= 0");
        }
        return runService.keywords(limit);
    }

    @GetMapping("/failures")
    public List<TaskFailure> failures() {
        return runService.failures();
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return responseCache.stats();
    }

    @DeleteMapping("/cache")
    public CacheStats clearCache() {
        responseCache.clear();
        return responseCache.stats();
    }
}
