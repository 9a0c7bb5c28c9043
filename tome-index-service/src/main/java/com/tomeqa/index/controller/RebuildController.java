package com.tomeqa.index.controller;

import com.tomeqa.index.dto.RebuildRequest;
import com.tomeqa.index.dto.RebuildRunResponse;
import com.tomeqa.index.lifecycle.IndexLifecycleManager;
import com.tomeqa.index.lifecycle.RebuildRun;
import com.tomeqa.index.lifecycle.ReconciliationEntry;
import com.tomeqa.index.status.SseStatusSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Collection;
import java.util.Optional;

/**
 * Rebuild runs, operator reconciliation and the live status stream.
 */
@RestController
@RequestMapping("/api/index")
@CrossOrigin(origins = "*")
@Slf4j
public class RebuildController {

    private final IndexLifecycleManager lifecycleManager;
    private final SseStatusSink statusSink;

    public RebuildController(IndexLifecycleManager lifecycleManager, SseStatusSink statusSink) {
        this.lifecycleManager = lifecycleManager;
        this.statusSink = statusSink;
    }

    @PostMapping("/rebuilds")
    public ResponseEntity<RebuildRunResponse> startRebuild(@RequestBody RebuildRequest request) {
        request.validate();
        RebuildRun run = lifecycleManager.startRebuild(request.collections(), request.getCacheBehaviorOrDefault());
        log.info("[API] Rebuild {} started for {}", run.getRunId(), run.getTargets());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RebuildRunResponse.from(run));
    }

    @GetMapping("/rebuilds/{runId}")
    public ResponseEntity<RebuildRunResponse> getRebuild(@PathVariable String runId) {
        return lifecycleManager.getRun(runId)
                .map(run -> ResponseEntity.ok(RebuildRunResponse.from(run)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/rebuilds/{runId}")
    public ResponseEntity<RebuildRunResponse> cancelRebuild(@PathVariable String runId) {
        Optional<RebuildRun> run = lifecycleManager.getRun(runId);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!lifecycleManager.cancel(runId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(RebuildRunResponse.from(run.get()));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RebuildRunResponse.from(run.get()));
    }

    @GetMapping("/reconciliation")
    public Collection<ReconciliationEntry> reconciliation() {
        return lifecycleManager.basesAwaitingReconciliation().values();
    }

    @DeleteMapping("/reconciliation/{base}")
    public ResponseEntity<Void> clearReconciliation(@PathVariable String base) {
        return lifecycleManager.clearReconciliation(base)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping(value = "/status/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter statusStream() {
        return statusSink.subscribe();
    }
}
