package com.fintech.webhook.api;

import com.fintech.webhook.domain.model.DedupIndexStats;
import com.fintech.webhook.domain.service.DedupIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator endpoints over the processed-transaction index.
 */
@Slf4j
@RestController
@RequestMapping("/admin/processed-transactions")
@RequiredArgsConstructor
public class AdminController {

    private final DedupIndex dedupIndex;

    @GetMapping("/stats")
    public ResponseEntity<DedupIndexStats> stats() {
        return ResponseEntity.ok(dedupIndex.stats());
    }

    /**
     * Purges processed ids older than {@code daysToKeep} days and returns the fresh stats.
     */
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup(@RequestParam(defaultValue = "30") int daysToKeep) {
        if (daysToKeep < 1) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", "daysToKeep must be at least 1");
            return ResponseEntity.badRequest().body(error);
        }

        int removed = dedupIndex.purgeProcessedOlderThan(Duration.ofDays(daysToKeep));
        log.info("Admin cleanup removed {} processed transaction ids older than {} days", removed, daysToKeep);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("removed", removed);
        body.put("daysToKeep", daysToKeep);
        body.put("stats", dedupIndex.stats());
        return ResponseEntity.ok(body);
    }
}
