package com.fintech.webhook.api;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final Clock clock;
    private final String version;

    public HealthController(Clock clock, @Value("${app.version:1.0.0}") String version) {
        this.clock = clock;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", clock.instant().toString());
        body.put("version", version);
        return ResponseEntity.ok(body);
    }
}
