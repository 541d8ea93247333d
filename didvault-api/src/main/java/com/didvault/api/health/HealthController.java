package com.didvault.api.health;

import com.didvault.api.registry.IdentityRegistryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final IdentityRegistryService registryService;

    public HealthController(IdentityRegistryService registryService) {
        this.registryService = registryService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "timestamp", Instant.now().toString()
        ));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(Map.of(
            "name", "DIDVault API",
            "version", "0.1.0-SNAPSHOT",
            "description", "Decentralized identity registry",
            "ledgerHeight", registryService.currentHeight(),
            "timestamp", Instant.now().toString()
        ));
    }
}
