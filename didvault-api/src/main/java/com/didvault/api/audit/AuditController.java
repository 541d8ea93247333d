package com.didvault.api.audit;

import com.didvault.api.audit.RegistryAuditLog.AuditEntry;
import com.didvault.api.audit.RegistryAuditLog.VerificationResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Audit trail of committed registry changes.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final RegistryAuditLog auditLog;

    public AuditController(RegistryAuditLog auditLog) {
        this.auditLog = auditLog;
    }

    /**
     * Latest audit entries, oldest first.
     * GET /api/v1/audit?limit=50
     */
    @GetMapping
    public ResponseEntity<List<AuditEntryResponse>> getEntries(
            @RequestParam(defaultValue = "50") int limit) {
        List<AuditEntryResponse> entries = auditLog.getLatestEntries(limit).stream()
                .map(AuditEntryResponse::from)
                .toList();
        return ResponseEntity.ok(entries);
    }

    /**
     * GET /api/v1/audit/verify
     */
    @GetMapping("/verify")
    public ResponseEntity<VerificationResult> verify() {
        return ResponseEntity.ok(auditLog.verifyIntegrity());
    }

    public record AuditEntryResponse(
        long sequenceNumber,
        String type,
        String subject,
        long height,
        Map<String, String> details,
        String recordedAt,
        String previousHash,
        String entryHash
    ) {
        static AuditEntryResponse from(AuditEntry entry) {
            return new AuditEntryResponse(
                entry.sequenceNumber(),
                entry.event().type().name(),
                entry.event().subject().principal(),
                entry.event().height(),
                entry.event().details(),
                entry.recordedAt().toString(),
                entry.previousHash(),
                entry.entryHash()
            );
        }
    }
}
