package com.didvault.api.identity;

import com.didvault.api.registry.IdentityRegistryService;
import com.didvault.registry.Owner;
import com.didvault.registry.RegistryLimits;
import com.didvault.registry.identity.IdentityRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Identity REST API: registration, credentials and lifecycle.
 *
 * Mutations act on the identity of the caller named in the
 * {@value #CALLER_HEADER} header.
 */
@RestController
@RequestMapping("/api/v1/identities")
public class IdentityController {

    public static final String CALLER_HEADER = "X-Caller-Principal";

    private final IdentityRegistryService registryService;

    public IdentityController(IdentityRegistryService registryService) {
        this.registryService = registryService;
    }

    /**
     * Register a DID for the caller.
     * POST /api/v1/identities
     */
    @PostMapping
    public ResponseEntity<IdentityResponse> createIdentity(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody CreateIdentityRequest request) {
        Owner owner = Owner.of(caller);
        IdentityRecord record = registryService.createDid(owner, request.did());
        return ResponseEntity.status(HttpStatus.CREATED).body(IdentityResponse.from(owner, record));
    }

    /**
     * GET /api/v1/identities/{owner}
     */
    @GetMapping("/{owner}")
    public ResponseEntity<IdentityResponse> getIdentity(@PathVariable String owner) {
        Owner subject = Owner.of(owner);
        return registryService.getDid(subject)
            .map(record -> ResponseEntity.ok(IdentityResponse.from(subject, record)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Permanently remove the caller's identity.
     * DELETE /api/v1/identities
     */
    @DeleteMapping
    public ResponseEntity<Void> revokeIdentity(@RequestHeader(CALLER_HEADER) String caller) {
        registryService.revokeDid(Owner.of(caller));
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/identities/credentials
     */
    @PostMapping("/credentials")
    public ResponseEntity<CredentialCountResponse> addCredential(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AddCredentialRequest request) {
        Owner owner = Owner.of(caller);
        int count = registryService.addCredential(owner, request.credential());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new CredentialCountResponse(owner.principal(), count));
    }

    /**
     * GET /api/v1/identities/{owner}/credentials/verify?credential=...
     */
    @GetMapping("/{owner}/credentials/verify")
    public ResponseEntity<VerificationResponse> verifyCredential(
            @PathVariable String owner,
            @RequestParam String credential) {
        boolean valid = registryService.verifyCredential(Owner.of(owner), credential);
        return ResponseEntity.ok(new VerificationResponse(valid));
    }

    @GetMapping("/{owner}/credentials/count")
    public ResponseEntity<CredentialCountResponse> getCredentialCount(@PathVariable String owner) {
        return ResponseEntity.ok(
            new CredentialCountResponse(owner, registryService.getCredentialCount(Owner.of(owner))));
    }

    /**
     * POST /api/v1/identities/deactivate
     */
    @PostMapping("/deactivate")
    public ResponseEntity<Void> deactivateIdentity(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody(required = false) DeactivateRequest request) {
        String reason = request != null ? request.reason() : null;
        registryService.deactivateDid(Owner.of(caller), reason);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/identities/reactivate
     */
    @PostMapping("/reactivate")
    public ResponseEntity<Void> reactivateIdentity(@RequestHeader(CALLER_HEADER) String caller) {
        registryService.reactivateDid(Owner.of(caller));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{owner}/active")
    public ResponseEntity<ActiveResponse> isActive(@PathVariable String owner) {
        return ResponseEntity.ok(new ActiveResponse(registryService.isDidActive(Owner.of(owner))));
    }

    // DTOs
    public record CreateIdentityRequest(@NotNull String did) {}

    public record AddCredentialRequest(@NotNull String credential) {}

    public record DeactivateRequest(@Size(max = RegistryLimits.MAX_REASON_LENGTH) String reason) {}

    public record IdentityResponse(
        String owner,
        String did,
        List<String> credentials,
        long createdAt,
        long updatedAt,
        boolean active,
        String revocationReason
    ) {
        static IdentityResponse from(Owner owner, IdentityRecord record) {
            return new IdentityResponse(
                owner.principal(),
                record.did(),
                record.credentials().asList(),
                record.createdAt(),
                record.updatedAt(),
                record.active(),
                record.revocationReason()
            );
        }
    }

    public record CredentialCountResponse(String owner, int count) {}

    public record VerificationResponse(boolean valid) {}

    public record ActiveResponse(boolean active) {}
}
