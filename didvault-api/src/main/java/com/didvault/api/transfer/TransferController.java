package com.didvault.api.transfer;

import com.didvault.api.registry.IdentityRegistryService;
import com.didvault.registry.Owner;
import com.didvault.registry.transfer.PendingTransfer;
import com.didvault.registry.transfer.TransferHistoryEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.didvault.api.identity.IdentityController.CALLER_HEADER;

/**
 * Two-step ownership transfer REST API.
 */
@RestController
@RequestMapping("/api/v1/transfers")
public class TransferController {

    private final IdentityRegistryService registryService;

    public TransferController(IdentityRegistryService registryService) {
        this.registryService = registryService;
    }

    /**
     * Offer the caller's identity to a new owner.
     * POST /api/v1/transfers
     */
    @PostMapping
    public ResponseEntity<PendingTransferResponse> initiateTransfer(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody InitiateTransferRequest request) {
        Owner owner = Owner.of(caller);
        PendingTransfer transfer = registryService.initiateTransfer(owner, Owner.of(request.newOwner()));
        return ResponseEntity.status(HttpStatus.CREATED).body(PendingTransferResponse.from(owner, transfer));
    }

    /**
     * Withdraw the caller's offer, expired or not.
     * DELETE /api/v1/transfers
     */
    @DeleteMapping
    public ResponseEntity<Void> cancelTransfer(@RequestHeader(CALLER_HEADER) String caller) {
        registryService.cancelTransfer(Owner.of(caller));
        return ResponseEntity.noContent().build();
    }

    /**
     * Accept the offer made by {@code currentOwner} to the caller.
     * POST /api/v1/transfers/{currentOwner}/accept
     */
    @PostMapping("/{currentOwner}/accept")
    public ResponseEntity<Void> acceptTransfer(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String currentOwner) {
        registryService.acceptTransfer(Owner.of(caller), Owner.of(currentOwner));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{owner}")
    public ResponseEntity<PendingTransferResponse> getPendingTransfer(@PathVariable String owner) {
        Owner subject = Owner.of(owner);
        return registryService.getPendingTransfer(subject)
            .map(transfer -> ResponseEntity.ok(PendingTransferResponse.from(subject, transfer)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{owner}/expired")
    public ResponseEntity<ExpiredResponse> isExpired(@PathVariable String owner) {
        return ResponseEntity.ok(new ExpiredResponse(registryService.isTransferExpired(Owner.of(owner))));
    }

    /**
     * Transfers received by the owner, oldest first.
     * GET /api/v1/transfers/{owner}/history
     */
    @GetMapping("/{owner}/history")
    public ResponseEntity<List<TransferHistoryResponse>> getHistory(@PathVariable String owner) {
        List<TransferHistoryResponse> history = registryService.getTransferHistory(Owner.of(owner)).stream()
            .map(TransferHistoryResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }

    // DTOs
    public record InitiateTransferRequest(@NotBlank String newOwner) {}

    public record PendingTransferResponse(
        String owner,
        String newOwner,
        long initiatedAt,
        long expiresAt
    ) {
        static PendingTransferResponse from(Owner owner, PendingTransfer transfer) {
            return new PendingTransferResponse(
                owner.principal(),
                transfer.newOwner().principal(),
                transfer.initiatedAt(),
                transfer.expiresAt()
            );
        }
    }

    public record TransferHistoryResponse(String from, String to, long timestamp) {
        static TransferHistoryResponse from(TransferHistoryEntry entry) {
            return new TransferHistoryResponse(entry.from().principal(), entry.to().principal(), entry.timestamp());
        }
    }

    public record ExpiredResponse(boolean expired) {}
}
