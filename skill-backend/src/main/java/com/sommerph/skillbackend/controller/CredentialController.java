package com.sommerph.skillbackend.controller;

import com.sommerph.skillbackend.exception.LedgerException;
import com.sommerph.skillbackend.model.account.BoundAccount;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.service.account.AccountBinderService;
import com.sommerph.skillbackend.service.credential.CredentialLedgerService;
import com.sommerph.skillbackend.service.escrow.EscrowPayoutService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
@Tag(name = "Credentials", description = "Endpoints for skill credentials, bound accounts and reward balances")
public class CredentialController {

    private final CredentialLedgerService credentialService;
    private final AccountBinderService accountBinderService;
    private final EscrowPayoutService escrowService;

    @Operation(summary = "List credential token ids of the given owner in minting order")
    @GetMapping("/owner/{ownerId}")
    public ResponseEntity<?> getCredentialsOf(@PathVariable @NotBlank String ownerId) {
        return ResponseEntity.ok(credentialService.getCredentialsOf(ownerId));
    }

    @Operation(summary = "Get a credential by token id")
    @GetMapping("/{tokenId}")
    public ResponseEntity<?> getCredential(@PathVariable long tokenId) {
        Credential credential = credentialService.getCredential(tokenId);
        if (credential == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(credential);
    }

    @Operation(summary = "Get the solution digest audit trail of a credential")
    @GetMapping("/{tokenId}/history")
    public ResponseEntity<?> getSolutionHistory(@PathVariable long tokenId) {
        return ResponseEntity.ok(credentialService.getSolutionHistory(tokenId));
    }

    @Operation(summary = "List the completion log of all credentials, oldest first")
    @GetMapping("/completions")
    public ResponseEntity<?> getCompletionLog(@RequestParam(defaultValue = "0") int page,
                                              @RequestParam(defaultValue = "50") int size) {
        try {
            return ResponseEntity.ok(credentialService.getCompletionLog(page, size));
        } catch (LedgerException e) {
            log.warn("Completion log request rejected: {}", e.getMessage());
            return LedgerResponses.rejected(e);
        }
    }

    @Operation(summary = "Derive an informational account for a credential (owner only, differs on every call)")
    @PostMapping("/{tokenId}/account")
    public ResponseEntity<?> deriveAccount(@PathVariable long tokenId, @RequestBody DeriveAccountRequest request) {
        log.info("Derive account for credential {} on behalf of {}", tokenId, request.getRequesterId());
        try {
            BoundAccount account = accountBinderService.deriveAccount(tokenId, request.getRequesterId());
            return ResponseEntity.ok(account);
        } catch (LedgerException e) {
            log.warn("Account derivation for credential {} rejected: {}", tokenId, e.getMessage());
            return LedgerResponses.rejected(e);
        } catch (Exception e) {
            log.error("Failed to derive account for credential: {}", tokenId, e);
            return ResponseEntity.internalServerError().body("Error deriving account: " + e.getMessage());
        }
    }

    @Operation(summary = "Get the reward balance paid out to a participant")
    @GetMapping("/balance/{participantId}")
    public ResponseEntity<?> getBalance(@PathVariable @NotBlank String participantId) {
        return ResponseEntity.ok(Map.of(
                "participantId", participantId,
                "balance", escrowService.balanceOf(participantId)));
    }

    @Data
    public static class DeriveAccountRequest {
        @NotBlank
        private String requesterId;
    }

}
