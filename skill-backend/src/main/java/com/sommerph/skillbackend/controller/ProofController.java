package com.sommerph.skillbackend.controller;

import com.sommerph.skillbackend.exception.LedgerException;
import com.sommerph.skillbackend.model.proof.Proof;
import com.sommerph.skillbackend.model.proof.VerificationResult;
import com.sommerph.skillbackend.service.proof.ProofSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
@RequestMapping("/api/proofs")
@RequiredArgsConstructor
@Tag(name = "Proofs", description = "Endpoints for submitting and verifying solution proofs")
public class ProofController {

    private final ProofSubmissionService proofService;

    @Operation(summary = "Submit a solution proof for an active challenge")
    @PostMapping
    public ResponseEntity<?> submitProof(@RequestBody SubmitProofRequest request) {
        log.info("Submit proof for challenge {} by solver: {}", request.getChallengeId(), request.getSolverId());
        try {
            long proofId = proofService.submitProof(request.getChallengeId(), request.getSolverId(),
                    request.getCompletionTime(), request.getScore(), request.getSolutionDigest(),
                    request.getExternalProofToken());
            return ResponseEntity.ok(Map.of("proofId", proofId));
        } catch (LedgerException e) {
            log.warn("Proof submission rejected for solver {}: {}", request.getSolverId(), e.getMessage());
            return LedgerResponses.rejected(e);
        } catch (Exception e) {
            log.error("Failed to submit proof for solver: {}", request.getSolverId(), e);
            return ResponseEntity.internalServerError().body("Error submitting proof: " + e.getMessage());
        }
    }

    @Operation(summary = "Verify a submitted proof, minting or updating the solver's credential and paying the reward")
    @PostMapping("/{proofId}/verify")
    public ResponseEntity<?> verifyProof(@PathVariable long proofId) {
        log.info("Verify proof {}", proofId);
        try {
            VerificationResult result = proofService.verifyProof(proofId);
            return ResponseEntity.ok(result);
        } catch (LedgerException e) {
            log.warn("Verification of proof {} rejected: {}", proofId, e.getMessage());
            return LedgerResponses.rejected(e);
        } catch (Exception e) {
            log.error("Failed to verify proof: {}", proofId, e);
            return ResponseEntity.internalServerError().body("Error verifying proof: " + e.getMessage());
        }
    }

    @Operation(summary = "Get a proof by id")
    @GetMapping("/{proofId}")
    public ResponseEntity<?> getProof(@PathVariable long proofId) {
        Proof proof = proofService.getProof(proofId);
        if (proof == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(proof);
    }

    @Operation(summary = "List proof ids submitted by the given solver, oldest first")
    @GetMapping("/solver/{solverId}")
    public ResponseEntity<?> getProofsOf(@PathVariable @NotBlank String solverId) {
        return ResponseEntity.ok(proofService.getProofsOf(solverId));
    }

    @Data
    public static class SubmitProofRequest {
        @Min(1)
        private long challengeId;
        @NotBlank
        private String solverId;
        @Min(0)
        private long completionTime;
        @Min(0)
        @Max(100)
        private int score;
        @NotBlank
        private String solutionDigest;
        private String externalProofToken;
    }

}
