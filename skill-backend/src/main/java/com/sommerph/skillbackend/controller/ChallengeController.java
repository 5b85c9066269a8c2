package com.sommerph.skillbackend.controller;

import com.sommerph.skillbackend.exception.LedgerException;
import com.sommerph.skillbackend.model.challenge.Challenge;
import com.sommerph.skillbackend.model.escrow.EscrowAccount;
import com.sommerph.skillbackend.service.challenge.ChallengeRegistryService;
import com.sommerph.skillbackend.service.escrow.EscrowPayoutService;
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

import java.math.BigInteger;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/challenges")
@RequiredArgsConstructor
@Tag(name = "Challenges", description = "Endpoints for publishing and retiring escrowed challenges")
public class ChallengeController {

    private final ChallengeRegistryService challengeService;
    private final EscrowPayoutService escrowService;

    @Operation(summary = "Create a challenge and escrow its reward")
    @PostMapping
    public ResponseEntity<?> createChallenge(@RequestBody CreateChallengeRequest request) {
        log.info("Create challenge for creator: {}", request.getCreatorId());
        try {
            long challengeId = challengeService.createChallenge(request.getCreatorId(), request.getChallengeType(),
                    request.getDifficulty(), request.getTimeLimit(), request.getRewardAmount(),
                    request.getFundsProvided(), request.getContentDigest());
            return ResponseEntity.ok(Map.of("challengeId", challengeId));
        } catch (LedgerException e) {
            log.warn("Challenge creation rejected for creator {}: {}", request.getCreatorId(), e.getMessage());
            return LedgerResponses.rejected(e);
        } catch (Exception e) {
            log.error("Failed to create challenge for creator: {}", request.getCreatorId(), e);
            return ResponseEntity.internalServerError().body("Error creating challenge: " + e.getMessage());
        }
    }

    @Operation(summary = "Deactivate a challenge (creator only, idempotent)")
    @PostMapping("/{challengeId}/deactivate")
    public ResponseEntity<?> deactivateChallenge(@PathVariable long challengeId, @RequestBody DeactivateRequest request) {
        log.info("Deactivate challenge {} for caller: {}", challengeId, request.getCallerId());
        try {
            return ResponseEntity.ok(challengeService.deactivateChallenge(challengeId, request.getCallerId()));
        } catch (LedgerException e) {
            log.warn("Deactivation of challenge {} rejected: {}", challengeId, e.getMessage());
            return LedgerResponses.rejected(e);
        } catch (Exception e) {
            log.error("Failed to deactivate challenge: {}", challengeId, e);
            return ResponseEntity.internalServerError().body("Error deactivating challenge: " + e.getMessage());
        }
    }

    @Operation(summary = "Get a challenge by id")
    @GetMapping("/{challengeId}")
    public ResponseEntity<?> getChallenge(@PathVariable long challengeId) {
        Challenge challenge = challengeService.getChallenge(challengeId);
        if (challenge == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(challenge);
    }

    @Operation(summary = "List challenge ids created by the given creator, oldest first")
    @GetMapping("/creator/{creatorId}")
    public ResponseEntity<?> getChallengesOf(@PathVariable @NotBlank String creatorId) {
        return ResponseEntity.ok(challengeService.getChallengesOf(creatorId));
    }

    @Operation(summary = "Get the escrow account and payouts of a challenge")
    @GetMapping("/{challengeId}/escrow")
    public ResponseEntity<?> getEscrow(@PathVariable long challengeId) {
        EscrowAccount escrow = escrowService.getEscrow(challengeId);
        if (escrow == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of(
                "escrow", escrow,
                "payouts", escrowService.getPayouts(challengeId)));
    }

    @Data
    public static class CreateChallengeRequest {
        @NotBlank
        private String creatorId;
        @NotBlank
        private String challengeType;
        @Min(1)
        @Max(10)
        private int difficulty;
        @Min(1)
        private long timeLimit;
        private BigInteger rewardAmount = BigInteger.ZERO;
        private BigInteger fundsProvided = BigInteger.ZERO;
        private String contentDigest;
    }

    @Data
    public static class DeactivateRequest {
        @NotBlank
        private String callerId;
    }

}
