package com.harvey.backend.controller;

import com.harvey.backend.dto.HealthReport;
import com.harvey.backend.exception.NotFoundException;
import com.harvey.backend.service.healing.SelfHealingManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/healing")
@RequiredArgsConstructor
public class HealingController {

    private final SelfHealingManager selfHealingManager;
    private final AdminTokenGuard adminTokenGuard;

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        return ResponseEntity.ok(selfHealingManager.getHealthReport());
    }

    @PostMapping("/services/{name}/recover")
    public ResponseEntity<RecoveryResponse> recover(@RequestHeader(value = AdminTokenGuard.HEADER, required = false) String token,
                                                    @PathVariable String name) {
        adminTokenGuard.requireAdmin(token);
        requireTracked(name);
        boolean recovered = selfHealingManager.attemptRecovery(name);
        return ResponseEntity.ok(new RecoveryResponse(name, recovered, selfHealingManager.healthScore(name)));
    }

    @PostMapping("/services/{name}/success")
    public ResponseEntity<RecoveryResponse> success(@RequestHeader(value = AdminTokenGuard.HEADER, required = false) String token,
                                                    @PathVariable String name) {
        adminTokenGuard.requireAdmin(token);
        requireTracked(name);
        selfHealingManager.recordSuccess(name);
        return ResponseEntity.ok(new RecoveryResponse(name, selfHealingManager.checkCircuit(name),
                selfHealingManager.healthScore(name)));
    }

    @PostMapping("/services/{name}/failure")
    public ResponseEntity<RecoveryResponse> failure(@RequestHeader(value = AdminTokenGuard.HEADER, required = false) String token,
                                                    @PathVariable String name,
                                                    @RequestBody(required = false) FailureRequest request) {
        adminTokenGuard.requireAdmin(token);
        requireTracked(name);
        selfHealingManager.recordFailure(name, request == null ? null : request.error());
        return ResponseEntity.ok(new RecoveryResponse(name, selfHealingManager.checkCircuit(name),
                selfHealingManager.healthScore(name)));
    }

    private void requireTracked(String name) {
        if (!selfHealingManager.isTracked(name)) {
            throw new NotFoundException("Unknown service: " + name);
        }
    }

    public record FailureRequest(String error) {}

    public record RecoveryResponse(String service, boolean available, double healthScore) {}
}
