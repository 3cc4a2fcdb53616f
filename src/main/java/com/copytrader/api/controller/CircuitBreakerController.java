package com.copytrader.api.controller;

import com.copytrader.api.dto.request.ManualTripRequest;
import com.copytrader.api.dto.request.ResetRequest;
import com.copytrader.domain.enums.CircuitBreakerState;
import com.copytrader.exception.CircuitBreakerStateException;
import com.copytrader.risk.CircuitBreakerService;
import com.copytrader.risk.CircuitBreakerStatus;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Circuit breaker status and admin controls.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/circuit-breaker -- state, trip reason, cooldown remaining</li>
 *   <li>POST /api/circuit-breaker/trip -- manual trip; stays tripped until reset or cooldown</li>
 *   <li>POST /api/circuit-breaker/cooldown -- start the cooldown of a tripped breaker</li>
 *   <li>POST /api/circuit-breaker/reset -- back to ACTIVE immediately</li>
 * </ul>
 * Every action answers with the resulting status.
 */
@RestController
@RequestMapping("/api/circuit-breaker")
public class CircuitBreakerController {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerController.class);

    private final CircuitBreakerService circuitBreakerService;

    public CircuitBreakerController(CircuitBreakerService circuitBreakerService) {
        this.circuitBreakerService = circuitBreakerService;
    }

    @GetMapping
    public ResponseEntity<CircuitBreakerStatus> getStatus() {
        return ResponseEntity.ok(circuitBreakerService.getStatus());
    }

    @PostMapping("/trip")
    public ResponseEntity<CircuitBreakerStatus> trip(@Valid @RequestBody ManualTripRequest request) {
        log.warn("Manual circuit breaker trip requested by {}: {}", request.getActor(), request.getReason());
        circuitBreakerService.manualTrip(request.getActor(), request.getReason());
        return ResponseEntity.ok(circuitBreakerService.getStatus());
    }

    @PostMapping("/cooldown")
    public ResponseEntity<CircuitBreakerStatus> cooldown() {
        if (!circuitBreakerService.enterCooldown()) {
            throw new CircuitBreakerStateException(circuitBreakerService.getState(), CircuitBreakerState.COOLDOWN);
        }
        return ResponseEntity.ok(circuitBreakerService.getStatus());
    }

    @PostMapping("/reset")
    public ResponseEntity<CircuitBreakerStatus> reset(@Valid @RequestBody ResetRequest request) {
        log.info("Circuit breaker reset requested by {}", request.getActor());
        circuitBreakerService.reset(request.getActor());
        return ResponseEntity.ok(circuitBreakerService.getStatus());
    }
}
