package com.copytrader.api.controller;

import com.copytrader.api.dto.request.SignalRequest;
import com.copytrader.oms.AdmissionResult;
import com.copytrader.oms.SignalAdmissionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound signal endpoint. An accepted signal answers 202 with its trade UUID; the trade
 * executes asynchronously on the consumer thread.
 */
@RestController
@RequestMapping("/api/signals")
public class SignalController {

    private final SignalAdmissionService signalAdmissionService;

    public SignalController(SignalAdmissionService signalAdmissionService) {
        this.signalAdmissionService = signalAdmissionService;
    }

    @PostMapping
    public ResponseEntity<AdmissionResult> submit(@Valid @RequestBody SignalRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(signalAdmissionService.admit(request));
    }
}
