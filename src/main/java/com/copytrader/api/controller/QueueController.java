package com.copytrader.api.controller;

import com.copytrader.domain.model.QueueDepths;
import com.copytrader.oms.SignalQueue;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/queue")
public class QueueController {

    private final SignalQueue signalQueue;

    public QueueController(SignalQueue signalQueue) {
        this.signalQueue = signalQueue;
    }

    /** Per-lane depth snapshot: high (exit), medium (conservative), low (aggressive). */
    @GetMapping("/depths")
    public ResponseEntity<QueueDepths> getDepths() {
        return ResponseEntity.ok(signalQueue.depths());
    }
}
