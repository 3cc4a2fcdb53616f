package com.copytrader.api.controller;

import com.copytrader.domain.model.Trade;
import com.copytrader.lifecycle.TradeLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private final TradeLifecycleService tradeLifecycleService;

    public TradeController(TradeLifecycleService tradeLifecycleService) {
        this.tradeLifecycleService = tradeLifecycleService;
    }

    @GetMapping("/{tradeUuid}")
    public ResponseEntity<Trade> getTrade(@PathVariable String tradeUuid) {
        return ResponseEntity.ok(tradeLifecycleService.get(tradeUuid));
    }
}
