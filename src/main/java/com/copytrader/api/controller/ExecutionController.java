package com.copytrader.api.controller;

import com.copytrader.domain.model.RpcHealth;
import com.copytrader.execution.TransactionExecutor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/execution")
public class ExecutionController {

    private final TransactionExecutor transactionExecutor;

    public ExecutionController(TransactionExecutor transactionExecutor) {
        this.transactionExecutor = transactionExecutor;
    }

    /** Current RPC mode, consecutive failures and last probe result. */
    @GetMapping("/rpc")
    public ResponseEntity<RpcHealth> getRpcHealth() {
        return ResponseEntity.ok(transactionExecutor.getRpcHealth());
    }
}
