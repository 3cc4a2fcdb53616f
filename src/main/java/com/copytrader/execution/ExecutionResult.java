package com.copytrader.execution;

import com.copytrader.domain.enums.RpcMode;
import com.copytrader.domain.enums.SubmissionPath;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExecutionResult {

    private String tradeUuid;
    private String signature;
    private SubmissionPath path;
    private RpcMode mode;
    private BigDecimal tipSol;
    private long latencyMs;
}
