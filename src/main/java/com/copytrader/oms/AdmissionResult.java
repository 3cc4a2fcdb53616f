package com.copytrader.oms;

import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.QueueDepths;
import lombok.Builder;
import lombok.Value;

/** Returned to the caller of an accepted signal. */
@Value
@Builder
public class AdmissionResult {

    String tradeUuid;
    TradeStatus status;
    QueueDepths queueDepths;
}
