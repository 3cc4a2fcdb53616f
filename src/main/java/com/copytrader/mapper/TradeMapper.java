package com.copytrader.mapper;

import com.copytrader.domain.model.Signal;
import com.copytrader.domain.model.Trade;
import com.copytrader.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the trade entity, its domain model, and the signal it
 * was created from.
 */
@Mapper
public interface TradeMapper {

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);

    /** New PENDING record for an admitted signal. Lifecycle columns are filled by the caller. */
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "retryCount", ignore = true)
    @Mapping(target = "txSignature", ignore = true)
    @Mapping(target = "exitTxSignature", ignore = true)
    @Mapping(target = "errorMessage", ignore = true)
    @Mapping(target = "pnlSol", ignore = true)
    @Mapping(target = "pnlUsd", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "closedAt", ignore = true)
    @Mapping(target = "version", ignore = true)
    TradeEntity fromSignal(Signal signal);

    /** Rebuild the signal of a stored trade, used when re-queueing a retry. */
    @Mapping(target = "timestamp", ignore = true)
    Signal toSignal(Trade trade);
}
