package com.copytrader.domain.enums;

/**
 * Direction of a copied trade, relative to SOL.
 */
public enum TradeAction {
    BUY,
    SELL
}
