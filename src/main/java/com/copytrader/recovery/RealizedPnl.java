package com.copytrader.recovery;

import java.math.BigDecimal;

/** Realized profit or loss of a closed trade, in SOL and USD. Negative is a loss. */
public record RealizedPnl(BigDecimal sol, BigDecimal usd) {}
