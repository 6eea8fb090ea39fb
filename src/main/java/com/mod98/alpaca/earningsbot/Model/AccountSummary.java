package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;

/**
 * Account snapshot in USD. Figures the broker does not report are {@code null}.
 */
public record AccountSummary(
        BigDecimal netLiquidation,
        BigDecimal cash,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        BigDecimal availableFunds,
        BigDecimal buyingPower
) {}
