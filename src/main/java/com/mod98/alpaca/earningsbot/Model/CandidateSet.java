package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Long and short symbols picked for one cycle, in ranking order. The two lists never share a symbol.
 */
public record CandidateSet(List<String> longSymbols, List<String> shortSymbols, List<RankedSymbol> ranking) {

    public CandidateSet {
        longSymbols = List.copyOf(longSymbols);
        shortSymbols = List.copyOf(shortSymbols);
        ranking = ranking == null ? List.of() : List.copyOf(ranking);
    }

    public static CandidateSet empty() {
        return new CandidateSet(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return longSymbols.isEmpty() && shortSymbols.isEmpty();
    }

    /** A symbol with its market cap and pre-earnings return in percent. */
    public record RankedSymbol(String symbol, BigDecimal marketCap, double preEarningsReturn) {}
}
