package com.mod98.alpaca.earningsbot.Model;

import java.time.Instant;
import java.util.List;

public record CycleReport(
        Instant startedAt,
        Instant finishedAt,
        TradingSession session,
        Outcome outcome,
        List<String> longCandidates,
        List<String> shortCandidates,
        int entriesFilled,
        int exitsSubmitted,
        String message
) {

    public enum Outcome {
        SKIPPED,
        ABORTED,
        COMPLETED
    }

    public static CycleReport skipped(Instant at, TradingSession session, String message) {
        return new CycleReport(at, at, session, Outcome.SKIPPED, List.of(), List.of(), 0, 0, message);
    }
}
