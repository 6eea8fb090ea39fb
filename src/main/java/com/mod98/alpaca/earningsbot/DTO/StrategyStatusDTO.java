package com.mod98.alpaca.earningsbot.DTO;

import com.mod98.alpaca.earningsbot.Model.CandidateSet;
import com.mod98.alpaca.earningsbot.Model.CycleReport;
import com.mod98.alpaca.earningsbot.Model.Position;
import com.mod98.alpaca.earningsbot.Model.TradingSession;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record StrategyStatusDTO(
        Instant now,
        TradingSession session,
        boolean brokerConnected,
        List<Position> positions,
        Map<String, Instant> cooldowns,
        CandidateSet lastSelection,
        CycleReport lastCycle
) {}
