package com.mod98.alpaca.earningsbot.DTO;

import java.time.Instant;

public record ApiErrorDTO(int status, String error, String message, Instant timestamp) {}
