package com.mod98.alpaca.earningsbot.Model;

import java.time.LocalTime;

public enum EarningsTiming {
    BEFORE_OPEN,
    AFTER_CLOSE;

    // Announcements stamped in the afternoon are treated as after-close.
    public static EarningsTiming fromTime(LocalTime time) {
        return time != null && time.getHour() >= 12 ? AFTER_CLOSE : BEFORE_OPEN;
    }
}
