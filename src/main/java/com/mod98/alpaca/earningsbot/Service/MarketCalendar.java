package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Model.TradingSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * US equity market calendar (NYSE full-day holidays) and session classification.
 *
 * <h3>Sessions (exchange time):</h3>
 * <ul>
 *   <li>Pre-market: 04:00 - 09:30</li>
 *   <li>Regular: 09:30 - 16:00</li>
 *   <li>After-hours: 16:00 - 20:00</li>
 * </ul>
 */
@Component
public class MarketCalendar {

    public static final ZoneId EXCHANGE_ZONE = ZoneId.of("America/New_York");

    public static final LocalTime PRE_MARKET_OPEN = LocalTime.of(4, 0);
    public static final LocalTime REGULAR_OPEN = LocalTime.of(9, 30);
    public static final LocalTime REGULAR_CLOSE = LocalTime.of(16, 0);
    public static final LocalTime AFTER_HOURS_CLOSE = LocalTime.of(20, 0);

    private final Clock clock;
    private final Map<Integer, Set<LocalDate>> holidaysByYear = new ConcurrentHashMap<>();

    public MarketCalendar(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return ZonedDateTime.now(clock).withZoneSameInstant(EXCHANGE_ZONE).toLocalDate();
    }

    public TradingSession currentSession() {
        return sessionAt(clock.instant());
    }

    public TradingSession sessionAt(Instant instant) {
        ZonedDateTime et = instant.atZone(EXCHANGE_ZONE);
        if (!isTradingDay(et.toLocalDate())) {
            return TradingSession.CLOSED;
        }
        LocalTime t = et.toLocalTime();
        if (t.isBefore(PRE_MARKET_OPEN)) return TradingSession.CLOSED;
        if (t.isBefore(REGULAR_OPEN)) return TradingSession.PRE_MARKET;
        if (t.isBefore(REGULAR_CLOSE)) return TradingSession.REGULAR;
        if (t.isBefore(AFTER_HOURS_CLOSE)) return TradingSession.AFTER_HOURS;
        return TradingSession.CLOSED;
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return !isHoliday(date);
    }

    public boolean isHoliday(LocalDate date) {
        return holidaysByYear.computeIfAbsent(date.getYear(), MarketCalendar::holidaysOf).contains(date);
    }

    static Set<LocalDate> holidaysOf(int year) {
        LocalDate newYear = LocalDate.of(year, Month.JANUARY, 1);
        // NYSE does not observe New Year's Day on the preceding Friday.
        LocalDate newYearObserved = newYear.getDayOfWeek() == DayOfWeek.SUNDAY ? newYear.plusDays(1) : newYear;

        Set<LocalDate> days = new HashSet<>();
        if (newYear.getDayOfWeek() != DayOfWeek.SATURDAY) {
            days.add(newYearObserved);
        }
        days.add(nthWeekday(year, Month.JANUARY, DayOfWeek.MONDAY, 3));   // Martin Luther King Jr. Day
        days.add(nthWeekday(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3));  // Washington's Birthday
        days.add(easterSunday(year).minusDays(2));                         // Good Friday
        days.add(LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));
        if (year >= 2022) {
            days.add(observed(LocalDate.of(year, Month.JUNE, 19)));        // Juneteenth
        }
        days.add(observed(LocalDate.of(year, Month.JULY, 4)));
        days.add(nthWeekday(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1)); // Labor Day
        days.add(nthWeekday(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4));// Thanksgiving
        days.add(observed(LocalDate.of(year, Month.DECEMBER, 25)));
        return Set.copyOf(days);
    }

    private static LocalDate observed(LocalDate holiday) {
        return switch (holiday.getDayOfWeek()) {
            case SATURDAY -> holiday.minusDays(1);
            case SUNDAY -> holiday.plusDays(1);
            default -> holiday;
        };
    }

    private static LocalDate nthWeekday(int year, Month month, DayOfWeek dow, int n) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dow));
    }

    // Anonymous Gregorian algorithm
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
