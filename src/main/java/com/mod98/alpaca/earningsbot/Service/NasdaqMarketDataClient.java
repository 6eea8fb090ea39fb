package com.mod98.alpaca.earningsbot.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mod98.alpaca.earningsbot.Cache.ExpiringCache;
import com.mod98.alpaca.earningsbot.Config.NasdaqProperties;
import com.mod98.alpaca.earningsbot.Exception.DataUnavailableException;
import com.mod98.alpaca.earningsbot.Model.EarningsEvent;
import com.mod98.alpaca.earningsbot.Model.EarningsTiming;
import com.mod98.alpaca.earningsbot.Model.PriceBar;
import com.mod98.alpaca.earningsbot.Port.MarketDataPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MarketDataPort} backed by the public Nasdaq JSON API: earnings calendar, daily history and quote summary.
 */
@Service
public class NasdaqMarketDataClient extends JsonHttpClient implements MarketDataPort {

    private static final Logger log = LoggerFactory.getLogger(NasdaqMarketDataClient.class);

    static final LocalTime PRE_MARKET_TIME = LocalTime.of(8, 0);
    static final LocalTime AFTER_HOURS_TIME = LocalTime.of(16, 30);

    private static final DateTimeFormatter HISTORY_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.US);

    private final String baseUrl;
    private final String userAgent;
    private final Clock clock;

    private final ExpiringCache<LocalDate, List<EarningsEvent>> calendarCache;
    private final ExpiringCache<String, BigDecimal> marketCapCache;

    public NasdaqMarketDataClient(NasdaqProperties props, Clock clock) {
        super(props.getRequestTimeout(), props.getMaxRetries());
        this.baseUrl = props.getBaseUrl();
        this.userAgent = props.getUserAgent();
        this.clock = clock;
        this.calendarCache = new ExpiringCache<>(props.getCalendarCacheTtl(), clock);
        this.marketCapCache = new ExpiringCache<>(props.getMarketCapCacheTtl(), clock);
    }

    @Override
    protected Map<String, String> defaultHeaders() {
        return Map.of(
                "User-Agent", userAgent,
                "Accept-Language", "en-US,en;q=0.9"
        );
    }

    @Override
    public List<EarningsEvent> getUpcomingEarnings(LocalDate from, LocalDate to) {
        List<EarningsEvent> events = new ArrayList<>();
        int requested = 0;
        int failed = 0;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            if (day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY) continue;
            requested++;
            try {
                events.addAll(calendarFor(day));
            } catch (DataUnavailableException e) {
                failed++;
                log.warn("Earnings calendar for {} unavailable → {}", day, e.getMessage());
            }
        }
        if (requested > 0 && failed == requested) {
            throw new DataUnavailableException(null, "Earnings calendar unavailable for " + from + ".." + to);
        }
        log.info("📅 {} earnings announcements between {} and {}", events.size(), from, to);
        return events;
    }

    private List<EarningsEvent> calendarFor(LocalDate day) {
        return calendarCache.getOrLoad(day, this::fetchCalendar);
    }

    private List<EarningsEvent> fetchCalendar(LocalDate day) {
        String url = baseUrl + "/api/calendar/earnings?date=" + day;
        try {
            return parseCalendar(getJson(url), day);
        } catch (IOException e) {
            throw new DataUnavailableException(null, "calendar " + day + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataUnavailableException(null, "calendar " + day + ": interrupted", e);
        }
    }

    @Override
    public List<PriceBar> getHistory(String symbol, int lookbackSessions) {
        LocalDate today = LocalDate.now(clock);
        // Calendar span wide enough to cover weekends and holidays.
        LocalDate fromDate = today.minusDays(lookbackSessions * 2L + 7);
        String url = baseUrl + "/api/quote/" + encode(symbol) + "/historical?assetclass=stocks"
                + "&fromdate=" + fromDate
                + "&todate=" + today
                + "&limit=" + (lookbackSessions * 2 + 7);
        try {
            List<PriceBar> bars = parseHistory(getJson(url));
            if (bars.size() > lookbackSessions) {
                return List.copyOf(bars.subList(bars.size() - lookbackSessions, bars.size()));
            }
            return bars;
        } catch (IOException e) {
            throw new DataUnavailableException(symbol, "history: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataUnavailableException(symbol, "history: interrupted", e);
        }
    }

    @Override
    public Optional<BigDecimal> getMarketCap(String symbol) {
        return Optional.ofNullable(marketCapCache.getOrLoad(symbol, this::fetchMarketCap));
    }

    // null when the summary has no positive market cap, so nothing is cached
    private BigDecimal fetchMarketCap(String symbol) {
        String url = baseUrl + "/api/quote/" + encode(symbol) + "/summary?assetclass=stocks";
        try {
            BigDecimal cap = parseSummaryMarketCap(getJson(url));
            return cap != null && cap.signum() > 0 ? cap : null;
        } catch (IOException e) {
            throw new DataUnavailableException(symbol, "summary: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataUnavailableException(symbol, "summary: interrupted", e);
        }
    }

    // ---- Parsing ----
    static List<EarningsEvent> parseCalendar(JsonNode root, LocalDate day) {
        JsonNode rows = root.path("data").path("rows");
        if (!rows.isArray()) return Collections.emptyList();

        List<EarningsEvent> events = new ArrayList<>();
        for (JsonNode row : rows) {
            String symbol = row.path("symbol").asText("").trim().toUpperCase(Locale.ROOT);
            if (symbol.isEmpty()) continue;
            LocalTime time = announcementTime(row.path("time").asText(""));
            events.add(new EarningsEvent(
                    symbol,
                    row.path("name").asText(symbol),
                    day.atTime(time),
                    EarningsTiming.fromTime(time),
                    money(row.path("epsForecast").asText(null)),
                    money(row.path("marketCap").asText(null)),
                    null,
                    null
            ));
        }
        return events;
    }

    static LocalTime announcementTime(String code) {
        if (code == null) return LocalTime.MIDNIGHT;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "time-pre-market" -> PRE_MARKET_TIME;
            case "time-after-hours" -> AFTER_HOURS_TIME;
            default -> LocalTime.MIDNIGHT;
        };
    }

    // Rows come newest first; the result is oldest first.
    static List<PriceBar> parseHistory(JsonNode root) {
        JsonNode rows = root.path("data").path("tradesTable").path("rows");
        List<PriceBar> bars = new ArrayList<>();
        for (JsonNode row : rows) {
            BigDecimal close = money(row.path("close").asText(null));
            String date = row.path("date").asText("");
            if (close == null || date.isBlank()) continue;
            try {
                bars.add(new PriceBar(LocalDate.parse(date, HISTORY_DATE), close));
            } catch (DateTimeParseException e) {
                log.debug("Skipping history row with date '{}'", date);
            }
        }
        Collections.reverse(bars);
        return bars;
    }

    static BigDecimal parseSummaryMarketCap(JsonNode root) {
        return money(root.path("data").path("summaryData").path("MarketCap").path("value").asText(null));
    }

    // "$1,234.56" / "($0.12)" / "N/A"
    static BigDecimal money(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty() || "N/A".equalsIgnoreCase(s) || "--".equals(s)) return null;
        boolean negative = s.startsWith("(") && s.endsWith(")") || s.startsWith("-");
        s = s.replaceAll("[$,()\\s-]", "");
        if (s.isEmpty()) return null;
        try {
            BigDecimal v = new BigDecimal(s);
            return negative ? v.negate() : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
