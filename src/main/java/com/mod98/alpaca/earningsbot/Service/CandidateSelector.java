package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Model.CandidateSet;
import com.mod98.alpaca.earningsbot.Model.CandidateSet.RankedSymbol;
import com.mod98.alpaca.earningsbot.Model.EarningsEvent;
import com.mod98.alpaca.earningsbot.Model.PriceBar;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import com.mod98.alpaca.earningsbot.Port.MarketDataPort;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Picks long and short candidates among the largest companies reporting earnings soon: weakest pre-earnings
 * performers go long, strongest go short.
 */
@RequiredArgsConstructor
@Component
public class CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private static final Pattern VALID_SYMBOL = Pattern.compile("^[A-Z0-9]{1,5}$");
    private static final Pattern OTC_SYMBOL = Pattern.compile("^\\w{5,}$|\\.|-");

    private final BrokerPort broker;
    private final MarketDataPort marketData;
    private final StrategyProperties props;

    public static boolean isValidSymbol(String symbol) {
        return symbol != null && VALID_SYMBOL.matcher(symbol).matches();
    }

    public CandidateSet select(List<EarningsEvent> events, LocalDate today) {
        LocalDate last = today.plusDays(props.getDaysRange());
        List<EarningsEvent> upcoming = events.stream()
                .filter(e -> !e.earningsDay().isBefore(today) && !e.earningsDay().isAfter(last))
                .toList();
        if (upcoming.isEmpty()) {
            log.info("No earnings announcements between {} and {}", today, last);
            return CandidateSet.empty();
        }

        Map<String, EarningsEvent> universe = qualify(dedupe(filterUniverse(upcoming)));
        log.info("{} tradable symbols report earnings between {} and {}", universe.size(), today, last);

        Map<String, BigDecimal> caps = marketCaps(universe);
        if (caps.isEmpty()) {
            log.info("No symbol with a usable market cap");
            return CandidateSet.empty();
        }

        List<String> largest = caps.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                .limit(quintileCount(caps.size(), props.getMarketCapQuintile()))
                .map(Map.Entry::getKey)
                .toList();
        log.info("Top market-cap quintile ({}): {}", largest.size(), abbreviate(largest));

        List<RankedSymbol> ranking = new ArrayList<>();
        for (String symbol : largest) {
            OptionalDouble ret = preEarningsReturn(symbol);
            if (ret.isPresent()) {
                ranking.add(new RankedSymbol(symbol, caps.get(symbol), ret.getAsDouble()));
            }
        }
        // List.sort is stable, so ties keep market-cap order.
        ranking.sort(Comparator.comparingDouble(RankedSymbol::preEarningsReturn));
        if (ranking.isEmpty()) {
            log.info("No pre-earnings return could be computed");
            return CandidateSet.empty();
        }

        List<String> ranked = ranking.stream().map(RankedSymbol::symbol).toList();
        Split split = partition(ranking, props.getReturnQuintile());
        Split resolved = resolveOverlap(split, ranked, props.getMaxPositions());

        CandidateSet result = new CandidateSet(resolved.longs(), resolved.shorts(), ranking);
        log.info("📈 Long candidates: {}", result.longSymbols());
        log.info("📉 Short candidates: {}", result.shortSymbols());
        return result;
    }

    // ---- Universe ----
    List<EarningsEvent> filterUniverse(List<EarningsEvent> events) {
        List<EarningsEvent> kept = new ArrayList<>();
        for (EarningsEvent e : events) {
            String symbol = e.symbol().trim().toUpperCase(Locale.ROOT);
            if (symbol.isEmpty()) continue;
            if (props.isExcludeOtc() && OTC_SYMBOL.matcher(symbol).find()) continue;
            if (e.price() != null && e.price().compareTo(props.getMinPrice()) < 0) continue;
            if (e.volume() != null && e.volume() < props.getMinVolume()) continue;
            if (!isValidSymbol(symbol)) continue;
            kept.add(symbol.equals(e.symbol()) ? e : new EarningsEvent(symbol, e.companyName(), e.earningsDate(),
                    e.timing(), e.estimatedEps(), e.marketCap(), e.price(), e.volume()));
        }
        return kept;
    }

    // One event per symbol, keeping the largest reported market cap.
    static Map<String, EarningsEvent> dedupe(List<EarningsEvent> events) {
        Map<String, EarningsEvent> bySymbol = new LinkedHashMap<>();
        for (EarningsEvent e : events) {
            bySymbol.merge(e.symbol(), e, (a, b) -> capOf(b).compareTo(capOf(a)) > 0 ? b : a);
        }
        return bySymbol;
    }

    private Map<String, EarningsEvent> qualify(Map<String, EarningsEvent> events) {
        Map<String, EarningsEvent> valid = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();
        events.forEach((symbol, e) -> {
            try {
                if (broker.qualify(symbol)) {
                    valid.put(symbol, e);
                } else {
                    rejected.add(symbol);
                }
            } catch (RuntimeException ex) {
                log.warn("Qualifying {} failed → {}", symbol, ex.getMessage());
                rejected.add(symbol);
            }
        });
        if (!rejected.isEmpty()) {
            log.info("Not tradable at the broker: {}", abbreviate(rejected));
        }
        return valid;
    }

    private Map<String, BigDecimal> marketCaps(Map<String, EarningsEvent> universe) {
        Map<String, BigDecimal> caps = new LinkedHashMap<>();
        universe.forEach((symbol, e) -> {
            BigDecimal cap = e.marketCap();
            if (!e.hasMarketCap()) {
                try {
                    cap = marketData.getMarketCap(symbol).orElse(null);
                } catch (RuntimeException ex) {
                    log.warn("Market cap lookup for {} failed → {}", symbol, ex.getMessage());
                    cap = null;
                }
            }
            if (cap != null && cap.signum() > 0) {
                caps.put(symbol, cap);
            }
        });
        return caps;
    }

    // ---- Returns ----
    OptionalDouble preEarningsReturn(String symbol) {
        int minPoints = props.getMinHistoryPoints();
        try {
            List<PriceBar> bars = marketData.getHistory(symbol, props.getHistoryLookbackSessions());
            if (bars.size() >= minPoints) {
                return returnOf(bars);
            }
            log.info("Only {} closes for {} from market data, trying broker bars", bars.size(), symbol);
        } catch (RuntimeException e) {
            log.warn("History for {} failed → {}, trying broker bars", symbol, e.getMessage());
        }
        try {
            List<PriceBar> bars = broker.getHistoricalBars(symbol, props.getBrokerHistoryDays());
            if (bars.size() >= minPoints) {
                return returnOf(bars);
            }
            log.warn("Not enough history to rank {}", symbol);
        } catch (RuntimeException e) {
            log.warn("Broker bars for {} failed → {}", symbol, e.getMessage());
        }
        return OptionalDouble.empty();
    }

    static OptionalDouble returnOf(List<PriceBar> bars) {
        BigDecimal first = bars.get(0).close();
        BigDecimal latest = bars.get(bars.size() - 1).close();
        if (first == null || latest == null || first.signum() <= 0 || latest.signum() <= 0) {
            return OptionalDouble.empty();
        }
        double pct = latest.divide(first, MathContext.DECIMAL64)
                .subtract(BigDecimal.ONE)
                .multiply(BigDecimal.valueOf(100))
                .doubleValue();
        return OptionalDouble.of(pct);
    }

    // ---- Partition ----
    record Split(List<String> longs, List<String> shorts) {}

    /** {@code ranking} must be sorted ascending by return. */
    static Split partition(List<RankedSymbol> ranking, BigDecimal quintile) {
        int m = ranking.size();
        List<String> symbols = ranking.stream().map(RankedSymbol::symbol).toList();
        if (m == 0) {
            return new Split(List.of(), List.of());
        }
        if (m == 1) {
            RankedSymbol only = ranking.get(0);
            return only.preEarningsReturn() < 0
                    ? new Split(List.of(only.symbol()), List.of())
                    : new Split(List.of(), List.of(only.symbol()));
        }
        if (m < 3) {
            int mid = m / 2;
            return new Split(symbols.subList(0, mid), symbols.subList(mid, m));
        }
        int count = quintileCount(m, quintile);
        return new Split(symbols.subList(0, count), symbols.subList(m - count, m));
    }

    /**
     * Makes the two lists disjoint and bounded. A symbol in both lists stays long when it ranks in the lower half,
     * short otherwise; anything still shared after truncation is dropped from the long list.
     */
    static Split resolveOverlap(Split split, List<String> ranked, int maxPositions) {
        List<String> longs = new ArrayList<>(split.longs());
        List<String> shorts = new ArrayList<>(split.shorts());
        int m = ranked.size();

        Set<String> common = intersection(longs, shorts);
        if (!common.isEmpty()) {
            log.warn("{} symbols in both lists, resolving by rank", common.size());
            for (String symbol : common) {
                double pos = (double) ranked.indexOf(symbol) / m;
                if (pos < 0.5) {
                    shorts.remove(symbol);
                } else {
                    longs.remove(symbol);
                }
            }
        }

        longs = new ArrayList<>(longs.subList(0, Math.min(longs.size(), maxPositions)));
        shorts = new ArrayList<>(shorts.subList(0, Math.min(shorts.size(), maxPositions)));

        Set<String> remaining = intersection(longs, shorts);
        if (!remaining.isEmpty()) {
            log.warn("Still shared after resolution, dropping from long: {}", remaining);
            longs.removeAll(remaining);
        }
        return new Split(List.copyOf(longs), List.copyOf(shorts));
    }

    static int quintileCount(int n, BigDecimal fraction) {
        return Math.max(1, BigDecimal.valueOf(n).multiply(fraction).intValue());
    }

    private static Set<String> intersection(List<String> a, List<String> b) {
        Set<String> common = new HashSet<>(a);
        common.retainAll(new HashSet<>(b));
        return common;
    }

    private static BigDecimal capOf(EarningsEvent e) {
        return e.marketCap() == null ? BigDecimal.ZERO : e.marketCap();
    }

    private static String abbreviate(List<String> symbols) {
        if (symbols.size() <= 10) return String.join(", ", symbols);
        return symbols.stream().limit(10).collect(Collectors.joining(", ")) + " … +" + (symbols.size() - 10);
    }
}
