package com.mod98.alpaca.earningsbot.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mod98.alpaca.earningsbot.Config.AlpacaProperties;
import com.mod98.alpaca.earningsbot.Exception.BrokerUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.OrderRejectedException;
import com.mod98.alpaca.earningsbot.Model.AccountSummary;
import com.mod98.alpaca.earningsbot.Model.Execution;
import com.mod98.alpaca.earningsbot.Model.OrderFill;
import com.mod98.alpaca.earningsbot.Model.OrderHandle;
import com.mod98.alpaca.earningsbot.Model.OrderRequest;
import com.mod98.alpaca.earningsbot.Model.OrderStatus;
import com.mod98.alpaca.earningsbot.Model.OrderType;
import com.mod98.alpaca.earningsbot.Model.PriceBar;
import com.mod98.alpaca.earningsbot.Model.Quote;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Alpaca REST adapter for {@link BrokerPort}.
 */
@Service
public class AlpacaClient extends JsonHttpClient implements BrokerPort {

    private static final Logger log = LoggerFactory.getLogger(AlpacaClient.class);

    private final String keyId;
    private final String secretKey;
    private final String baseUrl;
    private final String dataUrl;
    private final String feed;
    private final Clock clock;

    private final AtomicBoolean connected = new AtomicBoolean(false);

    @Autowired
    public AlpacaClient(AlpacaProperties props, Clock clock) {
        super(props.getRequestTimeout(), props.getMaxRetries());
        this.keyId = props.getApiKeyId();
        this.secretKey = props.getApiSecretKey();
        this.baseUrl = props.getBaseUrl();
        this.dataUrl = props.getDataUrl();
        this.feed = props.getFeed();
        this.clock = clock;

        if (keyId == null || secretKey == null || baseUrl == null || dataUrl == null) {
            throw new IllegalStateException("AlpacaProperties is not fully configured");
        }
        if (reconnect()) {
            log.info("✅ Alpaca API connected ({})", baseUrl);
        }
    }

    @Override
    protected Map<String, String> defaultHeaders() {
        return Map.of(
                "APCA-API-KEY-ID", keyId,
                "APCA-API-SECRET-KEY", secretKey
        );
    }

    // ---- Connection ----
    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public boolean reconnect() {
        try {
            JsonNode acc = getJson(baseUrl + "/v2/account");
            log.info("Alpaca account {} status={}", acc.path("id").asText("unknown"), acc.path("status").asText("?"));
            connected.set(true);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connected.set(false);
            return false;
        } catch (IOException e) {
            log.error("Failed to connect to Alpaca API → {}", e.getMessage());
            connected.set(false);
            return false;
        }
    }

    // REST is stateless; this only marks the session as closed.
    @Override
    public void disconnect() {
        if (connected.getAndSet(false)) {
            log.info("Alpaca session closed");
        }
    }

    // ---- Reference data ----
    @Override
    public boolean qualify(String symbol) {
        try {
            JsonNode asset = getJson(baseUrl + "/v2/assets/" + encode(symbol));
            return asset.path("tradable").asBoolean(false)
                    && "active".equalsIgnoreCase(asset.path("status").asText(""));
        } catch (HttpStatusException e) {
            if (e.statusCode() == 404) return false;
            throw unavailable("qualify", e);
        } catch (IOException e) {
            throw unavailable("qualify", e);
        } catch (InterruptedException e) {
            throw interrupted("qualify", e);
        }
    }

    @Override
    public Quote getQuote(String symbol) {
        String url = dataUrl + "/v2/stocks/" + encode(symbol) + "/snapshot?feed=" + encode(feed);
        try {
            return parseSnapshot(getJson(url));
        } catch (IOException e) {
            throw unavailable("getQuote", e);
        } catch (InterruptedException e) {
            throw interrupted("getQuote", e);
        }
    }

    @Override
    public List<PriceBar> getHistoricalBars(String symbol, int days) {
        LocalDate start = LocalDate.now(clock).minusDays(days);
        String url = dataUrl + "/v2/stocks/" + encode(symbol) + "/bars?timeframe=1Day"
                + "&start=" + start
                + "&limit=" + (days + 5)
                + "&adjustment=raw"
                + "&feed=" + encode(feed);
        try {
            return parseBars(getJson(url), clock.getZone());
        } catch (IOException e) {
            throw unavailable("getHistoricalBars", e);
        } catch (InterruptedException e) {
            throw interrupted("getHistoricalBars", e);
        }
    }

    // ---- Orders ----
    /**
     * Submits the order once under a fresh {@code client_order_id}. A POST that times out is not resent; the
     * order is looked up by that id instead, so a slow answer never turns into a second live order. A 5xx/429
     * resend that hits an already accepted order is refused by Alpaca as a duplicate and resolved the same way.
     */
    @Override
    public OrderHandle placeOrder(OrderRequest request) {
        String url = baseUrl + "/v2/orders";
        String clientOrderId = UUID.randomUUID().toString();
        HttpResponse<String> r;
        try {
            String body = mapper.writeValueAsString(orderBody(request, clientOrderId));
            r = sendWithRetry(req("POST", url, body).build(), false);
        } catch (IOException e) {
            log.warn("Order POST for {} failed → {}, looking up client order id {}",
                    request.symbol(), e.getMessage(), clientOrderId);
            return findSubmitted(request, clientOrderId)
                    .orElseThrow(() -> unavailable("placeOrder", e));
        } catch (InterruptedException e) {
            throw interrupted("placeOrder", e);
        }

        try {
            if (r.statusCode() == 422) {
                Optional<OrderHandle> existing = findSubmitted(request, clientOrderId);
                if (existing.isPresent()) return existing.get();
            }
            ensure2xx(r);
            String id = mapper.readTree(r.body()).path("id").asText("");
            if (id.isBlank()) {
                throw new OrderRejectedException(request, "broker answered without an order id");
            }
            return new OrderHandle(id, request.symbol());
        } catch (HttpStatusException e) {
            if (e.isClientError() && e.statusCode() != 429) {
                throw new OrderRejectedException(request, e.getMessage(), e);
            }
            throw unavailable("placeOrder", e);
        } catch (IOException e) {
            throw unavailable("placeOrder", e);
        }
    }

    // Empty when Alpaca has no order under the client id, i.e. the submission never arrived.
    private Optional<OrderHandle> findSubmitted(OrderRequest request, String clientOrderId) {
        String url = baseUrl + "/v2/orders:by_client_order_id?client_order_id=" + encode(clientOrderId);
        try {
            String id = getJson(url).path("id").asText("");
            if (id.isBlank()) return Optional.empty();
            log.info("Order {} for {} found by client order id {}", id, request.symbol(), clientOrderId);
            return Optional.of(new OrderHandle(id, request.symbol()));
        } catch (HttpStatusException e) {
            if (e.statusCode() == 404) return Optional.empty();
            throw unavailable("placeOrder", e);
        } catch (IOException e) {
            throw unavailable("placeOrder", e);
        } catch (InterruptedException e) {
            throw interrupted("placeOrder", e);
        }
    }

    @Override
    public OrderFill pollStatus(OrderHandle handle) {
        try {
            return parseOrderFill(getJson(baseUrl + "/v2/orders/" + encode(handle.orderId())));
        } catch (IOException e) {
            throw unavailable("pollStatus", e);
        } catch (InterruptedException e) {
            throw interrupted("pollStatus", e);
        }
    }

    // ---- Account ----
    @Override
    public Map<String, Long> getPositions() {
        try {
            return parsePositions(getJson(baseUrl + "/v2/positions"));
        } catch (IOException e) {
            throw unavailable("getPositions", e);
        } catch (InterruptedException e) {
            throw interrupted("getPositions", e);
        }
    }

    @Override
    public AccountSummary getAccountSummary() {
        try {
            JsonNode acc = getJson(baseUrl + "/v2/account");
            JsonNode positions = getJson(baseUrl + "/v2/positions");
            return parseAccount(acc, positions);
        } catch (IOException e) {
            throw unavailable("getAccountSummary", e);
        } catch (InterruptedException e) {
            throw interrupted("getAccountSummary", e);
        }
    }

    @Override
    public List<Execution> getExecutions() {
        String url = baseUrl + "/v2/account/activities/FILL?direction=desc&page_size=100";
        try {
            return parseExecutions(getJson(url));
        } catch (IOException e) {
            throw unavailable("getExecutions", e);
        } catch (InterruptedException e) {
            throw interrupted("getExecutions", e);
        }
    }

    // ---- Helpers ----
    private BrokerUnavailableException unavailable(String operation, IOException e) {
        if (!(e instanceof HttpStatusException)) {
            connected.set(false);
        }
        return new BrokerUnavailableException(operation, e.getMessage(), e);
    }

    private static BrokerUnavailableException interrupted(String operation, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new BrokerUnavailableException(operation, "interrupted", e);
    }

    static Map<String, Object> orderBody(OrderRequest request, String clientOrderId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", request.symbol());
        body.put("qty", String.valueOf(request.quantity()));
        body.put("side", request.action().name().toLowerCase(Locale.ROOT));
        body.put("type", request.type().name().toLowerCase(Locale.ROOT));
        body.put("time_in_force", request.timeInForce().name().toLowerCase(Locale.ROOT));
        body.put("client_order_id", clientOrderId);
        if (request.type() == OrderType.LIMIT) {
            body.put("limit_price", normalizePrice(request.limitPrice()).toPlainString());
            // Alpaca rejects extended_hours on market orders.
            body.put("extended_hours", request.extendedHours());
        }
        return body;
    }

    // Price profiling (fractional accuracy)
    static BigDecimal normalizePrice(BigDecimal px) {
        if (px == null) return null;
        return px.compareTo(BigDecimal.ONE) >= 0
                ? px.setScale(2, RoundingMode.HALF_UP)
                : px.setScale(4, RoundingMode.HALF_UP);
    }

    static OrderStatus mapOrderStatus(String status) {
        if (status == null) return OrderStatus.SUBMITTED;
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "filled" -> OrderStatus.FILLED;
            case "partially_filled" -> OrderStatus.PARTIALLY_FILLED;
            case "canceled" -> OrderStatus.CANCELLED;
            case "expired", "done_for_day" -> OrderStatus.API_CANCELLED;
            case "rejected", "suspended", "stopped" -> OrderStatus.INACTIVE;
            default -> OrderStatus.SUBMITTED;
        };
    }

    static OrderFill parseOrderFill(JsonNode order) {
        OrderStatus status = mapOrderStatus(order.path("status").asText(null));
        BigDecimal filled = decimal(order.path("filled_qty"));
        BigDecimal avg = decimal(order.path("filled_avg_price"));
        return new OrderFill(status,
                filled == null ? 0 : filled.intValue(),
                avg == null ? BigDecimal.ZERO : avg);
    }

    static Quote parseSnapshot(JsonNode snapshot) {
        BigDecimal last = decimal(snapshot.path("latestTrade").path("p"));
        BigDecimal close = decimal(snapshot.path("prevDailyBar").path("c"));
        if (close == null) {
            close = decimal(snapshot.path("dailyBar").path("c"));
        }
        JsonNode q = snapshot.path("latestQuote");
        return new Quote(last, close, decimal(q.path("bp")), decimal(q.path("ap")));
    }

    static List<PriceBar> parseBars(JsonNode root, ZoneId zone) {
        List<PriceBar> bars = new ArrayList<>();
        for (JsonNode b : root.path("bars")) {
            BigDecimal close = decimal(b.path("c"));
            String t = b.path("t").asText("");
            if (close == null || t.isBlank()) continue;
            LocalDate date = OffsetDateTime.parse(t).atZoneSameInstant(zone).toLocalDate();
            bars.add(new PriceBar(date, close));
        }
        return bars;
    }

    static Map<String, Long> parsePositions(JsonNode root) {
        Map<String, Long> positions = new LinkedHashMap<>();
        for (JsonNode p : root) {
            String symbol = p.path("symbol").asText("");
            BigDecimal qty = decimal(p.path("qty"));
            if (symbol.isBlank() || qty == null || qty.signum() == 0) continue;
            long signed = qty.abs().longValue();
            if ("short".equalsIgnoreCase(p.path("side").asText("")) || qty.signum() < 0) {
                signed = -signed;
            }
            positions.put(symbol, signed);
        }
        return positions;
    }

    static AccountSummary parseAccount(JsonNode acc, JsonNode positions) {
        BigDecimal unrealized = BigDecimal.ZERO;
        for (JsonNode p : positions) {
            BigDecimal pl = decimal(p.path("unrealized_pl"));
            if (pl != null) unrealized = unrealized.add(pl);
        }
        return new AccountSummary(
                decimal(acc.path("equity")),
                decimal(acc.path("cash")),
                unrealized,
                null, // not exposed by the account endpoint
                decimal(acc.path("non_marginable_buying_power")),
                decimal(acc.path("buying_power"))
        );
    }

    static List<Execution> parseExecutions(JsonNode root) {
        List<Execution> out = new ArrayList<>();
        for (JsonNode a : root) {
            BigDecimal qty = decimal(a.path("qty"));
            BigDecimal price = decimal(a.path("price"));
            String time = a.path("transaction_time").asText("");
            if (qty == null || price == null || time.isBlank()) continue;
            out.add(new Execution(
                    OffsetDateTime.parse(time).toInstant(),
                    a.path("symbol").asText(""),
                    a.path("side").asText("").toUpperCase(Locale.ROOT),
                    qty,
                    price,
                    "ALPACA"
            ));
        }
        return out;
    }

    // Alpaca sends most numbers as strings.
    private static BigDecimal decimal(JsonNode n) {
        if (n == null || n.isMissingNode() || n.isNull()) return null;
        if (n.isNumber()) return n.decimalValue();
        String s = n.asText("").trim();
        if (s.isEmpty()) return null;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
