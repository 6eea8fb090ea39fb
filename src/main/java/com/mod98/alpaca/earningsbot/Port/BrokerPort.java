package com.mod98.alpaca.earningsbot.Port;

import com.mod98.alpaca.earningsbot.Exception.BrokerUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.OrderRejectedException;
import com.mod98.alpaca.earningsbot.Model.AccountSummary;
import com.mod98.alpaca.earningsbot.Model.Execution;
import com.mod98.alpaca.earningsbot.Model.OrderFill;
import com.mod98.alpaca.earningsbot.Model.OrderHandle;
import com.mod98.alpaca.earningsbot.Model.OrderRequest;
import com.mod98.alpaca.earningsbot.Model.PriceBar;
import com.mod98.alpaca.earningsbot.Model.Quote;

import java.util.List;
import java.util.Map;

/**
 * Broker connectivity used by the strategy. Every call blocks until the broker answers or times out.
 * Connection and transport failures surface as {@link BrokerUnavailableException}.
 */
public interface BrokerPort {

    boolean isConnected();

    /**
     * Re-establishes the broker session.
     *
     * @return true when the broker answers again
     */
    boolean reconnect();

    void disconnect();

    /** True when the broker knows the symbol and allows trading it. */
    boolean qualify(String symbol);

    Quote getQuote(String symbol);

    /** Daily bars for the last {@code days} calendar days, oldest first. */
    List<PriceBar> getHistoricalBars(String symbol, int days);

    /**
     * @throws OrderRejectedException when the broker refuses the order
     */
    OrderHandle placeOrder(OrderRequest request);

    OrderFill pollStatus(OrderHandle handle);

    /** Signed quantity per symbol; shorts are negative. */
    Map<String, Long> getPositions();

    AccountSummary getAccountSummary();

    List<Execution> getExecutions();
}
