package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Model.CycleReport;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Outer run loop. Cycles and stop-loss checks share one thread, so they never overlap and the ledger has a
 * single writer. The broker connection is checked, and re-established if needed, before every cycle.
 */
@Service
public class StrategyLoopService {

    private static final Logger log = LoggerFactory.getLogger(StrategyLoopService.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    private final StrategyCycleService cycle;
    private final BrokerPort broker;
    private final MarketCalendar calendar;
    private final StrategyProperties props;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public StrategyLoopService(StrategyCycleService cycle, BrokerPort broker, MarketCalendar calendar,
                               StrategyProperties props, Clock clock) {
        this.cycle = cycle;
        this.broker = broker;
        this.calendar = calendar;
        this.props = props;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "StrategyLoop");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void start() {
        scheduler.execute(cycle::restoreState);
        if (!props.isLoopEnabled()) {
            log.info("Strategy loop disabled, cycles run on demand only");
            return;
        }
        scheduler.scheduleWithFixedDelay(this::runScheduledCycle,
                0, props.getRunInterval().toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::runStopCheck,
                props.getStopCheckInterval().toMillis(), props.getStopCheckInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("📊 Strategy loop started (cycle every {}, stop-loss check every {})",
                props.getRunInterval(), props.getStopCheckInterval());
    }

    /** Queues one cycle on the strategy thread, behind anything already running. */
    public Future<CycleReport> triggerNow() {
        log.info("Cycle requested by operator");
        return scheduler.submit(this::connectedCycle);
    }

    void runScheduledCycle() {
        try {
            connectedCycle();
        } catch (Exception e) {
            // Keep the schedule alive; an exception here would cancel it.
            log.error("Strategy cycle failed: {}", e.getMessage(), e);
        }
    }

    void runStopCheck() {
        // One reconnect attempt per tick; a failed I/O call elsewhere leaves the session marked closed.
        if (!broker.isConnected() && !broker.reconnect()) {
            log.debug("Broker still disconnected, stop-loss check skipped");
            return;
        }
        try {
            int exits = cycle.checkStopLosses();
            if (exits > 0) {
                log.info("Stop-loss check closed {} positions", exits);
            }
        } catch (Exception e) {
            log.error("Stop-loss check failed: {}", e.getMessage(), e);
        }
    }

    CycleReport connectedCycle() {
        if (!ensureConnected()) {
            log.error("Broker unreachable after {} attempts, skipping cycle", props.getReconnectAttempts());
            return CycleReport.skipped(clock.instant(), calendar.currentSession(), "broker disconnected");
        }
        return cycle.runCycle();
    }

    boolean ensureConnected() {
        if (broker.isConnected()) return true;
        for (int attempt = 1; attempt <= props.getReconnectAttempts(); attempt++) {
            log.info("Reconnecting to broker (attempt {}/{})", attempt, props.getReconnectAttempts());
            if (broker.reconnect()) return true;
            if (attempt < props.getReconnectAttempts() && !props.getReconnectInterval().isZero()) {
                try {
                    Thread.sleep(props.getReconnectInterval().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping StrategyLoopService...");
        scheduler.shutdown();
        // An in-flight cycle is allowed to finish, including the status polling of an open order.
        Duration grace = SHUTDOWN_GRACE.plus(props.getOrderPollInterval().multipliedBy(props.getOrderPollAttempts()));
        try {
            if (!scheduler.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Cycle still running after {}, forcing shutdown; open orders are logged by the executor", grace);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        broker.disconnect();
    }
}
