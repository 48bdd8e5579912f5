package com.kotsin.scanner.scan;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.feed.CandleInbox;
import com.kotsin.scanner.harmonic.ActivePatternStore;
import com.kotsin.scanner.indicator.IndicatorGateway;
import com.kotsin.scanner.model.RawCandle;
import com.kotsin.scanner.model.SessionInfo;
import com.kotsin.scanner.model.TradeSignal;
import com.kotsin.scanner.session.SessionScheduler;
import com.kotsin.scanner.signal.TradeSignalDispatcher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ScanLoop - Session-paced driver of the scanner.
 *
 * Each tick:
 * 1. Classifies the session and applies its API budget to the indicator gateway
 * 2. Runs one task per watchlist symbol on the scan executor: drain inbox, validate, scan
 * 3. Waits for every symbol, hands signals to the dispatcher
 * 4. Schedules the next tick after the session's scan interval
 *
 * Owns all per-symbol state and the active ABCD pattern store. Ticks never overlap, so a
 * symbol's state is only touched by one worker at a time.
 */
@Component
@Slf4j
public class ScanLoop {

    private static final String LOG_PREFIX = "[SCAN]";

    private final SymbolScanner symbolScanner;
    private final SessionScheduler sessionScheduler;
    private final CandleInbox inbox;
    private final IndicatorGateway indicatorGateway;
    private final TradeSignalDispatcher dispatcher;
    private final ScannerConfigRegistry configRegistry;
    private final TaskScheduler taskScheduler;
    private final Executor scanExecutor;

    private final Map<String, SymbolScanState> states = new ConcurrentHashMap<>();
    private final ActivePatternStore activePatterns;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong();
    private volatile ScheduledFuture<?> nextTick;

    @Value("${scanner.loop.enabled:true}")
    private boolean enabled = true;

    public ScanLoop(SymbolScanner symbolScanner,
                    SessionScheduler sessionScheduler,
                    CandleInbox inbox,
                    IndicatorGateway indicatorGateway,
                    TradeSignalDispatcher dispatcher,
                    ScannerConfigRegistry configRegistry,
                    @Qualifier("scanScheduler") TaskScheduler taskScheduler,
                    @Qualifier("scanExecutor") Executor scanExecutor) {
        this.symbolScanner = symbolScanner;
        this.sessionScheduler = sessionScheduler;
        this.inbox = inbox;
        this.indicatorGateway = indicatorGateway;
        this.dispatcher = dispatcher;
        this.configRegistry = configRegistry;
        this.taskScheduler = taskScheduler;
        this.scanExecutor = scanExecutor;
        this.activePatterns = new ActivePatternStore(configRegistry.current().getHarmonic().getActivePatternTtl());
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("{} Disabled by configuration", LOG_PREFIX);
            return;
        }
        if (running.compareAndSet(false, true)) {
            log.info("{} Starting for watchlist {}", LOG_PREFIX, configRegistry.current().getWatchlist().getSymbols());
            nextTick = taskScheduler.schedule(this::tick, Instant.now());
        }
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> pending = nextTick;
            if (pending != null) {
                pending.cancel(false);
            }
            log.info("{} Stopped after {} ticks", LOG_PREFIX, tickCount.get());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void tick() {
        SessionInfo session = sessionScheduler.current();
        try {
            runOnce(session);
        } catch (Exception e) {
            log.error("{} Tick failed: {}", LOG_PREFIX, e.getMessage(), e);
        }
        if (running.get()) {
            nextTick = taskScheduler.schedule(this::tick, Instant.now().plus(session.getScanInterval()));
        }
    }

    /**
     * One full tick for the given session. Blocks until every symbol has been scanned.
     *
     * @return signals emitted in this tick
     */
    public List<TradeSignal> runOnce(SessionInfo session) {
        ScannerProperties props = configRegistry.current();
        indicatorGateway.updateBudget(session.getApiBudgetPerMinute());
        long tick = tickCount.incrementAndGet();

        List<TradeSignal> signals = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> scans = new ArrayList<>();
        for (String symbol : props.getWatchlist().getSymbols()) {
            SymbolScanState state = states.computeIfAbsent(symbol, s ->
                    new SymbolScanState(s, props.getWatchlist().getInterval(), props.getHistory().getMaxLength()));
            scans.add(CompletableFuture.runAsync(() -> signals.addAll(scanSymbol(state, session)), scanExecutor));
        }
        CompletableFuture.allOf(scans.toArray(new CompletableFuture[0])).join();

        signals.forEach(dispatcher::dispatch);
        log.debug("{} Tick {} session={} symbols={} signals={}", LOG_PREFIX, tick, session.getSession(),
                scans.size(), signals.size());
        return signals;
    }

    private List<TradeSignal> scanSymbol(SymbolScanState state, SessionInfo session) {
        try {
            List<RawCandle> raws = inbox.drain(state.getSymbol());
            if (!raws.isEmpty()) {
                int appended = symbolScanner.ingest(state, raws);
                log.debug("{} {} appended {}/{} candles (history={})", LOG_PREFIX, state.getSymbol(),
                        appended, raws.size(), state.getHistory().size());
            }
            return symbolScanner.scan(state, session, activePatterns);
        } catch (Exception e) {
            log.error("{} {} scan failed: {}", LOG_PREFIX, state.getSymbol(), e.getMessage(), e);
            return List.of();
        }
    }

    public SymbolScanState getState(String symbol) {
        return states.get(symbol);
    }

    public ActivePatternStore getActivePatterns() {
        return activePatterns;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
