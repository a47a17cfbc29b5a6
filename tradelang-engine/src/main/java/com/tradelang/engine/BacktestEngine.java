package com.tradelang.engine;

import com.tradelang.core.model.BacktestConfig;
import com.tradelang.core.model.BacktestResult;
import com.tradelang.core.model.PerformanceMetrics;
import com.tradelang.core.model.PriceTable;
import com.tradelang.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-position, long-only backtest over precomputed signals.
 *
 * Two states, flat and in position. Entries and exits fill at the signal bar's
 * close and the full account equity is invested on every entry. An exit bar
 * never re-enters. A position still open after the last bar is marked to market
 * and reported separately from the trade ledger.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final PositionSizer positionSizer;

    public BacktestEngine() {
        this(new PositionSizer());
    }

    public BacktestEngine(PositionSizer positionSizer) {
        this.positionSizer = positionSizer;
    }

    /**
     * Run a backtest with fully decided signals.
     */
    public BacktestResult run(PriceTable table, StrategySignals signals, BacktestConfig config) {
        return run(table, box(signals.entry()), box(signals.exit()), config);
    }

    /**
     * Run a backtest where some bars may be undecidable. A null entry or exit
     * value on a bar triggers nothing and carries the previous equity forward.
     *
     * @throws IllegalArgumentException if the signals are not aligned with the table
     */
    public BacktestResult run(PriceTable table, Boolean[] entry, Boolean[] exit, BacktestConfig config) {
        if (entry.length != table.size() || exit.length != table.size()) {
            throw new IllegalArgumentException("Signals must have one value per bar: table has "
                + table.size() + " bars, entry " + entry.length + ", exit " + exit.length);
        }

        long startTime = System.currentTimeMillis();
        BacktestContext ctx = new BacktestContext(table, config);

        for (int i = 0; i < table.size(); i++) {
            if (entry[i] == null || exit[i] == null) {
                ctx.carry(i);
                continue;
            }

            if (!ctx.inPosition()) {
                if (entry[i]) {
                    enter(ctx, i);
                }
            } else if (exit[i]) {
                Trade trade = ctx.close(i);
                log.debug("Exit at bar {} price {} pnl {}", i, trade.exitPrice(), trade.pnl());
            } else {
                ctx.markToMarket(i);
            }

            ctx.record(i);
        }

        double finalEquity = table.isEmpty() ? config.initialCapital() : ctx.equityCurve()[table.size() - 1];
        PerformanceMetrics metrics = PerformanceMetrics.calculate(
            ctx.trades(), config.initialCapital(), finalEquity, ctx.maxDrawdown(), config.annualizationPeriods());

        long duration = System.currentTimeMillis() - startTime;
        log.info("Backtest complete: {} bars, {} trades, final equity {}, max drawdown {}%{}",
            table.size(), metrics.totalTrades(), String.format("%.2f", metrics.finalEquity()),
            String.format("%.2f", metrics.maxDrawdownPercent()),
            ctx.inPosition() ? " (position still open)" : "");

        return new BacktestResult(
            config,
            ctx.trades(),
            ctx.equityCurve(),
            ctx.drawdownCurve(),
            metrics,
            ctx.position(),
            table.size(),
            duration
        );
    }

    private void enter(BacktestContext ctx, int bar) {
        double price = ctx.closeAt(bar);
        if (!positionSizer.canEnterAt(price)) {
            log.warn("Skipping entry at bar {}: close {} is not a tradable price", bar, price);
            return;
        }
        double shares = positionSizer.shares(ctx.equity(), price);
        ctx.open(bar, shares);
        log.debug("Entry at bar {} price {} shares {}", bar, price, shares);
    }

    private static Boolean[] box(boolean[] values) {
        Boolean[] boxed = new Boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return boxed;
    }
}
