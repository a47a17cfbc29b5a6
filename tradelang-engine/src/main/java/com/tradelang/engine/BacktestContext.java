package com.tradelang.engine;

import com.tradelang.core.model.BacktestConfig;
import com.tradelang.core.model.Position;
import com.tradelang.core.model.PriceTable;
import com.tradelang.core.model.Trade;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one backtest run: ledger, equity and drawdown curves,
 * the live position and the running peak. Created fresh for every run.
 */
final class BacktestContext {

    private final PriceTable table;
    private final List<Trade> trades = new ArrayList<>();
    private final double[] equityCurve;
    private final double[] drawdownCurve;

    private Position position;
    private double equity;
    private double peak;
    private double drawdown;
    private double maxDrawdown;

    BacktestContext(PriceTable table, BacktestConfig config) {
        this.table = table;
        this.equityCurve = new double[table.size()];
        this.drawdownCurve = new double[table.size()];
        this.equity = config.initialCapital();
        this.peak = config.initialCapital();
    }

    boolean inPosition() {
        return position != null;
    }

    Position position() {
        return position;
    }

    double equity() {
        return equity;
    }

    double closeAt(int bar) {
        return table.close(bar);
    }

    void open(int bar, double shares) {
        position = new Position(bar, table.timestamp(bar), table.close(bar), shares, equity);
    }

    Trade close(int bar) {
        Trade trade = Trade.close(position, bar, table.timestamp(bar), table.close(bar));
        equity = position.equityAtEntry() + trade.pnl();
        trades.add(trade);
        position = null;
        return trade;
    }

    void markToMarket(int bar) {
        equity = position.marketValue(table.close(bar));
    }

    /**
     * Record the bar after a decision: update the running peak and drawdown.
     */
    void record(int bar) {
        if (equity > peak) {
            peak = equity;
        }
        drawdown = (equity - peak) / peak;
        if (drawdown < maxDrawdown) {
            maxDrawdown = drawdown;
        }
        equityCurve[bar] = equity;
        drawdownCurve[bar] = drawdown;
    }

    /**
     * Record an undecidable bar: equity and drawdown carry forward unchanged.
     */
    void carry(int bar) {
        equityCurve[bar] = equity;
        drawdownCurve[bar] = drawdown;
    }

    List<Trade> trades() {
        return trades;
    }

    double[] equityCurve() {
        return equityCurve;
    }

    double[] drawdownCurve() {
        return drawdownCurve;
    }

    double maxDrawdown() {
        return maxDrawdown;
    }
}
