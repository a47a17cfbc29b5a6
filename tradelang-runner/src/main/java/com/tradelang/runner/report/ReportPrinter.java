package com.tradelang.runner.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradelang.core.model.BacktestResult;
import com.tradelang.core.model.PerformanceMetrics;
import com.tradelang.core.model.Position;
import com.tradelang.core.model.Trade;
import com.tradelang.runner.PipelineResult;
import com.tradelang.runner.data.HttpClientFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders pipeline results as a plain-text summary or a JSON {@link RunReport}.
 * Amounts and percentages are shown with two decimals.
 */
public class ReportPrinter {

    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
    private static final String RULE = "-".repeat(60);

    private final ObjectMapper mapper;

    public ReportPrinter() {
        this(HttpClientFactory.getMapper());
    }

    public ReportPrinter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String text(String strategyName, PipelineResult result) {
        BacktestResult backtest = result.backtest();
        PerformanceMetrics m = backtest.metrics();
        StringBuilder sb = new StringBuilder();

        sb.append("Strategy: ").append(strategyName).append('\n');
        if (result.naturalLanguage() != null) {
            sb.append("Input:    ").append(result.naturalLanguage()).append('\n');
        }
        sb.append(RULE).append('\n');
        sb.append(result.dsl().strip()).append('\n');
        sb.append(RULE).append('\n');

        if (!result.indicatorKeys().isEmpty()) {
            sb.append("Indicators: ").append(String.join(", ", result.indicatorKeys())).append('\n');
        }
        sb.append(format("Bars: %d   Entry signals: %d   Exit signals: %d%n",
            backtest.barsProcessed(), result.signals().entryCount(), result.signals().exitCount()));
        sb.append('\n');

        sb.append(format("%-18s %,.2f%n", "Initial equity", m.initialEquity()));
        sb.append(format("%-18s %,.2f%n", "Final equity", m.finalEquity()));
        sb.append(format("%-18s %s%,.2f (%s%.2f%%)%n", "Total return",
            sign(m.totalReturn()), m.totalReturn(), sign(m.totalReturnPercent()), m.totalReturnPercent()));
        sb.append(format("%-18s %.2f%%%n", "Max drawdown", m.maxDrawdownPercent()));
        sb.append(format("%-18s %d (%d won, %d lost)%n", "Trades", m.totalTrades(), m.winningTrades(), m.losingTrades()));
        sb.append(format("%-18s %.2f%%%n", "Win rate", m.winRate()));
        sb.append(format("%-18s %.2f%%%n", "Average return", m.averageReturn()));
        sb.append(format("%-18s %.2f%%%n", "Average win", m.averageWin()));
        sb.append(format("%-18s %.2f%%%n", "Average loss", m.averageLoss()));
        sb.append(format("%-18s %s%n", "Profit factor", profitFactor(m.profitFactor())));
        sb.append(format("%-18s %.2f%n", "Sharpe ratio", m.sharpeRatio()));

        if (!backtest.trades().isEmpty()) {
            sb.append('\n');
            sb.append(format("%-4s %-16s %-16s %12s %12s %12s %12s %9s%n",
                "#", "Entry", "Exit", "Entry px", "Exit px", "Shares", "PnL", "Return"));
            int n = 1;
            for (Trade t : backtest.trades()) {
                sb.append(format("%-4d %-16s %-16s %12.2f %12.2f %12.2f %12.2f %8.2f%%%n",
                    n++, time(t.entryTime()), time(t.exitTime()),
                    t.entryPrice(), t.exitPrice(), t.shareCount(), t.pnl(), t.returnPercent()));
            }
        }

        if (backtest.hasOpenPosition()) {
            Position p = backtest.openPosition();
            sb.append('\n');
            sb.append(format("Open position: %.2f shares since %s at %.2f%n",
                p.shareCount(), time(p.entryTime()), p.entryPrice()));
        }

        return sb.toString();
    }

    public String json(RunReport report) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }

    private static String profitFactor(double value) {
        return Double.isInfinite(value) ? "inf" : format("%.2f", value);
    }

    private static String sign(double value) {
        return value > 0 ? "+" : "";
    }

    private static String time(long epochMillis) {
        return TIME_FORMAT.format(Instant.ofEpochMilli(epochMillis));
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
