package io.trading.analytics.backtest;

import io.trading.analytics.indicator.Indicators;

import java.util.Arrays;

/**
 * Replays a price series through a z-score mean-reversion strategy holding at most one
 * position at a time.
 *
 * <p>At each index from {@code period} onward the current price is scored against the
 * mean and deviation of the preceding {@code period} prices, recomputed from scratch at
 * every step. A position still open at the end of the series is discarded.
 */
public class MeanReversionBacktester {

    private final BacktestSettings settings;

    public MeanReversionBacktester() {
        this(BacktestSettings.DEFAULTS);
    }

    public MeanReversionBacktester(BacktestSettings settings) {
        this.settings = settings;
    }

    public BacktestResult run(String instrumentId, double[] prices) {
        int period = settings.period();
        if (prices.length < period) {
            return BacktestResult.empty(instrumentId);
        }

        Position position = null;
        int tradeCount = 0;
        int wins = 0;
        int losses = 0;
        double totalPnl = 0.0;

        for (int i = period; i < prices.length; i++) {
            double price = prices[i];
            double[] trailing = Arrays.copyOfRange(prices, i - period, i);
            double zScore = Indicators.zScore(price, Indicators.mean(trailing), Indicators.std(trailing));

            if (position == null) {
                if (zScore > settings.entryThreshold()) {
                    position = new Position(PositionSide.SHORT, price, i);
                } else if (zScore < -settings.entryThreshold()) {
                    position = new Position(PositionSide.LONG, price, i);
                }
            } else if (Math.abs(zScore) < settings.exitThreshold()) {
                double pnl = position.pnl(price);
                tradeCount++;
                totalPnl += pnl;
                if (pnl > 0) {
                    wins++;
                } else {
                    losses++;
                }
                position = null;
            }
        }

        if (tradeCount == 0) {
            return BacktestResult.empty(instrumentId);
        }
        return new BacktestResult(
            instrumentId,
            tradeCount,
            wins,
            losses,
            (double) wins / tradeCount,
            totalPnl,
            totalPnl / tradeCount
        );
    }

    public BacktestSettings getSettings() {
        return settings;
    }
}
