package io.trading.analytics.backtest;

/**
 * Outcome of a backtest run.
 *
 * @param instrumentId Instrument symbol
 * @param tradeCount   Closed round trips
 * @param wins         Trades with positive PnL
 * @param losses       Trades with zero or negative PnL
 * @param winRate      wins / tradeCount, 0 without trades
 * @param totalPnl     Sum of trade PnL
 * @param avgPnl       totalPnl / tradeCount, 0 without trades
 */
public record BacktestResult(
    String instrumentId,
    int tradeCount,
    int wins,
    int losses,
    double winRate,
    double totalPnl,
    double avgPnl
) {
    public static BacktestResult empty(String instrumentId) {
        return new BacktestResult(instrumentId, 0, 0, 0, 0.0, 0.0, 0.0);
    }
}
