package io.trading.analytics.backtest;

/**
 * Open simulated position.
 *
 * @param side       Long or short
 * @param entryPrice Price the position was opened at
 * @param entryIndex Index of the opening price in the replayed series
 */
public record Position(PositionSide side, double entryPrice, int entryIndex) {

    public Position {
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
    }

    /**
     * Signed profit of closing at {@code exitPrice}.
     */
    public double pnl(double exitPrice) {
        return side == PositionSide.LONG ? exitPrice - entryPrice : entryPrice - exitPrice;
    }
}
