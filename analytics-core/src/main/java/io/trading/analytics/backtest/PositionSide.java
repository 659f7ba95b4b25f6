package io.trading.analytics.backtest;

public enum PositionSide {
    LONG,
    SHORT
}
