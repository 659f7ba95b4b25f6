package io.trading.analytics.history;

/**
 * Point-in-time copy of one instrument's rolling history, oldest first.
 * The arrays are private copies; holders may read them freely but must not rely on
 * them tracking later appends.
 *
 * @param instrumentId Instrument symbol
 * @param generation   Flush generation of the latest append
 * @param prices       Window mean prices
 * @param volumes      Window total volumes
 * @param timestamps   Window timestamps
 * @param returns      Simple returns between consecutive prices
 */
public record HistorySnapshot(
    String instrumentId,
    long generation,
    double[] prices,
    double[] volumes,
    long[] timestamps,
    double[] returns
) {
    public int size() {
        return prices.length;
    }

    public boolean isEmpty() {
        return prices.length == 0;
    }

    /**
     * Gets the newest price, or 0 when empty.
     */
    public double lastPrice() {
        return prices.length == 0 ? 0.0 : prices[prices.length - 1];
    }
}
