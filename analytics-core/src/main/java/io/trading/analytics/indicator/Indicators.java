package io.trading.analytics.indicator;

import io.trading.analytics.model.Trend;

import java.util.OptionalDouble;

/**
 * Stateless statistical indicators over price, volume and return series.
 *
 * <p>Every function is total: insufficient data yields a documented fallback value or
 * {@link OptionalDouble#empty()}, and degenerate input (zero deviation, zero volume,
 * zero variance) yields a neutral value instead of a division fault.
 *
 * <p>Series are ordered oldest first.
 */
public final class Indicators {

    public static final double NEUTRAL_RSI = 50.0;

    private Indicators() { /* utility class */ }

    /**
     * Arithmetic mean; 0.0 for an empty series.
     */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation, {@code sqrt(sum((x - mean)^2) / N)}; 0.0 when N &lt; 2.
     */
    public static double std(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return Math.sqrt(variance(values));
    }

    /**
     * Population variance; 0.0 for an empty series.
     */
    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSquares += diff * diff;
        }
        return sumSquares / values.length;
    }

    /**
     * Volume weighted average price; 0.0 when the series are empty, of different
     * length, or the total volume is not positive.
     */
    public static double vwap(double[] prices, double[] volumes) {
        if (prices.length == 0 || prices.length != volumes.length) {
            return 0.0;
        }
        double notional = 0.0;
        double totalVolume = 0.0;
        for (int i = 0; i < prices.length; i++) {
            notional += prices[i] * volumes[i];
            totalVolume += volumes[i];
        }
        return totalVolume > 0 ? notional / totalVolume : 0.0;
    }

    /**
     * Mean of the last {@code period} values, or of all values when fewer are available.
     */
    public static double sma(double[] values, int period) {
        if (values.length < period) {
            return mean(values);
        }
        return mean(tail(values, period));
    }

    /**
     * Exponential moving average with {@code k = 2 / (period + 1)}, seeded with the
     * oldest value and walked oldest to newest. Falls back to the simple mean when
     * fewer than {@code period} values are available.
     */
    public static double ema(double[] values, int period) {
        if (values.length == 0) {
            return 0.0;
        }
        if (values.length < period) {
            return mean(values);
        }
        double k = 2.0 / (period + 1);
        double ema = values[0];
        for (int i = 1; i < values.length; i++) {
            ema = values[i] * k + ema * (1 - k);
        }
        return ema;
    }

    /**
     * Relative strength index over the last {@code period} price changes.
     * Returns {@value #NEUTRAL_RSI} with fewer than {@code period + 1} values, and when
     * there were neither gains nor losses; 100 when there were only gains.
     */
    public static double rsi(double[] values, int period) {
        if (values.length < period + 1) {
            return NEUTRAL_RSI;
        }
        double gains = 0.0;
        double losses = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            double change = values[i] - values[i - 1];
            if (change > 0) {
                gains += change;
            } else {
                losses -= change;
            }
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;

        if (avgLoss == 0) {
            return avgGain > 0 ? 100.0 : NEUTRAL_RSI;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /**
     * Signed distance from the mean in standard deviations; 0.0 when std is 0.
     */
    public static double zScore(double value, double mean, double std) {
        if (std == 0) {
            return 0.0;
        }
        return (value - mean) / std;
    }

    /**
     * Pearson correlation coefficient. Undefined (empty) unless both series have the
     * same length of at least 2 and both have non-zero deviation.
     */
    public static OptionalDouble correlation(double[] xs, double[] ys) {
        if (xs.length < 2 || xs.length != ys.length) {
            return OptionalDouble.empty();
        }
        double xMean = mean(xs);
        double yMean = mean(ys);
        double xStd = std(xs);
        double yStd = std(ys);
        if (xStd == 0 || yStd == 0) {
            return OptionalDouble.empty();
        }

        double covariance = 0.0;
        for (int i = 0; i < xs.length; i++) {
            covariance += (xs[i] - xMean) * (ys[i] - yMean);
        }
        return OptionalDouble.of(covariance / (xs.length * xStd * yStd));
    }

    /**
     * Uptrend when {@code price > sma > ema}, downtrend when {@code price < sma < ema},
     * neutral otherwise.
     */
    public static Trend trend(double sma, double ema, double price) {
        if (price > sma && sma > ema) {
            return Trend.UPTREND;
        }
        if (price < sma && sma < ema) {
            return Trend.DOWNTREND;
        }
        return Trend.NEUTRAL;
    }

    /**
     * Cheap stand-in for an ADF test: lag-1 autocovariance over variance as an
     * autocorrelation proxy, mapped to {@code 1 / (1 + |autocorr|)}. Lower values mean
     * more mean-reverting. Empty with fewer than {@code minPoints} values; 1.0 for a
     * constant series.
     */
    public static OptionalDouble stationarityPValue(double[] values, int minPoints) {
        if (values.length < minPoints) {
            return OptionalDouble.empty();
        }
        double mean = mean(values);
        double autocovariance = 0.0;
        for (int i = 1; i < values.length; i++) {
            autocovariance += (values[i] - mean) * (values[i - 1] - mean);
        }
        autocovariance /= values.length;

        double variance = variance(values);
        if (variance == 0) {
            return OptionalDouble.of(1.0);
        }
        double autocorrelation = autocovariance / variance;
        return OptionalDouble.of(1.0 / (1.0 + Math.abs(autocorrelation)));
    }

    /**
     * Simplified GARCH(1,1) one step volatility forecast:
     * {@code omega = (1 - alpha - beta) * Var(r)},
     * {@code sigma^2 = omega + alpha * r_last^2 + beta * std(r)^2}.
     * Empty with fewer than {@code minReturns} returns.
     */
    public static OptionalDouble volatilityForecast(double[] returns, double alpha, double beta, int minReturns) {
        if (returns.length < minReturns || returns.length == 0) {
            return OptionalDouble.empty();
        }
        double longTermVariance = variance(returns);
        double recentStd = std(returns);
        double lastReturn = returns[returns.length - 1];

        double omega = (1 - alpha - beta) * longTermVariance;
        double forecastVariance = omega + alpha * lastReturn * lastReturn + beta * recentStd * recentStd;
        return OptionalDouble.of(Math.sqrt(Math.max(forecastVariance, 0.0)));
    }

    /**
     * Gets the last {@code count} values (all of them when fewer).
     */
    public static double[] tail(double[] values, int count) {
        if (count >= values.length) {
            return values;
        }
        double[] result = new double[count];
        System.arraycopy(values, values.length - count, result, 0, count);
        return result;
    }
}
