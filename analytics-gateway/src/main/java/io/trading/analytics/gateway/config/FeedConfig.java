package io.trading.analytics.gateway.config;

import io.trading.analytics.parser.StreamType;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Feed subscription and reconnect settings.
 *
 * @param baseUrl           Combined stream endpoint, e.g. {@code wss://fstream.binance.com/stream}
 * @param instruments       Subscribed instruments
 * @param streamType        Trade stream flavour
 * @param enableCompression Whether to offer permessage-deflate
 * @param maxRetries        Consecutive failed connection attempts before giving up
 * @param backoffBaseMs     First reconnect delay
 * @param backoffMaxMs      Reconnect delay cap
 * @param backoffJitterMs   Upper bound of the random jitter added to each delay
 */
public record FeedConfig(
    String baseUrl,
    List<String> instruments,
    StreamType streamType,
    boolean enableCompression,
    int maxRetries,
    long backoffBaseMs,
    long backoffMaxMs,
    long backoffJitterMs
) {
    public FeedConfig {
        if (baseUrl == null || baseUrl.isEmpty()) {
            throw new IllegalArgumentException("baseUrl cannot be null or empty");
        }
        if (instruments == null || instruments.isEmpty()) {
            throw new IllegalArgumentException("instruments cannot be null or empty");
        }
        if (streamType == null) {
            throw new IllegalArgumentException("streamType cannot be null");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (backoffBaseMs <= 0 || backoffMaxMs < backoffBaseMs || backoffJitterMs < 0) {
            throw new IllegalArgumentException("invalid backoff settings");
        }
        instruments = List.copyOf(instruments);
    }

    /**
     * Builds the combined stream URI, e.g.
     * {@code wss://fstream.binance.com/stream?streams=btcusdt@aggTrade/ethusdt@aggTrade}.
     */
    public URI streamUri() {
        String streams = instruments.stream()
            .map(instrument -> instrument.toLowerCase(Locale.ROOT) + "@" + streamType.getStreamName())
            .collect(Collectors.joining("/"));
        return URI.create(baseUrl + "?streams=" + streams);
    }
}
