package io.trading.analytics.gateway.feed;

import io.trading.analytics.gateway.config.FeedConfig;
import io.trading.analytics.gateway.core.ProcessingTimer;
import io.trading.analytics.model.TradeEvent;
import io.trading.analytics.parser.TradeMessageParser;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Keeps a trade feed connected and turns its messages into {@link TradeEvent}s.
 *
 * <p>{@link #connect()} runs the whole connection lifecycle on the calling thread: it
 * connects, listens until the session drops, then reconnects with exponential backoff.
 * The consecutive failure counter resets on every successful connect. After
 * {@code maxRetries} consecutive failed attempts the client moves to
 * {@link FeedState#FAILED} and {@code connect()} returns. {@link #close()} may be called
 * from any thread; it interrupts a pending backoff wait and closes the live session.
 *
 * <p>Malformed messages are counted and dropped; they never end the session.
 */
public class FeedClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedClient.class);

    private final String name;
    private final FeedConfig config;
    private final FeedConnector connector;
    private final TradeMessageParser parser;
    private final Consumer<TradeEvent> tickConsumer;
    private final BackoffPolicy backoff;
    private final EpochClock clock;
    private final FeedListener listener;
    private final ProcessingTimer processingTimer;

    private final AtomicReference<FeedState> state = new AtomicReference<>(FeedState.DISCONNECTED);
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch closeLatch = new CountDownLatch(1);
    private final AtomicLong ticksReceived = new AtomicLong();
    private final AtomicLong parseErrors = new AtomicLong();
    private final AtomicLong reconnectAttempts = new AtomicLong();

    private volatile FeedSession session;
    private volatile long connectedAt;
    private volatile long lastTickTimestamp;

    public FeedClient(
        String name,
        FeedConfig config,
        FeedConnector connector,
        TradeMessageParser parser,
        Consumer<TradeEvent> tickConsumer,
        BackoffPolicy backoff,
        EpochClock clock,
        FeedListener listener,
        ProcessingTimer processingTimer
    ) {
        this.name = name;
        this.config = config;
        this.connector = connector;
        this.parser = parser;
        this.tickConsumer = tickConsumer;
        this.backoff = backoff;
        this.clock = clock;
        this.listener = listener;
        this.processingTimer = processingTimer;
    }

    /**
     * Runs the connect / listen / reconnect loop until the client is closed or retries
     * are exhausted.
     *
     * @return the terminal state, {@link FeedState#CLOSED} or {@link FeedState#FAILED}
     */
    public FeedState connect() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException(name + ": connect() already called");
        }

        URI uri = config.streamUri();
        int consecutiveFailures = 0;

        while (!isClosed()) {
            transition(FeedState.CONNECTING);
            FeedSession opened;
            try {
                opened = connector.open(uri, this::onMessage);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                consecutiveFailures++;
                LOGGER.warn("{}: Connection attempt {}/{} failed: {}",
                    name, consecutiveFailures, config.maxRetries(), e.getMessage());

                if (consecutiveFailures >= config.maxRetries()) {
                    transition(FeedState.FAILED);
                    LOGGER.error("{}: Max reconnect retries ({}) reached, giving up", name, config.maxRetries());
                    return state();
                }
                if (!backoffWait(consecutiveFailures - 1)) {
                    break;
                }
                continue;
            }

            consecutiveFailures = 0;
            session = opened;
            connectedAt = clock.time();
            transition(FeedState.CONNECTED);
            LOGGER.info("{}: Listening on {}", name, uri);

            try {
                if (!isClosed()) {
                    opened.awaitClose();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                session = null;
                connectedAt = 0;
                opened.close();
            }

            if (isClosed()) {
                break;
            }
            LOGGER.warn("{}: Connection lost", name);
            if (!backoffWait(0)) {
                break;
            }
        }

        transition(FeedState.CLOSED);
        return state();
    }

    private boolean backoffWait(int attempt) {
        transition(FeedState.RECONNECTING);
        reconnectAttempts.incrementAndGet();
        listener.onReconnectAttempt();

        long delayMs = backoff.delayMs(attempt);
        LOGGER.info("{}: Reconnecting in {} ms", name, delayMs);
        try {
            return !closeLatch.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void onMessage(String message) {
        ProcessingTimer.TimingContext timing = processingTimer.start();
        try {
            Optional<TradeEvent> trade = parser.parse(message);
            if (trade.isEmpty()) {
                LOGGER.debug("{}: Ignoring non-trade message", name);
                return;
            }
            TradeEvent event = trade.get();
            ticksReceived.incrementAndGet();
            lastTickTimestamp = event.timestamp();
            tickConsumer.accept(event);
            listener.onTick();
        } catch (RuntimeException e) {
            parseErrors.incrementAndGet();
            listener.onParseError();
            LOGGER.debug("{}: Dropping malformed message: {}", name, e.getMessage());
        } finally {
            processingTimer.record("feed", "parse", timing.stop());
        }
    }

    private void transition(FeedState next) {
        FeedState previous = state.getAndUpdate(current -> current.isTerminal() ? current : next);
        if (!previous.isTerminal() && previous != next) {
            LOGGER.debug("{}: {} -> {}", name, previous, next);
            listener.onStateChange(next);
        }
    }

    private boolean isClosed() {
        return closeLatch.getCount() == 0;
    }

    public FeedState state() {
        return state.get();
    }

    /**
     * Seconds since the current connection was established; 0 when not connected.
     */
    public double uptimeSeconds() {
        long since = connectedAt;
        if (since == 0 || state() != FeedState.CONNECTED) {
            return 0.0;
        }
        return Math.max(0, clock.time() - since) / 1000.0;
    }

    public long ticksReceived() {
        return ticksReceived.get();
    }

    public long lastTickTimestamp() {
        return lastTickTimestamp;
    }

    public long parseErrors() {
        return parseErrors.get();
    }

    public long reconnectAttempts() {
        return reconnectAttempts.get();
    }

    public FeedStatus status() {
        return new FeedStatus(state(), uptimeSeconds(), ticksReceived(), lastTickTimestamp(),
            parseErrors(), reconnectAttempts());
    }

    public String getName() {
        return name;
    }

    /**
     * Stops the client. Cancels a pending backoff wait and closes the live session.
     */
    @Override
    public void close() {
        if (isClosed()) {
            return;
        }
        closeLatch.countDown();
        FeedState previous = state.getAndUpdate(current -> current == FeedState.FAILED ? current : FeedState.CLOSED);
        if (previous != FeedState.FAILED && previous != FeedState.CLOSED) {
            listener.onStateChange(FeedState.CLOSED);
        }
        FeedSession current = session;
        if (current != null) {
            current.close();
        }
        LOGGER.info("{}: Closed", name);
    }
}
