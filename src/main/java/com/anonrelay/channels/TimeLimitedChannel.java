package com.anonrelay.channels;

import com.anonrelay.shared.error.DeliveryException;
import com.anonrelay.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator: bounds every outbound call by a timeout. Calls are never retried. Timeouts and
 * failures surface as {@link DeliveryException}.
 */
public class TimeLimitedChannel implements OutboundChannel {

    private static final Logger log = LoggerFactory.getLogger(TimeLimitedChannel.class);

    private final OutboundChannel delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeLimitedChannel(OutboundChannel delegate, Duration timeout, ExecutorService executor) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public Optional<String> deliver(String target, OutboundMessage message) {
        return call("deliver to " + target, () -> delegate.deliver(target, message));
    }

    @Override
    public void notify(String adminChannel, String text) {
        call("notify " + adminChannel, () -> {
            delegate.notify(adminChannel, text);
            return null;
        });
    }

    private <T> T call(String what, Callable<T> action) {
        Future<T> future;
        try {
            future = executor.submit(action);
        } catch (RuntimeException e) {
            throw new DeliveryException("Outbound executor rejected " + what, e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Outbound call timed out after {}ms: {}", timeout.toMillis(), what);
            throw new DeliveryException("Timed out: " + what, e);
        } catch (ExecutionException e) {
            throw new DeliveryException("Failed: " + what + ": " + rootMessage(e), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DeliveryException("Interrupted: " + what, e);
        }
    }

    private static String rootMessage(Throwable t) {
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage();
    }
}
