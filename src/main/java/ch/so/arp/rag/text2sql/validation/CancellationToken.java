package ch.so.arp.rag.text2sql.validation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one query. The repair loop checks it
 * before every generation and execution; calls already in flight are not
 * interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
