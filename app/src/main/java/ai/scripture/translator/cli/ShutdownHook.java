package ai.scripture.translator.cli;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns a termination signal into an interrupt of the main thread, so a run stops between chunks and verifies.
 *
 * <p>Does nothing once the main thread has finished its work, since that thread is then blocked in
 * {@code System.exit} waiting for this hook.
 */
final class ShutdownHook implements Runnable {

    private final Thread mainThread;
    private final Duration joinTimeout;
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final AtomicBoolean triggered = new AtomicBoolean(false);

    ShutdownHook(Thread mainThread, Duration joinTimeout) {
        this.mainThread = Objects.requireNonNull(mainThread, "mainThread");
        this.joinTimeout = Objects.requireNonNull(joinTimeout, "joinTimeout");
    }

    /**
     * Marks the main thread's work as done; the hook returns immediately from then on.
     */
    void markFinished() {
        finished.set(true);
    }

    /**
     * @return {@code true} when a signal arrived while work was still running
     */
    boolean triggered() {
        return triggered.get();
    }

    @Override
    public void run() {
        if (finished.get()) {
            return;
        }
        triggered.set(true);
        mainThread.interrupt();
        try {
            mainThread.join(joinTimeout.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
