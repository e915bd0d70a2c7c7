package io.controlplane;

import com.google.common.util.concurrent.Uninterruptibles;
import io.controlplane.component.ComponentException;
import io.controlplane.component.ComponentManager;
import io.controlplane.reconciler.ReconcilerSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single shutdown path of the server: whoever triggers it (an OS signal or a failure
 * during startup), reconcilers stop first, then every component in reverse order.
 */
@Slf4j
public class ShutdownSequencer {

    public enum State {
        RUNNING,
        STOPPING,
        STOPPED
    }

    static final String SIGTERM = "SIGTERM";

    private final BlockingQueue<String> signals = new ArrayBlockingQueue<>(1);
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final CountDownLatch stopped = new CountDownLatch(1);

    /**
     * Request shutdown. Never blocks; if a request is already pending this one is dropped.
     */
    public void signal(String reason) {
        if (!signals.offer(reason)) {
            log.debug("Shutdown already requested, ignoring {}", reason);
        }
    }

    /**
     * Route JVM termination (SIGTERM, SIGINT) into the shutdown path and hold the JVM
     * until the sequence completed.
     */
    public void installSignalHandler() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (handleTermination()) {
                // the JVM would otherwise report 128+signal
                Runtime.getRuntime().halt(0);
            }
        }, "shutdown-hook"));
    }

    /**
     * Request shutdown for a termination signal, then wait without bound until every
     * component stopped. An in-flight init or start phase runs to its end first, and the
     * JVM must not exit before supervised processes are gone.
     *
     * @return true if this call requested the shutdown
     */
    boolean handleTermination() {
        boolean requested = state.get() == State.RUNNING;
        if (requested) {
            log.info("Received termination signal");
            signal(SIGTERM);
        }
        if (state.get() != State.STOPPED) {
            log.info("Waiting for shutdown to complete");
        }
        Uninterruptibles.awaitUninterruptibly(stopped);
        return requested;
    }

    /**
     * Block until a shutdown is requested.
     *
     * @return the reason passed to {@link #signal(String)}
     */
    public String awaitSignal() throws InterruptedException {
        return signals.take();
    }

    /**
     * Stop reconcilers, then the component manager. Only the first call does anything.
     *
     * @param reconcilers may be null when startup failed before reconcilers were created
     * @return true if this call performed the shutdown
     */
    public boolean shutdown(ReconcilerSet reconcilers, ComponentManager manager) {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) {
            log.debug("Shutdown already {}", state.get());
            return false;
        }
        try {
            if (reconcilers != null) {
                reconcilers.stopAll();
            }
            manager.stop();
            log.info("All components stopped");
        } catch (ComponentException e) {
            log.warn("Shutdown completed with errors: {}", e.getMessage());
        } finally {
            state.set(State.STOPPED);
            stopped.countDown();
        }
        return true;
    }

    public State getState() {
        return state.get();
    }

    boolean awaitStopped(Duration timeout) {
        try {
            return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
