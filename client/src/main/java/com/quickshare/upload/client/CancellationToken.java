package com.quickshare.upload.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cooperative cancellation signal threaded through every collaborator call of an
 * upload attempt.
 *
 * <p>
 * Collaborators either poll {@link #isCancellationRequested()} at their
 * suspension points or {@link #register(Runnable) register} an abort callback for
 * the duration of an outbound call and close the returned registration once the
 * call has settled.
 *
 * <p>
 * Tokens are obtained from a {@link CancellationSource}; only the source can
 * fire them.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken();

    private final Object lock = new Object();
    private final Set<CallbackRegistration> registrations = new LinkedHashSet<>();
    private volatile boolean cancelled;

    CancellationToken() {
    }

    /**
     * @return a token that is never cancelled
     */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * Registers a callback to run when cancellation is requested.
     *
     * <p>
     * If cancellation was already requested the callback runs immediately on the
     * calling thread. Callbacks run at most once.
     *
     * @param callback abort action, e.g. cancelling an in-flight request
     * @return registration to close once the guarded call has settled
     */
    public Registration register(Runnable callback) {
        CallbackRegistration registration = new CallbackRegistration(callback);
        synchronized (lock) {
            if (!cancelled) {
                registrations.add(registration);
                return registration;
            }
        }
        runCallback(callback);
        return registration;
    }

    void cancel() {
        List<CallbackRegistration> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(registrations);
            registrations.clear();
        }
        for (CallbackRegistration registration : toRun) {
            runCallback(registration.callback);
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handle of a registered cancellation callback. Closing it detaches the
     * callback; closing twice is a no-op.
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final class CallbackRegistration implements Registration {
        private final Runnable callback;

        private CallbackRegistration(Runnable callback) {
            this.callback = callback;
        }

        @Override
        public void close() {
            synchronized (lock) {
                registrations.remove(this);
            }
        }
    }
}
