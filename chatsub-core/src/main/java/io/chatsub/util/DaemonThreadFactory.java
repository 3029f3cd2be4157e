package io.chatsub.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the coordinating thread of a {@link io.chatsub.session.ChatSession}.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc., with the prefix taken from
 * {@link io.chatsub.session.ChatSession.Builder#threadNamePrefix(String)} so each account's
 * session thread can be told apart in thread dumps. Threads are daemons, so a session that is
 * never closed does not keep the JVM alive, and anything escaping a session task is logged
 * through {@code java.util.logging} at {@code SEVERE}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught exception on " + t.getName(), e));
        return thread;
    }
}
