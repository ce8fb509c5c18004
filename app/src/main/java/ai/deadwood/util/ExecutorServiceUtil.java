package ai.deadwood.util;

import ai.deadwood.exception.GlobalExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorServiceUtil {

    private ExecutorServiceUtil() {}

    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        var factory = new ThreadFactory() {
            private final ThreadFactory delegate = Executors.defaultThreadFactory();
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = delegate.newThread(r);
                t.setName(threadPrefix + ++count);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler(GlobalExceptionHandler::handle);
                return t;
            }
        };
        return Executors.newFixedThreadPool(parallelism, factory);
    }

    /** Single daemon thread for cool-downs and deadlines. */
    public static ScheduledExecutorService newScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(createNamedThreadFactory(name));
    }

    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        return r -> {
            var thread = new Thread(r);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(new GlobalExceptionHandler());
            return thread;
        };
    }
}
