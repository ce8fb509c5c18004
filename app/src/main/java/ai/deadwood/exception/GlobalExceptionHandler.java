package ai.deadwood.exception;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.CancellationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class GlobalExceptionHandler implements UncaughtExceptionHandler {
    private static final Logger logger = LogManager.getLogger(GlobalExceptionHandler.class);

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        handle(thread, throwable);
    }

    /**
     * Logs the throwable.
     *
     * <p>InterruptedException and CancellationException are suppressed here; worker threads see them when the pool
     * shuts down.
     */
    public static void handle(Thread thread, Throwable th) {
        if (isCausedBy(th, InterruptedException.class) || isCausedBy(th, CancellationException.class)) {
            logger.debug("Suppressing cancellation/interrupt on thread {}", thread.getName(), th);
            return;
        }

        logger.error("Uncaught exception on thread {}", thread.getName(), th);
    }

    /**
     * @return true if the given Class is part of the throwable cause chain.
     */
    public static boolean isCausedBy(Throwable th, Class<? extends Throwable> cls) {
        if (cls.isInstance(th)) return true;
        else if (th.getCause() == null) return false;
        else return isCausedBy(th.getCause(), cls);
    }
}
