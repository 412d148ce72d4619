package ai.treescan.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /**
     * Fixed pool of daemon threads named {@code threadPrefix + n}.
     *
     * @param stackSizeBytes requested stack size per thread, or 0 for the JVM default
     */
    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix, long stackSizeBytes) {
        assert parallelism >= 1 : "parallelism must be >= 1";
        var factory = new ThreadFactory() {
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = new Thread(null, r, threadPrefix + ++count, stackSizeBytes);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler(
                        (thr, ex) -> logger.error("Uncaught exception in thread {}", thr.getName(), ex));
                return t;
            }
        };
        return Executors.newFixedThreadPool(parallelism, factory);
    }
}
