package io.github.flameyossnowy.querycraft.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Process-wide logging switches for the query compiler.
 *
 * <p>Messages are built lazily from suppliers so a disabled logger costs a
 * single flag check. {@link #ENABLED} gates info output, {@link #DEEP} gates
 * the very chatty per-join output.</p>
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("querycraft");

    public static boolean ENABLED = Boolean.getBoolean("querycraft.logging");

    public static boolean DEEP = Boolean.getBoolean("querycraft.logging.deep");

    private Logging() {}

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }
}
