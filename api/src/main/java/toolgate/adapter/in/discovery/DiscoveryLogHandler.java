package toolgate.adapter.in.discovery;

import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.LogRecord;

import toolgate.core.service.discovery.SessionDiscoveryService;

/**
 * Log handler feeding log records to passive session discovery.
 *
 * <p>The message text and its parameters are scanned as-is; formatting is not
 * needed for pattern matching. Records from this application's own loggers
 * and records emitted while discovery runs on the same thread are skipped, so
 * discovery never processes its own output.
 */
public class DiscoveryLogHandler extends Handler {

    private static final String OWN_LOGGER_PREFIX = "toolgate.";

    private final SessionDiscoveryService discoveryService;
    private final ThreadLocal<Boolean> publishing = ThreadLocal.withInitial(() -> Boolean.FALSE);

    public DiscoveryLogHandler(SessionDiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    @Override
    public void publish(LogRecord record) {
        if (record == null || publishing.get() || isOwnRecord(record)) {
            return;
        }
        publishing.set(Boolean.TRUE);
        try {
            String text = textOf(record);
            if (!text.isEmpty()) {
                discoveryService.observe(text);
            }
        } catch (RuntimeException e) {
            reportError("Session discovery failed for log record", e, ErrorManager.GENERIC_FAILURE);
        } finally {
            publishing.set(Boolean.FALSE);
        }
    }

    @Override
    public void flush() {
        // nothing buffered
    }

    @Override
    public void close() {
        publishing.remove();
    }

    static String textOf(LogRecord record) {
        StringBuilder text = new StringBuilder();
        if (record.getMessage() != null) {
            text.append(record.getMessage());
        }
        Object[] parameters = record.getParameters();
        if (parameters != null) {
            for (Object parameter : parameters) {
                if (parameter != null) {
                    text.append(' ').append(parameter);
                }
            }
        }
        return text.toString();
    }

    private static boolean isOwnRecord(LogRecord record) {
        String loggerName = record.getLoggerName();
        return loggerName != null && loggerName.startsWith(OWN_LOGGER_PREFIX);
    }
}
