package toolgate.adapter.out.transport;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import toolgate.core.model.transport.TransportHandle;

/**
 * Per-session streamable HTTP transport state held by this process.
 */
public class StreamableHttpTransport implements TransportHandle {

    public static final String KIND = "StreamableHTTP";

    private final String sessionId;
    private final String serverName;
    private final Instant createdAt;
    private final AtomicLong exchanges = new AtomicLong();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public StreamableHttpTransport(String sessionId, String serverName, Instant createdAt) {
        this.sessionId = sessionId;
        this.serverName = serverName;
        this.createdAt = createdAt;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String serverName() {
        return serverName;
    }

    @Override
    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public void recordExchange() {
        if (!open.get()) {
            throw new IllegalStateException("Transport for session " + sessionId + " is closed");
        }
        exchanges.incrementAndGet();
    }

    @Override
    public long exchangeCount() {
        return exchanges.get();
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        open.set(false);
    }
}
