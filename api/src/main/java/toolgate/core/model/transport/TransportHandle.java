package toolgate.core.model.transport;

import java.time.Instant;

/**
 * In-process transport object serving one session.
 *
 * <p>Handles never leave the process that created them.
 */
public interface TransportHandle {

    String sessionId();

    /**
     * Transport kind recorded in the durable existence record.
     */
    String kind();

    String serverName();

    Instant createdAt();

    /**
     * Note that a request/response exchange went through this transport.
     */
    void recordExchange();

    long exchangeCount();

    boolean isOpen();

    /**
     * Release the transport. Calling close on a closed handle has no effect.
     */
    void close();
}
