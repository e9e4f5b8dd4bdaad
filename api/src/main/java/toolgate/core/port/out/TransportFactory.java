package toolgate.core.port.out;

import io.smallrye.mutiny.Uni;

import toolgate.core.model.transport.TransportHandle;

/**
 * Constructs in-process transports.
 */
public interface TransportFactory {

    /**
     * Create a transport serving the given session.
     *
     * @return the started transport, or a failure with
     *     {@link toolgate.core.model.transport.TransportConstructionException}
     */
    Uni<TransportHandle> create(String sessionId, String serverName);
}
