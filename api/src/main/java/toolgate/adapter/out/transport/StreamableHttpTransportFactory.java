package toolgate.adapter.out.transport;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.model.transport.TransportConstructionException;
import toolgate.core.model.transport.TransportHandle;
import toolgate.core.port.out.TransportFactory;

/**
 * Creates {@link StreamableHttpTransport}s.
 */
@ApplicationScoped
public class StreamableHttpTransportFactory implements TransportFactory {

    private static final Logger LOG = Logger.getLogger(StreamableHttpTransportFactory.class);

    private final Clock clock;

    @Inject
    public StreamableHttpTransportFactory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<TransportHandle> create(String sessionId, String serverName) {
        return Uni.createFrom().item(() -> {
            if (sessionId == null || sessionId.isBlank()) {
                throw new TransportConstructionException(sessionId, "Cannot create a transport without a session id");
            }
            LOG.debugf(
                    "Creating %s transport for session %s on %s", StreamableHttpTransport.KIND, sessionId, serverName);
            return new StreamableHttpTransport(sessionId, serverName, clock.instant());
        });
    }
}
