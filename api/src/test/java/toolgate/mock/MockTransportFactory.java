package toolgate.mock;

import java.time.Clock;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import jakarta.inject.Inject;

import io.quarkus.test.Mock;
import io.smallrye.mutiny.Uni;

import toolgate.adapter.out.transport.StreamableHttpTransportFactory;
import toolgate.core.model.transport.TransportConstructionException;
import toolgate.core.model.transport.TransportHandle;
import toolgate.core.port.out.TransportFactory;

/**
 * Transport factory for tests.
 *
 * <p>Sessions whose id starts with {@value #UNBUILDABLE_PREFIX} can never get a
 * transport; every other session gets a regular streamable HTTP transport.
 */
@Mock
@Alternative
@Priority(1)
@ApplicationScoped
public class MockTransportFactory implements TransportFactory {

    public static final String UNBUILDABLE_PREFIX = "unbuildable-";

    private final StreamableHttpTransportFactory delegate;

    @Inject
    public MockTransportFactory(Clock clock) {
        this.delegate = new StreamableHttpTransportFactory(clock);
    }

    @Override
    public Uni<TransportHandle> create(String sessionId, String serverName) {
        if (sessionId != null && sessionId.startsWith(UNBUILDABLE_PREFIX)) {
            return Uni.createFrom()
                    .failure(new TransportConstructionException(sessionId, "Transport refused for " + sessionId));
        }
        return delegate.create(sessionId, serverName);
    }
}
