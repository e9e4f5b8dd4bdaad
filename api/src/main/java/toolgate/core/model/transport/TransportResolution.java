package toolgate.core.model.transport;

import java.util.Optional;

import toolgate.core.model.session.TransportSession;

/**
 * Outcome of resolving a session's transport.
 *
 * <p>Only {@link TransportState#LIVE} resolutions carry a handle. Detached
 * resolutions carry the existence record that was found.
 */
public record TransportResolution(
        String sessionId, TransportState state, TransportHandle handle, TransportSession record) {

    public static TransportResolution unknown(String sessionId) {
        return new TransportResolution(sessionId, TransportState.UNKNOWN, null, null);
    }

    public static TransportResolution detached(TransportSession record) {
        return new TransportResolution(record.sessionId(), TransportState.DETACHED, null, record);
    }

    public static TransportResolution live(TransportHandle handle) {
        return new TransportResolution(handle.sessionId(), TransportState.LIVE, handle, null);
    }

    public boolean isLive() {
        return state == TransportState.LIVE;
    }

    public Optional<TransportHandle> liveHandle() {
        return Optional.ofNullable(handle);
    }

    public Optional<TransportSession> existenceRecord() {
        return Optional.ofNullable(record);
    }
}
