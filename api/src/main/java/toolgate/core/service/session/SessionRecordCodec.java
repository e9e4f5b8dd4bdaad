package toolgate.core.service.session;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jboss.logging.Logger;

import toolgate.core.model.session.ApplicationSession;
import toolgate.core.model.session.TransportSession;

/**
 * JSON encoding of stored session records.
 *
 * <p>Records that cannot be decoded are reported as absent and logged; they
 * expire on their own.
 */
public final class SessionRecordCodec {

    private static final Logger LOG = Logger.getLogger(SessionRecordCodec.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    public String encode(ApplicationSession session) {
        return write(session, session.sessionId());
    }

    public String encode(TransportSession transport) {
        return write(transport, transport.sessionId());
    }

    public Optional<ApplicationSession> decodeSession(String key, String json) {
        return read(key, json, ApplicationSession.class);
    }

    public Optional<TransportSession> decodeTransport(String key, String json) {
        return read(key, json, TransportSession.class);
    }

    private static String write(Object record, String sessionId) {
        try {
            return OBJECT_MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session record for " + sessionId + " is not serializable", e);
        }
    }

    private static <T> Optional<T> read(String key, String json, Class<T> type) {
        try {
            return Optional.of(OBJECT_MAPPER.readValue(json, type));
        } catch (JsonProcessingException e) {
            LOG.warnf("Ignoring unreadable %s at %s: %s", type.getSimpleName(), key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
