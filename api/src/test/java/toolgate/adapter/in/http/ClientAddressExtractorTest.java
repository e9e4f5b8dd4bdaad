package toolgate.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClientAddressExtractor")
class ClientAddressExtractorTest {

    private final ClientAddressExtractor extractor = new ClientAddressExtractor();

    private String extract(Map<String, String> headers, String remoteAddress) {
        return extractor.extract(headers::get, remoteAddress);
    }

    @Test
    @DisplayName("should use the first X-Forwarded-For entry")
    void shouldUseXForwardedFor() {
        assertEquals(
                "203.0.113.7",
                extract(Map.of("X-Forwarded-For", "203.0.113.7, 10.0.0.1", "X-Real-IP", "10.0.0.9"), "10.0.0.2"));
    }

    @Test
    @DisplayName("should read the for parameter of Forwarded")
    void shouldUseForwarded() {
        assertEquals(
                "198.51.100.4",
                extract(Map.of("Forwarded", "for=\"198.51.100.4\";proto=https, for=10.0.0.1"), "10.0.0.2"));
    }

    @Test
    @DisplayName("should fall back to X-Real-IP")
    void shouldUseXRealIp() {
        assertEquals("192.0.2.1", extract(Map.of("X-Real-IP", " 192.0.2.1 "), "10.0.0.2"));
    }

    @Test
    @DisplayName("should fall back to the remote address, then unknown")
    void shouldFallBackToRemoteAddress() {
        assertEquals("10.0.0.2", extract(Map.of(), "10.0.0.2"));
        assertEquals("unknown", extract(Map.of(), null));
    }
}
