package toolgate.adapter.in.http;

import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;

import toolgate.core.model.identity.RequestMetadata;

/**
 * Determines the originating client address of a request.
 *
 * <p>Order: first {@code X-Forwarded-For} entry, RFC 7239 {@code Forwarded for=},
 * {@code X-Real-IP}, then the socket's remote address.
 */
@ApplicationScoped
public class ClientAddressExtractor {

    /**
     * @param headers       header lookup, returning null for absent headers
     * @param remoteAddress the socket peer address, may be null
     * @return the client address, or {@value RequestMetadata#UNKNOWN}
     */
    public String extract(Function<String, String> headers, String remoteAddress) {
        var xForwardedFor = headers.apply("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        var forwarded = headers.apply("Forwarded");
        if (forwarded != null && !forwarded.isBlank()) {
            var forParam = extractForwardedFor(forwarded);
            if (forParam != null) {
                return forParam;
            }
        }

        var xRealIp = headers.apply("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }

        if (remoteAddress != null && !remoteAddress.isBlank()) {
            return remoteAddress;
        }
        return RequestMetadata.UNKNOWN;
    }

    private String extractForwardedFor(String forwarded) {
        // First entry is the original client
        var firstEntry = forwarded.split(",")[0].trim();
        for (var part : firstEntry.split(";")) {
            var keyValue = part.trim().split("=", 2);
            if (keyValue.length == 2 && keyValue[0].equalsIgnoreCase("for")) {
                var value = keyValue[1];
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                return value.isBlank() ? null : value;
            }
        }
        return null;
    }
}
