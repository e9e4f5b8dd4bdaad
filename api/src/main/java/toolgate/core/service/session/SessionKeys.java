package toolgate.core.service.session;

/**
 * Backend key layout.
 *
 * <pre>
 * {prefix}session:{scope}:{sessionId}   application session (scope = identity hash or "shared")
 * {prefix}transport:{sessionId}         transport existence record
 * {prefix}user-index:{identityHash}     set of session ids owned by an identity
 * </pre>
 */
public final class SessionKeys {

    private final String sessionNamespace;
    private final String transportNamespace;
    private final String userIndexNamespace;

    public SessionKeys(String keyPrefix) {
        this.sessionNamespace = keyPrefix + "session:";
        this.transportNamespace = keyPrefix + "transport:";
        this.userIndexNamespace = keyPrefix + "user-index:";
    }

    public String session(String scope, String sessionId) {
        return scopePrefix(scope) + sessionId;
    }

    public String scopePrefix(String scope) {
        return sessionNamespace + scope + ":";
    }

    public String sessionNamespace() {
        return sessionNamespace;
    }

    public String transport(String sessionId) {
        return transportNamespace + sessionId;
    }

    public String transportNamespace() {
        return transportNamespace;
    }

    public String userIndex(String identityHash) {
        return userIndexNamespace + identityHash;
    }

    public String userIndexNamespace() {
        return userIndexNamespace;
    }
}
