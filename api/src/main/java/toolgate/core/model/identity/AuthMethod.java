package toolgate.core.model.identity;

/**
 * How a caller's identity was derived.
 */
public enum AuthMethod {
    JWT("jwt"),
    API_KEY("api_key"),
    ANONYMOUS("anonymous");

    private final String wireName;

    AuthMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
