package toolgate.core.model.identity;

/**
 * Category of caller a session belongs to.
 */
public enum UserType {
    INDIVIDUAL("individual"),
    ORGANIZATION("organization"),
    SERVICE_ACCOUNT("service_account"),
    ANONYMOUS("anonymous"),
    AUTHENTICATED_USER("authenticated_user");

    private final String wireName;

    UserType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in identity hashes, client ids and diagnostics.
     */
    public String wireName() {
        return wireName;
    }
}
