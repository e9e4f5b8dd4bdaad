package toolgate.core.model.session;

/**
 * Result of a session store mutation.
 */
public enum StoreOutcome {
    CREATED,
    ALREADY_PRESENT,
    UPDATED,
    DELETED,
    ABSENT;

    /**
     * Whether the targeted record existed when the operation ran.
     */
    public boolean found() {
        return this != ABSENT;
    }
}
