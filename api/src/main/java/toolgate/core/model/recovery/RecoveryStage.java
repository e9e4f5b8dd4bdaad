package toolgate.core.model.recovery;

/**
 * Stage at which a recovery completed.
 */
public enum RecoveryStage {
    /** A live transport was already bound. */
    ALREADY_LIVE,
    /** The application session existed; a new transport was bound to it. */
    REATTACHED,
    /** Neither existed; a recovered application session and a new transport were created. */
    REBUILT
}
