package toolgate.core.model.recovery;

import toolgate.core.model.transport.TransportHandle;

/**
 * Successful recovery result.
 *
 * @param sessionId the recovered session id
 * @param stage     the stage that completed recovery
 * @param handle    the live transport now serving the session
 * @param attempt   the attempt counter after admission
 */
public record RecoveryOutcome(String sessionId, RecoveryStage stage, TransportHandle handle, int attempt) {}
