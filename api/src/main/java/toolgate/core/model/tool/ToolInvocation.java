package toolgate.core.model.tool;

import toolgate.core.model.identity.UserType;

/**
 * A tool call completed against a session.
 *
 * @param sessionId the effective session id, which may differ from the one requested
 * @param userType  the caller's resolved user type
 * @param verb      the invoked tool
 * @param result    the handler's result
 */
public record ToolInvocation(String sessionId, UserType userType, String verb, ToolResult result) {}
