package toolgate.core.model.tool;

/**
 * Error categories a tool handler can report.
 */
public enum ToolErrorKind {
    INVALID_ARGUMENTS,
    UNKNOWN_TOOL,
    EXECUTION_FAILED
}
