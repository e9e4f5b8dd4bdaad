package toolgate.core.model.tool;

/**
 * Result of a tool invocation: either a value or an error kind with a message.
 */
public record ToolResult(Object value, ToolErrorKind errorKind, String message) {

    public static ToolResult ok(Object value) {
        return new ToolResult(value, null, null);
    }

    public static ToolResult error(ToolErrorKind kind, String message) {
        return new ToolResult(null, kind, message);
    }

    public boolean isError() {
        return errorKind != null;
    }
}
