package toolgate.core.port.out;

import java.util.Map;
import java.util.Set;

import toolgate.core.model.tool.ToolResult;

/**
 * A group of tools reachable through the front door.
 *
 * <p>Handlers report errors through {@link ToolResult}; they do not throw for
 * bad input.
 */
public interface ToolHandler {

    /**
     * Verbs this handler answers.
     */
    Set<String> verbs();

    ToolResult invoke(String verb, Map<String, Object> arguments);
}
