package toolgate.adapter.out.tool;

import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import toolgate.core.model.tool.ToolErrorKind;
import toolgate.core.model.tool.ToolResult;
import toolgate.core.port.out.ToolHandler;

/**
 * Arithmetic tools: {@code calculator_add}, {@code calculator_subtract},
 * {@code calculator_multiply} and {@code calculator_divide}, each taking
 * numeric arguments {@code a} and {@code b}.
 */
@ApplicationScoped
public class CalculatorToolHandler implements ToolHandler {

    static final String ADD = "calculator_add";
    static final String SUBTRACT = "calculator_subtract";
    static final String MULTIPLY = "calculator_multiply";
    static final String DIVIDE = "calculator_divide";

    private static final Set<String> VERBS = Set.of(ADD, SUBTRACT, MULTIPLY, DIVIDE);

    @Override
    public Set<String> verbs() {
        return VERBS;
    }

    @Override
    public ToolResult invoke(String verb, Map<String, Object> arguments) {
        if (!VERBS.contains(verb)) {
            return ToolResult.error(ToolErrorKind.UNKNOWN_TOOL, "Unknown tool: " + verb);
        }
        Double a = number(arguments.get("a"));
        Double b = number(arguments.get("b"));
        if (a == null || b == null) {
            return ToolResult.error(ToolErrorKind.INVALID_ARGUMENTS, "Both arguments must be numbers.");
        }
        return switch (verb) {
            case ADD -> ToolResult.ok(a + b);
            case SUBTRACT -> ToolResult.ok(a - b);
            case MULTIPLY -> ToolResult.ok(a * b);
            default -> b == 0.0
                    ? ToolResult.error(ToolErrorKind.INVALID_ARGUMENTS, "Division by zero is not allowed.")
                    : ToolResult.ok(a / b);
        };
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
