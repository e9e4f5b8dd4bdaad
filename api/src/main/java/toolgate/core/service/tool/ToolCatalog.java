package toolgate.core.service.tool;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import toolgate.core.port.out.ToolHandler;

/**
 * Maps tool verbs to the handlers that answer them.
 */
@ApplicationScoped
public class ToolCatalog {

    private static final Logger LOG = Logger.getLogger(ToolCatalog.class);

    private final Map<String, ToolHandler> handlersByVerb;

    @Inject
    public ToolCatalog(Instance<ToolHandler> handlers) {
        this(handlers.stream().toList());
    }

    public ToolCatalog(Iterable<ToolHandler> handlers) {
        Map<String, ToolHandler> byVerb = new TreeMap<>();
        for (ToolHandler handler : handlers) {
            for (String verb : handler.verbs()) {
                ToolHandler previous = byVerb.putIfAbsent(verb, handler);
                if (previous != null) {
                    LOG.warnf(
                            "Tool %s offered by both %s and %s, keeping the first",
                            verb, previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
                }
            }
        }
        this.handlersByVerb = Collections.unmodifiableMap(byVerb);
    }

    public Optional<ToolHandler> find(String verb) {
        return Optional.ofNullable(handlersByVerb.get(verb));
    }

    public Set<String> verbs() {
        return handlersByVerb.keySet();
    }
}
