package toolgate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session recovery budgets.
 *
 * <p>Configuration prefix: {@code toolgate.recovery}
 *
 * @see toolgate.core.service.recovery.RecoveryOrchestrator
 */
@ConfigMapping(prefix = "toolgate.recovery")
public interface RecoveryConfig {

    /**
     * Maximum recovery attempts per session id within one cooldown window.
     *
     * @return attempt budget (default: 3)
     */
    @WithDefault("3")
    int maxAttempts();

    /**
     * Time without attempts after which a session's counter resets.
     * Counters idle for twice this long are discarded.
     *
     * @return cooldown (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration cooldown();

    /**
     * How often idle counters are swept.
     *
     * @return sweep interval (default: 1 hour)
     */
    @WithDefault("1h")
    String cleanupInterval();
}
