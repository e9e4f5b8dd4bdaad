package toolgate.adapter.out.storage.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.port.out.SessionBackend;

/**
 * Redis implementation of {@link SessionBackend}.
 *
 * <p>Values are plain strings with native Redis TTLs; user indexes are Redis sets.
 * Insert-if-absent uses {@code SET key value NX EX ttl} so creation and expiry are
 * a single command.
 */
public class RedisSessionBackend implements SessionBackend {

    private static final Logger LOG = Logger.getLogger(RedisSessionBackend.class);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSessionBackend(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.setCommands = redisDataSource.set(String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Uni<Void> setex(String key, Duration ttl, String value) {
        return timeoutHelper.withTimeout(valueCommands.setex(key, seconds(ttl), value), "setex");
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, Duration ttl, String value) {
        var operation = redisDataSource
                .execute("SET", key, value, "NX", "EX", String.valueOf(seconds(ttl)))
                .map(response -> {
                    // SET ... NX replies nil when the key already exists
                    boolean stored = response != null;
                    if (!stored) {
                        LOG.debugf("Key already present in Redis: %s", key);
                    }
                    return stored;
                });
        return timeoutHelper.withTimeout(operation, "setIfAbsent");
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return timeoutHelper.withTimeout(valueCommands.get(key).map(Optional::ofNullable), "get");
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return timeoutHelper.withTimeout(keyCommands.del(key).map(count -> count != null && count > 0), "delete");
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return timeoutHelper.withTimeout(
                keyCommands.expire(key, seconds(ttl)).map(Boolean.TRUE::equals), "expire");
    }

    @Override
    public Uni<Void> addToSet(String key, String member) {
        return timeoutHelper.withTimeout(setCommands.sadd(key, member).replaceWithVoid(), "addToSet");
    }

    @Override
    public Uni<Void> removeFromSet(String key, String member) {
        return timeoutHelper.withTimeout(setCommands.srem(key, member).replaceWithVoid(), "removeFromSet");
    }

    @Override
    public Uni<Set<String>> members(String key) {
        return timeoutHelper.withTimeout(
                setCommands.smembers(key).map(members -> members != null ? Set.copyOf(members) : Set.<String>of()),
                "members");
    }

    @Override
    public Uni<List<String>> keys(String prefix) {
        return timeoutHelper.withTimeout(
                keyCommands.keys(prefix + "*").map(keys -> keys != null ? keys : List.<String>of()), "keys");
    }

    @Override
    public Uni<Boolean> ping() {
        var operation = redisDataSource
                .execute("PING")
                .map(response -> response != null && "PONG".equalsIgnoreCase(response.toString()));
        return timeoutHelper.withTimeoutFallback(operation, "ping", () -> false);
    }

    private static long seconds(Duration ttl) {
        // Redis rejects non-positive expiries
        return Math.max(1, ttl.toSeconds());
    }
}
