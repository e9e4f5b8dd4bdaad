package toolgate.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.port.out.SessionBackend;

/**
 * In-memory implementation of {@link SessionBackend}.
 *
 * <p>Intended for development and testing only. Data is lost on restart and not
 * shared across instances, so recovery across processes cannot be exercised with it.
 *
 * <p>Expiry follows Redis semantics: values written with {@link #setex} expire,
 * sets created by {@link #addToSet} do not until {@link #expire} is called, and
 * a set whose last member is removed disappears.
 */
public class InMemorySessionBackend implements SessionBackend {

    private static final Logger LOG = Logger.getLogger(InMemorySessionBackend.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    /**
     * Create a backend without a background sweep. Expired entries are still
     * invisible to readers; they are only reclaimed by {@link #purgeExpired()}.
     */
    public InMemorySessionBackend(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = null;
    }

    public InMemorySessionBackend(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-backend-cleanup");
            t.setDaemon(true);
            return t;
        });
        long periodMillis = Math.max(1, cleanupInterval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(this::purgeExpired, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<Void> setex(String key, Duration ttl, String value) {
        return Uni.createFrom().item(() -> {
            entries.put(key, Entry.value(value, clock.instant().plus(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, Duration ttl, String value) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            AtomicBoolean stored = new AtomicBoolean(false);
            entries.compute(key, (k, existing) -> {
                if (existing != null && existing.isLive(now)) {
                    return existing;
                }
                stored.set(true);
                return Entry.value(value, now.plus(ttl));
            });
            return stored.get();
        });
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> live(key).map(Entry::value));
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            Entry removed = entries.remove(key);
            return removed != null && removed.isLive(clock.instant());
        });
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            AtomicBoolean updated = new AtomicBoolean(false);
            entries.computeIfPresent(key, (k, existing) -> {
                if (!existing.isLive(now)) {
                    return null;
                }
                updated.set(true);
                return existing.expiringAt(now.plus(ttl));
            });
            return updated.get();
        });
    }

    @Override
    public Uni<Void> addToSet(String key, String member) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            entries.compute(key, (k, existing) -> {
                if (existing == null || !existing.isLive(now) || existing.members() == null) {
                    return Entry.set(Set.of(member), null);
                }
                Set<String> members = new HashSet<>(existing.members());
                members.add(member);
                return Entry.set(members, existing.expiresAt());
            });
            return null;
        });
    }

    @Override
    public Uni<Void> removeFromSet(String key, String member) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            entries.computeIfPresent(key, (k, existing) -> {
                if (!existing.isLive(now) || existing.members() == null) {
                    return existing.isLive(now) ? existing : null;
                }
                Set<String> members = new HashSet<>(existing.members());
                members.remove(member);
                return members.isEmpty() ? null : Entry.set(members, existing.expiresAt());
            });
            return null;
        });
    }

    @Override
    public Uni<Set<String>> members(String key) {
        return Uni.createFrom().item(() -> live(key)
                .map(Entry::members)
                .<Set<String>>map(Set::copyOf)
                .orElse(Set.of()));
    }

    @Override
    public Uni<List<String>> keys(String prefix) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            return entries.entrySet().stream()
                    .filter(e -> e.getKey().startsWith(prefix))
                    .filter(e -> e.getValue().isLive(now))
                    .map(java.util.Map.Entry::getKey)
                    .sorted()
                    .toList();
        });
    }

    @Override
    public Uni<Boolean> ping() {
        return Uni.createFrom().item(true);
    }

    /**
     * Remove expired entries.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !e.getValue().isLive(now));
        int removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Purged %d expired session backend entries", removed);
        }
        return Math.max(removed, 0);
    }

    /**
     * Number of stored entries, including expired ones not yet purged.
     */
    public int size() {
        return entries.size();
    }

    public void shutdown() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdown();
        }
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null || !entry.isLive(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * A stored string value or set. Exactly one of {@code value} and {@code members}
     * is non-null; a null {@code expiresAt} never expires.
     */
    private record Entry(String value, Set<String> members, Instant expiresAt) {

        static Entry value(String value, Instant expiresAt) {
            return new Entry(value, null, expiresAt);
        }

        static Entry set(Set<String> members, Instant expiresAt) {
            return new Entry(null, Set.copyOf(members), expiresAt);
        }

        boolean isLive(Instant now) {
            return expiresAt == null || now.isBefore(expiresAt);
        }

        Entry expiringAt(Instant expiresAt) {
            return new Entry(value, members, expiresAt);
        }
    }
}
