package dev.agentlink.client;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregate index of one kind of item across every connected server, keyed by (server, name).
 * When several servers offer the same name, lookups resolve to the one registered first.
 */
class CapabilityCatalog<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityCatalog.class);

    private final String kind;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Key, Slot<T>> entries = new ConcurrentHashMap<>();

    CapabilityCatalog(String kind) {
        this.kind = kind;
    }

    /**
     * Adds everything one connection discovered.
     */
    void addAll(Connection owner, List<T> descriptors, Function<T, String> naming) {
        for (T descriptor : descriptors) {
            String name = naming.apply(descriptor);
            find(name).ifPresent(existing -> LOGGER.warn(
                "{} {} is offered by both {} and {}; calls resolve to {}",
                kind, name, existing.serverName(), owner.serverName(), existing.serverName()));
            entries.put(new Key(owner, name),
                new Slot<>(sequence.incrementAndGet(), owner, new CatalogEntry<>(owner.serverName(), name, descriptor)));
        }
    }

    /**
     * Removes every entry owned by {@code owner}. Entries of a newer connection under the same
     * server name are kept.
     */
    void purge(Connection owner) {
        entries.keySet().removeIf(key -> key.owner() == owner);
    }

    Optional<CatalogEntry<T>> find(String name) {
        return lookup(name).map(Slot::entry);
    }

    Optional<Connection> owner(String name) {
        return lookup(name).map(Slot::owner);
    }

    List<CatalogEntry<T>> snapshot() {
        List<Slot<T>> slots = new ArrayList<>(entries.values());
        slots.sort(Comparator.comparingLong(Slot::sequence));
        List<CatalogEntry<T>> result = new ArrayList<>(slots.size());
        for (Slot<T> slot : slots) {
            result.add(slot.entry());
        }
        return result;
    }

    int size() {
        return entries.size();
    }

    private Optional<Slot<T>> lookup(String name) {
        Slot<T> first = null;
        for (Map.Entry<Key, Slot<T>> candidate : entries.entrySet()) {
            if (candidate.getKey().name().equals(name)
                && (first == null || candidate.getValue().sequence() < first.sequence())) {
                first = candidate.getValue();
            }
        }
        return Optional.ofNullable(first);
    }

    private record Key(Connection owner, String name) {
    }

    private record Slot<T>(long sequence, Connection owner, CatalogEntry<T> entry) {
    }
}
