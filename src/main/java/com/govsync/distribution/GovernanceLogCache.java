package com.govsync.distribution;

import com.govsync.bus.GovernanceLogEntry;
import com.govsync.bus.LogUpdateEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Client-side copy of governance log entries, kept current by applying delivered events.
 * Listings are newest first.
 */
public class GovernanceLogCache {

    private static final Comparator<GovernanceLogEntry> NEWEST_FIRST = Comparator
        .comparing((GovernanceLogEntry entry) -> entry.timestamp() != null ? entry.timestamp() : Instant.EPOCH)
        .reversed()
        .thenComparing(GovernanceLogEntry::id);

    private final Map<String, GovernanceLogEntry> entries = new ConcurrentHashMap<>();

    public void apply(LogUpdateEvent event) {
        GovernanceLogEntry entry = event.log();
        switch (event.type()) {
            case CREATED, UPDATED -> entries.put(entry.id(), entry);
            case DELETED -> entries.remove(entry.id());
        }
    }

    public void replaceAll(Collection<GovernanceLogEntry> snapshot) {
        entries.clear();
        snapshot.forEach(entry -> entries.put(entry.id(), entry));
    }

    public Optional<GovernanceLogEntry> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public List<GovernanceLogEntry> all() {
        return select(entry -> true);
    }

    /**
     * Case-insensitive substring match over summary, actor, entry type and the linked
     * project, phase, step and memory anchor ids. A blank term matches everything.
     */
    public List<GovernanceLogEntry> search(String term) {
        if (term == null || term.isBlank()) {
            return all();
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        return select(entry -> contains(entry.summary(), needle)
            || contains(entry.actor(), needle)
            || contains(entry.entryType().getValue(), needle)
            || contains(entry.projectId(), needle)
            || contains(entry.phaseId(), needle)
            || contains(entry.stepId(), needle)
            || contains(entry.memoryAnchorId(), needle));
    }

    public List<GovernanceLogEntry> byProject(String projectId) {
        return select(entry -> Objects.equals(projectId, entry.projectId()));
    }

    public List<GovernanceLogEntry> byPhase(String phaseId) {
        return select(entry -> Objects.equals(phaseId, entry.phaseId()));
    }

    public List<GovernanceLogEntry> byStep(String stepId) {
        return select(entry -> Objects.equals(stepId, entry.stepId()));
    }

    public int size() {
        return entries.size();
    }

    private List<GovernanceLogEntry> select(Predicate<GovernanceLogEntry> filter) {
        return entries.values().stream().filter(filter).sorted(NEWEST_FIRST).toList();
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
