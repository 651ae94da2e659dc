package com.z254.lazarus.domain.repository;

import com.z254.lazarus.domain.model.Incident;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory incident store. Terminal incidents are kept, flagged archived.
 */
@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private static final Comparator<Incident> BY_DETECTION = Comparator
            .comparing(Incident::getDetectedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Incident::getId);

    private final Map<String, Incident> store = new ConcurrentHashMap<>();

    @Override
    public Incident save(Incident incident) {
        store.put(incident.getId(), incident);
        return incident;
    }

    @Override
    public Optional<Incident> update(String id, UnaryOperator<Incident> mutation) {
        return Optional.ofNullable(store.computeIfPresent(id, (key, incident) -> mutation.apply(incident)));
    }

    @Override
    public Optional<Incident> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<Incident> findByResourceKey(String resourceKey) {
        return store.values().stream()
                .filter(incident -> resourceKey.equals(incident.getResourceKey()))
                .sorted(BY_DETECTION)
                .toList();
    }

    @Override
    public List<Incident> findAll() {
        List<Incident> all = new ArrayList<>(store.values());
        all.sort(BY_DETECTION);
        return all;
    }
}
