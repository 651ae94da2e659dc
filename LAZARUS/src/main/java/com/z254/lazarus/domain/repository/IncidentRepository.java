package com.z254.lazarus.domain.repository;

import com.z254.lazarus.domain.model.Incident;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository abstraction for incident persistence.
 */
public interface IncidentRepository {

    /**
     * Persist the given incident. Existing incidents are replaced.
     */
    Incident save(Incident incident);

    /**
     * Apply a mutation atomically with respect to other updates of the same incident.
     *
     * @return the updated incident, or empty if no incident has the id
     */
    Optional<Incident> update(String id, UnaryOperator<Incident> mutation);

    /**
     * Look up an incident by ID.
     */
    Optional<Incident> findById(String id);

    /**
     * Incidents of a resource, oldest first.
     */
    List<Incident> findByResourceKey(String resourceKey);

    /**
     * Retrieve all incidents.
     */
    List<Incident> findAll();
}
