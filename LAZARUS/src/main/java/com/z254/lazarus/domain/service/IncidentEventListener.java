package com.z254.lazarus.domain.service;

import com.z254.lazarus.domain.model.Incident;

/**
 * Receives incident lifecycle changes after they were audited and stored.
 */
public interface IncidentEventListener {

    void onIncidentEvent(Incident incident, String eventType);
}
