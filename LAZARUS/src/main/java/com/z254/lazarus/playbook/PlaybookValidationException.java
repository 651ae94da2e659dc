package com.z254.lazarus.playbook;

import com.z254.lazarus.common.LazarusException;

import java.util.List;

/**
 * Raised when a playbook document or publication is rejected.
 */
public class PlaybookValidationException extends LazarusException {

    private final String playbookId;
    private final List<String> violations;

    public PlaybookValidationException(String playbookId, List<String> violations) {
        super("Playbook " + playbookId + " rejected: " + String.join("; ", violations));
        this.playbookId = playbookId;
        this.violations = List.copyOf(violations);
    }

    public PlaybookValidationException(String playbookId, String violation) {
        this(playbookId, List.of(violation));
    }

    public String getPlaybookId() {
        return playbookId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
