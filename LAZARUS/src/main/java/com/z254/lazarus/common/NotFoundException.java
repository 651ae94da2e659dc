package com.z254.lazarus.common;

/**
 * Raised when an incident, playbook, ticket or detector id is unknown.
 */
public class NotFoundException extends LazarusException {

    public NotFoundException(String type, String id) {
        super(type + " not found: " + id);
    }
}
