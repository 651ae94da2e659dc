package com.z254.lazarus.lock;

/**
 * Why an incident asks for a resource lock.
 */
public enum Admission {
    /** First attempt of a newly detected incident; may be coalesced when the queue is full */
    NEW,
    /** Follow-up attempt of an incident that was already admitted; always queues */
    RETRY
}
