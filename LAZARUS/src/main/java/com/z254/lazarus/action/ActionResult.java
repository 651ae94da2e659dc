package com.z254.lazarus.action;

/**
 * Result of running an action (or its dry run) against a resource.
 *
 * @param changed whether the resource state was modified
 */
public record ActionResult(boolean changed, String detail) {

    public static ActionResult changed(String detail) {
        return new ActionResult(true, detail);
    }

    public static ActionResult noOp(String detail) {
        return new ActionResult(false, detail);
    }
}
