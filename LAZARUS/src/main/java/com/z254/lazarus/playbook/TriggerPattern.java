package com.z254.lazarus.playbook;

import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Severity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Predicate deciding whether a playbook applies to a failure.
 * <p>
 * All regular expressions must match the whole value. Every configured part must match:
 * <ul>
 *     <li>kind - regex over the failure kind (required)</li>
 *     <li>resource - regex over the resource key</li>
 *     <li>context - per context key, regex over its value (a missing key never matches)</li>
 *     <li>minimum severity</li>
 * </ul>
 */
public final class TriggerPattern {

    private final String kind;
    private final String resource;
    private final Map<String, String> context;
    private final Severity minSeverity;

    private final Pattern kindPattern;
    private final Pattern resourcePattern;
    private final Map<String, Pattern> contextPatterns;

    private TriggerPattern(String kind, String resource, Map<String, String> context, Severity minSeverity) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.resource = resource;
        this.context = context == null ? Map.of() : Map.copyOf(context);
        this.minSeverity = minSeverity;
        this.kindPattern = Pattern.compile(kind);
        this.resourcePattern = resource == null ? null : Pattern.compile(resource);
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        this.context.forEach((key, regex) -> compiled.put(key, Pattern.compile(regex)));
        this.contextPatterns = compiled;
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if any expression does not compile
     */
    public static TriggerPattern of(String kind, String resource, Map<String, String> context, Severity minSeverity) {
        return new TriggerPattern(kind, resource, context, minSeverity);
    }

    public static TriggerPattern kind(String kindRegex) {
        return new TriggerPattern(kindRegex, null, null, null);
    }

    public boolean matches(Failure failure) {
        if (failure.getKind() == null || !kindPattern.matcher(failure.getKind()).matches()) {
            return false;
        }
        if (resourcePattern != null && (failure.getResourceKey() == null
                || !resourcePattern.matcher(failure.getResourceKey()).matches())) {
            return false;
        }
        if (minSeverity != null && !failure.getSeverity().isAtLeast(minSeverity)) {
            return false;
        }
        for (Map.Entry<String, Pattern> entry : contextPatterns.entrySet()) {
            String value = failure.getContext().get(entry.getKey());
            if (value == null || !entry.getValue().matcher(value).matches()) {
                return false;
            }
        }
        return true;
    }

    public String getKind() {
        return kind;
    }

    public String getResource() {
        return resource;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public Severity getMinSeverity() {
        return minSeverity;
    }

    @Override
    public String toString() {
        return "TriggerPattern{kind=" + kind + ", resource=" + resource + ", context=" + context
                + ", minSeverity=" + minSeverity + "}";
    }
}
