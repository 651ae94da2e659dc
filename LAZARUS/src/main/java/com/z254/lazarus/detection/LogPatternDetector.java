package com.z254.lazarus.detection;

import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Severity;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Event-driven detector over log lines. Lines fed through {@link #accept(String)} that match the
 * pattern are buffered; the next probe drains the buffer into one failure.
 */
public class LogPatternDetector implements Detector {

    public static final String KIND = "log_pattern";

    private final String id;
    private final String resourceKey;
    private final String faultKind;
    private final Pattern pattern;
    private final Severity severity;
    private final Duration pollInterval;
    private final int maxBuffered;
    private final Deque<String> matches = new ArrayDeque<>();
    private long dropped;

    public LogPatternDetector(String id, String resourceKey, String faultKind, String regex, Severity severity,
                              Duration pollInterval, int maxBuffered) {
        this.id = id;
        this.resourceKey = resourceKey;
        this.faultKind = faultKind;
        this.pattern = Pattern.compile(regex);
        this.severity = severity;
        this.pollInterval = pollInterval;
        this.maxBuffered = maxBuffered;
    }

    /**
     * Offer one log line.
     *
     * @return true if the line matched
     */
    public boolean accept(String line) {
        if (line == null || !pattern.matcher(line).find()) {
            return false;
        }
        synchronized (matches) {
            if (matches.size() >= maxBuffered) {
                matches.removeFirst();
                dropped++;
            }
            matches.addLast(line);
        }
        return true;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public String targetResourceKey() {
        return resourceKey;
    }

    @Override
    public Optional<Failure> probe() {
        String first;
        String last;
        int count;
        long droppedLines;
        synchronized (matches) {
            if (matches.isEmpty()) {
                return Optional.empty();
            }
            first = matches.peekFirst();
            last = matches.peekLast();
            count = matches.size();
            droppedLines = dropped;
            matches.clear();
            dropped = 0;
        }
        return Optional.of(Failure.builder()
                .detectorId(id)
                .resourceKey(resourceKey)
                .kind(faultKind)
                .severity(severity)
                .context(Map.of(
                        "pattern", pattern.pattern(),
                        "matches", String.valueOf(count + droppedLines),
                        "firstLine", first,
                        "lastLine", last))
                .build());
    }
}
