package email.agent.app.service;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What one poll cycle did for one user.
 */
@Value
public class PollSummary {
    public enum Status { SUCCESS, SKIPPED, ERROR }

    Status status;
    int processed;
    String reason;
    Map<ProcessingResult, Integer> outcomes;

    public static PollSummary success(Map<ProcessingResult, Integer> outcomes) {
        int processed = outcomes.values().stream().mapToInt(Integer::intValue).sum();
        return new PollSummary(Status.SUCCESS, processed, null, Collections.unmodifiableMap(new EnumMap<>(outcomes)));
    }

    public static PollSummary skipped(String reason) {
        return new PollSummary(Status.SKIPPED, 0, reason, Map.of());
    }

    public static PollSummary error(String reason) {
        return new PollSummary(Status.ERROR, 0, reason, Map.of());
    }

    public int count(ProcessingResult result) {
        return outcomes.getOrDefault(result, 0);
    }
}
