package queuectl;

import java.util.Map;

public record QueueSummary(Map<JobState, Integer> counts, int activeWorkers) {

    public int count(JobState state) {
        return counts.getOrDefault(state, 0);
    }
}
