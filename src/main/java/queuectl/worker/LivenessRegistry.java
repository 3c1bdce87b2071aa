package queuectl.worker;

import java.util.Set;

public interface LivenessRegistry {

    void register(long pid, int ordinal);

    void deregister(long pid);

    /**
     * Live entries only. Stale entries found during the scan are pruned as a side effect.
     */
    Set<Long> listAlive();

    /**
     * Removes entries whose process is gone.
     *
     * @return the pruned process ids
     */
    Set<Long> pruneStale();
}
