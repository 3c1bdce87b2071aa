package queuectl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queuectl.worker.LivenessRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Operator-facing queue operations: enqueue, inspection and dead letter handling.
 */
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    private final JobStore store;
    private final Config config;
    private final LivenessRegistry livenessRegistry;
    private final ObjectMapper objectMapper;

    public QueueService(JobStore store, Config config, LivenessRegistry livenessRegistry, ObjectMapper objectMapper) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.livenessRegistry = Objects.requireNonNull(livenessRegistry, "livenessRegistry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @throws InvalidJobException if the text is not a JSON object
     */
    public JobRequest parseRequest(String jobSpecJson) {
        if (jobSpecJson == null || jobSpecJson.isBlank()) {
            throw new InvalidJobException("Job spec must not be empty.");
        }
        try {
            JobRequest request = objectMapper.readValue(jobSpecJson, JobRequest.class);
            if (request == null) {
                throw new InvalidJobException("Job spec must be a JSON object.");
            }
            return request;
        } catch (JsonProcessingException e) {
            throw new InvalidJobException("Invalid JSON provided: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Validates and inserts a new pending job.
     *
     * @throws InvalidJobException   if the command is missing or the retry limit is not positive
     * @throws DuplicateJobException if the id is taken
     */
    public Job enqueue(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.command() == null || request.command().isBlank()) {
            throw new InvalidJobException("Job must contain a 'command' field.");
        }
        if (request.id() != null && request.id().isBlank()) {
            throw new InvalidJobException("Job 'id' must not be blank.");
        }

        int retryLimit;
        if (request.maxRetries() != null) {
            retryLimit = request.maxRetries();
        } else {
            config.reload();
            retryLimit = config.maxRetries();
        }
        if (retryLimit < 1) {
            throw new InvalidJobException("'max_retries' must be at least 1, got " + retryLimit + ".");
        }

        String id = request.id() != null ? request.id() : UUID.randomUUID().toString();
        Job job = store.insert(id, request.command(), retryLimit);
        log.debug("Enqueued {}", job);
        return job;
    }

    public List<Job> findJobsByState(JobState state) {
        return store.findByState(state);
    }

    /**
     * Jobs grouped by state, in lifecycle order.
     */
    public Map<JobState, List<Job>> listAll() {
        Map<JobState, List<Job>> all = new LinkedHashMap<>();
        for (JobState state : JobState.values()) {
            all.put(state, store.findByState(state));
        }
        return all;
    }

    public QueueSummary summary() {
        return new QueueSummary(store.countByState(), livenessRegistry.listAlive().size());
    }

    public List<Job> dlqJobs() {
        return store.findByState(JobState.DEAD);
    }

    /**
     * @throws JobNotInDlqException if the job does not exist or is not dead
     */
    public void retryDeadJob(String jobId) {
        if (!store.resurrect(jobId)) {
            throw new JobNotInDlqException(jobId);
        }
        log.info("Job '{}' moved from DLQ to 'pending' queue.", jobId);
    }
}
