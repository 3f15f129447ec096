package email.agent.app.service;

import email.agent.app.entity.ActivityType;
import email.agent.app.entity.BatchDraftJob;
import email.agent.app.repository.BatchDraftJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies one finished item to its job's counters. Increments and the completion
 * flip are single SQL updates, so concurrent items never lose a count and exactly
 * one of them observes the transition to COMPLETED.
 */
@Slf4j
@Service
public class BatchJobProgressService {
    private final BatchDraftJobRepository batchDraftJobRepository;
    private final ActivityService activityService;

    public BatchJobProgressService(BatchDraftJobRepository batchDraftJobRepository, ActivityService activityService) {
        this.batchDraftJobRepository = batchDraftJobRepository;
        this.activityService = activityService;
    }

    /**
     * @return true if this item completed the job
     */
    @Transactional
    public boolean recordOutcome(String jobId, BatchItemOutcome outcome) {
        int updated = outcome.countsAsCompleted()
            ? batchDraftJobRepository.incrementCompleted(jobId)
            : batchDraftJobRepository.incrementFailed(jobId);
        if (updated == 0) {
            log.warn("Batch job {} not found while recording email {}", jobId, outcome.getEmailId());
            return false;
        }

        if (batchDraftJobRepository.markCompletedIfDone(jobId) == 0) {
            return false;
        }

        BatchDraftJob job = batchDraftJobRepository.findById(jobId).orElseThrow(() -> new BatchJobNotFoundException(jobId));
        log.info("Batch job {} completed: {} drafted, {} failed of {}",
            jobId, job.getCompletedEmails(), job.getFailedEmails(), job.getTotalEmails());
        activityService.log(job.getUserId(), ActivityType.BATCH_COMPLETED,
            String.format("Batch draft generation finished: %d completed, %d failed",
                job.getCompletedEmails(), job.getFailedEmails()),
            null, null, null);
        return true;
    }
}
