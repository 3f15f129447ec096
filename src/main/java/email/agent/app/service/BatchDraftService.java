package email.agent.app.service;

import email.agent.app.entity.BatchDraftJob;
import email.agent.app.entity.BatchJobStatus;
import email.agent.app.entity.Email;
import email.agent.app.repository.BatchDraftJobRepository;
import email.agent.app.repository.EmailRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Starts batch draft jobs and reports their progress.
 */
@Slf4j
@Service
public class BatchDraftService {
    private final BatchDraftJobRepository batchDraftJobRepository;
    private final EmailRepository emailRepository;
    private final DraftGenerationWorker draftGenerationWorker;
    private final int maxEmails;

    public BatchDraftService(
            BatchDraftJobRepository batchDraftJobRepository,
            EmailRepository emailRepository,
            DraftGenerationWorker draftGenerationWorker,
            @Value("${agent.batch.max-emails:20}") int maxEmails) {
        this.batchDraftJobRepository = batchDraftJobRepository;
        this.emailRepository = emailRepository;
        this.draftGenerationWorker = draftGenerationWorker;
        this.maxEmails = maxEmails;
    }

    /**
     * Validates the request, creates the job in PROCESSING and queues one work item per email.
     * Invalid requests throw {@link BatchDraftException} and create nothing.
     */
    public BatchDraftJob startBatch(String userId, List<String> emailIds) {
        if (emailIds == null || emailIds.isEmpty()) {
            throw new BatchDraftException("At least one email id is required");
        }
        Set<String> distinctIds = new LinkedHashSet<>(emailIds);
        if (distinctIds.size() > maxEmails) {
            throw new BatchDraftException("At most " + maxEmails + " emails can be drafted in one batch");
        }

        Set<String> ownedIds = emailRepository.findByUserIdAndIdIn(userId, distinctIds).stream()
            .map(Email::getId)
            .collect(Collectors.toSet());
        List<String> unknown = distinctIds.stream().filter(id -> !ownedIds.contains(id)).collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new BatchDraftException("Emails not found: " + String.join(", ", unknown));
        }

        BatchDraftJob job = new BatchDraftJob();
        job.setUserId(userId);
        job.setTotalEmails(distinctIds.size());
        job.setStatus(BatchJobStatus.PROCESSING);
        job.setEmailIds(new ArrayList<>(distinctIds));
        BatchDraftJob saved = batchDraftJobRepository.save(job);
        log.info("Started batch job {} for user {} with {} emails", saved.getId(), userId, distinctIds.size());

        // The job row is committed above, so workers can always find it
        for (String emailId : distinctIds) {
            draftGenerationWorker.generateDraftAsync(emailId, saved.getId());
        }
        return saved;
    }

    public BatchDraftJob getJob(String userId, String jobId) {
        return batchDraftJobRepository.findByIdAndUserId(jobId, userId)
            .orElseThrow(() -> new BatchJobNotFoundException(jobId));
    }
}
