package email.agent.app.service;

import email.agent.app.entity.Draft;
import email.agent.app.entity.Email;
import email.agent.app.entity.UserSettings;
import email.agent.app.message.InboundMessage;
import email.agent.app.repository.EmailRepository;
import email.agent.app.repository.UserSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Generates the draft for one email of a batch job and reports it to the job.
 */
@Slf4j
@Service
public class DraftGenerationWorker {
    private final EmailRepository emailRepository;
    private final UserSettingsRepository userSettingsRepository;
    private final DraftService draftService;
    private final EmailProcessorFactory emailProcessorFactory;
    private final BatchJobProgressService batchJobProgressService;

    public DraftGenerationWorker(
            EmailRepository emailRepository,
            UserSettingsRepository userSettingsRepository,
            DraftService draftService,
            EmailProcessorFactory emailProcessorFactory,
            BatchJobProgressService batchJobProgressService) {
        this.emailRepository = emailRepository;
        this.userSettingsRepository = userSettingsRepository;
        this.draftService = draftService;
        this.emailProcessorFactory = emailProcessorFactory;
        this.batchJobProgressService = batchJobProgressService;
    }

    @Async("emailProcessingExecutor")
    public CompletableFuture<BatchItemOutcome> generateDraftAsync(String emailId, String jobId) {
        return CompletableFuture.completedFuture(generateDraft(emailId, jobId));
    }

    /**
     * Never throws; every path reports exactly one outcome to the job.
     */
    public BatchItemOutcome generateDraft(String emailId, String jobId) {
        BatchItemOutcome outcome = draftFor(emailId);
        try {
            batchJobProgressService.recordOutcome(jobId, outcome);
        } catch (Exception e) {
            log.error("Failed to record batch progress for job {} email {}: {}", jobId, emailId, e.getMessage(), e);
        }
        return outcome;
    }

    private BatchItemOutcome draftFor(String emailId) {
        try {
            Optional<Email> found = emailRepository.findByIdWithUser(emailId);
            if (found.isEmpty()) {
                return BatchItemOutcome.failed(emailId, "email_not_found");
            }
            Email email = found.get();

            Optional<Draft> existing = draftService.findActiveDraft(email);
            if (existing.isPresent()) {
                log.debug("Email {} already has draft {}, skipping", emailId, existing.get().getId());
                return BatchItemOutcome.skipped(emailId, existing.get().getId());
            }

            String userId = email.getUser().getId();
            Optional<UserSettings> settings = userSettingsRepository.findByUserId(userId);
            if (settings.isEmpty()) {
                log.error("User {} has no settings, cannot draft email {}", userId, emailId);
                return BatchItemOutcome.failed(emailId, "no_settings");
            }

            Draft draft = emailProcessorFactory.createForDrafting(userId)
                .generateDraftOnly(InboundMessage.fromEmail(email), settings.get());
            log.info("Generated draft {} for email {}", draft.getId(), emailId);
            return BatchItemOutcome.drafted(emailId, draft.getId());
        } catch (Exception e) {
            log.error("Error generating draft for email {}: {}", emailId, e.getMessage(), e);
            return BatchItemOutcome.failed(emailId, e.getMessage());
        }
    }
}
