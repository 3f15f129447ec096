package email.agent.app.service;

import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.services.gmail.model.Message;
import email.agent.app.entity.Email;
import email.agent.app.entity.GmailAccount;
import email.agent.app.entity.SyncStatus;
import email.agent.app.entity.User;
import email.agent.app.entity.UserSettings;
import email.agent.app.message.InboundMessage;
import email.agent.app.repository.EmailRepository;
import email.agent.app.repository.GmailAccountRepository;
import email.agent.app.repository.UserRepository;
import email.agent.app.repository.UserSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Polls connected mailboxes and feeds new messages through the reply pipeline.
 * Each user is polled on the processing executor under a database lock, so
 * several nodes can run the schedule without polling the same mailbox twice.
 */
@Slf4j
@Service
public class EmailProcessingService {
    private final GmailApiService gmailApiService;
    private final EmailRepository emailRepository;
    private final UserRepository userRepository;
    private final UserSettingsRepository userSettingsRepository;
    private final GmailAccountRepository gmailAccountRepository;
    private final TokenRefreshService tokenRefreshService;
    private final DistributedLockService distributedLockService;
    private final EmailProcessorFactory emailProcessorFactory;
    private final Executor executor;

    public EmailProcessingService(
            GmailApiService gmailApiService,
            EmailRepository emailRepository,
            UserRepository userRepository,
            UserSettingsRepository userSettingsRepository,
            GmailAccountRepository gmailAccountRepository,
            TokenRefreshService tokenRefreshService,
            DistributedLockService distributedLockService,
            EmailProcessorFactory emailProcessorFactory,
            @Qualifier("emailProcessingExecutor") Executor executor) {
        this.gmailApiService = gmailApiService;
        this.emailRepository = emailRepository;
        this.userRepository = userRepository;
        this.userSettingsRepository = userSettingsRepository;
        this.gmailAccountRepository = gmailAccountRepository;
        this.tokenRefreshService = tokenRefreshService;
        this.distributedLockService = distributedLockService;
        this.emailProcessorFactory = emailProcessorFactory;
        this.executor = executor;
    }

    @Scheduled(fixedDelayString = "${agent.poll.interval-ms:60000}", initialDelayString = "${agent.poll.initial-delay-ms:30000}")
    public void pollAllUsers() {
        log.info("Mailbox poll started");
        try {
            List<CompletableFuture<PollSummary>> futures = new ArrayList<>();
            for (User user : userRepository.findActiveWithGmailAccount()) {
                futures.add(CompletableFuture.supplyAsync(() -> pollUser(user), executor)
                    .exceptionally(ex -> {
                        log.error("Error polling mailbox of user {}: {}", user.getId(), ex.getMessage(), ex);
                        return PollSummary.error(ex.getMessage());
                    }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (Exception e) {
            log.error("Error in scheduled mailbox poll: {}", e.getMessage(), e);
        }
        log.info("Mailbox poll ended");
    }

    /**
     * Manually trigger a poll for one user (webhook / admin). Runs on the calling thread.
     */
    public PollSummary pollUserNow(String userId) {
        User user = userRepository.findById(userId)
            .orElseThrow(() -> new IllegalArgumentException("User not found: " + userId));
        return pollUser(user);
    }

    public PollSummary pollUser(User user) {
        GmailAccount account = user.getGmailAccount();
        if (account == null || account.getToken() == null || account.getToken().getAccessToken() == null) {
            log.debug("User {} has no connected Gmail account, skipping", user.getId());
            return PollSummary.skipped("no_gmail_account");
        }
        if (account.getSyncStatus() == SyncStatus.EXPIRED) {
            log.debug("Gmail account {} needs to be reconnected, skipping", account.getEmailAddress());
            return PollSummary.skipped("token_expired");
        }

        String lockKey = user.getId();
        if (!distributedLockService.tryLock(lockKey)) {
            log.debug("User {} is already being polled by another node, skipping", user.getId());
            return PollSummary.skipped("locked");
        }
        try {
            return pollMailbox(user, account);
        } finally {
            distributedLockService.releaseLock(lockKey);
        }
    }

    private PollSummary pollMailbox(User user, GmailAccount account) {
        Optional<UserSettings> settings = userSettingsRepository.findByUserId(user.getId());
        if (settings.isEmpty()) {
            log.error("User {} has no settings, not processing mail", user.getId());
            return PollSummary.error("no_settings");
        }

        String address = account.getEmailAddress();
        try {
            String accessToken = tokenRefreshService.ensureValidAccessToken(account);

            // Read the cursor first; anything arriving during the cycle is fetched again next time and deduplicated
            String historyId;
            List<Message> messages;
            try {
                historyId = gmailApiService.getCurrentHistoryId(accessToken, address);
                messages = gmailApiService.fetchNewEmails(accessToken, address, account.getLastHistoryId());
            } catch (GoogleJsonResponseException e) {
                if (e.getStatusCode() != 401) {
                    throw e;
                }
                log.info("Received 401 for account {}, refreshing token and retrying", address);
                accessToken = tokenRefreshService.refreshTokenOn401(account);
                historyId = gmailApiService.getCurrentHistoryId(accessToken, address);
                messages = gmailApiService.fetchNewEmails(accessToken, address, account.getLastHistoryId());
            }
            log.info("Emails to process count {} for {}", messages.size(), address);

            EmailProcessor processor = emailProcessorFactory.create(user, account, accessToken);
            Map<ProcessingResult, Integer> outcomes = new EnumMap<>(ProcessingResult.class);

            // Stored by an earlier cycle but not resolved; the history cursor has already moved past them
            for (Email pending : emailRepository.findByUserIdAndProcessedFalse(user.getId())) {
                try {
                    log.info("Retrying unprocessed email {} for {}", pending.getGmailId(), address);
                    ProcessingResult result = processor.processEmail(InboundMessage.fromEmail(pending), settings.get());
                    outcomes.merge(result, 1, Integer::sum);
                } catch (Exception e) {
                    log.error("Failed to retry email {} for account {}: {}", pending.getGmailId(), address, e.getMessage(), e);
                }
            }

            for (Message message : messages) {
                try {
                    InboundMessage inbound = gmailApiService.toInboundMessage(message);
                    if (!storeIfNew(user, inbound)) {
                        continue;
                    }
                    ProcessingResult result = processor.processEmail(inbound, settings.get());
                    outcomes.merge(result, 1, Integer::sum);
                } catch (Exception e) {
                    // Continue with next email
                    log.error("Failed to process email {} for account {}: {}", message.getId(), address, e.getMessage(), e);
                }
            }

            if (historyId != null) {
                account.setLastHistoryId(historyId);
            }
            account.setLastPolledAt(Instant.now());
            gmailAccountRepository.save(account);
            return PollSummary.success(outcomes);
        } catch (Exception e) {
            log.error("Error polling emails for account {}: {}", address, e.getMessage(), e);
            return PollSummary.error(e.getMessage());
        }
    }

    /**
     * Stores a newly seen message. Returns false when it is already stored; unprocessed
     * stored messages are retried from the database at the start of the cycle.
     */
    private boolean storeIfNew(User user, InboundMessage inbound) {
        if (emailRepository.findByUserIdAndGmailId(user.getId(), inbound.getGmailId()).isPresent()) {
            return false;
        }

        Email email = new Email();
        email.setUser(user);
        email.setGmailId(inbound.getGmailId());
        email.setThreadId(inbound.getThreadId());
        email.setMessageId(inbound.getMessageId());
        email.setFromEmail(inbound.getFromEmail());
        email.setFromName(inbound.getFromName());
        email.setToEmails(new ArrayList<>(inbound.getToEmails()));
        email.setCcEmails(new ArrayList<>(inbound.getCcEmails()));
        email.setSubject(inbound.getSubject());
        email.setSnippet(inbound.getSnippet());
        email.setBodyText(inbound.getBodyText());
        email.setBodyHtml(inbound.getBodyHtml());
        email.setReceivedAt(inbound.getReceivedAt());
        emailRepository.save(email);
        return true;
    }
}
