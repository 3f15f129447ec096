package email.agent.app.service;

import email.agent.app.entity.ActivityType;
import email.agent.app.entity.Draft;
import email.agent.app.entity.DraftStatus;
import email.agent.app.entity.Email;
import email.agent.app.entity.GmailAccount;
import email.agent.app.repository.DraftRepository;
import email.agent.app.repository.GmailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Sends drafts the user approved. Only an APPROVED draft is sent, so a draft can't go out twice.
 */
@Slf4j
@Service
public class DraftSendService {
    private final DraftRepository draftRepository;
    private final GmailAccountRepository gmailAccountRepository;
    private final TokenRefreshService tokenRefreshService;
    private final GmailApiService gmailApiService;
    private final ActivityService activityService;

    public DraftSendService(
            DraftRepository draftRepository,
            GmailAccountRepository gmailAccountRepository,
            TokenRefreshService tokenRefreshService,
            GmailApiService gmailApiService,
            ActivityService activityService) {
        this.draftRepository = draftRepository;
        this.gmailAccountRepository = gmailAccountRepository;
        this.tokenRefreshService = tokenRefreshService;
        this.gmailApiService = gmailApiService;
        this.activityService = activityService;
    }

    public DraftSendResult sendApprovedDraft(String userId, String draftId) {
        Optional<Draft> found = draftRepository.findByIdWithEmailAndUser(draftId);
        if (found.isEmpty() || !userId.equals(found.get().getUser().getId())) {
            return DraftSendResult.rejected(draftId, "draft_not_found");
        }
        Draft draft = found.get();
        if (draft.getStatus() != DraftStatus.APPROVED) {
            log.debug("Draft {} is {}, not sending", draftId, draft.getStatus());
            return DraftSendResult.rejected(draftId, "invalid_status_" + draft.getStatus().name().toLowerCase());
        }

        Optional<GmailAccount> account = gmailAccountRepository.findByUserId(userId);
        if (account.isEmpty()) {
            return DraftSendResult.rejected(draftId, "no_gmail_account");
        }

        try {
            String accessToken = tokenRefreshService.ensureValidAccessToken(account.get());
            Email email = draft.getEmail();
            OutgoingMessage message = OutgoingMessage.builder()
                .from(account.get().getEmailAddress())
                .to(new ArrayList<>(draft.getToEmails()))
                .subject(draft.getSubject())
                .body(draft.getBodyText())
                .inReplyTo(email.getMessageId())
                .threadId(email.getThreadId())
                .build();
            String messageId = gmailApiService.sendMessage(accessToken, account.get().getEmailAddress(), message);

            draft.setStatus(DraftStatus.SENT);
            draft.setSentAt(Instant.now());
            draftRepository.save(draft);
            activityService.log(userId, ActivityType.EMAIL_SENT, "Sent approved response to " + String.join(", ", draft.getToEmails()),
                email.getId(), draft.getId(), draft.getMatchedRuleId());
            log.info("Sent approved draft {} as message {}", draftId, messageId);
            return DraftSendResult.sent(draftId, messageId);
        } catch (Exception e) {
            log.error("Failed to send draft {}: {}", draftId, e.getMessage(), e);
            return DraftSendResult.rejected(draftId, "send_failed: " + e.getMessage());
        }
    }
}
