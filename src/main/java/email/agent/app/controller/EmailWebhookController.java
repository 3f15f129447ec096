package email.agent.app.controller;

import email.agent.app.service.EmailProcessingService;
import email.agent.app.service.PollSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Webhook controller for real-time email processing.
 * Can be triggered manually or integrated with Gmail Push Notifications (Pub/Sub).
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
public class EmailWebhookController {
    private final EmailProcessingService emailProcessingService;

    public EmailWebhookController(EmailProcessingService emailProcessingService) {
        this.emailProcessingService = emailProcessingService;
    }

    /**
     * Poll one user's mailbox now and report what happened.
     */
    @PostMapping("/process-emails/{userId}")
    public ResponseEntity<PollSummary> triggerEmailProcessingForUser(@PathVariable String userId) {
        try {
            PollSummary summary = emailProcessingService.pollUserNow(userId);
            if (summary.getStatus() == PollSummary.Status.ERROR) {
                return ResponseEntity.status(500).body(summary);
            }
            return ResponseEntity.ok(summary);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Error processing emails for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(500).body(PollSummary.error(e.getMessage()));
        }
    }
}
