package email.agent.app.controller;

import email.agent.app.service.DraftSendResult;
import email.agent.app.service.DraftSendService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users/{userId}/drafts")
public class DraftController {
    private final DraftSendService draftSendService;

    public DraftController(DraftSendService draftSendService) {
        this.draftSendService = draftSendService;
    }

    @PostMapping("/{draftId}/send")
    public ResponseEntity<DraftSendResult> sendDraft(@PathVariable String userId, @PathVariable String draftId) {
        DraftSendResult result = draftSendService.sendApprovedDraft(userId, draftId);
        if (result.isSent()) {
            return ResponseEntity.ok(result);
        }
        if ("draft_not_found".equals(result.getReason())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }
        if (result.getReason() != null && result.getReason().startsWith("send_failed")) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }
}
