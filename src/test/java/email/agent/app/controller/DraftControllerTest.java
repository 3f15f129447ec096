package email.agent.app.controller;

import email.agent.app.service.DraftSendResult;
import email.agent.app.service.DraftSendService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DraftControllerTest {

    @Mock
    private DraftSendService draftSendService;

    private DraftController controller;

    @BeforeEach
    void setUp() {
        controller = new DraftController(draftSendService);
    }

    private HttpStatus statusFor(DraftSendResult result) {
        when(draftSendService.sendApprovedDraft("user-1", "draft-1")).thenReturn(result);
        ResponseEntity<DraftSendResult> response = controller.sendDraft("user-1", "draft-1");
        return HttpStatus.valueOf(response.getStatusCode().value());
    }

    @Test
    void sendDraft_WhenSent_ShouldReturnOk() {
        assertEquals(HttpStatus.OK, statusFor(DraftSendResult.sent("draft-1", "msg-1")));
    }

    @Test
    void sendDraft_WhenMissing_ShouldReturnNotFound() {
        assertEquals(HttpStatus.NOT_FOUND, statusFor(DraftSendResult.rejected("draft-1", "draft_not_found")));
    }

    @Test
    void sendDraft_WhenNotApproved_ShouldReturnConflict() {
        assertEquals(HttpStatus.CONFLICT, statusFor(DraftSendResult.rejected("draft-1", "invalid_status_pending")));
    }

    @Test
    void sendDraft_WhenGmailFails_ShouldReturnBadGateway() {
        assertEquals(HttpStatus.BAD_GATEWAY, statusFor(DraftSendResult.rejected("draft-1", "send_failed: 503")));
    }
}
