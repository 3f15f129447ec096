package email.agent.app.service;

import email.agent.app.entity.ActivityType;
import email.agent.app.entity.Draft;
import email.agent.app.entity.DraftStatus;
import email.agent.app.entity.Email;
import email.agent.app.entity.GmailAccount;
import email.agent.app.entity.User;
import email.agent.app.repository.DraftRepository;
import email.agent.app.repository.GmailAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DraftSendServiceTest {

    @Mock
    private DraftRepository draftRepository;

    @Mock
    private GmailAccountRepository gmailAccountRepository;

    @Mock
    private TokenRefreshService tokenRefreshService;

    @Mock
    private GmailApiService gmailApiService;

    @Mock
    private ActivityService activityService;

    private DraftSendService draftSendService;
    private Draft draft;
    private GmailAccount account;

    @BeforeEach
    void setUp() {
        draftSendService = new DraftSendService(draftRepository, gmailAccountRepository, tokenRefreshService,
                gmailApiService, activityService);

        User user = new User();
        user.setId("user-1");

        Email email = new Email();
        email.setId("email-1");
        email.setMessageId("<msg-1@corp.com>");
        email.setThreadId("thread-1");

        draft = new Draft();
        draft.setId("draft-1");
        draft.setUser(user);
        draft.setEmail(email);
        draft.setToEmails(List.of("ana@corp.com"));
        draft.setSubject("Re: Hello");
        draft.setBodyText("Hi Ana");
        draft.setStatus(DraftStatus.APPROVED);

        account = new GmailAccount();
        account.setEmailAddress("me@corp.com");
    }

    @Test
    void sendApprovedDraft_WithApprovedDraft_ShouldSendThreadedReplyAndMarkSent() throws Exception {
        // Given
        when(draftRepository.findByIdWithEmailAndUser("draft-1")).thenReturn(Optional.of(draft));
        when(gmailAccountRepository.findByUserId("user-1")).thenReturn(Optional.of(account));
        when(tokenRefreshService.ensureValidAccessToken(account)).thenReturn("token");
        when(gmailApiService.sendMessage(eq("token"), eq("me@corp.com"), any(OutgoingMessage.class))).thenReturn("sent-1");

        // When
        DraftSendResult result = draftSendService.sendApprovedDraft("user-1", "draft-1");

        // Then
        assertTrue(result.isSent());
        assertEquals("sent-1", result.getMessageId());
        ArgumentCaptor<OutgoingMessage> captor = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(gmailApiService).sendMessage(eq("token"), eq("me@corp.com"), captor.capture());
        OutgoingMessage sent = captor.getValue();
        assertEquals("<msg-1@corp.com>", sent.getInReplyTo());
        assertEquals("thread-1", sent.getThreadId());
        assertEquals(List.of("ana@corp.com"), sent.getTo());
        assertEquals(DraftStatus.SENT, draft.getStatus());
        assertNotNull(draft.getSentAt());
        verify(draftRepository).save(draft);
        verify(activityService).log(eq("user-1"), eq(ActivityType.EMAIL_SENT), anyString(),
                eq("email-1"), eq("draft-1"), isNull());
    }

    @Test
    void sendApprovedDraft_WithPendingDraft_ShouldRefuse() throws Exception {
        // Given
        draft.setStatus(DraftStatus.PENDING);
        when(draftRepository.findByIdWithEmailAndUser("draft-1")).thenReturn(Optional.of(draft));

        // When
        DraftSendResult result = draftSendService.sendApprovedDraft("user-1", "draft-1");

        // Then
        assertFalse(result.isSent());
        assertEquals("invalid_status_pending", result.getReason());
        verify(gmailApiService, never()).sendMessage(any(), any(), any());
    }

    @Test
    void sendApprovedDraft_WithAlreadySentDraft_ShouldNotSendTwice() throws Exception {
        // Given
        draft.setStatus(DraftStatus.SENT);
        when(draftRepository.findByIdWithEmailAndUser("draft-1")).thenReturn(Optional.of(draft));

        // When
        DraftSendResult result = draftSendService.sendApprovedDraft("user-1", "draft-1");

        // Then
        assertEquals("invalid_status_sent", result.getReason());
        verify(gmailApiService, never()).sendMessage(any(), any(), any());
    }

    @Test
    void sendApprovedDraft_WithOtherUsersDraft_ShouldReportNotFound() {
        // Given
        when(draftRepository.findByIdWithEmailAndUser("draft-1")).thenReturn(Optional.of(draft));

        // When
        DraftSendResult result = draftSendService.sendApprovedDraft("user-2", "draft-1");

        // Then
        assertEquals("draft_not_found", result.getReason());
        verifyNoInteractions(gmailAccountRepository);
    }

    @Test
    void sendApprovedDraft_WhenGmailFails_ShouldKeepDraftApproved() throws Exception {
        // Given
        when(draftRepository.findByIdWithEmailAndUser("draft-1")).thenReturn(Optional.of(draft));
        when(gmailAccountRepository.findByUserId("user-1")).thenReturn(Optional.of(account));
        when(tokenRefreshService.ensureValidAccessToken(account)).thenReturn("token");
        when(gmailApiService.sendMessage(any(), any(), any())).thenThrow(new RuntimeException("503"));

        // When
        DraftSendResult result = draftSendService.sendApprovedDraft("user-1", "draft-1");

        // Then
        assertFalse(result.isSent());
        assertEquals("send_failed: 503", result.getReason());
        assertEquals(DraftStatus.APPROVED, draft.getStatus());
        verify(draftRepository, never()).save(any());
    }
}
