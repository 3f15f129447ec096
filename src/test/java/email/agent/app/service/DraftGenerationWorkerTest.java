package email.agent.app.service;

import email.agent.app.entity.Draft;
import email.agent.app.entity.Email;
import email.agent.app.entity.User;
import email.agent.app.entity.UserSettings;
import email.agent.app.message.InboundMessage;
import email.agent.app.repository.EmailRepository;
import email.agent.app.repository.UserSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DraftGenerationWorkerTest {

    @Mock
    private EmailRepository emailRepository;

    @Mock
    private UserSettingsRepository userSettingsRepository;

    @Mock
    private DraftService draftService;

    @Mock
    private EmailProcessorFactory emailProcessorFactory;

    @Mock
    private BatchJobProgressService batchJobProgressService;

    @Mock
    private EmailProcessor emailProcessor;

    private DraftGenerationWorker worker;
    private Email email;
    private User user;

    @BeforeEach
    void setUp() {
        worker = new DraftGenerationWorker(emailRepository, userSettingsRepository, draftService,
                emailProcessorFactory, batchJobProgressService);

        user = new User();
        user.setId("user-1");
        email = new Email();
        email.setId("email-1");
        email.setUser(user);
        email.setGmailId("gmail-1");
        email.setFromEmail("ana@corp.com");
        email.setSubject("Hello");
        email.setBodyText("Hi there");
    }

    @Test
    void generateDraft_WithValidEmail_ShouldDraftAndReportCompleted() {
        // Given
        UserSettings settings = UserSettings.defaultsFor(user);
        Draft draft = new Draft();
        draft.setId("draft-1");
        when(emailRepository.findByIdWithUser("email-1")).thenReturn(Optional.of(email));
        when(draftService.findActiveDraft(email)).thenReturn(Optional.empty());
        when(userSettingsRepository.findByUserId("user-1")).thenReturn(Optional.of(settings));
        when(emailProcessorFactory.createForDrafting("user-1")).thenReturn(emailProcessor);
        when(emailProcessor.generateDraftOnly(any(InboundMessage.class), eq(settings))).thenReturn(draft);

        // When
        BatchItemOutcome outcome = worker.generateDraft("email-1", "job-1");

        // Then
        assertEquals(BatchItemOutcome.Status.DRAFTED, outcome.getStatus());
        assertEquals("draft-1", outcome.getDraftId());
        verify(batchJobProgressService).recordOutcome("job-1", outcome);
    }

    @Test
    void generateDraft_WithExistingDraft_ShouldSkipWithoutCallingModel() {
        // Given
        Draft existing = new Draft();
        existing.setId("draft-0");
        when(emailRepository.findByIdWithUser("email-1")).thenReturn(Optional.of(email));
        when(draftService.findActiveDraft(email)).thenReturn(Optional.of(existing));

        // When
        BatchItemOutcome outcome = worker.generateDraft("email-1", "job-1");

        // Then
        assertEquals(BatchItemOutcome.Status.SKIPPED, outcome.getStatus());
        assertTrue(outcome.countsAsCompleted());
        verifyNoInteractions(emailProcessorFactory);
        verify(batchJobProgressService).recordOutcome("job-1", outcome);
    }

    @Test
    void generateDraft_WithMissingEmail_ShouldReportFailure() {
        // Given
        when(emailRepository.findByIdWithUser("email-x")).thenReturn(Optional.empty());

        // When
        BatchItemOutcome outcome = worker.generateDraft("email-x", "job-1");

        // Then
        assertEquals(BatchItemOutcome.Status.FAILED, outcome.getStatus());
        assertEquals("email_not_found", outcome.getReason());
        verify(batchJobProgressService).recordOutcome("job-1", outcome);
    }

    @Test
    void generateDraft_WithoutSettings_ShouldReportFailure() {
        // Given
        when(emailRepository.findByIdWithUser("email-1")).thenReturn(Optional.of(email));
        when(draftService.findActiveDraft(email)).thenReturn(Optional.empty());
        when(userSettingsRepository.findByUserId("user-1")).thenReturn(Optional.empty());

        // When
        BatchItemOutcome outcome = worker.generateDraft("email-1", "job-1");

        // Then
        assertEquals("no_settings", outcome.getReason());
        verifyNoInteractions(emailProcessorFactory);
    }

    @Test
    void generateDraft_WhenModelFails_ShouldReportFailureInsteadOfThrowing() {
        // Given
        UserSettings settings = UserSettings.defaultsFor(user);
        when(emailRepository.findByIdWithUser("email-1")).thenReturn(Optional.of(email));
        when(draftService.findActiveDraft(email)).thenReturn(Optional.empty());
        when(userSettingsRepository.findByUserId("user-1")).thenReturn(Optional.of(settings));
        when(emailProcessorFactory.createForDrafting("user-1")).thenReturn(emailProcessor);
        when(emailProcessor.generateDraftOnly(any(InboundMessage.class), eq(settings)))
                .thenThrow(new ReplyGenerationService.QuotaException("quota exceeded", new RuntimeException()));

        // When
        BatchItemOutcome outcome = worker.generateDraft("email-1", "job-1");

        // Then
        assertEquals(BatchItemOutcome.Status.FAILED, outcome.getStatus());
        assertEquals("quota exceeded", outcome.getReason());
        verify(batchJobProgressService).recordOutcome("job-1", outcome);
    }

    @Test
    void generateDraft_WhenProgressRecordingFails_ShouldStillReturnOutcome() {
        // Given
        when(emailRepository.findByIdWithUser("email-x")).thenReturn(Optional.empty());
        when(batchJobProgressService.recordOutcome(eq("job-1"), any())).thenThrow(new IllegalStateException("db down"));

        // When
        BatchItemOutcome outcome = worker.generateDraft("email-x", "job-1");

        // Then
        assertEquals(BatchItemOutcome.Status.FAILED, outcome.getStatus());
    }
}
