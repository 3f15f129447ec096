package email.agent.app.controller;

import email.agent.app.entity.BatchDraftJob;
import email.agent.app.entity.BatchJobStatus;
import email.agent.app.service.BatchDraftException;
import email.agent.app.service.BatchDraftService;
import email.agent.app.service.BatchJobNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchDraftControllerTest {

    @Mock
    private BatchDraftService batchDraftService;

    private BatchDraftController controller;

    @BeforeEach
    void setUp() {
        controller = new BatchDraftController(batchDraftService);
    }

    private static BatchDraftRequest request(List<String> ids) {
        BatchDraftRequest request = new BatchDraftRequest();
        request.setEmailIds(ids);
        return request;
    }

    @Test
    void startBatch_WithValidRequest_ShouldReturnAcceptedJob() {
        // Given
        BatchDraftJob job = new BatchDraftJob();
        job.setId("job-1");
        job.setUserId("user-1");
        job.setTotalEmails(2);
        job.setStatus(BatchJobStatus.PROCESSING);
        when(batchDraftService.startBatch("user-1", List.of("e1", "e2"))).thenReturn(job);

        // When
        ResponseEntity<?> response = controller.startBatch("user-1", request(List.of("e1", "e2")));

        // Then
        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        BatchJobResponse body = (BatchJobResponse) response.getBody();
        assertEquals("job-1", body.getJobId());
        assertEquals("processing", body.getStatus());
        assertEquals(2, body.getTotalEmails());
    }

    @Test
    void startBatch_WithInvalidRequest_ShouldReturnBadRequest() {
        // Given
        when(batchDraftService.startBatch("user-1", List.of()))
                .thenThrow(new BatchDraftException("At least one email id is required"));

        // When
        ResponseEntity<?> response = controller.startBatch("user-1", request(List.of()));

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void getBatch_WithUnknownJob_ShouldReturnNotFound() {
        // Given
        when(batchDraftService.getJob("user-1", "job-x")).thenThrow(new BatchJobNotFoundException("job-x"));

        // When
        ResponseEntity<?> response = controller.getBatch("user-1", "job-x");

        // Then
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }
}
