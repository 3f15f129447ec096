package email.agent.app.repository;

import email.agent.app.entity.BatchDraftJob;
import email.agent.app.entity.BatchJobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class BatchDraftJobRepositoryTest {

    @Autowired
    private BatchDraftJobRepository batchDraftJobRepository;

    private String jobId;

    @BeforeEach
    void setUp() {
        BatchDraftJob job = new BatchDraftJob();
        job.setUserId("user-1");
        job.setTotalEmails(3);
        job.setStatus(BatchJobStatus.PROCESSING);
        job.setEmailIds(List.of("e1", "e2", "e3"));
        jobId = batchDraftJobRepository.saveAndFlush(job).getId();
    }

    @Test
    void counters_WithTwoSuccessesAndOneFailure_ShouldCompleteJobExactlyOnce() {
        // Given
        assertEquals(1, batchDraftJobRepository.incrementCompleted(jobId));
        assertEquals(0, batchDraftJobRepository.markCompletedIfDone(jobId));
        assertEquals(1, batchDraftJobRepository.incrementFailed(jobId));
        assertEquals(0, batchDraftJobRepository.markCompletedIfDone(jobId));
        assertEquals(1, batchDraftJobRepository.incrementCompleted(jobId));

        // When
        int first = batchDraftJobRepository.markCompletedIfDone(jobId);
        int second = batchDraftJobRepository.markCompletedIfDone(jobId);

        // Then
        assertEquals(1, first);
        assertEquals(0, second);
        BatchDraftJob job = batchDraftJobRepository.findById(jobId).orElseThrow();
        assertEquals(BatchJobStatus.COMPLETED, job.getStatus());
        assertEquals(2, job.getCompletedEmails());
        assertEquals(1, job.getFailedEmails());
        assertEquals(3, job.getTotalEmails());
    }

    @Test
    void increment_WithUnknownJob_ShouldUpdateNothing() {
        assertEquals(0, batchDraftJobRepository.incrementCompleted("missing"));
        assertEquals(0, batchDraftJobRepository.incrementFailed("missing"));
    }

    @Test
    void findByIdAndUserId_WithOtherUser_ShouldBeEmpty() {
        assertTrue(batchDraftJobRepository.findByIdAndUserId(jobId, "user-1").isPresent());
        assertTrue(batchDraftJobRepository.findByIdAndUserId(jobId, "user-2").isEmpty());
    }
}
