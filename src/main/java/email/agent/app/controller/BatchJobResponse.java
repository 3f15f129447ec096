package email.agent.app.controller;

import email.agent.app.entity.BatchDraftJob;
import lombok.Value;

import java.time.Instant;

@Value
public class BatchJobResponse {
    String jobId;
    String status;
    int totalEmails;
    int completedEmails;
    int failedEmails;
    Instant createdAt;

    public static BatchJobResponse from(BatchDraftJob job) {
        return new BatchJobResponse(job.getId(), job.getStatus().name().toLowerCase(),
            job.getTotalEmails(), job.getCompletedEmails(), job.getFailedEmails(), job.getCreatedAt());
    }
}
