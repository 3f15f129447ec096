package email.agent.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress of a user-requested batch of draft generations. Counters are only
 * changed through the atomic updates in BatchDraftJobRepository.
 */
@Entity
@Table(name = "batch_draft_jobs")
@Data
public class BatchDraftJob {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private int totalEmails;

    @Column(nullable = false)
    private int completedEmails = 0;

    @Column(nullable = false)
    private int failedEmails = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private BatchJobStatus status = BatchJobStatus.PENDING;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "batch_draft_job_emails", joinColumns = @JoinColumn(name = "job_id"))
    @Column(name = "email_id")
    private List<String> emailIds = new ArrayList<>();

    private Instant createdAt = Instant.now();
}
