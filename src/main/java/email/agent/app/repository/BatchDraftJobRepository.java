package email.agent.app.repository;

import email.agent.app.entity.BatchDraftJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Batch counters are mutated with single-statement updates so concurrent items
 * never lose an increment. The SET expressions read the pre-update row values.
 */
@Repository
public interface BatchDraftJobRepository extends JpaRepository<BatchDraftJob, String> {
    Optional<BatchDraftJob> findByIdAndUserId(String id, String userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE batch_draft_jobs SET completed_emails = completed_emails + 1 WHERE id = :id",
            nativeQuery = true)
    int incrementCompleted(@Param("id") String id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE batch_draft_jobs SET failed_emails = failed_emails + 1 WHERE id = :id",
            nativeQuery = true)
    int incrementFailed(@Param("id") String id);

    /**
     * Flips the job to COMPLETED once every item has reported. Returns 1 only for
     * the caller whose update crossed the threshold, 0 for everyone else.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE batch_draft_jobs SET status = 'COMPLETED' " +
            "WHERE id = :id AND status <> 'COMPLETED' AND completed_emails + failed_emails >= total_emails",
            nativeQuery = true)
    int markCompletedIfDone(@Param("id") String id);
}
