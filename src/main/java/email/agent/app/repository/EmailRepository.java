package email.agent.app.repository;

import email.agent.app.entity.Email;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmailRepository extends JpaRepository<Email, String> {
    Optional<Email> findByUserIdAndGmailId(String userId, String gmailId);

    List<Email> findByUserIdAndIdIn(String userId, Collection<String> ids);

    List<Email> findByUserIdAndProcessedFalse(String userId);

    // Fetch with the user to avoid LazyInitializationException in async workers
    @Query("SELECT e FROM Email e JOIN FETCH e.user WHERE e.id = :id")
    Optional<Email> findByIdWithUser(@Param("id") String id);
}
