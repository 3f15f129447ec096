package email.agent.app.repository;

import email.agent.app.entity.Draft;
import email.agent.app.entity.DraftStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface DraftRepository extends JpaRepository<Draft, String> {
    Optional<Draft> findFirstByEmailIdAndStatusIn(String emailId, Collection<DraftStatus> statuses);

    @Query("SELECT d FROM Draft d JOIN FETCH d.email JOIN FETCH d.user WHERE d.id = :id")
    Optional<Draft> findByIdWithEmailAndUser(@Param("id") String id);
}
