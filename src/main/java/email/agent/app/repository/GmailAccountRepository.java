package email.agent.app.repository;

import email.agent.app.entity.GmailAccount;
import email.agent.app.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GmailAccountRepository extends JpaRepository<GmailAccount, String> {
    Optional<GmailAccount> findByUser(User user);
    Optional<GmailAccount> findByUserId(String userId);
}
