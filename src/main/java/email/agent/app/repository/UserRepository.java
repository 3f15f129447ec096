package email.agent.app.repository;

import email.agent.app.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserRepository extends JpaRepository<User, String> {
    // Users the poller should visit: active and with a connected mailbox
    @Query("SELECT u FROM User u JOIN FETCH u.gmailAccount WHERE u.active = true")
    List<User> findActiveWithGmailAccount();
}
