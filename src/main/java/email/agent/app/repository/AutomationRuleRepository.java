package email.agent.app.repository;

import email.agent.app.entity.AutomationRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AutomationRuleRepository extends JpaRepository<AutomationRule, String> {
    // Creation order is the definition order the rule engine uses to break priority ties
    List<AutomationRule> findByUserIdOrderByCreatedAtAsc(String userId);
}
