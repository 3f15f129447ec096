package email.agent.app.service;

import email.agent.app.entity.ActivityLog;
import email.agent.app.entity.ActivityType;
import email.agent.app.repository.ActivityLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ActivityService {
    private final ActivityLogRepository activityLogRepository;

    public ActivityService(ActivityLogRepository activityLogRepository) {
        this.activityLogRepository = activityLogRepository;
    }

    public ActivityLog log(String userId, ActivityType type, String description,
                           String emailId, String draftId, String ruleId) {
        ActivityLog entry = new ActivityLog();
        entry.setUserId(userId);
        entry.setActivityType(type);
        entry.setDescription(description);
        entry.setEmailId(emailId);
        entry.setDraftId(draftId);
        entry.setRuleId(ruleId);
        log.debug("Activity {} for user {}: {}", type, userId, description);
        return activityLogRepository.save(entry);
    }
}
