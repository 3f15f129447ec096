package email.agent.app.service;

import email.agent.app.entity.GmailAccount;
import email.agent.app.entity.User;
import email.agent.app.repository.AutomationRuleRepository;
import email.agent.app.repository.EmailRepository;
import email.agent.app.rules.RuleDefinitionParser;
import email.agent.app.rules.RuleEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Wires an {@link EmailProcessor} for one user: their rules, their mailbox and the shared collaborators.
 */
@Slf4j
@Service
public class EmailProcessorFactory {
    private final ReplyGenerationService replyGenerationService;
    private final GmailApiService gmailApiService;
    private final AutomationRuleRepository automationRuleRepository;
    private final RuleDefinitionParser ruleDefinitionParser;
    private final EmailRepository emailRepository;
    private final DraftService draftService;
    private final ActivityService activityService;

    public EmailProcessorFactory(
            ReplyGenerationService replyGenerationService,
            GmailApiService gmailApiService,
            AutomationRuleRepository automationRuleRepository,
            RuleDefinitionParser ruleDefinitionParser,
            EmailRepository emailRepository,
            DraftService draftService,
            ActivityService activityService) {
        this.replyGenerationService = replyGenerationService;
        this.gmailApiService = gmailApiService;
        this.automationRuleRepository = automationRuleRepository;
        this.ruleDefinitionParser = ruleDefinitionParser;
        this.emailRepository = emailRepository;
        this.draftService = draftService;
        this.activityService = activityService;
    }

    /**
     * Processor for the polling path. Rule definitions are parsed up front, so a broken
     * rule fails here with an {@link email.agent.app.rules.InvalidRuleException}.
     */
    public EmailProcessor create(User user, GmailAccount account, String accessToken) {
        RuleEngine ruleEngine = ruleDefinitionParser.buildEngine(
            automationRuleRepository.findByUserIdOrderByCreatedAtAsc(user.getId()));
        log.debug("Loaded {} active rules for user {}", ruleEngine.getRules().size(), user.getId());
        MailSender sender = new GmailMailSender(gmailApiService, accessToken, account.getEmailAddress());
        return new EmailProcessor(user.getId(), sender, replyGenerationService, ruleEngine,
            emailRepository, draftService, activityService);
    }

    /**
     * Processor for explicit draft requests: no rules, and sending is refused.
     */
    public EmailProcessor createForDrafting(String userId) {
        return new EmailProcessor(userId, MailSender.unavailable("drafting only"), replyGenerationService,
            RuleEngine.empty(), emailRepository, draftService, activityService);
    }
}
