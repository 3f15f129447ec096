package email.agent.app.service;

import email.agent.app.entity.Draft;
import email.agent.app.entity.DraftStatus;
import email.agent.app.entity.Email;
import email.agent.app.repository.DraftRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Optional;

/**
 * At most one active draft (pending, approved, sent, auto_sent) exists per email.
 * The check below handles the common case; the unique active_email_id column
 * rejects the loser of a concurrent insert, which is then treated as "already exists".
 *
 * Not transactional: each repository call commits on its own so a rejected insert
 * does not poison a surrounding transaction.
 */
@Slf4j
@Service
public class DraftService {
    private final DraftRepository draftRepository;
    private final ActivityService activityService;

    public DraftService(DraftRepository draftRepository, ActivityService activityService) {
        this.draftRepository = draftRepository;
        this.activityService = activityService;
    }

    public Optional<Draft> findActiveDraft(Email email) {
        return draftRepository.findFirstByEmailIdAndStatusIn(email.getId(), DraftStatus.ACTIVE);
    }

    /**
     * Persists the draft unless the email already has an active one, in which case that
     * one is returned unchanged and no activity is logged.
     */
    public Draft createDraft(String userId, NewDraft request) {
        Email email = request.getEmail();
        Optional<Draft> existing = findActiveDraft(email);
        if (existing.isPresent()) {
            log.debug("Draft {} already exists for email {}, not creating another", existing.get().getId(), email.getId());
            return existing.get();
        }

        Draft draft = new Draft();
        draft.setUser(email.getUser());
        draft.setEmail(email);
        draft.setToEmails(new ArrayList<>(request.getToEmails()));
        draft.setSubject(request.getSubject());
        draft.setBodyText(request.getBody());
        draft.setStatus(request.getStatus());
        draft.setLlmModelUsed(request.getLlmModel());
        draft.setLlmReasoning(request.getLlmReasoning());
        draft.setLlmConfidence(request.getLlmConfidence());
        draft.setMatchedRuleId(request.getMatchedRuleId());
        draft.setGuardrailFlagged(request.isGuardrailFlagged());
        draft.setGuardrailViolations(request.getGuardrailViolations());
        draft.setSentAt(request.getSentAt());

        Draft saved;
        try {
            saved = draftRepository.saveAndFlush(draft);
        } catch (DataIntegrityViolationException e) {
            // Lost the race against another writer for the same email
            Draft winner = findActiveDraft(email).orElseThrow(() -> e);
            log.info("Concurrent draft {} won for email {}, returning it", winner.getId(), email.getId());
            return winner;
        }

        if (request.getActivityType() != null) {
            activityService.log(userId, request.getActivityType(), request.getActivityDescription(),
                email.getId(), saved.getId(), request.getMatchedRuleId());
        }
        return saved;
    }
}
