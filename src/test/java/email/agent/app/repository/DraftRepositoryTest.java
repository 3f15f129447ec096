package email.agent.app.repository;

import email.agent.app.entity.Draft;
import email.agent.app.entity.DraftStatus;
import email.agent.app.entity.Email;
import email.agent.app.entity.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class DraftRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private DraftRepository draftRepository;

    @Autowired
    private EmailRepository emailRepository;

    private User user;
    private Email email;

    @BeforeEach
    void setUp() {
        user = new User();
        user.setId("user-1");
        user.setPrimaryEmail("me@corp.com");
        entityManager.persist(user);

        email = new Email();
        email.setUser(user);
        email.setGmailId("gmail-1");
        email.setFromEmail("ana@corp.com");
        email.setSubject("Hello");
        entityManager.persist(email);
        entityManager.flush();
    }

    private Draft draft(DraftStatus status) {
        Draft draft = new Draft();
        draft.setUser(user);
        draft.setEmail(email);
        draft.setToEmails(List.of("ana@corp.com"));
        draft.setSubject("Re: Hello");
        draft.setBodyText("Hi Ana");
        draft.setStatus(status);
        return draft;
    }

    @Test
    void saveAndFlush_WithSecondActiveDraftForSameEmail_ShouldBeRejected() {
        // Given
        draftRepository.saveAndFlush(draft(DraftStatus.PENDING));

        // When / Then
        assertThrows(DataIntegrityViolationException.class,
                () -> draftRepository.saveAndFlush(draft(DraftStatus.AUTO_SENT)));
    }

    @Test
    void saveAndFlush_WithRejectedDrafts_ShouldAllowNewActiveDraft() {
        // Given
        Draft rejected = draftRepository.saveAndFlush(draft(DraftStatus.PENDING));
        rejected.setStatus(DraftStatus.REJECTED);
        draftRepository.saveAndFlush(rejected);
        draftRepository.saveAndFlush(draft(DraftStatus.REJECTED));

        // When
        Draft fresh = draftRepository.saveAndFlush(draft(DraftStatus.PENDING));

        // Then
        assertNull(draftRepository.findById(rejected.getId()).orElseThrow().getActiveEmailId());
        assertEquals(email.getId(), fresh.getActiveEmailId());
    }

    @Test
    void findFirstByEmailIdAndStatusIn_ShouldIgnoreRejectedDrafts() {
        // Given
        draftRepository.saveAndFlush(draft(DraftStatus.REJECTED));

        // When
        Optional<Draft> active = draftRepository.findFirstByEmailIdAndStatusIn(email.getId(), DraftStatus.ACTIVE);

        // Then
        assertTrue(active.isEmpty());
    }

    @Test
    void findByIdWithEmailAndUser_ShouldFetchAssociations() {
        // Given
        Draft saved = draftRepository.saveAndFlush(draft(DraftStatus.APPROVED));
        entityManager.clear();

        // When
        Draft loaded = draftRepository.findByIdWithEmailAndUser(saved.getId()).orElseThrow();

        // Then
        assertEquals("gmail-1", loaded.getEmail().getGmailId());
        assertEquals("user-1", loaded.getUser().getId());
    }

    @Test
    void findByUserIdAndIdIn_ShouldOnlyReturnOwnEmails() {
        // Given
        User other = new User();
        other.setId("user-2");
        entityManager.persist(other);
        Email foreign = new Email();
        foreign.setUser(other);
        foreign.setGmailId("gmail-2");
        entityManager.persist(foreign);
        entityManager.flush();

        // When
        List<Email> owned = emailRepository.findByUserIdAndIdIn("user-1", List.of(email.getId(), foreign.getId()));

        // Then
        assertEquals(1, owned.size());
        assertEquals(email.getId(), owned.get(0).getId());
    }
}
