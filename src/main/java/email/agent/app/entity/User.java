package email.agent.app.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(exclude = {"gmailAccount", "settings"})
@EqualsAndHashCode(exclude = {"gmailAccount", "settings"})
public class User {
    @Id
    private String id; // OAuth subject / internal UUID

    private String primaryEmail;

    private boolean active = true;

    @OneToOne(mappedBy = "user", cascade = CascadeType.ALL, orphanRemoval = true)
    private GmailAccount gmailAccount;

    @OneToOne(mappedBy = "user", cascade = CascadeType.ALL, orphanRemoval = true)
    private UserSettings settings;
}
