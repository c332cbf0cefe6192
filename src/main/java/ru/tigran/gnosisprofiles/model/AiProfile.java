package ru.tigran.gnosisprofiles.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.DynamicUpdate;

/**
 * AI persona profile generated from a piece of source content.
 * At most one row exists per content_id.
 */
@Entity
@DynamicUpdate
@Table(name = "ais", uniqueConstraints = {
    @UniqueConstraint(name = "uk_ais_content_id", columnNames = "content_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "aiId", callSuper = false)
@ToString(exclude = "systemsInstructions")
public class AiProfile extends AuditableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "ai_id")
    private Long aiId;

    @Column(name = "content_id", nullable = false)
    private Long contentId;

    @Column(name = "display_name")
    private String displayName;

    private String name;

    @Column(columnDefinition = "TEXT")
    private String bio;

    private String location;

    // Generated persona behaviour, used as the system prompt of the AI agent
    @Column(name = "systems_instructions", columnDefinition = "TEXT")
    private String systemsInstructions;

    @Column(name = "profile_pic_url", length = 512)
    private String profilePicUrl;

    public AiProfile(Long contentId) {
        this.contentId = contentId;
    }
}
