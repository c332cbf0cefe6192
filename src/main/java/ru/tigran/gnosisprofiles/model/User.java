package ru.tigran.gnosisprofiles.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.DynamicUpdate;
import org.springframework.data.domain.Persistable;

/**
 * Human user profile. The identifier is assigned by the caller, never generated.
 *
 * Because the id is always set, Spring Data cannot tell a new user from a stored one by the id
 * alone. A freshly constructed user reports itself as new, so saving it issues an INSERT, and a
 * concurrent insert of the same user_id fails on the primary key instead of being merged.
 * Updates write only the changed columns, so overlapping partial updates keep each other's fields.
 */
@Entity
@DynamicUpdate
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "userId", callSuper = false)
@ToString(exclude = "newEntity")
public class User extends AuditableEntity implements Persistable<Long> {
    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "display_name")
    private String displayName;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String bio;

    private String location;

    @Column(name = "profile_pic_url", length = 512)
    private String profilePicUrl;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean newEntity = true;

    public User(Long userId) {
        this.userId = userId;
    }

    @Override
    public Long getId() {
        return userId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
