package dev.forgelink.domain.entity;

import jakarta.persistence.*;

/**
 * Commit author, unique per (organization, email). Created on first sighting, never renamed.
 */
@Entity
@Table(name = "commit_authors", uniqueConstraints = {
        @UniqueConstraint(name = "uk_commit_authors_org_email", columnNames = {"organization_id", "email"})
})
public class CommitAuthor {

    public static final int MAX_EMAIL_LENGTH = 75;
    public static final int MAX_NAME_LENGTH = 128;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "name", length = MAX_NAME_LENGTH)
    private String name;

    @Column(name = "email", nullable = false, length = MAX_EMAIL_LENGTH)
    private String email;

    protected CommitAuthor() {
    }

    public static CommitAuthor create(long organizationId, String name, String email) {
        CommitAuthor a = new CommitAuthor();
        a.organizationId = organizationId;
        a.name = name != null && name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
        a.email = email;
        return a;
    }

    /** Emails absent, blank or longer than the column allows are not attributable. */
    public static boolean isUsableEmail(String email) {
        return email != null && !email.isBlank() && email.length() <= MAX_EMAIL_LENGTH;
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }
}
