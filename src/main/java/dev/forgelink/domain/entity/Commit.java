package dev.forgelink.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Ingested commit. Unique per (repository, key); duplicates from redelivery are dropped at insert time.
 */
@Entity
@Table(name = "commits", uniqueConstraints = {
        @UniqueConstraint(name = "uk_commits_repository_key", columnNames = {"repository_id", "commit_key"})
}, indexes = {
        @Index(name = "idx_commits_author", columnList = "author_id")
})
public class Commit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(name = "commit_key", nullable = false, length = 64)
    private String key;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id")
    private CommitAuthor author;

    @Column(name = "date_added", nullable = false)
    private Instant dateAdded;

    protected Commit() {
    }

    public static Commit create(long organizationId, long repositoryId, String key, String message,
            CommitAuthor author, Instant dateAdded) {
        Commit c = new Commit();
        c.organizationId = organizationId;
        c.repositoryId = repositoryId;
        c.key = key;
        c.message = message;
        c.author = author;
        c.dateAdded = dateAdded;
        return c;
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public Long getRepositoryId() {
        return repositoryId;
    }

    public String getKey() {
        return key;
    }

    public String getMessage() {
        return message;
    }

    public CommitAuthor getAuthor() {
        return author;
    }

    public Instant getDateAdded() {
        return dateAdded;
    }
}
