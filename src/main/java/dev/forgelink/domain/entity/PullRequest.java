package dev.forgelink.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Ingested pull request, keyed by (repository, number). Upserted on every delivery.
 */
@Entity
@Table(name = "pull_requests", uniqueConstraints = {
        @UniqueConstraint(name = "uk_pull_requests_repository_key", columnNames = {"repository_id", "pr_key"})
})
public class PullRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(name = "pr_key", nullable = false, length = 64)
    private String key;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id")
    private CommitAuthor author;

    @Column(name = "merge_commit_sha", length = 64)
    private String mergeCommitSha;

    @Column(name = "date_added", nullable = false)
    private Instant dateAdded;

    protected PullRequest() {
    }

    public static PullRequest create(long organizationId, long repositoryId, String key, String title,
            String message, CommitAuthor author, String mergeCommitSha, Instant dateAdded) {
        PullRequest p = new PullRequest();
        p.organizationId = organizationId;
        p.repositoryId = repositoryId;
        p.key = key;
        p.title = title;
        p.message = message;
        p.author = author;
        p.mergeCommitSha = mergeCommitSha;
        p.dateAdded = dateAdded;
        return p;
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

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public CommitAuthor getAuthor() {
        return author;
    }

    public String getMergeCommitSha() {
        return mergeCommitSha;
    }

    public Instant getDateAdded() {
        return dateAdded;
    }
}
