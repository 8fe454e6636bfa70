package dev.forgelink.repository;

import dev.forgelink.domain.entity.PullRequest;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.hibernate.query.NativeQuery;
import org.hibernate.type.StandardBasicTypes;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneOffset;

@Repository
public class PullRequestRepositoryImpl implements PullRequestRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public int upsert(PullRequest pullRequest) {
        String sql = """
                INSERT INTO pull_requests (
                    organization_id, repository_id, pr_key,
                    title, message, author_id,
                    merge_commit_sha, date_added
                ) VALUES (
                    :organizationId, :repositoryId, :prKey,
                    :title, :message, :authorId,
                    :mergeCommitSha, :dateAdded
                )
                ON CONFLICT (repository_id, pr_key)
                DO UPDATE SET
                    title = EXCLUDED.title,
                    message = EXCLUDED.message,
                    author_id = EXCLUDED.author_id,
                    merge_commit_sha = EXCLUDED.merge_commit_sha,
                    date_added = EXCLUDED.date_added
                """;

        Long authorId = pullRequest.getAuthor() != null ? pullRequest.getAuthor().getId() : null;
        NativeQuery<?> query = entityManager.createNativeQuery(sql).unwrap(NativeQuery.class);
        query.setParameter("organizationId", pullRequest.getOrganizationId(), StandardBasicTypes.LONG);
        query.setParameter("repositoryId", pullRequest.getRepositoryId(), StandardBasicTypes.LONG);
        query.setParameter("prKey", pullRequest.getKey(), StandardBasicTypes.STRING);
        query.setParameter("title", pullRequest.getTitle(), StandardBasicTypes.STRING);
        query.setParameter("message", pullRequest.getMessage(), StandardBasicTypes.STRING);
        query.setParameter("authorId", authorId, StandardBasicTypes.LONG);
        query.setParameter("mergeCommitSha", pullRequest.getMergeCommitSha(), StandardBasicTypes.STRING);
        query.setParameter("dateAdded", pullRequest.getDateAdded().atOffset(ZoneOffset.UTC),
                StandardBasicTypes.OFFSET_DATE_TIME);

        return query.executeUpdate();
    }
}
