package dev.forgelink.repository;

import dev.forgelink.domain.entity.Commit;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.hibernate.query.NativeQuery;
import org.hibernate.type.StandardBasicTypes;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneOffset;

/**
 * Native insert-or-ignore for commits. Each call is its own transaction so one bad commit in a
 * push cannot abort its siblings.
 */
@Repository
public class CommitRepositoryImpl implements CommitRepositoryCustom {

    private static final Logger log = LoggerFactory.getLogger(CommitRepositoryImpl.class);

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public boolean insertIfAbsent(Commit commit) {
        String sql = """
                INSERT INTO commits (
                    organization_id, repository_id, commit_key,
                    message, author_id, date_added
                ) VALUES (
                    :organizationId, :repositoryId, :commitKey,
                    :message, :authorId, :dateAdded
                )
                ON CONFLICT (repository_id, commit_key) DO NOTHING
                """;

        Long authorId = commit.getAuthor() != null ? commit.getAuthor().getId() : null;
        NativeQuery<?> query = entityManager.createNativeQuery(sql).unwrap(NativeQuery.class);
        query.setParameter("organizationId", commit.getOrganizationId(), StandardBasicTypes.LONG);
        query.setParameter("repositoryId", commit.getRepositoryId(), StandardBasicTypes.LONG);
        query.setParameter("commitKey", commit.getKey(), StandardBasicTypes.STRING);
        query.setParameter("message", commit.getMessage(), StandardBasicTypes.STRING);
        query.setParameter("authorId", authorId, StandardBasicTypes.LONG);
        query.setParameter("dateAdded", commit.getDateAdded().atOffset(ZoneOffset.UTC),
                StandardBasicTypes.OFFSET_DATE_TIME);

        int affected = query.executeUpdate();
        if (affected == 0) {
            log.debug("Commit {} already recorded for repository {}", commit.getKey(), commit.getRepositoryId());
        }
        return affected > 0;
    }
}
