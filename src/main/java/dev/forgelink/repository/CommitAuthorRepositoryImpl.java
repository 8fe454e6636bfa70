package dev.forgelink.repository;

import dev.forgelink.domain.entity.CommitAuthor;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.hibernate.query.NativeQuery;
import org.hibernate.type.StandardBasicTypes;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Get-or-create for commit authors backed by {@code ON CONFLICT DO NOTHING}, so two deliveries
 * racing on the same email both end up with the same row.
 */
@Repository
public class CommitAuthorRepositoryImpl implements CommitAuthorRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public CommitAuthor getOrCreate(CommitAuthor candidate) {
        NativeQuery<?> insert = entityManager.createNativeQuery("""
                        INSERT INTO commit_authors (organization_id, name, email)
                        VALUES (:organizationId, :name, :email)
                        ON CONFLICT (organization_id, email) DO NOTHING
                        """).unwrap(NativeQuery.class);
        insert.setParameter("organizationId", candidate.getOrganizationId(), StandardBasicTypes.LONG);
        insert.setParameter("name", candidate.getName(), StandardBasicTypes.STRING);
        insert.setParameter("email", candidate.getEmail(), StandardBasicTypes.STRING);
        insert.executeUpdate();

        return entityManager.createQuery(
                        "SELECT a FROM CommitAuthor a WHERE a.organizationId = :organizationId AND a.email = :email",
                        CommitAuthor.class)
                .setParameter("organizationId", candidate.getOrganizationId())
                .setParameter("email", candidate.getEmail())
                .getSingleResult();
    }
}
