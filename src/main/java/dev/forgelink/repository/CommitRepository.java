package dev.forgelink.repository;

import dev.forgelink.domain.entity.Commit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Commit entity.
 * Extends custom interface for conflict-tolerant inserts.
 */
@Repository
public interface CommitRepository extends JpaRepository<Commit, Long>, CommitRepositoryCustom {

    Optional<Commit> findByRepositoryIdAndKey(Long repositoryId, String key);

    long countByRepositoryId(Long repositoryId);
}
