package dev.forgelink.repository;

import dev.forgelink.domain.entity.PullRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PullRequestRepository extends JpaRepository<PullRequest, Long>, PullRequestRepositoryCustom {

    Optional<PullRequest> findByRepositoryIdAndKey(Long repositoryId, String key);

    long countByRepositoryId(Long repositoryId);
}
