package dev.forgelink.repository;

import dev.forgelink.domain.entity.CommitAuthor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CommitAuthorRepository extends JpaRepository<CommitAuthor, Long>, CommitAuthorRepositoryCustom {

    Optional<CommitAuthor> findByOrganizationIdAndEmail(Long organizationId, String email);
}
