package dev.forgelink.repository;

import dev.forgelink.domain.entity.Installation;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Installations are always loaded with their organizations: the webhook pipeline fans out over
 * them outside of any transaction.
 */
@Repository
public interface InstallationRepository extends JpaRepository<Installation, Long> {

    @EntityGraph(attributePaths = "organizations")
    Optional<Installation> findByProviderAndExternalId(String provider, String externalId);

    @EntityGraph(attributePaths = "organizations")
    Optional<Installation> findWithOrganizationsById(Long id);
}
