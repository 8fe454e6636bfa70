package dev.forgelink.repository;

import dev.forgelink.domain.entity.SourceRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SourceRepositoryRepository extends JpaRepository<SourceRepository, Long> {

    Optional<SourceRepository> findByOrganizationIdAndProviderAndExternalId(
            Long organizationId, String provider, String externalId);

    Optional<SourceRepository> findByIdAndOrganizationId(Long id, Long organizationId);

    List<SourceRepository> findByOrganizationIdOrderByNameAsc(Long organizationId);
}
