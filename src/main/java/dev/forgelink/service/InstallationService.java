package dev.forgelink.service;

import dev.forgelink.domain.entity.Installation;
import dev.forgelink.exception.ResourceNotFoundException;
import dev.forgelink.repository.InstallationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Installation lookups scoped to an organization. */
@Service
@Transactional(readOnly = true)
public class InstallationService {
    private final InstallationRepository repository;

    public InstallationService(InstallationRepository repository) {
        this.repository = repository;
    }

    /**
     * @throws ResourceNotFoundException if the installation does not exist or is not linked to the organization
     */
    public Installation requireForOrganization(long organizationId, long installationId) {
        return repository.findWithOrganizationsById(installationId)
                .filter(installation -> installation.isLinkedTo(organizationId))
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Integration " + installationId + " not found for organization " + organizationId));
    }
}
