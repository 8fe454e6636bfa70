package dev.forgelink.service;

import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.SourceRepository;
import dev.forgelink.dto.response.AvailableRepositoryResponse;
import dev.forgelink.dto.response.RepositoryResponse;
import dev.forgelink.exception.ResourceNotFoundException;
import dev.forgelink.infrastructure.gitea.GiteaApiClient;
import dev.forgelink.infrastructure.gitea.GiteaApiClient.GiteaRepository;
import dev.forgelink.infrastructure.gitea.GiteaApiException;
import dev.forgelink.repository.InstallationRepository;
import dev.forgelink.repository.SourceRepositoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connects Gitea repositories to an organization: registers our webhook upstream and keeps the
 * local record. Unlinking removes both.
 */
@Service
public class RepositoryLinkService {
    private static final Logger log = LoggerFactory.getLogger(RepositoryLinkService.class);

    private final InstallationService installationService;
    private final InstallationRepository installationRepository;
    private final SourceRepositoryRepository repositories;
    private final GiteaApiClient giteaApiClient;

    public RepositoryLinkService(InstallationService installationService,
                                 InstallationRepository installationRepository,
                                 SourceRepositoryRepository repositories,
                                 GiteaApiClient giteaApiClient) {
        this.installationService = installationService;
        this.installationRepository = installationRepository;
        this.repositories = repositories;
        this.giteaApiClient = giteaApiClient;
    }

    public List<AvailableRepositoryResponse> listAvailableRepositories(long organizationId, long installationId) {
        Installation installation = installationService.requireForOrganization(organizationId, installationId);
        return giteaApiClient.listUserRepositories(installation).stream()
                .map(r -> new AvailableRepositoryResponse(r.fullName(), r.fullName()))
                .toList();
    }

    public RepositoryResponse linkRepository(long organizationId, long installationId, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
        Installation installation = installationService.requireForOrganization(organizationId, installationId);
        String externalId = SourceRepository.externalIdFor(installation.getInstance(), identifier);
        if (repositories.findByOrganizationIdAndProviderAndExternalId(
                organizationId, SourceRepository.PROVIDER_GITEA, externalId).isPresent()) {
            throw new IllegalStateException("A repository with that configuration already exists");
        }

        GiteaRepository upstream = giteaApiClient.getRepository(installation, identifier);
        long hookId = giteaApiClient.createRepositoryWebhook(installation, identifier);

        Map<String, Object> config = new HashMap<>();
        config.put(SourceRepository.CONFIG_INSTANCE, installation.getInstance());
        config.put(SourceRepository.CONFIG_WEBHOOK_ID, hookId);
        config.put(SourceRepository.CONFIG_REPO, identifier);
        SourceRepository repository = SourceRepository.create(organizationId, installation.getId(),
                SourceRepository.PROVIDER_GITEA, externalId, identifier, upstream.htmlUrl(), config);
        try {
            repository = repositories.save(repository);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent link; drop the hook we just created
            removeWebhook(installation, identifier, hookId);
            throw new IllegalStateException("A repository with that configuration already exists", e);
        }
        log.info("Linked {} to organization {} (repository {}, hook {})",
                identifier, organizationId, repository.getId(), hookId);
        return RepositoryQueryService.toResponse(repository);
    }

    public void unlinkRepository(long organizationId, long repositoryId) {
        SourceRepository repository = repositories.findByIdAndOrganizationId(repositoryId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Repository " + repositoryId + " not found"));

        String hookId = repository.configValue(SourceRepository.CONFIG_WEBHOOK_ID);
        if (hookId != null && repository.getInstallationId() != null) {
            installationRepository.findById(repository.getInstallationId())
                    .ifPresent(installation -> removeWebhook(installation, repository.getRepoPath(), Long.parseLong(hookId)));
        }
        repositories.delete(repository);
        log.info("Unlinked repository {} ({}) from organization {}", repositoryId, repository.getName(), organizationId);
    }

    private void removeWebhook(Installation installation, String repo, long hookId) {
        try {
            giteaApiClient.deleteRepositoryWebhook(installation, repo, hookId);
        } catch (GiteaApiException e) {
            if (!e.isNotFound()) throw e;
            log.info("Webhook {} on {} already gone", hookId, repo);
        }
    }
}
