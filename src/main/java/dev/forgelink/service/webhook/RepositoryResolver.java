package dev.forgelink.service.webhook;

import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.SourceRepository;
import dev.forgelink.dto.request.EventRepository;
import dev.forgelink.repository.SourceRepositoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Maps the repository named in an event to the organization's tracked repository.
 *
 * <p>Lookup is by external id, so an upstream rename still finds the row; the stored name, URL and
 * config are then brought up to date.
 */
@Service
public class RepositoryResolver {
    private static final Logger log = LoggerFactory.getLogger(RepositoryResolver.class);

    private final SourceRepositoryRepository repositories;

    public RepositoryResolver(SourceRepositoryRepository repositories) {
        this.repositories = repositories;
    }

    public Optional<SourceRepository> resolve(long organizationId, Installation installation,
                                              EventRepository eventRepository) {
        String externalId = SourceRepository.externalIdFor(installation.getInstance(), eventRepository.fullName());
        Optional<SourceRepository> found = repositories.findByOrganizationIdAndProviderAndExternalId(
                organizationId, SourceRepository.PROVIDER_GITEA, externalId);
        if (found.isEmpty()) {
            log.atDebug().setMessage("gitea.webhook.repository-not-tracked")
                    .addKeyValue("organization_id", organizationId)
                    .addKeyValue("external_id", externalId).log();
            return Optional.empty();
        }

        SourceRepository repository = found.get();
        if (repository.isStale(eventRepository.fullName(), eventRepository.htmlUrl())) {
            log.atInfo().setMessage("gitea.webhook.repository-renamed")
                    .addKeyValue("repository_id", repository.getId())
                    .addKeyValue("old_name", repository.getName())
                    .addKeyValue("new_name", eventRepository.fullName()).log();
            repository.applyUpstreamRename(eventRepository.fullName(), eventRepository.htmlUrl());
            repository = repositories.save(repository);
        }
        return Optional.of(repository);
    }
}
