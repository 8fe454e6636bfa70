package dev.forgelink.service;

import dev.forgelink.domain.entity.PullRequest;
import dev.forgelink.domain.entity.SourceRepository;
import dev.forgelink.dto.response.RepositoryResponse;
import dev.forgelink.repository.SourceRepositoryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class RepositoryQueryService {
    private final SourceRepositoryRepository repository;
    public RepositoryQueryService(SourceRepositoryRepository repository) { this.repository = repository; }

    public List<RepositoryResponse> listRepositories(long organizationId) {
        return repository.findByOrganizationIdOrderByNameAsc(organizationId).stream()
                .filter(r -> SourceRepository.PROVIDER_GITEA.equals(r.getProvider()))
                .map(RepositoryQueryService::toResponse)
                .toList();
    }

    public Optional<RepositoryResponse> findById(long organizationId, long repositoryId) {
        return repository.findByIdAndOrganizationId(repositoryId, organizationId).map(RepositoryQueryService::toResponse);
    }

    public static String pullRequestUrl(SourceRepository repo, PullRequest pullRequest) {
        return repo.getUrl() + "/pulls/" + pullRequest.getKey();
    }

    static RepositoryResponse toResponse(SourceRepository r) {
        return new RepositoryResponse(r.getId(), r.getName(), r.getUrl(), r.getExternalId(), r.getProvider(),
                r.getInstallationId(), r.getCreatedAt());
    }
}
