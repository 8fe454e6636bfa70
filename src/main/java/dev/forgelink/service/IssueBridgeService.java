package dev.forgelink.service;

import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.valueobject.IssueReference;
import dev.forgelink.dto.response.IssueResponse;
import dev.forgelink.dto.response.IssueSearchResult;
import dev.forgelink.exception.UpstreamRateLimitException;
import dev.forgelink.infrastructure.gitea.GiteaApiClient;
import dev.forgelink.infrastructure.gitea.GiteaApiClient.GiteaIssue;
import dev.forgelink.infrastructure.gitea.GiteaApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Creates, fetches, links and searches Gitea issues on behalf of an organization's installation.
 */
@Service
public class IssueBridgeService {
    private static final Logger log = LoggerFactory.getLogger(IssueBridgeService.class);

    public static final String FIELD_EXTERNAL_ISSUE = "externalIssue";

    private final InstallationService installationService;
    private final GiteaApiClient giteaApiClient;

    public IssueBridgeService(InstallationService installationService, GiteaApiClient giteaApiClient) {
        this.installationService = installationService;
        this.giteaApiClient = giteaApiClient;
    }

    public IssueResponse createIssue(long organizationId, long installationId, String repo,
                                     String title, String description) {
        if (repo == null || repo.isBlank()) throw new IllegalArgumentException("Repository must be provided");
        if (title == null || title.isBlank()) throw new IllegalArgumentException("Title must be provided");
        Installation installation = installationService.requireForOrganization(organizationId, installationId);

        GiteaIssue issue = giteaApiClient.createIssue(installation, repo, title, description);
        IssueReference reference = new IssueReference(repo, String.valueOf(issue.number()));
        log.info("Created issue {} for organization {}", reference.key(), organizationId);
        return toResponse(installation, reference, issue);
    }

    public IssueResponse getIssue(long organizationId, long installationId, String issueId) {
        IssueReference reference = IssueReference.parse(issueId);
        Installation installation = installationService.requireForOrganization(organizationId, installationId);
        GiteaIssue issue = giteaApiClient.getIssue(installation, reference.repo(), reference.index());
        return toResponse(installation, reference, issue);
    }

    /**
     * Resolves the issue and, when {@code comment} has text, posts it on the issue.
     */
    public IssueResponse linkIssue(long organizationId, long installationId, String issueId, String comment) {
        IssueReference reference = IssueReference.parse(issueId);
        Installation installation = installationService.requireForOrganization(organizationId, installationId);
        GiteaIssue issue = giteaApiClient.getIssue(installation, reference.repo(), reference.index());
        if (comment != null && !comment.isBlank()) {
            giteaApiClient.createIssueComment(installation, reference.repo(), reference.index(), comment);
        }
        return toResponse(installation, reference, issue);
    }

    public List<IssueSearchResult> searchIssues(long organizationId, long installationId,
                                                String field, String query, String repo) {
        Installation installation = installationService.requireForOrganization(organizationId, installationId);
        if (field == null || field.isBlank()) throw new IllegalArgumentException("field is a required parameter");
        if (query == null || query.isBlank()) throw new IllegalArgumentException("query is a required parameter");
        if (!FIELD_EXTERNAL_ISSUE.equals(field)) throw new IllegalArgumentException("Invalid field: " + field);
        if (repo == null || repo.isBlank()) throw new IllegalArgumentException("repo is a required parameter");

        try {
            return giteaApiClient.searchIssues(installation, repo, query).stream()
                    .map(i -> new IssueSearchResult("#" + i.number() + " " + i.title(), i.number()))
                    .toList();
        } catch (GiteaApiException e) {
            if (e.isForbidden()) {
                throw new UpstreamRateLimitException("Gitea refused issue search for " + repo, e);
            }
            throw e;
        }
    }

    private static IssueResponse toResponse(Installation installation, IssueReference reference, GiteaIssue issue) {
        return new IssueResponse(reference.key(), reference.externalKey(installation.getDomainName()),
                issue.title(), issue.body(), reference.url(installation.getBaseUrl()), reference.repo(),
                reference.key());
    }
}
