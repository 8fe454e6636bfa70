package dev.forgelink.service.webhook;

import dev.forgelink.domain.entity.CommitAuthor;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.Organization;
import dev.forgelink.domain.entity.PullRequest;
import dev.forgelink.domain.entity.SourceRepository;
import dev.forgelink.domain.enums.GiteaEventType;
import dev.forgelink.dto.request.PullRequestEventPayload;
import dev.forgelink.exception.NotActionableException;
import dev.forgelink.repository.CommitAuthorRepository;
import dev.forgelink.repository.PullRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Creates or refreshes the pull request named in the event. Keyed by (repository, number), so
 * redelivery and later actions (edited, closed, merged) update the same row.
 */
@Component
public class PullRequestEventHandler implements WebhookEventHandler<PullRequestEventPayload> {
    private static final Logger log = LoggerFactory.getLogger(PullRequestEventHandler.class);

    private final RepositoryResolver repositoryResolver;
    private final PullRequestRepository pullRequestRepository;
    private final CommitAuthorRepository authorRepository;

    public PullRequestEventHandler(RepositoryResolver repositoryResolver,
                                   PullRequestRepository pullRequestRepository,
                                   CommitAuthorRepository authorRepository) {
        this.repositoryResolver = repositoryResolver;
        this.pullRequestRepository = pullRequestRepository;
        this.authorRepository = authorRepository;
    }

    @Override
    public GiteaEventType eventType() {
        return GiteaEventType.PULL_REQUEST;
    }

    @Override
    public Class<PullRequestEventPayload> payloadType() {
        return PullRequestEventPayload.class;
    }

    @Override
    public void validate(PullRequestEventPayload event) {
        List<String> missing = event.missingFields();
        if (!missing.isEmpty()) {
            log.atWarn().setMessage("gitea.webhook.pull-request-incomplete")
                    .addKeyValue("missing", missing).log();
            throw new NotActionableException("Pull request event missing " + missing);
        }
        try {
            Timestamps.parseUtc(event.pullRequest().createdAt());
        } catch (IllegalArgumentException e) {
            log.atWarn().setMessage("gitea.webhook.pull-request-incomplete")
                    .addKeyValue("created_at", event.pullRequest().createdAt()).log();
            throw new NotActionableException("Pull request created_at unparseable");
        }
    }

    @Override
    public void handle(Organization organization, Installation installation, PullRequestEventPayload event) {
        Optional<SourceRepository> resolved =
                repositoryResolver.resolve(organization.getId(), installation, event.repository());
        if (resolved.isEmpty()) return;
        SourceRepository repository = resolved.get();

        PullRequestEventPayload.PullRequest pr = event.pullRequest();
        CommitAuthor author = resolveAuthor(organization.getId(), pr);

        PullRequest pullRequest = PullRequest.create(organization.getId(), repository.getId(),
                String.valueOf(pr.number()), pr.title(), pr.body(), author,
                event.effectiveMergeCommitSha(), Timestamps.parseUtc(pr.createdAt()));
        pullRequestRepository.upsert(pullRequest);

        log.atInfo().setMessage("gitea.webhook.pull-request-processed")
                .addKeyValue("organization_id", organization.getId())
                .addKeyValue("repository_id", repository.getId())
                .addKeyValue("number", pr.number())
                .addKeyValue("action", event.action()).log();
    }

    private CommitAuthor resolveAuthor(long organizationId, PullRequestEventPayload.PullRequest pr) {
        String email = pr.user().email();
        if (!CommitAuthor.isUsableEmail(email)) return null;
        try {
            return authorRepository.getOrCreate(CommitAuthor.create(organizationId, pr.user().username(), email));
        } catch (RuntimeException e) {
            log.atWarn().setMessage("gitea.webhook.author-failed")
                    .addKeyValue("organization_id", organizationId)
                    .addKeyValue("number", pr.number())
                    .setCause(e).log();
            return null;
        }
    }
}
