package dev.forgelink.service.webhook;

import dev.forgelink.domain.entity.Commit;
import dev.forgelink.domain.entity.CommitAuthor;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.Organization;
import dev.forgelink.domain.entity.SourceRepository;
import dev.forgelink.domain.enums.GiteaEventType;
import dev.forgelink.dto.request.PushEventPayload;
import dev.forgelink.dto.request.PushEventPayload.CommitEntry;
import dev.forgelink.repository.CommitAuthorRepository;
import dev.forgelink.repository.CommitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records the commits of a push. Each commit is inserted in its own transaction; a commit that
 * fails is logged and the rest of the push still goes through. Redelivered commits are no-ops.
 */
@Component
public class PushEventHandler implements WebhookEventHandler<PushEventPayload> {
    private static final Logger log = LoggerFactory.getLogger(PushEventHandler.class);

    private final RepositoryResolver repositoryResolver;
    private final CommitMessageFilter messageFilter;
    private final CommitRepository commitRepository;
    private final CommitAuthorRepository authorRepository;

    public PushEventHandler(RepositoryResolver repositoryResolver, CommitMessageFilter messageFilter,
                            CommitRepository commitRepository, CommitAuthorRepository authorRepository) {
        this.repositoryResolver = repositoryResolver;
        this.messageFilter = messageFilter;
        this.commitRepository = commitRepository;
        this.authorRepository = authorRepository;
    }

    @Override
    public GiteaEventType eventType() {
        return GiteaEventType.PUSH;
    }

    @Override
    public Class<PushEventPayload> payloadType() {
        return PushEventPayload.class;
    }

    @Override
    public void handle(Organization organization, Installation installation, PushEventPayload event) {
        Optional<SourceRepository> resolved =
                repositoryResolver.resolve(organization.getId(), installation, event.repository());
        if (resolved.isEmpty()) return;
        SourceRepository repository = resolved.get();

        // authors seen in this push, by email
        Map<String, CommitAuthor> authors = new HashMap<>();
        int inserted = 0;
        for (CommitEntry entry : event.commits()) {
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                log.atWarn().setMessage("gitea.webhook.commit-skipped")
                        .addKeyValue("repository_id", repository.getId())
                        .addKeyValue("reason", "missing-id").log();
                continue;
            }
            if (messageFilter.isIgnored(entry.message())) {
                log.atDebug().setMessage("gitea.webhook.commit-ignored")
                        .addKeyValue("commit", entry.id()).log();
                continue;
            }
            try {
                Instant dateAdded = Timestamps.parseUtc(entry.timestamp());
                CommitAuthor author = resolveAuthor(organization.getId(), entry, authors);
                Commit commit = Commit.create(organization.getId(), repository.getId(), entry.id(),
                        entry.message(), author, dateAdded);
                if (commitRepository.insertIfAbsent(commit)) inserted++;
            } catch (RuntimeException e) {
                log.atWarn().setMessage("gitea.webhook.commit-failed")
                        .addKeyValue("repository_id", repository.getId())
                        .addKeyValue("commit", entry.id())
                        .setCause(e).log();
            }
        }
        log.atInfo().setMessage("gitea.webhook.push-processed")
                .addKeyValue("organization_id", organization.getId())
                .addKeyValue("repository_id", repository.getId())
                .addKeyValue("commits", event.commits().size())
                .addKeyValue("inserted", inserted).log();
    }

    /** Returns null when the email is unusable or the author cannot be stored; the commit is kept either way. */
    private CommitAuthor resolveAuthor(long organizationId, CommitEntry entry, Map<String, CommitAuthor> seen) {
        String email = entry.authorEmail();
        if (!CommitAuthor.isUsableEmail(email)) return null;
        CommitAuthor known = seen.get(email);
        if (known != null) return known;
        try {
            CommitAuthor author = authorRepository.getOrCreate(
                    CommitAuthor.create(organizationId, entry.authorName(), email));
            seen.put(email, author);
            return author;
        } catch (RuntimeException e) {
            log.atWarn().setMessage("gitea.webhook.author-failed")
                    .addKeyValue("organization_id", organizationId)
                    .addKeyValue("commit", entry.id())
                    .setCause(e).log();
            return null;
        }
    }
}
