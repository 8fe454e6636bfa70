package dev.forgelink.repository;

import dev.forgelink.domain.entity.PullRequest;

public interface PullRequestRepositoryCustom {

    /**
     * Create-or-update keyed by (repository, key) using PostgreSQL {@code ON CONFLICT DO UPDATE}.
     * The stored row always reflects the latest delivery.
     *
     * @return rows affected (1)
     */
    int upsert(PullRequest pullRequest);
}
