package dev.forgelink.repository;

import dev.forgelink.domain.entity.CommitAuthor;

public interface CommitAuthorRepositoryCustom {

    /**
     * Returns the author stored for (organization, email), inserting {@code candidate} first if
     * none exists. An existing author keeps its name.
     */
    CommitAuthor getOrCreate(CommitAuthor candidate);
}
