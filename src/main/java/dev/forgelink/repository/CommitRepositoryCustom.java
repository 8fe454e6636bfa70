package dev.forgelink.repository;

import dev.forgelink.domain.entity.Commit;

/**
 * Custom repository interface for Commit insert-or-ignore.
 */
public interface CommitRepositoryCustom {

    /**
     * Inserts the commit unless one with the same (repository, key) exists.
     * Uses PostgreSQL {@code ON CONFLICT DO NOTHING}; redelivery is a no-op, never an error.
     *
     * @return true if a row was inserted, false if the commit was already known
     */
    boolean insertIfAbsent(Commit commit);
}
