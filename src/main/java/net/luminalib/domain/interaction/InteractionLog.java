package net.luminalib.domain.interaction;

import java.util.List;
import java.util.UUID;

/**
 * Append-only log of reader activity. Entries are never updated or deleted.
 */
public interface InteractionLog {

    List<UserInteraction> findByUserId(UUID userId);

    List<UserInteraction> findByBookId(UUID bookId);

    void record(UserInteraction interaction);
}
