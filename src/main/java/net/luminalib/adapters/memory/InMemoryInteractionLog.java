package net.luminalib.adapters.memory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.interaction.UserInteraction;

public class InMemoryInteractionLog implements InteractionLog {

    private final List<UserInteraction> interactions = new CopyOnWriteArrayList<>();

    @Override
    public List<UserInteraction> findByUserId(UUID userId) {
        return interactions.stream().filter(interaction -> interaction.userId().equals(userId)).toList();
    }

    @Override
    public List<UserInteraction> findByBookId(UUID bookId) {
        return interactions.stream().filter(interaction -> interaction.bookId().equals(bookId)).toList();
    }

    @Override
    public void record(UserInteraction interaction) {
        interactions.add(interaction);
    }
}
