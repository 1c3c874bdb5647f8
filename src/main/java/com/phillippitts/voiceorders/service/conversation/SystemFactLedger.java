package com.phillippitts.voiceorders.service.conversation;

import com.phillippitts.voiceorders.domain.conversation.MessageRole;
import com.phillippitts.voiceorders.domain.conversation.SystemFact;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Remembers the last system message injected per tag and suppresses identical repeats.
 *
 * <p>For a given tag the context receives a new system message only when the content differs
 * from the content last injected under that tag. One ledger belongs to one session and is only
 * mutated by that session's order knowledge stage.
 */
public final class SystemFactLedger {

    private static final Logger LOG = LogManager.getLogger(SystemFactLedger.class);

    private final ConversationContext context;
    private final Map<String, String> lastContentByTag = new HashMap<>();

    public SystemFactLedger(ConversationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Injects the fact as a system message unless the same content is already recorded for its tag.
     *
     * @return {@code true} if a system message was appended
     */
    public boolean inject(SystemFact fact) {
        Objects.requireNonNull(fact, "fact");
        if (fact.content().equals(lastContentByTag.get(fact.tag()))) {
            LOG.debug("Skipping duplicate system fact: tag={}", fact.tag());
            return false;
        }
        context.appendMessage(MessageRole.SYSTEM, fact.content());
        lastContentByTag.put(fact.tag(), fact.content());
        LOG.info("Injected system fact: tag={}, chars={}", fact.tag(), fact.content().length());
        return true;
    }

    public Optional<String> lastContent(String tag) {
        return Optional.ofNullable(lastContentByTag.get(tag));
    }
}
