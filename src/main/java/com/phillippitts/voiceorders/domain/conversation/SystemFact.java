package com.phillippitts.voiceorders.domain.conversation;

import java.util.Objects;

/**
 * Tagged piece of context injected into the conversation as a system message.
 * Facts sharing a tag replace each other; an identical repeat is suppressed.
 *
 * @param tag     dedup key
 * @param content system message text
 */
public record SystemFact(String tag, String content) {

    public SystemFact {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(content, "content");
    }
}
