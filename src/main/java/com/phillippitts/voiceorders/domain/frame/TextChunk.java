package com.phillippitts.voiceorders.domain.frame;

/**
 * A piece of text: a finalized transcription on the user side, or a (possibly partial) reply on the bot side.
 *
 * @param text the text, never null
 */
public record TextChunk(String text) implements Frame {

    public TextChunk {
        text = text == null ? "" : text;
    }
}
