package com.phillippitts.voiceorders.presentation.websocket;

import com.phillippitts.voiceorders.domain.frame.AudioChunk;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.TransportMessage;
import com.phillippitts.voiceorders.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;
import java.util.Optional;

/**
 * JSON text protocol of the voice socket, designed for browser clients exchanging base64 PCM.
 *
 * <p>Inbound:
 * <pre>
 * {"type":"audio","data":"&lt;base64 PCM16LE&gt;","sample_rate":16000,"channels":1}
 * {"type":"message","data":...}
 * </pre>
 * Outbound:
 * <pre>
 * {"type":"message","data":"&lt;JSON payload as string&gt;"}
 * {"type":"audio","data":"&lt;base64 PCM16LE&gt;","sample_rate":24000,"channels":1}
 * </pre>
 */
public final class JsonFrameSerializer {

    private static final Logger LOG = LogManager.getLogger(JsonFrameSerializer.class);

    /**
     * Encodes an outbound frame; frames without a wire form yield empty.
     */
    public Optional<String> serialize(Frame frame) {
        if (frame instanceof TransportMessage message) {
            return Optional.of(new JSONObject()
                    .put("type", "message")
                    .put("data", message.jsonPayload())
                    .toString());
        }
        if (frame instanceof AudioChunk audio) {
            return Optional.of(new JSONObject()
                    .put("type", "audio")
                    .put("data", Base64.getEncoder().encodeToString(audio.pcm()))
                    .put("sample_rate", audio.sampleRate())
                    .put("channels", audio.channels())
                    .toString());
        }
        return Optional.empty();
    }

    /**
     * Decodes an inbound text message. Malformed or unsupported messages yield empty.
     */
    public Optional<Frame> deserialize(String text) {
        JSONObject payload;
        try {
            payload = new JSONObject(text);
        } catch (JSONException e) {
            LOG.debug("Ignoring non-JSON message: {}", e.getMessage());
            return Optional.empty();
        }
        String type = payload.optString("type", "");
        switch (type) {
            case "audio":
                return decodeAudio(payload);
            case "message":
                LOG.debug("Client message received; no stage consumes client messages");
                return Optional.empty();
            default:
                LOG.debug("Ignoring message of unknown type '{}'", type);
                return Optional.empty();
        }
    }

    private static Optional<Frame> decodeAudio(JSONObject payload) {
        String data = payload.optString("data", "");
        if (data.isEmpty()) {
            return Optional.empty();
        }
        byte[] pcm;
        try {
            pcm = Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            LOG.debug("Ignoring audio with invalid base64: {}", e.getMessage());
            return Optional.empty();
        }
        int sampleRate = positiveOr(payload.optInt("sample_rate", 0), AudioFormat.DEFAULT_SAMPLE_RATE);
        int channels = positiveOr(payload.optInt("channels", 0), AudioFormat.DEFAULT_CHANNELS);
        return Optional.of(new AudioChunk(pcm, sampleRate, channels));
    }

    private static int positiveOr(int value, int fallback) {
        return value > 0 ? value : fallback;
    }
}
