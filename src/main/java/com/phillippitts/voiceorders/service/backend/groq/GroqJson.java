package com.phillippitts.voiceorders.service.backend.groq;

import com.phillippitts.voiceorders.domain.conversation.ChatMessage;
import com.phillippitts.voiceorders.exception.BackendCallException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.List;

/**
 * Request builders and response readers for the OpenAI-compatible JSON bodies.
 */
final class GroqJson {

    private GroqJson() {}

    static String chatRequest(String model, List<ChatMessage> messages) {
        JSONArray array = new JSONArray();
        for (ChatMessage m : messages) {
            array.put(new JSONObject().put("role", m.role().apiValue()).put("content", m.content()));
        }
        return new JSONObject()
                .put("model", model)
                .put("messages", array)
                .toString();
    }

    static String speechRequest(String model, String voice, String text) {
        return new JSONObject()
                .put("model", model)
                .put("voice", voice)
                .put("input", text)
                .put("response_format", "wav")
                .toString();
    }

    /**
     * Reads {@code choices[0].message.content}.
     */
    static String completionContent(String body, String backend) {
        try {
            JSONObject message = new JSONObject(body)
                    .getJSONArray("choices")
                    .getJSONObject(0)
                    .getJSONObject("message");
            return message.optString("content", "");
        } catch (JSONException e) {
            throw new BackendCallException("Unexpected chat completion response: " + e.getMessage(), backend, e);
        }
    }

    /**
     * Reads {@code text} of a transcription response.
     */
    static String transcriptText(String body, String backend) {
        try {
            return new JSONObject(body).getString("text");
        } catch (JSONException e) {
            throw new BackendCallException("Unexpected transcription response: " + e.getMessage(), backend, e);
        }
    }
}
