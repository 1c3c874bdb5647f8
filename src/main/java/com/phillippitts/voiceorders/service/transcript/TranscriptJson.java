package com.phillippitts.voiceorders.service.transcript;

import com.phillippitts.voiceorders.domain.transcript.TranscriptEntry;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Wire format of transcript snapshots:
 * {@code [{"type":"user"|"bot","message":"...","time":"yyyy-MM-dd HH:mm:ss"}, ...]}.
 */
final class TranscriptJson {

    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TranscriptJson() {}

    static String toJson(List<TranscriptEntry> entries) {
        JSONArray array = new JSONArray();
        for (TranscriptEntry entry : entries) {
            array.put(new JSONObject()
                    .put("type", entry.speaker().wireValue())
                    .put("message", entry.text())
                    .put("time", TIME.format(entry.timestamp())));
        }
        return array.toString();
    }
}
