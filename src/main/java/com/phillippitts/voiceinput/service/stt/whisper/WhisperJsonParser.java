package com.phillippitts.voiceinput.service.stt.whisper;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Extracts the recognized text from whisper.cpp JSON output ({@code -oj}).
 *
 * <p>Accepts a top-level {@code text}, the {@code transcription} array whisper.cpp writes,
 * or a {@code segments} array. Malformed input yields an empty string.
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    static String extractText(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("text")) {
                return obj.optString("text", "").trim();
            }
            if (obj.has("transcription")) {
                return joinSegments(obj.optJSONArray("transcription"));
            }
            if (obj.has("segments")) {
                return joinSegments(obj.optJSONArray("segments"));
            }
        } catch (JSONException e) {
            return "";
        }
        return "";
    }

    private static String joinSegments(JSONArray segments) {
        if (segments == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length(); i++) {
            JSONObject seg = segments.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            String t = seg.optString("text", "").trim();
            if (t.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t);
        }
        return sb.toString();
    }
}
