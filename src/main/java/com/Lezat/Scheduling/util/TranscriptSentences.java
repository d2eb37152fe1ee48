package com.Lezat.Scheduling.util;

import com.Lezat.Scheduling.model.TranscriptSentence;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/** Sentence arrays as Fireflies and Read AI send them, in webhooks and API responses alike. */
public final class TranscriptSentences {

    private TranscriptSentences() {
    }

    /** Entries without text are skipped. A missing or non-array node gives an empty list. */
    public static List<TranscriptSentence> parse(JsonNode blocks) {
        List<TranscriptSentence> sentences = new ArrayList<>();
        if (blocks == null || !blocks.isArray()) return sentences;
        for (JsonNode b : blocks) {
            if (!b.isObject()) continue;
            String text = JsonPaths.firstFlattenedText(b, "words", "text", "raw_text");
            if (text == null) continue;
            sentences.add(new TranscriptSentence(
                    JsonPaths.firstText(b, "speaker.name", "speaker_name", "speaker"),
                    b.hasNonNull("start_time") ? b.get("start_time").asDouble() : null,
                    b.hasNonNull("end_time") ? b.get("end_time").asDouble() : null,
                    text));
        }
        return sentences;
    }

    /** One "Speaker: text" line per sentence, or null when there are none. */
    public static String toText(List<TranscriptSentence> sentences) {
        if (sentences == null || sentences.isEmpty()) return null;
        List<String> lines = new ArrayList<>();
        for (TranscriptSentence s : sentences) {
            lines.add(s.getSpeaker() == null ? s.getText() : s.getSpeaker() + ": " + s.getText());
        }
        return String.join("\n", lines);
    }
}
