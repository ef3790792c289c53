package com.phillippitts.fstintent.presentation.json;

import com.phillippitts.fstintent.domain.EntityValue;
import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.domain.RecognizedIntent;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntentJsonWriterTest {

    @Test
    void rendersRecordFields() {
        IntentRecord record = new IntentRecord("play prince", List.of("play", "prince"),
                new RecognizedIntent("PlayArtist", 0.5), List.of(new EntityValue("artist", "prince")));

        JSONObject json = IntentJsonWriter.toJson(record);

        assertThat(json.getString("text")).isEqualTo("play prince");
        assertThat(json.getJSONArray("tokens").toList()).containsExactly("play", "prince");
        assertThat(json.getJSONObject("intent").getString("name")).isEqualTo("PlayArtist");
        assertThat(json.getJSONObject("intent").getDouble("confidence")).isEqualTo(0.5);
        JSONObject entity = json.getJSONArray("entities").getJSONObject(0);
        assertThat(entity.getString("entity")).isEqualTo("artist");
        assertThat(entity.getString("value")).isEqualTo("prince");
    }

    @Test
    void batchKeepsSentenceOrderAndEscapesKeys() {
        Map<String, List<IntentRecord>> results = new LinkedHashMap<>();
        results.put("zulu \"quoted\"", List.of());
        results.put("alpha", List.of(new IntentRecord("alpha", List.of("alpha"),
                new RecognizedIntent("A", 1.0), List.of())));

        String text = IntentJsonWriter.write(results);

        assertThat(text.indexOf("zulu")).isLessThan(text.indexOf("alpha"));
        JSONObject parsed = new JSONObject(text);
        assertThat(parsed.getJSONArray("zulu \"quoted\"").length()).isZero();
        JSONArray alpha = parsed.getJSONArray("alpha");
        assertThat(alpha.getJSONObject(0).getJSONObject("intent").getString("name")).isEqualTo("A");
    }

    @Test
    void emptyBatchIsEmptyObject() {
        assertThat(IntentJsonWriter.write(Map.of())).isEqualTo("{}");
    }
}
