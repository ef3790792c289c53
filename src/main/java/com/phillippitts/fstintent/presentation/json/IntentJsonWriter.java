package com.phillippitts.fstintent.presentation.json;

import com.phillippitts.fstintent.domain.EntityValue;
import com.phillippitts.fstintent.domain.IntentRecord;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders recognition results as JSON.
 *
 * <p>Batch format (one key per sentence, in input order):
 * <pre>
 * {"turn on the light": [{"text": "turn on the light", "tokens": ["turn", "on", "the", "light"],
 *   "intent": {"name": "LightOn", "confidence": 1}, "entities": []}]}
 * </pre>
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class IntentJsonWriter {

    private IntentJsonWriter() {
        // Utility class - prevent instantiation
    }

    /**
     * Writes the batch map. {@link JSONObject} does not keep insertion order, so the outer object
     * is assembled here to preserve the sentence order of the map.
     *
     * @param results sentence → intent records
     * @return compact JSON object text
     */
    public static String write(Map<String, List<IntentRecord>> results) {
        StringBuilder sb = new StringBuilder("{");
        Iterator<Map.Entry<String, List<IntentRecord>>> it = results.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, List<IntentRecord>> entry = it.next();
            sb.append(JSONObject.quote(entry.getKey()))
                    .append(':')
                    .append(toJson(entry.getValue()));
            if (it.hasNext()) {
                sb.append(',');
            }
        }
        return sb.append('}').toString();
    }

    public static JSONArray toJson(List<IntentRecord> records) {
        JSONArray array = new JSONArray();
        for (IntentRecord record : records) {
            array.put(toJson(record));
        }
        return array;
    }

    public static JSONObject toJson(IntentRecord record) {
        JSONObject intent = new JSONObject()
                .put("name", record.intent().name())
                .put("confidence", record.intent().confidence());

        JSONArray entities = new JSONArray();
        for (EntityValue entity : record.entities()) {
            entities.put(new JSONObject()
                    .put("entity", entity.entity())
                    .put("value", entity.value()));
        }

        return new JSONObject()
                .put("text", record.text())
                .put("tokens", new JSONArray(record.tokens()))
                .put("intent", intent)
                .put("entities", entities);
    }
}
