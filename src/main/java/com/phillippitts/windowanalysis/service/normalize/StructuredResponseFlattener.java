package com.phillippitts.windowanalysis.service.normalize;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a JSON-object response into {@code key: value} text lines so structured and free-text
 * responses go through the same extraction rules.
 *
 * <p>Keys are emitted in sorted order so the output does not depend on JSON key order. Nested
 * objects use dotted keys; arrays of scalars are joined into one sentence list. Text that is
 * not a JSON object (optionally wrapped in a Markdown code fence) is returned unchanged.
 */
final class StructuredResponseFlattener {

    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private StructuredResponseFlattener() {
    }

    static String flatten(String response) {
        if (response == null) {
            return "";
        }
        String candidate = response.trim();
        Matcher fence = CODE_FENCE.matcher(candidate);
        if (fence.matches()) {
            candidate = fence.group(1).trim();
        }
        if (!candidate.startsWith("{")) {
            return response;
        }
        try {
            JSONObject json = new JSONObject(candidate);
            List<String> lines = new ArrayList<>();
            appendObject(lines, "", json);
            return String.join("\n", lines);
        } catch (JSONException e) {
            // looked like JSON but isn't; treat as free text
            return response;
        }
    }

    private static void appendObject(List<String> lines, String prefix, JSONObject obj) {
        for (String key : new TreeSet<>(obj.keySet())) {
            Object value = obj.opt(key);
            String path = prefix.isEmpty() ? key : prefix + "." + key;
            if (value instanceof JSONObject nested) {
                appendObject(lines, path, nested);
            } else if (value instanceof JSONArray array) {
                appendArray(lines, path, array);
            } else if (value != null && value != JSONObject.NULL) {
                lines.add(path + ": " + value);
            }
        }
    }

    private static void appendArray(List<String> lines, String path, JSONArray array) {
        List<String> scalars = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            Object item = array.opt(i);
            if (item instanceof JSONObject nested) {
                appendObject(lines, path, nested);
            } else if (item != null && item != JSONObject.NULL && !(item instanceof JSONArray)) {
                scalars.add(String.valueOf(item).trim());
            }
        }
        if (!scalars.isEmpty()) {
            lines.add(path + ": " + String.join(". ", scalars));
        }
    }
}
