package org.permsync.main.http;

import java.util.ArrayList;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * A thin query layer over json-simple.  Paths look like
 * `profile > login` or `items > [0] > id`.  Querying for something that
 * isn't there yields a "missing" value rather than an exception, so callers
 * can choose between a default and failing loudly.
 */
public class JSON {

    private Object elt;
    private boolean missing;
    private String failedQuery;

    public static JSON parse(String json) {
        try {
            return new JSON(new JSONParser().parse(json));
        } catch (ParseException e) {
            throw new IllegalArgumentException(String.format("Couldn't parse JSON: %s", abbreviate(json)), e);
        }
    }

    public JSON(Object parsed) {
        elt = parsed;
        missing = false;
    }

    private JSON(Object failedObj, String failedQuery) {
        elt = failedObj;
        this.missing = true;
        this.failedQuery = failedQuery;
    }

    public String toString() {
        return String.valueOf(elt);
    }

    public JSON path(String query) {
        if (missing) {
            return this;
        }

        Object target = elt;

        for (String bit : query.split(" *> *")) {
            if (bit.matches("\\[[0-9]+\\]")) {
                int idx = Integer.parseInt(bit.substring(1, bit.length() - 1));

                if (!(target instanceof JSONArray) || idx >= ((JSONArray) target).size()) {
                    return new JSON(elt, query);
                }

                target = ((JSONArray) target).get(idx);
            } else {
                if (!(target instanceof JSONObject) || !((JSONObject) target).containsKey(bit)) {
                    return new JSON(elt, query);
                }

                target = ((JSONObject) target).get(bit);
            }
        }

        return new JSON(target);
    }

    private void checkPresent() {
        if (this.missing) {
            throw new IllegalStateException(String.format("No values were matched for query '%s' against: %s",
                                                          this.failedQuery,
                                                          abbreviate(String.valueOf(this.elt))));
        }
    }

    public boolean isMissing() {
        return missing;
    }

    public boolean isPresent() {
        return !missing;
    }

    public boolean isNull() {
        return missing || elt == null;
    }

    public Long asLong(Long dflt) {
        return isNull() ? dflt : asLongOrDie();
    }

    public Long asLongOrDie() {
        checkPresent();

        if (elt instanceof Number) {
            return ((Number) elt).longValue();
        }

        if (elt instanceof String && ((String) elt).matches("-?[0-9]+")) {
            return Long.valueOf((String) elt);
        }

        throw new IllegalStateException(String.format("Expected a long but had: %s", elt));
    }

    // Identifiers show up as numbers in one API and strings in another.
    public String asString(String dflt) {
        return isNull() ? dflt : asStringOrDie();
    }

    public String asStringOrDie() {
        checkPresent();

        if (elt instanceof String) {
            return (String) elt;
        }

        if (elt instanceof Number || elt instanceof Boolean) {
            return String.valueOf(elt);
        }

        throw new IllegalStateException(String.format("Expected a string but had: %s", elt));
    }

    public Boolean asBoolean(Boolean dflt) {
        if (isNull()) {
            return dflt;
        }

        if (elt instanceof Boolean) {
            return (Boolean) elt;
        }

        throw new IllegalStateException(String.format("Expected a boolean but had: %s", elt));
    }

    @SuppressWarnings("unchecked")
    public List<JSON> asJSONList() {
        checkPresent();

        if (!(elt instanceof JSONArray)) {
            throw new IllegalStateException(String.format("Expected an array but had: %s", abbreviate(String.valueOf(elt))));
        }

        List<JSON> result = new ArrayList<>();
        ((JSONArray) elt).forEach((obj) -> result.add(new JSON(obj)));
        return result;
    }

    private static String abbreviate(String s) {
        if (s == null || s.length() <= 200) {
            return s;
        }

        return s.substring(0, 197) + "...";
    }
}
