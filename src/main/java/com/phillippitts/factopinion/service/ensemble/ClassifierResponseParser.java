package com.phillippitts.factopinion.service.ensemble;

import com.phillippitts.factopinion.exception.ClassifierException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Decodes inference server responses into {@link ClassProbabilities}.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code [{"label":"LABEL_0","score":0.2},{"label":"LABEL_1","score":0.8}]}</li>
 *   <li>the same list wrapped in an outer array (batch form)</li>
 *   <li>{@code {"probabilities":[0.2,0.8]}} ordered (not-fact, fact)</li>
 * </ul>
 *
 * <p>When only one label is returned (top-1 responses) the other class gets the complement.
 */
final class ClassifierResponseParser {

    private ClassifierResponseParser() {}

    static ClassProbabilities parse(String body, String factLabel, String classifierName) {
        if (body == null || body.isBlank()) {
            throw new ClassifierException("Empty classifier response", classifierName);
        }
        try {
            String trimmed = body.strip();
            if (trimmed.startsWith("[")) {
                JSONArray arr = new JSONArray(trimmed);
                if (arr.length() > 0 && arr.optJSONArray(0) != null) {
                    arr = arr.getJSONArray(0);
                }
                return fromLabelScores(arr, factLabel, classifierName);
            }
            JSONObject obj = new JSONObject(trimmed);
            JSONArray probs = obj.optJSONArray("probabilities");
            if (probs == null) {
                throw new ClassifierException("Response has neither label scores nor 'probabilities'",
                        classifierName);
            }
            if (probs.length() != 2) {
                throw new ClassifierException("Expected 2 probabilities, got " + probs.length(), classifierName);
            }
            return build(probs.getDouble(0), probs.getDouble(1), classifierName);
        } catch (JSONException e) {
            throw new ClassifierException("Malformed classifier response: " + e.getMessage(), classifierName, e);
        }
    }

    private static ClassProbabilities fromLabelScores(JSONArray arr, String factLabel, String classifierName) {
        if (arr.length() == 0) {
            throw new ClassifierException("Classifier returned no labels", classifierName);
        }
        Double fact = null;
        double others = 0.0;
        int otherCount = 0;
        for (int i = 0; i < arr.length(); i++) {
            JSONObject entry = arr.getJSONObject(i);
            String label = entry.getString("label");
            double score = entry.getDouble("score");
            if (factLabel.equals(label)) {
                fact = score;
            } else {
                others += score;
                otherCount++;
            }
        }
        if (fact != null) {
            return build(otherCount == 0 ? 1.0 - fact : others, fact, classifierName);
        }
        if (otherCount == 1) {
            return build(others, 1.0 - others, classifierName);
        }
        throw new ClassifierException("Fact label '" + factLabel + "' missing from response", classifierName);
    }

    private static ClassProbabilities build(double notFact, double fact, String classifierName) {
        try {
            return new ClassProbabilities(notFact, fact);
        } catch (IllegalArgumentException e) {
            throw new ClassifierException("Invalid probabilities: " + e.getMessage(), classifierName, e);
        }
    }
}
