package org.pharmaguard.tools.pgx.confidence;

import com.fasterxml.jackson.databind.JsonNode;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.utils.Utils;
import org.pharmaguard.utils.json.JsonUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A reported confidence and whether the call it was attached to turned out correct.
 */
public record CalibrationObservation(double confidence, boolean correct) {

    public CalibrationObservation {
        confidence = Utils.clampToUnitInterval(confidence);
    }

    public int outcome() {
        return correct ? 1 : 0;
    }

    /**
     * Reads {@code {"confidence": 0.96, "correct": 1}} lines. Confidences are clamped to [0,1]; any non-zero
     * {@code correct} counts as correct.
     */
    public static List<CalibrationObservation> readJsonLines(final Path input) {
        final List<CalibrationObservation> observations = new ArrayList<>();
        for (final JsonNode node : JsonUtils.readJsonLines(input)) {
            final JsonNode confidence = node.get("confidence");
            final JsonNode correct = node.get("correct");
            if (confidence == null || !confidence.isNumber() || correct == null || !(correct.isNumber() || correct.isBoolean())) {
                throw new UserException.MalformedFile(input.toString(),
                        "every line needs a numeric \"confidence\" and a numeric or boolean \"correct\": " + node);
            }
            final boolean isCorrect = correct.isBoolean() ? correct.booleanValue() : correct.asInt() != 0;
            observations.add(new CalibrationObservation(confidence.doubleValue(), isCorrect));
        }
        return observations;
    }
}
