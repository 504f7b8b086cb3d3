package com.tunechat.match.match;

import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ConfidenceCalibrator {
    private final CalibrationProperties properties;

    public ConfidenceCalibrator(CalibrationProperties properties) {
        this.properties = properties;
    }

    /**
     * Confidence from the gap between the two best scores. Scores must be sorted descending.
     */
    public double calibrate(List<Double> sortedScores) {
        if (sortedScores == null || sortedScores.isEmpty()) {
            return 0.0;
        }
        if (sortedScores.size() == 1) {
            return properties.getSingle();
        }
        double gap = sortedScores.get(0) - sortedScores.get(1);
        double sigmoid = 1.0 / (1.0 + Math.exp(-properties.getScale() * gap));
        return Math.max(properties.getMin(), Math.min(properties.getMax(), sigmoid));
    }
}
