package com.matey.anomaly.core.forward;

import lombok.Builder;
import lombok.Value;

/**
 * Detection parameters sent with every batch. Thresholds are optional and left to the
 * detection service when null.
 */
@Value
@Builder(toBuilder = true)
public class DetectionSettings {

    int windowSize;
    int baselineLines;
    Double ncdThreshold;
    Double pValueThreshold;

    public static DetectionSettings standard() {
        return DetectionSettings.builder()
                .windowSize(50)
                .baselineLines(100)
                .build();
    }

    /**
     * Smaller window and looser thresholds; flags more events on quiet markets.
     */
    public static DetectionSettings sensitive() {
        return DetectionSettings.builder()
                .windowSize(20)
                .baselineLines(40)
                .ncdThreshold(0.25)
                .pValueThreshold(0.1)
                .build();
    }

    public static DetectionSettings forProfile(String profile) {
        String p = profile == null ? "standard" : profile.trim().toLowerCase();
        return switch (p) {
            case "standard" -> standard();
            case "sensitive" -> sensitive();
            default -> throw new IllegalArgumentException("Unknown detection profile '" + profile + "'");
        };
    }

    /**
     * Applies the non-null overrides on top of this profile.
     */
    public DetectionSettings withOverrides(Integer windowSize, Integer baselineLines,
                                           Double ncdThreshold, Double pValueThreshold) {
        DetectionSettingsBuilder builder = toBuilder();
        if (windowSize != null) {
            builder.windowSize(windowSize);
        }
        if (baselineLines != null) {
            builder.baselineLines(baselineLines);
        }
        if (ncdThreshold != null) {
            builder.ncdThreshold(ncdThreshold);
        }
        if (pValueThreshold != null) {
            builder.pValueThreshold(pValueThreshold);
        }
        return builder.build();
    }
}
