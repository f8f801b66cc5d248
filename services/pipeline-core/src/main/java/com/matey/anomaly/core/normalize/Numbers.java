package com.matey.anomaly.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;

final class Numbers {

    static final double MISSING = 0.0;

    private Numbers() {
    }

    /**
     * JSON numbers and numeric strings become doubles; a missing value becomes
     * {@link #MISSING}; anything else is rejected.
     */
    static double coerce(JsonNode value, String field) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return MISSING;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            return Double.parseDouble(value.textValue().trim());
        }
        throw new IllegalArgumentException("Field '" + field + "' is not numeric");
    }
}
