package com.harvey.backend.service.training;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acceptance band for a model type's primary metric. A null bound is open.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationThreshold {

    private String metric;
    private Double min;
    private boolean minInclusive;
    private Double max;
    private boolean maxInclusive = true;

    public static ValidationThreshold above(String metric, double min) {
        return new ValidationThreshold(metric, min, false, null, true);
    }

    public static ValidationThreshold within(String metric, double min, double max) {
        return new ValidationThreshold(metric, min, true, max, true);
    }

    public boolean accepts(double value) {
        if (Double.isNaN(value)) {
            return false;
        }
        if (min != null && (minInclusive ? value < min : value <= min)) {
            return false;
        }
        return max == null || (maxInclusive ? value <= max : value < max);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder(metric);
        if (min != null && max != null) {
            sb.append(" in ").append(minInclusive ? "[" : "(").append(min).append(", ")
                    .append(max).append(maxInclusive ? "]" : ")");
        } else if (min != null) {
            sb.append(minInclusive ? " >= " : " > ").append(min);
        } else if (max != null) {
            sb.append(maxInclusive ? " <= " : " < ").append(max);
        }
        return sb.toString();
    }
}
