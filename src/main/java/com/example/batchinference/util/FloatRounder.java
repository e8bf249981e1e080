package com.example.batchinference.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rounds floating point values to a fixed number of decimals. Uses half-even
 * rounding on the decimal representation so that rounding an already rounded
 * value is a no-op. NaN, infinities and nulls pass through unchanged.
 */
public final class FloatRounder {

    private final int precision;

    public FloatRounder(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("Rounding precision must not be negative");
        }
        this.precision = precision;
    }

    public double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
    }

    public Double round(Double value) {
        return value == null ? null : round(value.doubleValue());
    }

    public List<Double> round(List<Double> values) {
        if (values == null) {
            return null;
        }
        List<Double> rounded = new ArrayList<>(values.size());
        for (Double value : values) {
            rounded.add(round(value));
        }
        return Collections.unmodifiableList(rounded);
    }
}
