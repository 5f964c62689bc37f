package io.genoflow.core.task;

public record ValueRange(double min, double max) {

    public ValueRange {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Range bounds must be numbers");
        }
        if (min > max) {
            throw new IllegalArgumentException("min must be less than or equal to max");
        }
    }

    public static ValueRange of(double min, double max) {
        return new ValueRange(min, max);
    }

    /// Unit interval, used for probabilities and normalised scores.
    public static ValueRange unit() {
        return new ValueRange(0.0, 1.0);
    }

    public boolean contains(double value) {
        return (min <= value) && (value <= max);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
