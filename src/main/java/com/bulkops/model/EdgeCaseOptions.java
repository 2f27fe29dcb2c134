package com.bulkops.model;

/**
 * Fractions of generated records that receive edge-case values.
 *
 * @param nullOptionalFraction   records whose optional fields are left null
 * @param boundaryStringFraction records whose text fields are filled to their maximum length
 * @param outOfRangeFraction     records with extreme but valid numbers and dates
 */
public record EdgeCaseOptions(double nullOptionalFraction, double boundaryStringFraction, double outOfRangeFraction) {

    public static final EdgeCaseOptions NONE = new EdgeCaseOptions(0, 0, 0);

    public EdgeCaseOptions {
        requireFraction(nullOptionalFraction, "nullOptionalFraction");
        requireFraction(boundaryStringFraction, "boundaryStringFraction");
        requireFraction(outOfRangeFraction, "outOfRangeFraction");
    }

    private static void requireFraction(double value, String name) {
        if (value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
        }
    }
}
