package com.github.nikalon.sunposition;

public class Helper {
    // Common functions used when performing astronomical calculations

    private Helper() {} // Disallow instantiation

    static double modulo(double dividend, double divisor) {
        // Modulo defined as floor division, where the sign is determined by the divisor. Math.floorMod only exists
        // for integers, so this is the floating point version.
        return dividend - divisor * Math.floor(dividend / divisor);
    }

    // Fractional part of a number of revolutions, in degrees
    static double revolutions(double turns) {
        return 360.0 * (turns - Math.floor(turns));
    }

    /**
     * Reduces an angle in degrees to the range [0, 360). An angle of exactly 360 degrees reduces to 0.
     */
    public static double reduceDegrees(double degrees) {
        double reduced = modulo(degrees, 360.0);

        // Tiny negative inputs such as -1e-15 land on 360.0 after rounding
        if (reduced >= 360.0) {
            reduced = 0.0;
        }
        return reduced;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    // Keeps Math.asin away from NaN when floating point drift pushes the sine slightly past +-1
    static double safeAsin(double sine) {
        return Math.asin(clamp(sine, -1.0, 1.0));
    }
}
