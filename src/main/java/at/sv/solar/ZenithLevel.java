package at.sv.solar;

/**
 * The angle from the observer's vertical at which the sun is considered to cross the horizon.
 * Everything beyond {@link #OFFICIAL} describes a deeper twilight.
 */
public enum ZenithLevel {
    OFFICIAL(90.83),
    CIVIL(96),
    NAUTICAL(102),
    ASTRONOMICAL(108);

    private final double degrees;

    ZenithLevel(double degrees) {
        this.degrees = degrees;
    }

    public double getDegrees() {
        return degrees;
    }
}
