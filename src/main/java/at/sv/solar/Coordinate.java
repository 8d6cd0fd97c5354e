package at.sv.solar;

/**
 * A geographic position in degrees. Latitude is positive to the north, longitude positive to the east.
 */
public record Coordinate(double latitude, double longitude) {

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude).validate();
    }

    /**
     * @return this coordinate, if both components are finite and in range
     * @throws InvalidCoordinate otherwise
     */
    public Coordinate validate() {
        assertInRange("latitude", latitude, 90);
        assertInRange("longitude", longitude, 180);
        return this;
    }

    private static void assertInRange(String name, double value, int limit) {
        if (!Double.isFinite(value) || value < -limit || value > limit) {
            throw new InvalidCoordinate("Invalid " + name + " '" + value + "'. Allowed range: [-" + limit + ".." + limit + "]");
        }
    }

    @Override
    public String toString() {
        return "[" + latitude + "," + longitude + ']';
    }
}
