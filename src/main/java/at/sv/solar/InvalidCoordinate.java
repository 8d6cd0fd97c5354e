package at.sv.solar;

/**
 * Thrown when a latitude or longitude is outside its allowed range or not a finite number.
 */
public class InvalidCoordinate extends RuntimeException {
    public InvalidCoordinate(String message) {
        super(message);
    }
}
