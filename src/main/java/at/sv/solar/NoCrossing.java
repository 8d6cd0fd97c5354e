package at.sv.solar;

/**
 * Why the sun does not cross a zenith on a given day. Not an error: this is polar day or polar night.
 */
public enum NoCrossing {
    SUNRISE_NEVER_OCCURS,
    SUNSET_NEVER_OCCURS
}
