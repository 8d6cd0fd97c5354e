package at.sv.solar;

/**
 * The sun's apparent position for a seed time: right ascension in hours and the declination as sine and cosine.
 */
record SolarPosition(double rightAscensionHours, double sinDeclination, double cosDeclination) {
}
