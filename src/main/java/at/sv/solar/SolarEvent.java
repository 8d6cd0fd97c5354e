package at.sv.solar;

import java.util.List;
import java.util.Locale;

/**
 * Identifies one of the eight events of a day, e.g. the civil sunrise.
 */
public record SolarEvent(EventKind kind, ZenithLevel zenith) {

    public static final SolarEvent SUNRISE = new SolarEvent(EventKind.SUNRISE, ZenithLevel.OFFICIAL);
    public static final SolarEvent SUNSET = new SolarEvent(EventKind.SUNSET, ZenithLevel.OFFICIAL);
    public static final SolarEvent CIVIL_SUNRISE = new SolarEvent(EventKind.SUNRISE, ZenithLevel.CIVIL);
    public static final SolarEvent CIVIL_SUNSET = new SolarEvent(EventKind.SUNSET, ZenithLevel.CIVIL);
    public static final SolarEvent NAUTICAL_SUNRISE = new SolarEvent(EventKind.SUNRISE, ZenithLevel.NAUTICAL);
    public static final SolarEvent NAUTICAL_SUNSET = new SolarEvent(EventKind.SUNSET, ZenithLevel.NAUTICAL);
    public static final SolarEvent ASTRONOMICAL_SUNRISE = new SolarEvent(EventKind.SUNRISE, ZenithLevel.ASTRONOMICAL);
    public static final SolarEvent ASTRONOMICAL_SUNSET = new SolarEvent(EventKind.SUNSET, ZenithLevel.ASTRONOMICAL);

    /**
     * All events, ordered by zenith and then by kind.
     */
    public static final List<SolarEvent> ALL = List.of(SUNRISE, SUNSET, CIVIL_SUNRISE, CIVIL_SUNSET,
            NAUTICAL_SUNRISE, NAUTICAL_SUNSET, ASTRONOMICAL_SUNRISE, ASTRONOMICAL_SUNSET);

    public static SolarEvent of(EventKind kind, ZenithLevel zenith) {
        return new SolarEvent(kind, zenith);
    }

    /**
     * @return a stable name like {@code civilSunrise}, or {@code sunset} for the official events
     */
    public String getName() {
        String kindName = kind == EventKind.SUNRISE ? "Sunrise" : "Sunset";
        if (zenith == ZenithLevel.OFFICIAL) {
            return kindName.toLowerCase(Locale.ENGLISH);
        }
        return zenith.name().toLowerCase(Locale.ENGLISH) + kindName;
    }

    @Override
    public String toString() {
        return getName();
    }
}
