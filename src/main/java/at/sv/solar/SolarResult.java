package at.sv.solar;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The sunrise and sunset instants (UTC) of one date and coordinate, for all four zenith levels.
 * An absent value means that the sun does not cross that zenith on that day.
 */
@EqualsAndHashCode
public final class SolarResult {

    @Getter
    private final ZonedDateTime date;
    @Getter
    private final Coordinate coordinate;
    private final Map<SolarEvent, ZonedDateTime> times;
    private final Map<SolarEvent, NoCrossing> noCrossings;

    SolarResult(ZonedDateTime date, Coordinate coordinate, Map<SolarEvent, ZonedDateTime> times,
                Map<SolarEvent, NoCrossing> noCrossings) {
        this.date = date;
        this.coordinate = coordinate;
        this.times = Collections.unmodifiableMap(new LinkedHashMap<>(times));
        this.noCrossings = Collections.unmodifiableMap(new LinkedHashMap<>(noCrossings));
    }

    public Optional<ZonedDateTime> get(SolarEvent event) {
        return Optional.ofNullable(times.get(event));
    }

    public Optional<ZonedDateTime> get(EventKind kind, ZenithLevel zenith) {
        return get(SolarEvent.of(kind, zenith));
    }

    public Optional<ZonedDateTime> getSunrise() {
        return get(SolarEvent.SUNRISE);
    }

    public Optional<ZonedDateTime> getSunset() {
        return get(SolarEvent.SUNSET);
    }

    public Optional<ZonedDateTime> getCivilSunrise() {
        return get(SolarEvent.CIVIL_SUNRISE);
    }

    public Optional<ZonedDateTime> getCivilSunset() {
        return get(SolarEvent.CIVIL_SUNSET);
    }

    public Optional<ZonedDateTime> getNauticalSunrise() {
        return get(SolarEvent.NAUTICAL_SUNRISE);
    }

    public Optional<ZonedDateTime> getNauticalSunset() {
        return get(SolarEvent.NAUTICAL_SUNSET);
    }

    public Optional<ZonedDateTime> getAstronomicalSunrise() {
        return get(SolarEvent.ASTRONOMICAL_SUNRISE);
    }

    public Optional<ZonedDateTime> getAstronomicalSunset() {
        return get(SolarEvent.ASTRONOMICAL_SUNSET);
    }

    /**
     * @return the events without a zenith crossing on this day, in the order of {@link SolarEvent#ALL}
     */
    public List<SolarEvent> getAbsentEvents() {
        return SolarEvent.ALL.stream()
                             .filter(event -> !times.containsKey(event))
                             .collect(Collectors.toList());
    }

    /**
     * @return why the event does not occur on this day, or empty if it does
     */
    public Optional<NoCrossing> getNoCrossing(SolarEvent event) {
        return Optional.ofNullable(noCrossings.get(event));
    }

    /**
     * Whether the given instant lies in [sunrise, sunset) of the official zenith.
     * <p>
     * Returns false if either the official sunrise or sunset is absent. Polar day and polar night are
     * therefore both reported as night.
     */
    public boolean isDaytime(Instant instant) {
        ZonedDateTime sunrise = times.get(SolarEvent.SUNRISE);
        ZonedDateTime sunset = times.get(SolarEvent.SUNSET);
        if (sunrise == null || sunset == null) {
            return false;
        }
        return !instant.isBefore(sunrise.toInstant()) && instant.isBefore(sunset.toInstant());
    }

    public boolean isDaytime(ZonedDateTime dateTime) {
        return isDaytime(dateTime.toInstant());
    }

    public boolean isNighttime(Instant instant) {
        return !isDaytime(instant);
    }

    public boolean isNighttime(ZonedDateTime dateTime) {
        return isNighttime(dateTime.toInstant());
    }

    @Override
    public String toString() {
        return "SolarResult{" +
               "date=" + date +
               ", coordinate=" + coordinate +
               ", times=" + times +
               ", noCrossings=" + noCrossings +
               '}';
    }
}
