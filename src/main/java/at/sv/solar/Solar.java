package at.sv.solar;

import at.sv.solar.log.ObservabilitySink;
import lombok.Getter;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sunrise, sunset and twilight times for a date and coordinate.
 * <p>
 * Instances are immutable and can be shared between threads. Each call to {@link #calculate()} produces a new
 * {@link SolarResult}; nothing is cached.
 */
public final class Solar {

    static final String CALCULATE_MARKER = "solar.calculate";
    static final String CALCULATED_EVENT = "solar.calculated";

    /**
     * The date to calculate the events for, in UTC. Also the instant classified by {@link #isDaytime()}.
     */
    @Getter
    private final ZonedDateTime date;
    @Getter
    private final Coordinate coordinate;
    private final ObservabilitySink sink;

    private Solar(ZonedDateTime date, Coordinate coordinate, ObservabilitySink sink) {
        this.date = date;
        this.coordinate = coordinate;
        this.sink = sink;
    }

    /**
     * @throws InvalidCoordinate if the coordinate is out of range or not finite
     */
    public static Solar of(Instant date, Coordinate coordinate) {
        return of(date, coordinate, ObservabilitySink.disabled());
    }

    public static Solar of(Instant date, Coordinate coordinate, ObservabilitySink sink) {
        Objects.requireNonNull(date, "date");
        return of(date.atZone(ZoneOffset.UTC), coordinate, sink);
    }

    public static Solar of(ZonedDateTime date, Coordinate coordinate) {
        return of(date, coordinate, ObservabilitySink.disabled());
    }

    public static Solar of(ZonedDateTime date, Coordinate coordinate, ObservabilitySink sink) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(coordinate, "coordinate");
        Objects.requireNonNull(sink, "sink");
        return new Solar(date.withZoneSameInstant(ZoneOffset.UTC), coordinate.validate(), sink);
    }

    public SolarResult calculate() {
        SolarEventCalculator calculator = new SolarEventCalculator(date, coordinate);
        Map<SolarEvent, ZonedDateTime> times = new LinkedHashMap<>();
        Map<SolarEvent, NoCrossing> noCrossings = new LinkedHashMap<>();
        sink.startMarker(CALCULATE_MARKER);
        try {
            for (SolarEvent event : SolarEvent.ALL) {
                calculator.calculate(event, times, noCrossings);
            }
        } finally {
            sink.endMarker(CALCULATE_MARKER);
        }
        SolarResult result = new SolarResult(date, coordinate, times, noCrossings);
        sink.logEvent(CALCULATED_EVENT, annotations(result));
        return result;
    }

    public boolean isDaytime() {
        return calculate().isDaytime(date);
    }

    public boolean isNighttime() {
        return !isDaytime();
    }

    private Map<String, Object> annotations(SolarResult result) {
        List<String> absent = new ArrayList<>();
        Map<String, String> noCrossings = new LinkedHashMap<>();
        for (SolarEvent event : result.getAbsentEvents()) {
            absent.add(event.getName());
            result.getNoCrossing(event).ifPresent(reason -> noCrossings.put(event.getName(), reason.name()));
        }
        Map<String, Object> annotations = new LinkedHashMap<>();
        annotations.put("latitude", coordinate.latitude());
        annotations.put("longitude", coordinate.longitude());
        annotations.put("date", date.toLocalDate().toString());
        annotations.put("absent", absent);
        annotations.put("noCrossing", noCrossings);
        return annotations;
    }

    @Override
    public String toString() {
        return "Solar{" +
               "date=" + date +
               ", coordinate=" + coordinate +
               '}';
    }
}
