package at.sv.solar.time;

import at.sv.solar.Coordinate;
import at.sv.solar.Solar;
import at.sv.solar.SolarEvent;
import at.sv.solar.SolarResult;
import at.sv.solar.log.ObservabilitySink;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final int MAX_CACHED_DAYS = 32;

    private final Coordinate coordinate;
    private final ObservabilitySink sink;
    private final Cache<LocalDate, SolarResult> cache;

    public SunTimesProviderImpl(double lat, double lng) {
        this(Coordinate.of(lat, lng), ObservabilitySink.disabled());
    }

    public SunTimesProviderImpl(Coordinate coordinate, ObservabilitySink sink) {
        this.coordinate = coordinate.validate();
        this.sink = sink;
        cache = Caffeine.newBuilder()
                        .maximumSize(MAX_CACHED_DAYS)
                        .build();
    }

    @Override
    public @Nullable ZonedDateTime getSunrise(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.SUNRISE, dateTime);
    }

    @Override
    public @Nullable ZonedDateTime getSunset(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.SUNSET, dateTime);
    }

    @Override
    public @Nullable ZonedDateTime getCivilStart(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.CIVIL_SUNRISE, dateTime);
    }

    @Override
    public @Nullable ZonedDateTime getCivilEnd(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.CIVIL_SUNSET, dateTime);
    }

    @Override
    public @Nullable ZonedDateTime getNauticalStart(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.NAUTICAL_SUNRISE, dateTime);
    }

    @Override
    public @Nullable ZonedDateTime getNauticalEnd(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.NAUTICAL_SUNSET, dateTime);
    }

    @Override
    public @Nullable ZonedDateTime getAstronomicalStart(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.ASTRONOMICAL_SUNRISE, dateTime);
    }

    @Override
    public @Nullable ZonedDateTime getAstronomicalEnd(ZonedDateTime dateTime) {
        return timeOf(SolarEvent.ASTRONOMICAL_SUNSET, dateTime);
    }

    private @Nullable ZonedDateTime timeOf(SolarEvent event, ZonedDateTime dateTime) {
        return getResult(dateTime).get(event)
                                  .map(time -> time.withZoneSameInstant(dateTime.getZone()))
                                  .orElse(null);
    }

    /**
     * The local date is calculated as a UTC date, the rollover of the calculation moves the events
     * onto the neighbouring UTC day where needed.
     */
    @Override
    public SolarResult getResult(ZonedDateTime dateTime) {
        return cache.get(dateTime.toLocalDate(),
                date -> Solar.of(date.atStartOfDay(ZoneOffset.UTC), coordinate, sink).calculate());
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        return "astronomical_dawn: " + format(getAstronomicalStart(dateTime)) +
               "\nnautical_dawn: " + format(getNauticalStart(dateTime)) +
               "\ncivil_dawn: " + format(getCivilStart(dateTime)) +
               "\nsunrise: " + format(getSunrise(dateTime)) +
               "\nsunset: " + format(getSunset(dateTime)) +
               "\ncivil_dusk: " + format(getCivilEnd(dateTime)) +
               "\nnautical_dusk: " + format(getNauticalEnd(dateTime)) +
               "\nastronomical_dusk: " + format(getAstronomicalEnd(dateTime));
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    private String format(@Nullable ZonedDateTime time) {
        if (time == null) {
            return "-";
        }
        return TIME_FORMATTER.format(time);
    }
}
