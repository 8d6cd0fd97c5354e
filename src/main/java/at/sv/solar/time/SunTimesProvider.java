package at.sv.solar.time;

import at.sv.solar.SolarResult;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;

/**
 * Sun times for the local date of the given date time, expressed in its zone.
 * Returns null where the sun does not cross the respective zenith on that date.
 */
public interface SunTimesProvider {

    /**
     * The calculation the other methods read from, for the local date of the given date time.
     */
    SolarResult getResult(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getSunrise(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getSunset(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getCivilStart(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getCivilEnd(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getNauticalStart(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getNauticalEnd(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getAstronomicalStart(ZonedDateTime dateTime);

    @Nullable ZonedDateTime getAstronomicalEnd(ZonedDateTime dateTime);

    String toDebugString(ZonedDateTime dateTime);

    void clearCache();
}
