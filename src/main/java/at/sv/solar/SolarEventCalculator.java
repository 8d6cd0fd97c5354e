package at.sv.solar;

import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;

import static java.lang.Math.acos;
import static java.lang.Math.asin;
import static java.lang.Math.atan;
import static java.lang.Math.cos;
import static java.lang.Math.floor;
import static java.lang.Math.sin;
import static java.lang.Math.tan;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * Computes a single sunrise or sunset for one date and coordinate.
 * <p>
 * Uses the fixed-form approximation of the Almanac for Computers (1990), which is accurate to about a minute
 * for inhabited latitudes. All angles are in degrees unless the name says otherwise.
 */
final class SolarEventCalculator {

    private final ZonedDateTime date;
    private final Coordinate coordinate;

    SolarEventCalculator(ZonedDateTime date, Coordinate coordinate) {
        this.date = date.withZoneSameInstant(ZoneOffset.UTC);
        this.coordinate = coordinate;
    }

    /**
     * Puts the UTC instant of the event into {@code times}, or the reason why the sun does not cross the
     * zenith on that day into {@code noCrossings}.
     */
    void calculate(SolarEvent event, Map<SolarEvent, ZonedDateTime> times, Map<SolarEvent, NoCrossing> noCrossings) {
        EventKind kind = event.kind();
        double lngHour = toHours(coordinate.longitude());
        double t = seedTime(date, coordinate.longitude(), kind);
        SolarPosition position = solarPosition(t);
        double cosH = cosHourAngle(event.zenith(), position, coordinate.latitude());
        NoCrossing noCrossing = checkCrossing(cosH);
        if (noCrossing != null) {
            noCrossings.put(event, noCrossing);
            return;
        }
        double hourAngle = hourAngleHours(cosH, kind);
        times.put(event, assemble(hourAngle, position.rightAscensionHours(), t, lngHour, kind, date));
    }

    static double seedTime(ZonedDateTime date, double longitude, EventKind kind) {
        int dayOfYear = date.withZoneSameInstant(ZoneOffset.UTC).getDayOfYear();
        return dayOfYear + ((kind.getBaseHour() - toHours(longitude)) / 24);
    }

    static SolarPosition solarPosition(double t) {
        double meanAnomaly = (0.9856 * t) - 3.289;

        double trueLongitude = meanAnomaly
                               + 1.916 * sin(toRadians(meanAnomaly))
                               + 0.020 * sin(2 * toRadians(meanAnomaly))
                               + 282.634;
        trueLongitude = normalize(trueLongitude, 360);

        double rightAscension = toDegrees(atan(0.91764 * tan(toRadians(trueLongitude))));
        rightAscension = normalize(rightAscension, 360);
        // keep RA in the same quadrant as the true longitude
        double longitudeQuadrant = floor(trueLongitude / 90) * 90;
        double rightAscensionQuadrant = floor(rightAscension / 90) * 90;
        rightAscension += longitudeQuadrant - rightAscensionQuadrant;

        double sinDec = 0.39782 * sin(toRadians(trueLongitude));
        double cosDec = cos(asin(sinDec));
        return new SolarPosition(rightAscension / 15, sinDec, cosDec);
    }

    static double cosHourAngle(ZenithLevel zenith, SolarPosition position, double latitude) {
        double latitudeRadians = toRadians(latitude);
        return (cos(toRadians(zenith.getDegrees())) - (position.sinDeclination() * sin(latitudeRadians)))
               / (position.cosDeclination() * cos(latitudeRadians));
    }

    /**
     * @return null if the sun crosses the zenith, otherwise which event never occurs
     */
    static @Nullable NoCrossing checkCrossing(double cosH) {
        if (cosH >= 1) {
            return NoCrossing.SUNRISE_NEVER_OCCURS;
        }
        if (cosH <= -1) {
            return NoCrossing.SUNSET_NEVER_OCCURS;
        }
        return null;
    }

    static double hourAngleHours(double cosH, EventKind kind) {
        double hourAngle = toDegrees(acos(cosH));
        if (kind == EventKind.SUNRISE) {
            hourAngle = 360 - hourAngle;
        }
        return hourAngle / 15;
    }

    static ZonedDateTime assemble(double hourAngleHours, double rightAscensionHours, double t, double lngHour,
                                  EventKind kind, ZonedDateTime date) {
        double localMeanTime = hourAngleHours + rightAscensionHours - (0.06571 * t) - 6.622;
        double ut = normalize(localMeanTime - lngHour, 24);

        LocalDate day = date.withZoneSameInstant(ZoneOffset.UTC).toLocalDate();
        if (lngHour > 0 && ut > 12 && kind == EventKind.SUNRISE) {
            day = day.minusDays(1);
        } else if (lngHour < 0 && ut < 12 && kind == EventKind.SUNSET) {
            day = day.plusDays(1);
        }

        int hour = (int) floor(ut);
        int minute = (int) floor((ut - hour) * 60);
        int second = (int) ((((ut - hour) * 60) - minute) * 60);
        // plus* instead of LocalTime.of: ut may be exactly 24
        return day.atStartOfDay(ZoneOffset.UTC)
                  .plusHours(hour)
                  .plusMinutes(minute)
                  .plusSeconds(second);
    }

    static double toHours(double longitude) {
        return longitude / 15;
    }

    /**
     * Single wrap into [0, maximum] by adding or subtracting {@code maximum} once.
     */
    static double normalize(double value, double maximum) {
        if (value < 0) {
            value += maximum;
        }
        if (value > maximum) {
            value -= maximum;
        }
        return value;
    }
}
