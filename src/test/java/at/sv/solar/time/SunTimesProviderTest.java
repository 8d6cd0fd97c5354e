package at.sv.solar.time;

import at.sv.solar.Coordinate;
import at.sv.solar.InvalidCoordinate;
import at.sv.solar.log.ObservabilitySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SunTimesProviderTest {

    private static final ZoneOffset CET = ZoneOffset.ofHours(1);

    private ZonedDateTime dateTime;
    private SunTimesProviderImpl provider;

    private void assertTime(ZonedDateTime time, int hour, int minute, int second) {
        assertThat("Time differs", time.toLocalTime(), is(LocalTime.of(hour, minute, second)));
    }

    @BeforeEach
    void setUp() {
        dateTime = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, CET);
        provider = new SunTimesProviderImpl(48.20, 16.39); // Vienna
    }

    @Test
    void returnsCorrectTimes_dependingOnDate() {
        assertTime(provider.getAstronomicalStart(dateTime), 5, 51, 22);
        assertTime(provider.getNauticalStart(dateTime), 6, 29, 15);
        assertTime(provider.getCivilStart(dateTime), 7, 8, 54);
        assertTime(provider.getSunrise(dateTime), 7, 45, 18);
        assertTime(provider.getSunset(dateTime), 16, 10, 54);
        assertTime(provider.getCivilEnd(dateTime), 16, 47, 17);
        assertTime(provider.getNauticalEnd(dateTime), 17, 26, 55);
        assertTime(provider.getAstronomicalEnd(dateTime), 18, 4, 47);
        dateTime = dateTime.plusDays(30);
        assertTime(provider.getAstronomicalStart(dateTime), 5, 37, 5);
        assertTime(provider.getNauticalStart(dateTime), 6, 13, 37);
        assertTime(provider.getCivilStart(dateTime), 6, 51, 9);
        assertTime(provider.getSunrise(dateTime), 7, 24, 47);
        assertTime(provider.getSunset(dateTime), 16, 51, 47);
        assertTime(provider.getCivilEnd(dateTime), 17, 25, 22);
        assertTime(provider.getNauticalEnd(dateTime), 18, 2, 51);
        assertTime(provider.getAstronomicalEnd(dateTime), 18, 39, 22);
    }

    @Test
    void returnsCorrectTime_doesNotDependOnTimeOfDay() {
        assertTime(provider.getSunset(dateTime), 16, 10, 54);
        assertTime(provider.getSunset(dateTime.withHour(16).withMinute(14).withSecond(30)), 16, 10, 54);
    }

    @Test
    void returnsTimes_inZoneOfGivenDateTime() {
        ZonedDateTime noon = dateTime.withHour(12);

        ZonedDateTime local = provider.getSunrise(noon);
        ZonedDateTime utc = provider.getSunrise(noon.withZoneSameInstant(ZoneOffset.UTC));

        assertThat(local.getOffset(), is(CET));
        assertThat(utc.getOffset(), is(ZoneOffset.UTC));
        assertThat(utc.toInstant(), is(local.toInstant()));
    }

    @Test
    void westOfGreenwich_sunsetAfterUtcMidnight_isStillOnTheLocalDate() {
        provider = new SunTimesProviderImpl(37.7749, -122.4194);
        dateTime = ZonedDateTime.of(2024, 6, 21, 0, 0, 0, 0, ZoneOffset.ofHours(-7));

        ZonedDateTime sunset = provider.getSunset(dateTime);

        assertThat(sunset, is(ZonedDateTime.of(2024, 6, 21, 20, 35, 5, 0, ZoneOffset.ofHours(-7))));
        assertTime(provider.getSunrise(dateTime), 5, 48, 10);
    }

    @Test
    void eastOfGreenwich_sunriseBeforeUtcMidnight_isStillOnTheLocalDate() {
        provider = new SunTimesProviderImpl(-40, 170);
        dateTime = ZonedDateTime.of(2024, 3, 15, 0, 0, 0, 0, ZoneOffset.ofHours(12));

        ZonedDateTime sunrise = provider.getSunrise(dateTime);

        assertThat(sunrise, is(ZonedDateTime.of(2024, 3, 15, 6, 37, 48, 0, ZoneOffset.ofHours(12))));
    }

    @Test
    void returnsNull_ifSunNeverSetsAtLocation() {
        provider = new SunTimesProviderImpl(78.614803, 15.895517); // Somewhere in Svalbard (Norway)

        ZonedDateTime may = dateTime.withMonth(5);

        assertThat(provider.getSunset(may), nullValue());
        assertThat(provider.getSunrise(may), nullValue());
        assertThat(provider.getAstronomicalEnd(may), nullValue());
    }

    @Test
    void toDebugString_listsAllTimes_dashIfAbsent() {
        assertThat(provider.toDebugString(dateTime), is(
                "astronomical_dawn: 05:51:22\n" +
                "nautical_dawn: 06:29:15\n" +
                "civil_dawn: 07:08:54\n" +
                "sunrise: 07:45:18\n" +
                "sunset: 16:10:54\n" +
                "civil_dusk: 16:47:17\n" +
                "nautical_dusk: 17:26:55\n" +
                "astronomical_dusk: 18:04:47"));

        provider = new SunTimesProviderImpl(78.614803, 15.895517);
        assertThat(provider.toDebugString(dateTime.withMonth(5)), is(
                "astronomical_dawn: -\n" +
                "nautical_dawn: -\n" +
                "civil_dawn: -\n" +
                "sunrise: -\n" +
                "sunset: -\n" +
                "civil_dusk: -\n" +
                "nautical_dusk: -\n" +
                "astronomical_dusk: -"));
    }

    @Test
    void cachesResultPerLocalDate_untilCleared() {
        ObservabilitySink sink = mock(ObservabilitySink.class);
        provider = new SunTimesProviderImpl(Coordinate.of(48.20, 16.39), sink);

        provider.getSunrise(dateTime);
        provider.getSunset(dateTime.withHour(18));
        provider.getCivilEnd(dateTime.withHour(23));
        verify(sink, times(1)).startMarker("solar.calculate");

        provider.getSunrise(dateTime.plusDays(1));
        verify(sink, times(2)).startMarker("solar.calculate");

        provider.clearCache();
        provider.getSunrise(dateTime);
        verify(sink, times(3)).startMarker("solar.calculate");
    }

    @Test
    void invalidCoordinate_exception() {
        assertThrows(InvalidCoordinate.class, () -> new SunTimesProviderImpl(91, 0));
        assertThrows(InvalidCoordinate.class, () -> new SunTimesProviderImpl(0, -180.5));
    }
}
