package at.sv.solar;

import at.sv.solar.log.ObservabilitySink;
import at.sv.solar.log.Slf4jObservabilitySink;
import at.sv.solar.time.SunTimesProvider;
import at.sv.solar.time.SunTimesProviderImpl;
import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

@Command(name = "solar-calculator", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the sunrise, sunset and twilight times of a location.")
public final class SolarCalculatorCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SolarCalculatorCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--at", paramLabel = "<instant>",
            description = "The ISO-8601 instant to calculate for, e.g. 2024-06-21T12:00:00Z. " +
                          "It is also the instant classified as day or night. Default: now.")
    String at;
    @Option(names = "--offset", paramLabel = "<offset>",
            defaultValue = "${env:UTC_OFFSET:-Z}",
            description = "The UTC offset used to display the times, e.g. +02:00. Default: ${DEFAULT-VALUE}")
    String offset;
    @Option(names = "--json",
            description = "Print the result as JSON.")
    boolean json;
    @Option(names = "--verbose",
            description = "Log calculation events and timings to stderr.")
    boolean verbose;

    private final Supplier<Instant> currentTime;
    private final ObjectMapper mapper;

    public SolarCalculatorCli() {
        this(Instant::now);
    }

    SolarCalculatorCli(Supplier<Instant> currentTime) {
        this.currentTime = currentTime;
        mapper = new ObjectMapper();
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SolarCalculatorCli()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "cli");
        Coordinate coordinate = parseCoordinate();
        Instant instant = parseInstant();
        ZoneOffset zoneOffset = parseOffset();
        ch.qos.logback.classic.Logger solarLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("at.sv.solar");
        Level previousLevel = solarLogger.getLevel();
        if (verbose) {
            solarLogger.setLevel(Level.TRACE);
        }
        try {
            print(coordinate, instant.atZone(zoneOffset));
        } finally {
            solarLogger.setLevel(previousLevel);
        }
    }

    /**
     * Lists the events of the local date of {@code at} and classifies {@code at}, both from the same result.
     */
    private void print(Coordinate coordinate, ZonedDateTime at) {
        LOG.debug("Calculate for {} at {}", coordinate, at);
        ObservabilitySink sink = verbose ? new Slf4jObservabilitySink() : ObservabilitySink.disabled();
        SunTimesProvider sunTimesProvider = new SunTimesProviderImpl(coordinate, sink);
        SolarResult result = sunTimesProvider.getResult(at);
        boolean daytime = result.isDaytime(at);
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(result, at, daytime));
        } else {
            out.println("date: " + at.toLocalDate());
            out.println(sunTimesProvider.toDebugString(at));
            out.println("daytime: " + daytime);
        }
        out.flush();
    }

    private Coordinate parseCoordinate() {
        try {
            return Coordinate.of(latitude, longitude);
        } catch (InvalidCoordinate e) {
            fail(e.getMessage());
            return null;
        }
    }

    private Instant parseInstant() {
        if (at == null) {
            return currentTime.get();
        }
        try {
            return Instant.parse(at);
        } catch (DateTimeException e) {
            fail("--at must be an ISO-8601 instant like 2024-06-21T12:00:00Z, but was '" + at + "'");
            return null;
        }
    }

    private ZoneOffset parseOffset() {
        try {
            return ZoneOffset.of(offset);
        } catch (DateTimeException e) {
            fail("--offset must be a UTC offset like +02:00, but was '" + offset + "'");
            return null;
        }
    }

    private String toJson(SolarResult result, ZonedDateTime at, boolean daytime) {
        ObjectNode node = mapper.createObjectNode();
        node.put("date", at.toLocalDate().toString());
        node.put("at", at.toInstant().toString());
        node.put("latitude", result.getCoordinate().latitude());
        node.put("longitude", result.getCoordinate().longitude());
        for (SolarEvent event : SolarEvent.ALL) {
            String time = result.get(event)
                                .map(t -> DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(t.withZoneSameInstant(at.getOffset())))
                                .orElse(null);
            node.put(event.getName(), time);
        }
        node.put("daytime", daytime);
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize result", e);
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
