package at.sv.solar.log;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Writes events at debug and markers at trace level. The elapsed time is logged when a marker ends,
 * matched by name on the same thread.
 */
@Slf4j
public final class Slf4jObservabilitySink implements ObservabilitySink {

    private final Supplier<Long> nanoTime;
    private final Map<String, Long> startTimes;

    public Slf4jObservabilitySink() {
        this(System::nanoTime);
    }

    Slf4jObservabilitySink(Supplier<Long> nanoTime) {
        this.nanoTime = nanoTime;
        startTimes = new ConcurrentHashMap<>();
    }

    @Override
    public void logEvent(String eventName, Map<String, Object> annotations) {
        log.debug("[{}] - [{}]", eventName, annotations);
    }

    @Override
    public void startMarker(String name) {
        startTimes.put(markerKey(name), nanoTime.get());
        log.trace("Begin {}", name);
    }

    @Override
    public void endMarker(String name) {
        Long start = startTimes.remove(markerKey(name));
        if (start == null) {
            log.trace("End {} without begin", name);
            return;
        }
        log.trace("End {} after {}", name, Duration.ofNanos(nanoTime.get() - start));
    }

    private static String markerKey(String name) {
        return name + "@" + Thread.currentThread().getId();
    }
}
