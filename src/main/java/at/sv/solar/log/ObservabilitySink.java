package at.sv.solar.log;

import java.util.Map;

/**
 * Receives informational events and performance markers from the calculation.
 * <p>
 * Calls are fire-and-forget: implementations must not throw, and nothing they do is visible to the
 * calculation's results.
 */
public interface ObservabilitySink {

    void logEvent(String eventName, Map<String, Object> annotations);

    void startMarker(String name);

    void endMarker(String name);

    static ObservabilitySink disabled() {
        return DisabledObservabilitySink.INSTANCE;
    }
}
