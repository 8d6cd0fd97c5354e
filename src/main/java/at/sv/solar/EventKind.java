package at.sv.solar;

public enum EventKind {
    SUNRISE(6),
    SUNSET(18);

    /**
     * Approximate local solar time of the event, used to seed the calculation.
     */
    private final int baseHour;

    EventKind(int baseHour) {
        this.baseHour = baseHour;
    }

    public int getBaseHour() {
        return baseHour;
    }
}
