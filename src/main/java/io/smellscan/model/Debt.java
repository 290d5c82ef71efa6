package io.smellscan.model;

/**
 * Estimated effort to fix a finding.
 * Opaque to the engine apart from summing it up for reports.
 *
 * @param days  whole days
 * @param hours whole hours, 0-23
 * @param mins  whole minutes, 0-59
 */
public record Debt(int days, int hours, int mins) implements Comparable<Debt> {

    public static final Debt ZERO = new Debt(0, 0, 0);
    public static final Debt FIVE_MINS = new Debt(0, 0, 5);
    public static final Debt TEN_MINS = new Debt(0, 0, 10);
    public static final Debt TWENTY_MINS = new Debt(0, 0, 20);

    private static final int MINUTES_PER_HOUR = 60;
    private static final int HOURS_PER_DAY = 24;

    public Debt {
        if (days < 0 || hours < 0 || mins < 0) {
            throw new IllegalArgumentException("Debt components cannot be negative");
        }
        if (hours >= HOURS_PER_DAY || mins >= MINUTES_PER_HOUR) {
            throw new IllegalArgumentException("Debt hours must be < 24 and mins < 60, use ofMinutes() to normalize");
        }
    }

    /**
     * Creates a normalized debt from a total number of minutes.
     */
    public static Debt ofMinutes(long totalMinutes) {
        if (totalMinutes < 0) {
            throw new IllegalArgumentException("Debt cannot be negative");
        }
        long minutesPerDay = (long) MINUTES_PER_HOUR * HOURS_PER_DAY;
        int days = (int) (totalMinutes / minutesPerDay);
        long rest = totalMinutes % minutesPerDay;
        return new Debt(days, (int) (rest / MINUTES_PER_HOUR), (int) (rest % MINUTES_PER_HOUR));
    }

    public long totalMinutes() {
        return ((long) days * HOURS_PER_DAY + hours) * MINUTES_PER_HOUR + mins;
    }

    public Debt plus(Debt other) {
        return ofMinutes(totalMinutes() + other.totalMinutes());
    }

    @Override
    public int compareTo(Debt other) {
        return Long.compare(totalMinutes(), other.totalMinutes());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (days > 0) {
            sb.append(days).append('d');
        }
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (mins > 0 || sb.isEmpty()) {
            sb.append(mins).append("min");
        }
        return sb.toString();
    }
}
