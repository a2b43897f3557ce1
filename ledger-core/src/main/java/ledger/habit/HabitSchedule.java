package ledger.habit;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * When a habit is due.
 *
 * <p>{@code days} uses 0 for Sunday through 6 for Saturday. A {@link Frequency#DAILY}
 * schedule ignores it; a {@link Frequency#WEEKLY} schedule without days is due every day;
 * a {@link Frequency#CUSTOM} schedule requires at least one day.
 *
 * @param frequency the frequency
 * @param days      sorted, distinct days of the week
 */
public record HabitSchedule(Frequency frequency, List<Integer> days) implements Serializable {

    public static final HabitSchedule DAILY = new HabitSchedule(Frequency.DAILY, List.of());

    public HabitSchedule {
        Objects.requireNonNull(frequency, "frequency");
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer day : days == null ? List.<Integer>of() : days) {
            if (day == null || day < 0 || day > 6) {
                throw new IllegalArgumentException("days must be between 0 (Sunday) and 6 (Saturday)");
            }
            sorted.add(day);
        }
        if (frequency == Frequency.CUSTOM && sorted.isEmpty()) {
            throw new IllegalArgumentException("custom schedule requires at least one day");
        }
        days = frequency == Frequency.DAILY ? List.of() : List.copyOf(sorted);
    }

    public static HabitSchedule weekly(Integer... days) {
        return new HabitSchedule(Frequency.WEEKLY, List.of(days));
    }

    public static HabitSchedule custom(Integer... days) {
        return new HabitSchedule(Frequency.CUSTOM, List.of(days));
    }

    public boolean isDueOn(LocalDate date) {
        if (frequency == Frequency.DAILY || days.isEmpty()) {
            return true;
        }
        return days.contains(dayIndex(date.getDayOfWeek()));
    }

    /**
     * Encodes the schedule as {@code daily}, {@code weekly:1,3,5} or {@code custom:0,6}.
     */
    public String encode() {
        String name = frequency.name().toLowerCase(Locale.ROOT);
        if (days.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append(':');
        for (int i = 0; i < days.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(days.get(i));
        }
        return sb.toString();
    }

    /**
     * Parses the output of {@link #encode()}.
     *
     * @throws IllegalArgumentException if the text is not a valid schedule
     */
    public static HabitSchedule parse(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        int colon = encoded.indexOf(':');
        String name = colon < 0 ? encoded : encoded.substring(0, colon);
        Frequency frequency;
        try {
            frequency = Frequency.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown schedule frequency: " + name, e);
        }
        List<Integer> days = new ArrayList<>();
        if (colon >= 0) {
            for (String part : encoded.substring(colon + 1).split(",")) {
                if (!part.isBlank()) {
                    try {
                        days.add(Integer.parseInt(part.trim()));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid schedule day: " + part, e);
                    }
                }
            }
        }
        return new HabitSchedule(frequency, days);
    }

    static int dayIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }
}
