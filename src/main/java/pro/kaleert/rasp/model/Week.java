package pro.kaleert.rasp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Seven consecutive days, Monday first. Serialized as a plain array of days.
 */
@ToString
@EqualsAndHashCode
public final class Week {

    public static final int DAYS_PER_WEEK = 7;

    private final List<Day> days;

    private Week(List<Day> days) {
        if (days == null || days.size() != DAYS_PER_WEEK) {
            throw new IllegalArgumentException(String.format("Week needs %d days, got %s",
                    DAYS_PER_WEEK, days == null ? "none" : days.size()));
        }
        if (days.contains(null)) {
            throw new IllegalArgumentException("Week can't contain a missing day");
        }
        this.days = List.copyOf(days);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Week of(List<Day> days) {
        return new Week(days);
    }

    public static Week empty() {
        return new Week(Stream.generate(Day::empty).limit(DAYS_PER_WEEK).collect(Collectors.toList()));
    }

    @JsonValue
    public List<Day> days() {
        return days;
    }

    public Day day(int index) {
        return days.get(index);
    }
}
