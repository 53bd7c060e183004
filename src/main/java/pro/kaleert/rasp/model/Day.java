package pro.kaleert.rasp.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Lessons of one day for one week-column. Both lists always have {@link #LESSONS_PER_DAY} entries,
 * an empty slot is {@code null}.
 */
public record Day(List<Lesson> upperClasses, List<Lesson> lowerClasses) {

    public static final int LESSONS_PER_DAY = 7;

    public Day {
        upperClasses = freezeSlots(upperClasses, "upper");
        lowerClasses = freezeSlots(lowerClasses, "lower");
    }

    public static Day empty() {
        return new Day(Arrays.asList(new Lesson[LESSONS_PER_DAY]), Arrays.asList(new Lesson[LESSONS_PER_DAY]));
    }

    private static List<Lesson> freezeSlots(List<Lesson> slots, String half) {
        if (slots == null || slots.size() != LESSONS_PER_DAY) {
            throw new IllegalArgumentException(String.format("Day needs %d %s slots, got %s",
                    LESSONS_PER_DAY, half, slots == null ? "none" : slots.size()));
        }
        // List.copyOf rejects nulls, empty slots are nulls
        return Collections.unmodifiableList(new ArrayList<>(slots));
    }
}
