package pro.kaleert.rasp.service.parser;

import pro.kaleert.rasp.model.Course;

/**
 * Result of parsing one sheet when sheets are allowed to fail on their own.
 * Exactly one of {@code course} and {@code error} is set.
 */
public record SheetOutcome(String sheetName, Course course, ScheduleFormatException error) {

    public static SheetOutcome parsed(Course course) {
        return new SheetOutcome(course.name(), course, null);
    }

    public static SheetOutcome failed(String sheetName, ScheduleFormatException error) {
        return new SheetOutcome(sheetName, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
