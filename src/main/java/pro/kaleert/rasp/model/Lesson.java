package pro.kaleert.rasp.model;

/**
 * One class occurrence in a lesson slot. {@code teacher} is {@code null} when the sheet does not name one.
 */
public record Lesson(String name, LessonType type, String teacher, String room) {
}
