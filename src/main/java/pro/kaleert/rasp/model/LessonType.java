package pro.kaleert.rasp.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Pedagogical category of a lesson. The three known kinds come from fixed localized labels,
 * anything else is kept verbatim as {@link Kind#UNKNOWN}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LessonType(Kind kind, String label) {

    public static final LessonType LECTURE = new LessonType(Kind.LECTURE, null);
    public static final LessonType PRACTICE = new LessonType(Kind.PRACTICE, null);
    public static final LessonType LAB = new LessonType(Kind.LAB, null);

    public enum Kind {
        LECTURE,
        PRACTICE,
        LAB,
        UNKNOWN
    }

    public LessonType {
        if (kind == null) {
            throw new IllegalArgumentException("Lesson type kind is required");
        }
        if (kind == Kind.UNKNOWN && label == null) {
            throw new IllegalArgumentException("Unknown lesson type must keep its label");
        }
        if (kind != Kind.UNKNOWN) {
            label = null;
        }
    }

    public static LessonType unknown(String label) {
        return new LessonType(Kind.UNKNOWN, label);
    }

    /**
     * Maps a raw label from the sheet. Matching is case-sensitive.
     */
    public static LessonType fromLabel(String label) {
        return switch (label) {
            case "Лекционные" -> LECTURE;
            case "Практические" -> PRACTICE;
            case "Лабораторные" -> LAB;
            default -> unknown(label);
        };
    }
}
