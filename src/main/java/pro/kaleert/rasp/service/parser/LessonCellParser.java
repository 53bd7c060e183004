package pro.kaleert.rasp.service.parser;

import org.springframework.stereotype.Component;
import pro.kaleert.rasp.model.Lesson;
import pro.kaleert.rasp.model.LessonType;
import pro.kaleert.rasp.service.parser.grid.GridCell;

import java.util.Optional;

/**
 * Reads a class out of a description cell and a room cell.
 * <p>
 * The description looks like {@code "Name (Type)\nTeacher"}, the teacher line is optional.
 * Anything that doesn't fit means the slot is free, that's not an error.
 */
@Component
public class LessonCellParser {

    private static final String TYPE_OPENING = " (";
    private static final char TYPE_CLOSING = ')';

    public Optional<Lesson> parse(GridCell descriptionCell, GridCell roomCell) {
        if (!(descriptionCell instanceof GridCell.Text description)) {
            return Optional.empty();
        }
        String text = description.value();

        int typeStart = text.indexOf(TYPE_OPENING);
        if (typeStart < 0) {
            return Optional.empty();
        }
        String name = text.substring(0, typeStart);
        String rest = text.substring(typeStart + TYPE_OPENING.length());

        String typeWithParen = rest;
        String teacher = null;
        int lineBreak = rest.indexOf('\n');
        if (lineBreak >= 0) {
            typeWithParen = rest.substring(0, lineBreak);
            teacher = rest.substring(lineBreak + 1);
            if (teacher.isBlank()) {
                teacher = null;
            }
        }

        if (typeWithParen.isEmpty() || typeWithParen.charAt(typeWithParen.length() - 1) != TYPE_CLOSING) {
            return Optional.empty();
        }
        LessonType type = LessonType.fromLabel(typeWithParen.substring(0, typeWithParen.length() - 1));

        if (!(roomCell instanceof GridCell.Text room)) {
            return Optional.empty();
        }
        return Optional.of(new Lesson(name, type, teacher, room.value()));
    }
}
