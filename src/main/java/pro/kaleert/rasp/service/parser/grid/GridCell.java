package pro.kaleert.rasp.service.parser.grid;

/**
 * A decoded spreadsheet cell. Layout parsing only distinguishes text, empty and anything else.
 */
public sealed interface GridCell permits GridCell.Empty, GridCell.Text, GridCell.Numeric {

    GridCell EMPTY = new Empty();

    static GridCell empty() {
        return EMPTY;
    }

    static GridCell text(String value) {
        return new Text(value);
    }

    static GridCell number(double value) {
        return new Numeric(value);
    }

    default boolean isEmpty() {
        return this instanceof Empty;
    }

    record Empty() implements GridCell {
        @Override
        public String toString() {
            return "<empty>";
        }
    }

    record Text(String value) implements GridCell {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("Text cell needs a value");
            }
        }
    }

    record Numeric(double value) implements GridCell {
    }
}
