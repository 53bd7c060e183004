package pro.kaleert.rasp.service.parser;

/**
 * Positional layout of a timetable sheet.
 * <p>
 * Row 0 holds group names, row 1 subgroup numbers, the body follows as pairs of rows
 * (upper and lower class) per lesson, 7 lessons for each of the 7 days.
 * Every row starts with 3 lead-in cells (day, lesson number, time), then each week-column
 * takes two cells: the class description and its room.
 */
public final class SheetLayout {

    public static final int SHEETS_PER_WORKBOOK = 4;

    public static final int GROUP_NAME_ROW = 0;
    public static final int SUBGROUP_ROW = 1;
    public static final int HEADER_ROWS = 2;

    public static final int LEAD_IN_CELLS = 3;
    public static final int CELLS_PER_COLUMN = 2;
    public static final int ROWS_PER_LESSON = 2;

    public static final int DAYS_PER_WEEK = 7;
    public static final int LESSONS_PER_DAY = 7;
    public static final int MAX_LESSON_PAIRS = DAYS_PER_WEEK * LESSONS_PER_DAY;

    private SheetLayout() {
    }

    public static int dayOf(int pairIndex) {
        return pairIndex / LESSONS_PER_DAY;
    }

    public static int lessonOf(int pairIndex) {
        return pairIndex % LESSONS_PER_DAY;
    }

    public static int descriptionCell(int column) {
        return LEAD_IN_CELLS + column * CELLS_PER_COLUMN;
    }

    public static int roomCell(int column) {
        return descriptionCell(column) + 1;
    }

    /**
     * Cell index of the subgroup header entry for the n-th week-column.
     */
    public static int subgroupHeaderCell(int column) {
        return descriptionCell(column);
    }

    public static int expectedBodyCells(int subgroupsNum) {
        return subgroupsNum * CELLS_PER_COLUMN;
    }

    /**
     * Cells left after the lead-in, never negative.
     */
    public static int bodyCells(int rowWidth) {
        return Math.max(0, rowWidth - LEAD_IN_CELLS);
    }
}
