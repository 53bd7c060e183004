package pro.kaleert.rasp.service.parser;

import lombok.Getter;

/**
 * A sheet doesn't follow the timetable layout. Carries the sheet name and, when known,
 * the grid row and column the problem was found at (both zero-based, -1 when not applicable).
 */
@Getter
public class ScheduleFormatException extends RuntimeException {

    public enum Reason {
        WRONG_SHEET_COUNT,
        MISSING_HEADER_ROW,
        CELL_TYPE_MISMATCH,
        UNPARSABLE_SUBGROUP_NUMBER,
        ROW_COLUMN_COUNT_MISMATCH,
        TOO_MANY_ROWS,
        GROUP_SUBGROUP_COUNT_MISMATCH
    }

    private final Reason reason;
    private final String sheetName;
    private final int row;
    private final int column;

    public ScheduleFormatException(Reason reason, String sheetName, int row, int column, String details) {
        super(describe(sheetName, row, column, details));
        this.reason = reason;
        this.sheetName = sheetName;
        this.row = row;
        this.column = column;
    }

    public static ScheduleFormatException wrongSheetCount(int actual) {
        return new ScheduleFormatException(Reason.WRONG_SHEET_COUNT, null, -1, -1,
                String.format("Workbook must have %d sheets, got %d", SheetLayout.SHEETS_PER_WORKBOOK, actual));
    }

    public static ScheduleFormatException atSheet(Reason reason, String sheetName, String details) {
        return new ScheduleFormatException(reason, sheetName, -1, -1, details);
    }

    public static ScheduleFormatException atRow(Reason reason, String sheetName, int row, String details) {
        return new ScheduleFormatException(reason, sheetName, row, -1, details);
    }

    public static ScheduleFormatException atCell(Reason reason, String sheetName, int row, int column, String details) {
        return new ScheduleFormatException(reason, sheetName, row, column, details);
    }

    private static String describe(String sheetName, int row, int column, String details) {
        StringBuilder sb = new StringBuilder();
        if (sheetName != null) {
            sb.append("[sheet '").append(sheetName).append("'");
            if (row >= 0) sb.append(", row ").append(row);
            if (column >= 0) sb.append(", column ").append(column);
            sb.append("] ");
        }
        return sb.append(details).toString();
    }
}
