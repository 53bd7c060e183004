package pro.kaleert.rasp.service.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import pro.kaleert.rasp.model.Day;
import pro.kaleert.rasp.model.Lesson;
import pro.kaleert.rasp.model.Week;
import pro.kaleert.rasp.service.parser.ScheduleFormatException.Reason;
import pro.kaleert.rasp.service.parser.grid.GridCell;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Walks the sheet body two rows at a time and fills one week per week-column.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GridScanner {

    private final LessonCellParser lessonCellParser;

    /**
     * @param bodyRows      rows following the header rows
     * @param firstRowIndex sheet index of the first body row, used in error reports
     * @param subgroupsNum  number of week-columns announced by the subgroup header
     * @return one week per column, left to right
     */
    public List<Week> scan(String sheetName, List<List<GridCell>> bodyRows, int firstRowIndex, int subgroupsNum) {
        List<WeekBuffer> buffers = new ArrayList<>(subgroupsNum);
        for (int i = 0; i < subgroupsNum; i++) {
            buffers.add(new WeekBuffer());
        }

        int pairs = bodyRows.size() / SheetLayout.ROWS_PER_LESSON;
        if (bodyRows.size() % SheetLayout.ROWS_PER_LESSON != 0) {
            log.debug("Sheet '{}': trailing unpaired row {} ignored", sheetName, firstRowIndex + bodyRows.size() - 1);
        }

        for (int pair = 0; pair < pairs; pair++) {
            int upperIndex = pair * SheetLayout.ROWS_PER_LESSON;
            int upperRowNum = firstRowIndex + upperIndex;
            if (pair >= SheetLayout.MAX_LESSON_PAIRS) {
                throw ScheduleFormatException.atRow(Reason.TOO_MANY_ROWS, sheetName, upperRowNum,
                        String.format("Too many lesson rows, at most %d pairs fit in a week", SheetLayout.MAX_LESSON_PAIRS));
            }

            List<GridCell> upper = bodyRows.get(upperIndex);
            List<GridCell> lower = bodyRows.get(upperIndex + 1);
            checkWidth(sheetName, upperRowNum, upper, subgroupsNum);
            checkWidth(sheetName, upperRowNum + 1, lower, subgroupsNum);

            int day = SheetLayout.dayOf(pair);
            int lesson = SheetLayout.lessonOf(pair);
            for (int column = 0; column < subgroupsNum; column++) {
                WeekBuffer buffer = buffers.get(column);
                buffer.upper[day][lesson] = readLesson(upper, column);
                buffer.lower[day][lesson] = readLesson(lower, column);
            }
        }

        return buffers.stream().map(WeekBuffer::toWeek).toList();
    }

    private Lesson readLesson(List<GridCell> row, int column) {
        return lessonCellParser.parse(row.get(SheetLayout.descriptionCell(column)), row.get(SheetLayout.roomCell(column)))
                .orElse(null);
    }

    private static void checkWidth(String sheetName, int rowNum, List<GridCell> row, int subgroupsNum) {
        int expected = SheetLayout.expectedBodyCells(subgroupsNum);
        int actual = SheetLayout.bodyCells(row.size());
        if (row.size() < SheetLayout.LEAD_IN_CELLS || actual != expected) {
            throw ScheduleFormatException.atRow(Reason.ROW_COLUMN_COUNT_MISMATCH, sheetName, rowNum,
                    String.format("Row has %d cells after the lead-in, expected %d for %d columns",
                            actual, expected, subgroupsNum));
        }
    }

    private static final class WeekBuffer {
        private final Lesson[][] upper = new Lesson[SheetLayout.DAYS_PER_WEEK][SheetLayout.LESSONS_PER_DAY];
        private final Lesson[][] lower = new Lesson[SheetLayout.DAYS_PER_WEEK][SheetLayout.LESSONS_PER_DAY];

        Week toWeek() {
            List<Day> days = new ArrayList<>(SheetLayout.DAYS_PER_WEEK);
            for (int day = 0; day < SheetLayout.DAYS_PER_WEEK; day++) {
                days.add(new Day(Arrays.asList(upper[day]), Arrays.asList(lower[day])));
            }
            return Week.of(days);
        }
    }
}
