package pro.kaleert.rasp.service.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import pro.kaleert.rasp.model.Course;
import pro.kaleert.rasp.service.parser.ScheduleFormatException.Reason;
import pro.kaleert.rasp.service.parser.grid.GridCell;
import pro.kaleert.rasp.service.parser.grid.SheetGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns the four sheets of a timetable workbook into courses. Sheets are independent,
 * each one is parsed as a separate task on the parser executor.
 */
@Slf4j
@Service
public class ScheduleParserService {

    private final SubgroupHeaderParser subgroupHeaderParser;
    private final GridScanner gridScanner;
    private final SheetAssembler sheetAssembler;
    private final Executor executor;

    public ScheduleParserService(SubgroupHeaderParser subgroupHeaderParser,
                                 GridScanner gridScanner,
                                 SheetAssembler sheetAssembler,
                                 @Qualifier("sheetParserExecutor") Executor executor) {
        this.subgroupHeaderParser = subgroupHeaderParser;
        this.gridScanner = gridScanner;
        this.sheetAssembler = sheetAssembler;
        this.executor = executor;
    }

    /**
     * Parses all sheets and fails if any of them is malformed. The first broken sheet (in sheet order)
     * is thrown, failures of later sheets are attached as suppressed.
     *
     * @return exactly {@value SheetLayout#SHEETS_PER_WORKBOOK} courses in sheet order
     */
    public List<Course> parse(List<SheetGrid> sheets) {
        List<SheetOutcome> outcomes = parseEach(sheets);

        ScheduleFormatException first = null;
        List<Course> courses = new ArrayList<>(outcomes.size());
        for (SheetOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                courses.add(outcome.course());
            } else if (first == null) {
                first = outcome.error();
            } else {
                first.addSuppressed(outcome.error());
            }
        }
        if (first != null) {
            throw first;
        }
        return List.copyOf(courses);
    }

    /**
     * Parses all sheets, a malformed sheet only spoils its own outcome.
     */
    public List<SheetOutcome> parseEach(List<SheetGrid> sheets) {
        if (sheets.size() != SheetLayout.SHEETS_PER_WORKBOOK) {
            throw ScheduleFormatException.wrongSheetCount(sheets.size());
        }

        List<CompletableFuture<Course>> tasks = sheets.stream()
                .map(sheet -> CompletableFuture.supplyAsync(() -> parseSheet(sheet), executor))
                .toList();

        List<SheetOutcome> outcomes = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            String sheetName = sheets.get(i).name();
            try {
                outcomes.add(SheetOutcome.parsed(tasks.get(i).join()));
            } catch (CompletionException e) {
                if (e.getCause() instanceof ScheduleFormatException formatError) {
                    log.warn("Sheet '{}' is malformed: {}", sheetName, formatError.getMessage());
                    outcomes.add(SheetOutcome.failed(sheetName, formatError));
                } else if (e.getCause() instanceof RuntimeException runtimeError) {
                    throw runtimeError;
                } else {
                    throw e;
                }
            }
        }
        return List.copyOf(outcomes);
    }

    public Course parseSheet(SheetGrid sheet) {
        String name = sheet.name();
        if (sheet.rowCount() < SheetLayout.HEADER_ROWS) {
            throw ScheduleFormatException.atSheet(Reason.MISSING_HEADER_ROW, name,
                    String.format("Sheet has %d rows, the group and subgroup header rows are required", sheet.rowCount()));
        }

        List<SubgroupCluster> clusters = subgroupHeaderParser.parse(name, sheet.row(SheetLayout.SUBGROUP_ROW));
        int subgroupsNum = SubgroupCluster.totalColumns(clusters);

        List<List<GridCell>> body = sheet.rows().subList(SheetLayout.HEADER_ROWS, sheet.rowCount());
        var weeks = gridScanner.scan(name, body, SheetLayout.HEADER_ROWS, subgroupsNum);

        Course course = sheetAssembler.assembleCourse(name, sheet.row(SheetLayout.GROUP_NAME_ROW), clusters, weeks);
        log.info("Parsed sheet '{}': {} groups, {} week-columns", name, course.groups().size(), subgroupsNum);
        return course;
    }
}
