package pro.kaleert.rasp.service.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import pro.kaleert.rasp.service.parser.ScheduleFormatException.Reason;
import pro.kaleert.rasp.service.parser.grid.GridCell;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the subgroup header row into per-group column clusters.
 * <p>
 * Only description columns are looked at (the room cells next to them are merged and empty).
 * An empty header cell is a group without subgroups. A run of ascending numbers is one group's
 * subgroups, a number that doesn't go up starts the next group.
 */
@Slf4j
@Component
public class SubgroupHeaderParser {

    public static final int MAX_SUBGROUP_NUMBER = 255;

    public List<SubgroupCluster> parse(String sheetName, List<GridCell> headerRow) {
        ClusterCollector collector = new ClusterCollector();

        for (int column = 0; SheetLayout.subgroupHeaderCell(column) < headerRow.size(); column++) {
            int cellIndex = SheetLayout.subgroupHeaderCell(column);
            GridCell cell = headerRow.get(cellIndex);
            boolean first = column == 0;

            if (cell.isEmpty()) {
                collector.onEmpty(first);
            } else {
                collector.onNumber(parseNumber(sheetName, cellIndex, cell), first);
            }
        }

        List<SubgroupCluster> clusters = collector.finish();
        log.debug("Sheet '{}': {} group clusters over {} columns", sheetName, clusters.size(),
                SubgroupCluster.totalColumns(clusters));
        return clusters;
    }

    static int parseNumber(String sheetName, int cellIndex, GridCell cell) {
        if (!(cell instanceof GridCell.Text text)) {
            throw ScheduleFormatException.atCell(Reason.CELL_TYPE_MISMATCH, sheetName,
                    SheetLayout.SUBGROUP_ROW, cellIndex, "Subgroup number must be a text cell, got " + cell);
        }
        String value = text.value();
        if (!value.matches("\\+?\\d+")) {
            throw unparsable(sheetName, cellIndex, value);
        }
        try {
            int number = Integer.parseInt(value);
            if (number > MAX_SUBGROUP_NUMBER) {
                throw unparsable(sheetName, cellIndex, value);
            }
            return number;
        } catch (NumberFormatException e) {
            throw unparsable(sheetName, cellIndex, value);
        }
    }

    private static ScheduleFormatException unparsable(String sheetName, int cellIndex, String value) {
        return ScheduleFormatException.atCell(Reason.UNPARSABLE_SUBGROUP_NUMBER, sheetName,
                SheetLayout.SUBGROUP_ROW, cellIndex, "Not a subgroup number: '" + value + "'");
    }

    /**
     * Idle until a number shows up, then accumulating that group's subgroup numbers.
     * Each transition emits the clusters it has closed.
     */
    static class ClusterCollector {

        private final List<SubgroupCluster> clusters = new ArrayList<>();
        private List<Integer> current;

        void onEmpty(boolean first) {
            if (!first) {
                clusters.add(closeCurrent());
            }
            current = null;
        }

        void onNumber(int number, boolean first) {
            if (current == null) {
                if (!first) {
                    clusters.add(SubgroupCluster.single());
                }
                current = new ArrayList<>();
            }
            if (!current.isEmpty() && number <= current.get(current.size() - 1)) {
                clusters.add(SubgroupCluster.numbered(current));
                current = new ArrayList<>();
            }
            current.add(number);
        }

        boolean isAccumulating() {
            return current != null;
        }

        List<SubgroupCluster> finish() {
            clusters.add(closeCurrent());
            current = null;
            return List.copyOf(clusters);
        }

        private SubgroupCluster closeCurrent() {
            return current == null ? SubgroupCluster.single() : SubgroupCluster.numbered(current);
        }
    }
}
