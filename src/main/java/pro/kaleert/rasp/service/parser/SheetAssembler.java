package pro.kaleert.rasp.service.parser;

import org.springframework.stereotype.Component;
import pro.kaleert.rasp.model.Course;
import pro.kaleert.rasp.model.GroupInfo;
import pro.kaleert.rasp.model.Subgroup;
import pro.kaleert.rasp.model.Week;
import pro.kaleert.rasp.model.WeekInfo;
import pro.kaleert.rasp.service.parser.ScheduleFormatException.Reason;
import pro.kaleert.rasp.service.parser.grid.GridCell;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Joins group names, subgroup clusters and scanned weeks into groups.
 */
@Component
public class SheetAssembler {

    public Course assembleCourse(String sheetName, List<GridCell> groupNameRow,
                                 List<SubgroupCluster> clusters, List<Week> weeks) {
        return new Course(sheetName, assemble(sheetName, groupNameRow, clusters, weeks));
    }

    /**
     * Group names are the text cells of the name row after the lead-in. Merged name cells leave
     * blanks behind, so filtering leaves exactly one name per cluster.
     */
    public List<GroupInfo> assemble(String sheetName, List<GridCell> groupNameRow,
                                    List<SubgroupCluster> clusters, List<Week> weeks) {
        List<String> names = groupNames(groupNameRow);
        if (names.size() != clusters.size()) {
            throw ScheduleFormatException.atRow(Reason.GROUP_SUBGROUP_COUNT_MISMATCH, sheetName, SheetLayout.GROUP_NAME_ROW,
                    String.format("Found %d group names but %d subgroup clusters", names.size(), clusters.size()));
        }
        int columns = SubgroupCluster.totalColumns(clusters);
        if (columns != weeks.size()) {
            throw ScheduleFormatException.atSheet(Reason.ROW_COLUMN_COUNT_MISMATCH, sheetName,
                    String.format("Subgroup header describes %d columns but %d weeks were scanned", columns, weeks.size()));
        }

        Iterator<Week> cursor = weeks.iterator();
        List<GroupInfo> groups = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            SubgroupCluster cluster = clusters.get(i);
            WeekInfo weekInfo;
            if (cluster.hasSubgroups()) {
                List<Subgroup> subgroups = new ArrayList<>(cluster.numbers().size());
                for (Integer number : cluster.numbers()) {
                    subgroups.add(new Subgroup(number, cursor.next()));
                }
                weekInfo = new WeekInfo.WithSubgroups(subgroups);
            } else {
                weekInfo = new WeekInfo.WithoutSubgroup(cursor.next());
            }
            groups.add(new GroupInfo(names.get(i), weekInfo));
        }
        return groups;
    }

    static List<String> groupNames(List<GridCell> groupNameRow) {
        return groupNameRow.stream()
                .skip(SheetLayout.LEAD_IN_CELLS)
                .filter(cell -> cell instanceof GridCell.Text)
                .map(cell -> ((GridCell.Text) cell).value())
                .toList();
    }
}
