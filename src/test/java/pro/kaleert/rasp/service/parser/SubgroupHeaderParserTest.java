package pro.kaleert.rasp.service.parser;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pro.kaleert.rasp.service.parser.ScheduleFormatException.Reason;
import pro.kaleert.rasp.service.parser.grid.GridCell;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static pro.kaleert.rasp.service.parser.SheetFixtures.headerRow;

class SubgroupHeaderParserTest {

    private final SubgroupHeaderParser parser = new SubgroupHeaderParser();

    private static SubgroupCluster numbered(Integer... numbers) {
        return SubgroupCluster.numbered(List.of(numbers));
    }

    @Test
    void decreasingNumberStartsNextGroup() {
        List<SubgroupCluster> clusters = parser.parse("s", headerRow("1", "2", "1"));

        assertThat(clusters).containsExactly(numbered(1, 2), numbered(1));
        assertThat(SubgroupCluster.totalColumns(clusters)).isEqualTo(3);
    }

    @Test
    void rowWithoutNumbersIsOneGroupWithoutSubgroups() {
        List<SubgroupCluster> clusters = parser.parse("s", headerRow((String) null));

        assertThat(clusters).containsExactly(SubgroupCluster.single());
        assertThat(SubgroupCluster.totalColumns(clusters)).isEqualTo(1);
    }

    @Test
    void rowShorterThanLeadInIsOneGroupWithoutSubgroups() {
        assertThat(parser.parse("s", List.of(GridCell.empty(), GridCell.empty())))
                .containsExactly(SubgroupCluster.single());
    }

    @Test
    void everyEmptyCellIsAGroupOfItsOwn() {
        assertThat(parser.parse("s", headerRow(null, null, null)))
                .containsExactly(SubgroupCluster.single(), SubgroupCluster.single(), SubgroupCluster.single());
    }

    @Test
    void emptyCellAfterSubgroupsIsSeparateGroup() {
        assertThat(parser.parse("s", headerRow("1", "2", null, "1", null)))
                .containsExactly(numbered(1, 2), SubgroupCluster.single(), numbered(1), SubgroupCluster.single());
    }

    @Test
    void groupWithoutSubgroupsBeforeNumberedOne() {
        assertThat(parser.parse("s", headerRow(null, "1", "2", "3")))
                .containsExactly(SubgroupCluster.single(), numbered(1, 2, 3));
    }

    @Test
    void repeatedNumberStartsNextGroup() {
        assertThat(parser.parse("s", headerRow("1", "1")))
                .containsExactly(numbered(1), numbered(1));
    }

    @Test
    void columnCountMatchesHeaderCells() {
        List<GridCell> row = headerRow("1", "2", null, null, "2", "3", "1", null);

        assertThat(SubgroupCluster.totalColumns(parser.parse("s", row))).isEqualTo(8);
    }

    @Test
    void roomCellsAreIgnored() {
        List<GridCell> row = headerRow("1", "2");
        row.set(SheetLayout.roomCell(0), GridCell.number(7));

        assertThat(parser.parse("s", row)).containsExactly(numbered(1, 2));
    }

    @Test
    void numericSubgroupCellIsRejected() {
        List<GridCell> row = headerRow("1", null);
        row.set(SheetLayout.descriptionCell(1), GridCell.number(2));

        assertThatThrownBy(() -> parser.parse("Курс 2", row))
                .isInstanceOfSatisfying(ScheduleFormatException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(Reason.CELL_TYPE_MISMATCH);
                    assertThat(e.getSheetName()).isEqualTo("Курс 2");
                    assertThat(e.getRow()).isEqualTo(SheetLayout.SUBGROUP_ROW);
                    assertThat(e.getColumn()).isEqualTo(SheetLayout.descriptionCell(1));
                });
    }

    @Test
    void nonNumericTextIsRejected() {
        assertThatThrownBy(() -> parser.parse("s", headerRow("1", "II")))
                .isInstanceOfSatisfying(ScheduleFormatException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.UNPARSABLE_SUBGROUP_NUMBER));
    }

    @Test
    void numbersAboveRangeAreRejected() {
        assertThatThrownBy(() -> parser.parse("s", headerRow("256")))
                .isInstanceOfSatisfying(ScheduleFormatException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.UNPARSABLE_SUBGROUP_NUMBER));
        assertThatThrownBy(() -> parser.parse("s", headerRow("-1")))
                .isInstanceOfSatisfying(ScheduleFormatException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.UNPARSABLE_SUBGROUP_NUMBER));
    }

    @Nested
    class ClusterCollectorTest {

        private final SubgroupHeaderParser.ClusterCollector collector = new SubgroupHeaderParser.ClusterCollector();

        @Test
        void staysIdleOnLeadingEmptyCell() {
            collector.onEmpty(true);

            assertThat(collector.isAccumulating()).isFalse();
            assertThat(collector.finish()).containsExactly(SubgroupCluster.single());
        }

        @Test
        void ascendingNumbersAccumulate() {
            collector.onNumber(1, true);
            collector.onNumber(2, false);
            collector.onNumber(5, false);

            assertThat(collector.isAccumulating()).isTrue();
            assertThat(collector.finish()).containsExactly(numbered(1, 2, 5));
        }

        @Test
        void nonAscendingNumberClosesAndReopens() {
            collector.onNumber(2, true);
            collector.onNumber(3, false);
            collector.onNumber(3, false);
            collector.onNumber(1, false);

            assertThat(collector.finish()).containsExactly(numbered(2, 3), numbered(3), numbered(1));
        }

        @Test
        void emptyCellFlushesAndGoesIdle() {
            collector.onNumber(1, true);
            collector.onEmpty(false);

            assertThat(collector.isAccumulating()).isFalse();
            assertThat(collector.finish()).containsExactly(numbered(1), SubgroupCluster.single());
        }
    }
}
