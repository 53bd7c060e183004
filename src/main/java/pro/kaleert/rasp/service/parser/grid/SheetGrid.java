package pro.kaleert.rasp.service.parser.grid;

import java.util.List;

/**
 * One named sheet of a workbook as rows of decoded cells.
 */
public record SheetGrid(String name, List<List<GridCell>> rows) {

    public SheetGrid {
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int rowCount() {
        return rows.size();
    }

    public List<GridCell> row(int index) {
        return rows.get(index);
    }
}
