package pro.kaleert.rasp.service.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;
import pro.kaleert.rasp.service.parser.grid.GridCell;
import pro.kaleert.rasp.service.parser.grid.SheetGrid;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code .xls} and {@code .xlsx} workbooks into cell grids.
 * <p>
 * Each grid covers the bounding box of the sheet's non-empty cells, so a sheet whose first used
 * column is B starts at B. Merged regions keep their value in the top-left cell only, the rest is empty.
 */
@Slf4j
@Component
public class WorkbookGridReader {

    public List<SheetGrid> read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open workbook " + file, e);
        }
    }

    public List<SheetGrid> read(InputStream inputStream) {
        try (Workbook workbook = WorkbookFactory.create(inputStream)) {
            List<SheetGrid> sheets = new ArrayList<>(workbook.getNumberOfSheets());
            for (Sheet sheet : workbook) {
                SheetGrid grid = toGrid(sheet);
                log.debug("Read sheet '{}': {} rows", grid.name(), grid.rowCount());
                sheets.add(grid);
            }
            return sheets;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read workbook", e);
        }
    }

    SheetGrid toGrid(Sheet sheet) {
        int firstRow = Integer.MAX_VALUE;
        int lastRow = -1;
        int firstCol = Integer.MAX_VALUE;
        int lastCol = -1;

        for (Row row : sheet) {
            for (Cell cell : row) {
                if (toGridCell(cell).isEmpty()) continue;
                firstRow = Math.min(firstRow, cell.getRowIndex());
                lastRow = Math.max(lastRow, cell.getRowIndex());
                firstCol = Math.min(firstCol, cell.getColumnIndex());
                lastCol = Math.max(lastCol, cell.getColumnIndex());
            }
        }

        if (lastRow < 0) {
            return new SheetGrid(sheet.getSheetName(), List.of());
        }

        List<List<GridCell>> rows = new ArrayList<>(lastRow - firstRow + 1);
        for (int r = firstRow; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            List<GridCell> cells = new ArrayList<>(lastCol - firstCol + 1);
            for (int c = firstCol; c <= lastCol; c++) {
                cells.add(row == null ? GridCell.empty() : toGridCell(row.getCell(c)));
            }
            rows.add(cells);
        }
        return new SheetGrid(sheet.getSheetName(), rows);
    }

    GridCell toGridCell(Cell cell) {
        if (cell == null) return GridCell.empty();
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (type) {
            case STRING -> {
                String value = cell.getStringCellValue();
                yield value.isEmpty() ? GridCell.empty() : GridCell.text(value);
            }
            case NUMERIC -> GridCell.number(cell.getNumericCellValue());
            case BOOLEAN -> GridCell.number(cell.getBooleanCellValue() ? 1 : 0);
            default -> GridCell.empty();
        };
    }
}
