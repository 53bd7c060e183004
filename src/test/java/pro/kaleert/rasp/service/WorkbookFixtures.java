package pro.kaleert.rasp.service;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small faculty workbooks the way the real ones are laid out: day, lesson number and time
 * in the first three columns, merged group names, one description and one room column per subgroup.
 */
final class WorkbookFixtures {

    static final String[] DAYS = {"Понедельник", "Вторник", "Среда", "Четверг", "Пятница", "Суббота", "Воскресенье"};

    private WorkbookFixtures() {
    }

    static void writeFacultyWorkbook(Path target) throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(target)) {
            singleGroupSheet(workbook, "1 курс", "БИВТ-22-1");
            splitGroupSheet(workbook, "2 курс");
            singleGroupSheet(workbook, "3 курс", "БИВТ-20-1");
            singleGroupSheet(workbook, "4 курс", "БИВТ-19-1");
            workbook.write(out);
        }
    }

    static void writeThreeSheetWorkbook(Path target) throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(target)) {
            for (int i = 1; i <= 3; i++) {
                singleGroupSheet(workbook, i + " курс", "Г-" + i);
            }
            workbook.write(out);
        }
    }

    private static void leadIn(Row row, int bodyIndex) {
        int pair = bodyIndex / 2;
        row.createCell(0).setCellValue(DAYS[pair / 7]);
        row.createCell(1).setCellValue(pair % 7 + 1);
    }

    private static void header(Sheet sheet) {
        Row names = sheet.createRow(0);
        names.createCell(0).setCellValue("День");
        names.createCell(1).setCellValue("№");
        names.createCell(2).setCellValue("Время");
        sheet.createRow(1);
    }

    private static void singleGroupSheet(Workbook workbook, String name, String group) {
        Sheet sheet = workbook.createSheet(name);
        header(sheet);
        sheet.getRow(0).createCell(3).setCellValue(group);
        sheet.addMergedRegion(new CellRangeAddress(0, 0, 3, 4));

        Row upper = sheet.createRow(2);
        leadIn(upper, 0);
        upper.createCell(3).setCellValue("История (Лекционные)\nПетров П.П.");
        upper.createCell(4).setCellValue("Б-100");
        Row lower = sheet.createRow(3);
        leadIn(lower, 1);
    }

    private static void splitGroupSheet(Workbook workbook, String name) {
        Sheet sheet = workbook.createSheet(name);
        header(sheet);
        sheet.getRow(0).createCell(3).setCellValue("Group");
        sheet.addMergedRegion(new CellRangeAddress(0, 0, 3, 6));
        Row subgroups = sheet.getRow(1);
        subgroups.createCell(3).setCellValue("1");
        subgroups.createCell(5).setCellValue("2");

        for (int i = 0; i < 98; i++) {
            leadIn(sheet.createRow(2 + i), i);
        }
        Row first = sheet.getRow(2);
        first.createCell(3).setCellValue("Math (Практические)\nTeacher");
        first.createCell(4).setCellValue("Class");
        Row last = sheet.getRow(2 + 97);
        last.createCell(5).setCellValue("CS (Лабораторные)\nTeacher2");
        last.createCell(6).setCellValue("Class2");
    }
}
