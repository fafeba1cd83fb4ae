package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.Direction;
import com.kreasipositif.statementprocessor.domain.SourceKind;
import com.kreasipositif.statementprocessor.domain.StatementFormat;
import com.kreasipositif.statementprocessor.domain.StatementLine;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadsheetStatementParserTest {

    private final SpreadsheetStatementParser parser = new SpreadsheetStatementParser();

    @Test
    @DisplayName("Header found below a title row; date-formatted and numeric cells are read")
    void parse_workbook() throws IOException {
        ParseOutcome outcome = parser.parse(detect("statement.xlsx", workbook()));

        assertThat(outcome.lines()).hasSize(2);
        assertThat(outcome.warnings()).isEqualTo(1);

        StatementLine income = outcome.lines().get(0);
        assertThat(income.getSourceLine()).isEqualTo(3);
        assertThat(income.getDate()).isEqualTo(LocalDate.of(2026, 3, 3));
        assertThat(income.getAmount()).isEqualByComparingTo("10000.5");
        assertThat(income.getDirection()).isEqualTo(Direction.INCOME);
        assertThat(income.getPayer().bin()).isEqualTo("180540012345");

        StatementLine expense = outcome.lines().get(1);
        assertThat(expense.getDate()).isEqualTo(LocalDate.of(2026, 3, 5));
        assertThat(expense.getAmount()).isEqualByComparingTo("2500");
        assertThat(expense.getDirection()).isEqualTo(Direction.EXPENSE);
        assertThat(expense.getPayee().name()).isEqualTo("ТОО Степь Логистик");
    }

    @Test
    @DisplayName("BIN stored as a number keeps all twelve digits")
    void parse_numericBin() throws IOException {
        byte[] content;
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Выписка");
            Row header = sheet.createRow(0);
            String[] titles = {"Дата", "Контрагент", "БИН", "Сумма"};
            for (int i = 0; i < titles.length; i++) {
                header.createCell(i).setCellValue(titles[i]);
            }
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("03.03.2026");
            row.createCell(1).setCellValue("ТОО Алма Трейд");
            row.createCell(2).setCellValue(180540012345d);
            row.createCell(3).setCellValue(10000);
            workbook.write(out);
            content = out.toByteArray();
        }

        ParseOutcome outcome = parser.parse(detect("numeric-bin.xlsx", content));

        assertThat(outcome.lines()).hasSize(1);
        assertThat(outcome.lines().get(0).getPayer().bin()).isEqualTo("180540012345");
        assertThat(outcome.lines().get(0).getAmount()).isEqualByComparingTo("10000");
    }

    @Test
    @DisplayName("Bytes that are not a workbook are not recognized")
    void parse_notAWorkbook() {
        byte[] content = "definitely not a workbook".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> parser.parse(detect("broken.xlsx", content)))
                .isInstanceOf(UnsupportedStatementFormatException.class);
    }

    private static byte[] workbook() throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Выписка");
            sheet.createRow(0).createCell(0).setCellValue("Выписка по счету KZ86125KZT5004100100");

            Row header = sheet.createRow(1);
            String[] titles = {"Дата", "Контрагент", "БИН", "Сумма", "Назначение"};
            for (int i = 0; i < titles.length; i++) {
                header.createCell(i).setCellValue(titles[i]);
            }

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("dd.mm.yyyy"));

            Row first = sheet.createRow(2);
            Cell date = first.createCell(0);
            date.setCellValue(LocalDate.of(2026, 3, 3));
            date.setCellStyle(dateStyle);
            first.createCell(1).setCellValue("ТОО Алма Трейд");
            first.createCell(2).setCellValue("180540012345");
            first.createCell(3).setCellValue(10000.5);
            first.createCell(4).setCellValue("Оплата по счету 15");

            Row second = sheet.createRow(3);
            second.createCell(0).setCellValue("05.03.2026");
            second.createCell(1).setCellValue("ТОО Степь Логистик");
            second.createCell(3).setCellValue(-2500);
            second.createCell(4).setCellValue("Доставка");

            Row total = sheet.createRow(4);
            total.createCell(0).setCellValue("Итого");
            total.createCell(3).setCellValue(7500.5);

            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static DetectedStatement detect(String name, byte[] content) {
        return new DetectedStatement(name, StatementFormat.DELIMITED, SourceKind.SPREADSHEET, null, content);
    }
}
