package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.SourceKind;
import com.kreasipositif.statementprocessor.domain.StatementFormat;
import com.kreasipositif.statementprocessor.domain.StatementLine;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the first sheet of an XLS/XLSX statement with Apache POI.
 *
 * <p>Cells are rendered through {@link DataFormatter} so amounts keep the text the bank
 * printed; date-formatted cells are rendered as {@code dd.MM.yyyy}. Whole numbers are written
 * out in full, since a 12-digit BIN in General format would otherwise come back in scientific
 * notation. From there the rows
 * follow the same header-driven rules as delimited text.
 */
@Slf4j
@Component
public class SpreadsheetStatementParser implements StatementParser {

    private static final DateTimeFormatter CELL_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    @Override
    public boolean supports(DetectedStatement statement) {
        return statement.format() == StatementFormat.DELIMITED && statement.sourceKind() == SourceKind.SPREADSHEET;
    }

    @Override
    public ParseOutcome parse(DetectedStatement statement) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(statement.content()))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new UnsupportedStatementFormatException(statement.fileName(), "workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            return parseSheet(statement.fileName(), sheet, formatter, evaluator);
        } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
            throw new UnsupportedStatementFormatException(statement.fileName(), "unreadable workbook", e);
        }
    }

    private ParseOutcome parseSheet(String fileName, Sheet sheet, DataFormatter formatter, FormulaEvaluator evaluator) {
        StatementColumnLayout layout = null;
        int headerRow = -1;
        int scanned = 0;
        for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum() && scanned < DelimitedText.HEADER_SCAN_ROWS; r++) {
            List<String> cells = cells(sheet.getRow(r), formatter, evaluator);
            if (isBlank(cells)) {
                continue;
            }
            scanned++;
            Optional<StatementColumnLayout> candidate = StatementColumnLayout.fromHeader(cells);
            if (candidate.isPresent()) {
                layout = candidate.get();
                headerRow = r;
                break;
            }
        }
        if (layout == null) {
            throw new UnsupportedStatementFormatException(fileName, "no header row with date and amount columns");
        }
        log.debug("{}: header at row {}, {}", fileName, headerRow + 1, layout);

        StatementRowMapper mapper = new StatementRowMapper(layout);
        List<StatementLine> lines = new ArrayList<>();
        int warnings = 0;
        for (int r = headerRow + 1; r <= sheet.getLastRowNum(); r++) {
            List<String> cells = cells(sheet.getRow(r), formatter, evaluator);
            if (isBlank(cells)) {
                continue;
            }
            try {
                lines.add(mapper.map(cells, r + 1));
            } catch (MalformedStatementRecordException e) {
                warnings++;
                log.debug("{}: row {} dropped: {} {}", fileName, r + 1, e.getMessage(), cells);
            }
        }
        return new ParseOutcome(lines, warnings, "");
    }

    private static List<String> cells(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        List<String> cells = new ArrayList<>();
        if (row == null || row.getLastCellNum() < 0) {
            return cells;
        }
        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            if (cell == null) {
                cells.add("");
            } else if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
                cells.add(cell.getLocalDateTimeCellValue().toLocalDate().format(CELL_DATE));
            } else if (cell.getCellType() == CellType.NUMERIC && isWholeNumber(cell.getNumericCellValue())) {
                cells.add(NumberToTextConverter.toText(cell.getNumericCellValue()));
            } else {
                cells.add(formatter.formatCellValue(cell, evaluator).trim());
            }
        }
        return cells;
    }

    private static boolean isWholeNumber(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    private static boolean isBlank(List<String> cells) {
        return cells.stream().allMatch(String::isBlank);
    }
}
