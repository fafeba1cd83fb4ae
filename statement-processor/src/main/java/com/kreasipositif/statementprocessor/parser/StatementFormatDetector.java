package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.SourceKind;
import com.kreasipositif.statementprocessor.domain.StatementFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which grammar reads a file, from its name and content.
 *
 * <p>Order: spreadsheet extension, 1C markers at the start of a line, {@code .csv}/{@code .tsv}
 * extension, then a recognizable delimited header among the first rows of any other text. A
 * marker quoted inside a CSV field does not make the file a 1C export.
 */
@Slf4j
@Component
public class StatementFormatDetector {

    static final String EXCHANGE_MARKER = "1CClientBankExchange";
    static final String DOCUMENT_MARKER = "СекцияДокумент";

    private static final Pattern MARKER_LINE = Pattern.compile(
            "^[ \\t]*(?:" + EXCHANGE_MARKER + "|" + DOCUMENT_MARKER + ")", Pattern.MULTILINE);

    public DetectedStatement detect(String fileName, byte[] content) {
        String name = fileName == null ? "" : fileName;
        if (content == null || content.length == 0) {
            throw new UnsupportedStatementFormatException(name, "empty file");
        }

        String extension = extensionOf(name);
        if (extension.equals("xls") || extension.equals("xlsx")) {
            log.debug("'{}' detected as spreadsheet by extension", name);
            return new DetectedStatement(name, StatementFormat.DELIMITED, SourceKind.SPREADSHEET, null, content);
        }

        String text = StatementText.decode(content);
        if (MARKER_LINE.matcher(text).find()) {
            log.debug("'{}' detected as 1C exchange text", name);
            return new DetectedStatement(name, StatementFormat.NATIONAL_TXT, SourceKind.TEXT, text, content);
        }
        if (extension.equals("csv") || extension.equals("tsv")) {
            log.debug("'{}' detected as delimited text by extension", name);
            return new DetectedStatement(name, StatementFormat.DELIMITED, SourceKind.TEXT, text, content);
        }
        if (DelimitedText.findHeader(DelimitedText.records(text)).isPresent()) {
            log.debug("'{}' detected as delimited text by header row", name);
            return new DetectedStatement(name, StatementFormat.DELIMITED, SourceKind.TEXT, text, content);
        }
        throw new UnsupportedStatementFormatException(name, "no known grammar applies");
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
