package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.SourceKind;
import com.kreasipositif.statementprocessor.domain.StatementFormat;
import com.kreasipositif.statementprocessor.domain.StatementLine;
import com.kreasipositif.statementprocessor.parser.DelimitedText.Header;
import com.kreasipositif.statementprocessor.parser.DelimitedText.TextRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads CSV/TSV statement text. The delimiter is taken from the header row; rows are tokenized
 * with Spring Batch's quote-aware {@code DelimitedLineTokenizer}.
 */
@Slf4j
@Component
public class DelimitedStatementParser implements StatementParser {

    @Override
    public boolean supports(DetectedStatement statement) {
        return statement.format() == StatementFormat.DELIMITED && statement.sourceKind() == SourceKind.TEXT;
    }

    @Override
    public ParseOutcome parse(DetectedStatement statement) {
        List<TextRecord> records = DelimitedText.records(statement.text());
        Header header = DelimitedText.findHeader(records)
                .orElseThrow(() -> new UnsupportedStatementFormatException(
                        statement.fileName(), "no header row with date and amount columns"));
        log.debug("{}: header at line {}, delimiter '{}', {}", statement.fileName(),
                records.get(header.recordIndex()).line(), header.delimiter(), header.layout());

        StatementRowMapper mapper = new StatementRowMapper(header.layout());
        List<StatementLine> lines = new ArrayList<>();
        int warnings = 0;
        for (int i = header.recordIndex() + 1; i < records.size(); i++) {
            TextRecord record = records.get(i);
            if (DelimitedText.isSeparator(record.text(), header.delimiter())) {
                continue;
            }
            try {
                lines.add(mapper.map(DelimitedText.tokenize(record.text(), header.delimiter()), record.line()));
            } catch (MalformedStatementRecordException e) {
                warnings++;
                log.debug("{}: line {} dropped: {} [{}]", statement.fileName(), record.line(), e.getMessage(),
                        record.text());
            }
        }
        return new ParseOutcome(lines, warnings, "");
    }
}
