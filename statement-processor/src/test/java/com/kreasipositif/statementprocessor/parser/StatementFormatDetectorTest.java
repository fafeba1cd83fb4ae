package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.SourceKind;
import com.kreasipositif.statementprocessor.domain.StatementFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementFormatDetectorTest {

    private final StatementFormatDetector detector = new StatementFormatDetector();

    @Test
    @DisplayName("1C exchange markers win regardless of extension")
    void detect_nationalText() throws IOException {
        DetectedStatement detected = detector.detect("export.dat", fixture("national-march.txt"));

        assertThat(detected.format()).isEqualTo(StatementFormat.NATIONAL_TXT);
        assertThat(detected.sourceKind()).isEqualTo(SourceKind.TEXT);
        assertThat(detected.text()).startsWith("1CClientBankExchange");
    }

    @Test
    @DisplayName("1C text in windows-1251 is decoded")
    void detect_nationalTextInLegacyCodePage() {
        byte[] content = "1CClientBankExchange\r\nСекцияДокумент=Платежное поручение\r\nКонецДокумента\r\n"
                .getBytes(StatementText.WINDOWS_1251);

        DetectedStatement detected = detector.detect("kaspi.txt", content);

        assertThat(detected.format()).isEqualTo(StatementFormat.NATIONAL_TXT);
        assertThat(detected.text()).contains("СекцияДокумент").doesNotContain("\r");
    }

    @Test
    @DisplayName(".csv is delimited text by extension")
    void detect_csvByExtension() throws IOException {
        DetectedStatement detected = detector.detect("delimited-march.csv", fixture("delimited-march.csv"));

        assertThat(detected.format()).isEqualTo(StatementFormat.DELIMITED);
        assertThat(detected.sourceKind()).isEqualTo(SourceKind.TEXT);
    }

    @Test
    @DisplayName("1C marker quoted inside a CSV field does not make the file a 1C export")
    void detect_csvMentioningMarker() {
        byte[] content = ("Дата;Контрагент;Кредит;Назначение платежа\n"
                + "03.03.2026;ТОО Алма Трейд;10 000,00;\"Повтор: СекцияДокумент не загрузилась\"\n")
                .getBytes(StandardCharsets.UTF_8);

        DetectedStatement detected = detector.detect("march.csv", content);

        assertThat(detected.format()).isEqualTo(StatementFormat.DELIMITED);
        assertThat(detected.sourceKind()).isEqualTo(SourceKind.TEXT);
    }

    @Test
    @DisplayName(".txt with a recognizable header row is delimited text")
    void detect_txtWithHeader() throws IOException {
        DetectedStatement detected = detector.detect("comma-header.txt", fixture("comma-header.txt"));

        assertThat(detected.format()).isEqualTo(StatementFormat.DELIMITED);
        assertThat(detected.sourceKind()).isEqualTo(SourceKind.TEXT);
    }

    @Test
    @DisplayName("Excel extensions go to the spreadsheet reader without decoding")
    void detect_spreadsheetByExtension() {
        DetectedStatement detected = detector.detect("Statement.XLSX", new byte[]{0x50, 0x4B, 0x03, 0x04});

        assertThat(detected.format()).isEqualTo(StatementFormat.DELIMITED);
        assertThat(detected.sourceKind()).isEqualTo(SourceKind.SPREADSHEET);
        assertThat(detected.text()).isNull();
    }

    @Test
    @DisplayName("Prose without a header row is not recognized")
    void detect_prose() throws IOException {
        byte[] content = fixture("cover-letter.txt");

        assertThatThrownBy(() -> detector.detect("cover-letter.txt", content))
                .isInstanceOf(UnsupportedStatementFormatException.class)
                .hasMessageStartingWith(UnsupportedStatementFormatException.FORMAT_NOT_RECOGNIZED)
                .extracting("fileName").isEqualTo("cover-letter.txt");
    }

    @Test
    @DisplayName("Empty file is not recognized")
    void detect_empty() {
        assertThatThrownBy(() -> detector.detect("empty.csv", new byte[0]))
                .isInstanceOf(UnsupportedStatementFormatException.class);
        assertThatThrownBy(() -> detector.detect("blank.txt", "   \n".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(UnsupportedStatementFormatException.class);
    }

    static byte[] fixture(String name) throws IOException {
        return new ClassPathResource("statements/" + name).getContentAsByteArray();
    }
}
