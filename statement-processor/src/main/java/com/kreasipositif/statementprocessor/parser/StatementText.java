package com.kreasipositif.statementprocessor.parser;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns statement bytes into text with LF line endings.
 *
 * <p>Bank exports arrive either as UTF-8 (with or without BOM) or in the legacy Cyrillic code
 * page used by 1C. Strict UTF-8 decoding is tried first; any malformed sequence switches the
 * whole file to windows-1251.
 */
public final class StatementText {

    public static final Charset WINDOWS_1251 = Charset.forName("windows-1251");

    private StatementText() {
    }

    public static String decode(byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            text = new String(content, WINDOWS_1251);
        }
        return normalizeLineEndings(stripBom(text));
    }

    static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
