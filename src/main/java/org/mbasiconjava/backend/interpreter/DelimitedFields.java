package org.mbasiconjava.backend.interpreter;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Comma-separated items as typed at INPUT or stored by WRITE#: items may be
 * double-quoted, unquoted items lose surrounding blanks and quoted items
 * keep theirs.
 */
public final class DelimitedFields {
    private static final CSVFormat INPUT_FORMAT = CSVFormat.RFC4180.builder()
            .setIgnoreSurroundingSpaces(true)
            .build();
    private static final CSVFormat WRITE_FORMAT = CSVFormat.RFC4180.builder()
            .setQuoteMode(QuoteMode.NON_NUMERIC)
            .build();

    private DelimitedFields() {
    }

    /**
     * Splits one line into items. Returns null for a malformed line such as
     * an unterminated quote.
     */
    public static List<String> split(String line) {
        if (line.isBlank()) {
            return List.of("");
        }
        try (CSVParser parser = CSVParser.parse(line, INPUT_FORMAT)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                return List.of("");
            }
            List<String> fields = new ArrayList<>();
            for (String field : records.get(0)) {
                fields.add(field);
            }
            return fields;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            return null;
        }
    }

    /**
     * WRITE form: strings quoted, numbers bare without padding, comma
     * separated, no line terminator.
     */
    public static String join(List<BasicValue> values) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, WRITE_FORMAT)) {
            for (BasicValue value : values) {
                if (value.isString()) {
                    printer.print(value.getString());
                } else {
                    printer.print(new BigDecimal(BasicValue.formatNumberBody(value.toNumber())));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
