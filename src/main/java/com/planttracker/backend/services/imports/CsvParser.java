package com.planttracker.backend.services.imports;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.planttracker.backend.exceptions.CsvImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class CsvParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvParser.class);

    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};
    private static final int DELIMITER_SAMPLE_LINES = 5;
    private static final char BOM = '\uFEFF';

    public static class ParsedCsvData {
        private final char delimiter;
        private final List<String> headers;
        private final List<Map<String, String>> rows;

        public ParsedCsvData(char delimiter, List<String> headers, List<Map<String, String>> rows) {
            this.delimiter = delimiter;
            this.headers = List.copyOf(headers);
            this.rows = Collections.unmodifiableList(rows);
        }

        public char getDelimiter() { return delimiter; }
        public List<String> getHeaders() { return headers; }
        public List<Map<String, String>> getRows() { return rows; }
        public int getRowCount() { return rows.size(); }
    }

    /**
     * Parse CSV text with a header row into header -> value maps.
     * Values are trimmed and blank cells become null. Row order is preserved.
     *
     * @param maxRows upper bound on data rows, exceeding it fails the parse
     */
    public ParsedCsvData parse(String content, int maxRows) {
        if (content == null || content.trim().isEmpty()) {
            throw new CsvImportException("CSV file is empty");
        }
        if (content.charAt(0) == BOM) {
            content = content.substring(1);
        }

        char delimiter = detectDelimiter(content);

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(content))
                .withCSVParser(new CSVParserBuilder().withSeparator(delimiter).build())
                .build()) {

            List<String[]> allRows = reader.readAll().stream()
                    .filter(row -> !isBlankLine(row))
                    .collect(Collectors.toList());

            if (allRows.isEmpty()) {
                throw new CsvImportException("CSV file is empty");
            }

            List<String> headers = Arrays.stream(allRows.get(0))
                    .map(header -> header == null ? "" : header.trim())
                    .collect(Collectors.toList());

            if (headers.stream().allMatch(String::isEmpty)) {
                throw new CsvImportException("CSV header row is missing");
            }

            int dataRows = allRows.size() - 1;
            if (dataRows > maxRows) {
                throw new CsvImportException("CSV file too large. Maximum " + maxRows + " rows allowed, found " + dataRows);
            }

            List<Map<String, String>> rows = new ArrayList<>(dataRows);
            for (int i = 1; i < allRows.size(); i++) {
                String[] row = allRows.get(i);
                Map<String, String> rowMap = new LinkedHashMap<>();

                for (int j = 0; j < headers.size(); j++) {
                    String header = headers.get(j);
                    if (header.isEmpty()) {
                        continue;
                    }
                    String value = j < row.length && row[j] != null ? row[j].trim() : "";
                    rowMap.put(header, value.isEmpty() ? null : value);
                }

                rows.add(rowMap);
            }

            logger.debug("Parsed CSV with delimiter '{}', {} headers, {} rows", delimiter, headers.size(), rows.size());
            return new ParsedCsvData(delimiter, headers, rows);

        } catch (IOException | CsvException e) {
            throw new CsvImportException("Failed to parse CSV: " + e.getMessage(), e);
        }
    }

    /**
     * Detect CSV delimiter by counting candidates on the first few lines, default comma
     */
    char detectDelimiter(String content) {
        Map<Character, Integer> scores = new HashMap<>();

        try (Scanner scanner = new Scanner(content)) {
            int linesChecked = 0;

            while (scanner.hasNextLine() && linesChecked < DELIMITER_SAMPLE_LINES) {
                String line = scanner.nextLine();
                linesChecked++;

                for (char delimiter : CANDIDATE_DELIMITERS) {
                    int count = line.length() - line.replace(String.valueOf(delimiter), "").length();
                    scores.merge(delimiter, count, Integer::sum);
                }
            }
        }

        return scores.entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .max(Map.Entry.<Character, Integer>comparingByValue()
                        .thenComparing(entry -> entry.getKey() == ',' ? 1 : 0))
                .map(Map.Entry::getKey)
                .orElse(',');
    }

    private boolean isBlankLine(String[] row) {
        return row.length == 0 || (row.length == 1 && (row[0] == null || row[0].trim().isEmpty()));
    }
}
