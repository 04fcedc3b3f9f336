package com.example.pricing_import.loader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads an uploaded price list (workbook or delimited text) into raw rows.
 *
 * <ul>
 * <li>Header row = first row with at least two non-blank, non-numeric cells; earlier rows are dropped</li>
 * <li>Column labels are kept as-is and only passed on as extraction hints</li>
 * <li>Fully blank rows after the header are not data rows</li>
 * </ul>
 */
@Service
public class FileLoader {

    private static final Logger log = LoggerFactory.getLogger(FileLoader.class);

    private static final Pattern NUMERIC = Pattern.compile("^[-+]?[$£€¥₹]?\\s*[0-9][0-9.,'\\s]*\\s*[$£€¥₹%]?$");
    private static final int BINARY_SNIFF_BYTES = 8192;
    private static final Charset LEGACY_CHARSET = Charset.forName("windows-1252");

    public List<RawRow> load(String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            throw new EmptyFileException("File is empty: " + fileName);
        }

        FileFormat format = FileFormat.detect(fileName, content);
        log.info("Loading price list fileName={} format={} size={}", fileName, format, content.length);

        List<List<Object>> grid = switch (format) {
            case XLSX, XLS -> readWorkbook(content, fileName);
            case DELIMITED_TEXT -> readDelimited(content, fileName);
        };

        List<RawRow> rows = toRawRows(grid, fileName);
        log.info("Loaded {} data rows from {}", rows.size(), fileName);
        return rows;
    }

    // --- workbook ---

    private List<List<Object>> readWorkbook(byte[] content, String fileName) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            Sheet sheet = firstSheetWithData(workbook);
            List<List<Object>> grid = new ArrayList<>();
            if (sheet == null) {
                return grid;
            }
            for (int rowIndex = 0; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                List<Object> values = new ArrayList<>();
                if (row != null) {
                    for (int colIndex = 0; colIndex < row.getLastCellNum(); colIndex++) {
                        values.add(cellValue(row.getCell(colIndex)));
                    }
                }
                grid.add(values);
            }
            return grid;
        } catch (IOException e) {
            log.error("Workbook read failed: {}", fileName, e);
            throw new UnreadableFileException("Cannot read workbook " + fileName + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // POI signals corrupt or foreign content with assorted unchecked exceptions
            log.warn("Workbook parse failed: {} ({})", fileName, e.getMessage());
            throw new UnreadableFileException("Not a readable workbook: " + fileName, e);
        }
    }

    private Sheet firstSheetWithData(Workbook workbook) {
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            Sheet sheet = workbook.getSheetAt(i);
            if (sheet.getPhysicalNumberOfRows() > 0) {
                return sheet;
            }
        }
        return null;
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        switch (type) {
            case STRING:
                String s = cell.getStringCellValue().trim();
                return s.isEmpty() ? null : s;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getDateCellValue().toInstant()
                            .atZone(ZoneId.systemDefault())
                            .toLocalDate()
                            .toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    // --- delimited text ---

    private List<List<Object>> readDelimited(byte[] content, String fileName) {
        int sniff = Math.min(content.length, BINARY_SNIFF_BYTES);
        for (int i = 0; i < sniff; i++) {
            if (content[i] == 0) {
                throw new UnreadableFileException("Binary content is not delimited text: " + fileName);
            }
        }

        String text = decode(content, fileName);
        // BOM
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        char delimiter = DelimitedTextParser.sniffDelimiter(text);
        log.debug("Delimiter for {} is '{}'", fileName, delimiter == '\t' ? "\\t" : String.valueOf(delimiter));

        List<List<Object>> grid = new ArrayList<>();
        for (List<String> record : DelimitedTextParser.parse(text, delimiter)) {
            List<Object> values = new ArrayList<>(record.size());
            for (String field : record) {
                String trimmed = field.trim();
                values.add(trimmed.isEmpty() ? null : trimmed);
            }
            grid.add(values);
        }
        return grid;
    }

    /**
     * UTF-8 when the bytes are valid UTF-8, otherwise windows-1252 (spreadsheet exports on Windows).
     */
    private String decode(byte[] content, String fileName) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.info("{} is not valid UTF-8 ({}), decoding as {}", fileName, e.getMessage(), LEGACY_CHARSET);
            return new String(content, LEGACY_CHARSET);
        }
    }

    // --- header detection ---

    private List<RawRow> toRawRows(List<List<Object>> grid, String fileName) {
        int headerIndex = -1;
        for (int i = 0; i < grid.size(); i++) {
            if (isHeaderCandidate(grid.get(i))) {
                headerIndex = i;
                break;
            }
        }
        if (headerIndex < 0) {
            throw new EmptyFileException("No header row found in " + fileName);
        }

        List<String> labels = buildLabels(grid.get(headerIndex));
        List<RawRow> rows = new ArrayList<>();

        for (int i = headerIndex + 1; i < grid.size(); i++) {
            List<Object> values = grid.get(i);
            if (values.stream().allMatch(v -> RawRow.asText(v) == null)) {
                continue;
            }
            while (labels.size() < values.size()) {
                labels.add(uniqueLabel("column_" + (labels.size() + 1), labels));
            }
            Map<String, Object> cells = new LinkedHashMap<>();
            for (int col = 0; col < labels.size(); col++) {
                cells.put(labels.get(col), col < values.size() ? values.get(col) : null);
            }
            rows.add(new RawRow(i + 1, cells));
        }

        if (rows.isEmpty()) {
            throw new EmptyFileException("No data rows after header in " + fileName);
        }
        return rows;
    }

    private boolean isHeaderCandidate(List<Object> values) {
        int textCells = 0;
        for (Object v : values) {
            String text = RawRow.asText(v);
            if (text != null && !(v instanceof BigDecimal) && !NUMERIC.matcher(text).matches()) {
                textCells++;
            }
        }
        return textCells >= 2;
    }

    private List<String> buildLabels(List<Object> headerValues) {
        List<String> labels = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < headerValues.size(); i++) {
            String text = RawRow.asText(headerValues.get(i));
            String base = text == null ? "column_" + (i + 1) : text;
            int n = seen.merge(base, 1, Integer::sum);
            labels.add(n == 1 ? base : uniqueLabel(base + "_" + n, labels));
        }
        return labels;
    }

    private String uniqueLabel(String candidate, List<String> existing) {
        String label = candidate;
        int k = 2;
        while (existing.contains(label)) {
            label = candidate + "_" + k++;
        }
        return label;
    }
}
