package com.example.pricing_import.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class FileLoaderTest {

    private final FileLoader loader = new FileLoader();

    @Test
    void load_csvWithTitleRows_detectsHeaderAndKeepsSourcePositions() {
        String csv = "ACME Ltd price list\n"
                + "Valid from 2024-01-01\n"
                + "Product,Price,Unit\n"
                + "Cat6 Cable,\"1,234.56\",box\n"
                + ",,\n"
                + "RJ45 Plug,0.25,each\n";

        List<RawRow> rows = loader.load("prices.csv", csv.getBytes(StandardCharsets.UTF_8));

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).position()).isEqualTo(4);
        assertThat(rows.get(0).cells()).containsOnlyKeys("Product", "Price", "Unit");
        assertThat(rows.get(0).text("Price")).isEqualTo("1,234.56");
        assertThat(rows.get(1).position()).isEqualTo(6);
        assertThat(rows.get(1).text("Product")).isEqualTo("RJ45 Plug");
    }

    @Test
    void load_windows1252Csv_keepsPoundSign() {
        String csv = "Product,Price\nCable gland,£12.50\n";

        List<RawRow> rows = loader.load("prices.csv", csv.getBytes(Charset.forName("windows-1252")));

        assertThat(rows.get(0).text("Price")).isEqualTo("£12.50");
    }

    @Test
    void load_semicolonDelimitedWithBom_sniffsDelimiter() {
        String csv = "\uFEFFArtikel;Preis;Einheit\nSchraube M6;1.234,50;Stk\n";

        List<RawRow> rows = loader.load("preise.csv", csv.getBytes(StandardCharsets.UTF_8));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).cells()).containsOnlyKeys("Artikel", "Preis", "Einheit");
        assertThat(rows.get(0).text("Preis")).isEqualTo("1.234,50");
    }

    @Test
    void load_quotedFieldWithEscapedQuotesAndNewline_isOneCell() {
        String csv = "name,price\n\"Cable 19\"\" rack,\nlong\",12.00\n";

        List<RawRow> rows = loader.load("q.csv", csv.getBytes(StandardCharsets.UTF_8));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).text("name")).isEqualTo("Cable 19\" rack,\nlong");
    }

    @Test
    void load_duplicateAndBlankHeaders_getDistinctLabels() {
        String csv = "name,price,,price\nWidget,1.00,x,2.00\n";

        List<RawRow> rows = loader.load("d.csv", csv.getBytes(StandardCharsets.UTF_8));

        assertThat(rows.get(0).cells()).containsOnlyKeys("name", "price", "column_3", "price_2");
        assertThat(rows.get(0).text("price_2")).isEqualTo("2.00");
    }

    @Test
    void load_xlsxWorkbook_readsNumericCellsAsDecimals() throws IOException {
        byte[] xlsx;
        try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet("Prices");
            Row title = sheet.createRow(0);
            title.createCell(0).setCellValue("Supplier price list");
            Row header = sheet.createRow(2);
            header.createCell(0).setCellValue("Description");
            header.createCell(1).setCellValue("Net Price");
            Row data = sheet.createRow(3);
            data.createCell(0).setCellValue("24 Port Patch Panel");
            data.createCell(1).setCellValue(45.5);
            wb.write(out);
            xlsx = out.toByteArray();
        }

        List<RawRow> rows = loader.load("prices.xlsx", xlsx);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).position()).isEqualTo(4);
        assertThat(rows.get(0).cells().get("Net Price")).isEqualTo(new BigDecimal("45.5"));
        assertThat(rows.get(0).isNumeric("Net Price")).isTrue();
        assertThat(rows.get(0).isNumeric("Description")).isFalse();
        assertThat(rows.get(0).text("Description")).isEqualTo("24 Port Patch Panel");
    }

    @Test
    void load_emptyContent_throwsEmptyFile() {
        assertThatThrownBy(() -> loader.load("empty.csv", new byte[0]))
                .isInstanceOf(EmptyFileException.class);
    }

    @Test
    void load_headerOnly_throwsEmptyFile() {
        byte[] csv = "name,price\n\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> loader.load("h.csv", csv))
                .isInstanceOf(EmptyFileException.class);
    }

    @Test
    void load_numbersOnly_hasNoHeader() {
        byte[] csv = "1,2\n3,4\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> loader.load("n.csv", csv))
                .isInstanceOf(EmptyFileException.class)
                .hasMessageContaining("No header");
    }

    @Test
    void load_binaryPosingAsCsv_isUnreadable() {
        byte[] junk = { 'n', 'a', 'm', 'e', 0, 1, 2, 3 };

        assertThatThrownBy(() -> loader.load("prices.csv", junk))
                .isInstanceOf(UnreadableFileException.class);
    }

    @Test
    void load_corruptWorkbook_isUnreadable() {
        byte[] notXlsx = "this is not a workbook".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> loader.load("prices.xlsx", notXlsx))
                .isInstanceOf(UnreadableFileException.class);
    }
}
