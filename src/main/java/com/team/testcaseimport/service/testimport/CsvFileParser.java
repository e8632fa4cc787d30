package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.exception.FileParsingException;
import com.team.testcaseimport.model.testcase.ParsedFile;
import com.team.testcaseimport.model.testcase.RawRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 匯入流程第 1 階段：解碼並驗證上傳的 CSV 檔案。
 *
 * 流程：base64 解碼 → 拒絕試算表二進位格式 → 拆出標題列與資料列 → 驗證標題。
 * 任何錯誤都以 {@link FileParsingException} 中止流程，此時尚未呼叫任何遠端 API。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvFileParser {

    public static final Pattern TITLE_LIKE_HEADER = Pattern.compile("title|name|summary|test case", Pattern.CASE_INSENSITIVE);

    private static final String EXCEL_NOT_SUPPORTED =
            "Excel file formats (.xlsx/.xls) are not supported. Please upload a CSV (.csv) file.";

    private final BulkImportConfig config;

    /**
     * 解析 base64 編碼的 CSV 檔案。
     *
     * @param fileContent base64 編碼的檔案內容
     * @param fileName    原始檔名
     * @return 標題列與資料列（列號從 2 開始，標題列為第 1 列）
     */
    public ParsedFile parse(String fileContent, String fileName) {
        if (isSpreadsheetName(fileName)) {
            throw new FileParsingException(EXCEL_NOT_SUPPORTED);
        }

        byte[] bytes = decode(fileContent);
        if (isSpreadsheetBinary(bytes)) {
            throw new FileParsingException(EXCEL_NOT_SUPPORTED);
        }

        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        List<CSVRecord> records = readRecords(text);
        ParsedFile parsed = toParsedFile(records, fileName);
        validate(parsed);

        log.info("CSV 檔案解析完成：{} - {} 個欄位，{} 筆資料",
                fileName, parsed.getHeaders().size(), parsed.getRows().size());
        return parsed;
    }

    /**
     * 確認至少有一個像標題的欄位（title / name / summary / test case），
     * 或呼叫端明確指定對應到 System.Title 的欄位。
     */
    public void requireTitleColumn(ParsedFile parsed, Collection<String> explicitTitleHeaders) {
        boolean hasTitleLike = parsed.getHeaders().stream()
                .anyMatch(h -> TITLE_LIKE_HEADER.matcher(h).find() || explicitTitleHeaders.contains(h));
        if (!hasTitleLike) {
            throw new FileParsingException(List.of(
                    "Required field 'Title' not found. Please ensure your file has one of these column headers: "
                            + "title, name, test case title, summary"),
                    parsed.getWarnings());
        }
    }

    private byte[] decode(String fileContent) {
        if (fileContent == null || fileContent.isBlank()) {
            throw new FileParsingException("File content is empty");
        }
        try {
            return Base64.getMimeDecoder().decode(fileContent.trim());
        } catch (IllegalArgumentException e) {
            throw new FileParsingException("Failed to parse file: content is not valid base64 (" + e.getMessage() + ")");
        }
    }

    private List<CSVRecord> readRecords(String text) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setTrim(true)
                .setIgnoreEmptyLines(false)
                .build();

        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            return parser.getRecords();
        } catch (IOException | UncheckedIOException e) {
            throw new FileParsingException("CSV parsing error: " + e.getMessage());
        }
    }

    private ParsedFile toParsedFile(List<CSVRecord> records, String fileName) {
        ParsedFile parsed = ParsedFile.builder().fileName(fileName).build();
        // 空行也保留成紀錄，列號才會對應到檔案中的實際行數
        int headerIndex = 0;
        while (headerIndex < records.size() && isBlank(records.get(headerIndex))) {
            headerIndex++;
        }
        if (headerIndex == records.size()) {
            throw new FileParsingException("No headers found in file");
        }

        List<String> headers = new ArrayList<>();
        for (String header : records.get(headerIndex)) {
            headers.add(header.trim());
        }
        parsed.setHeaders(headers);

        for (int i = headerIndex + 1; i < records.size(); i++) {
            CSVRecord record = records.get(i);
            int rowIndex = i + 1;

            if (record.size() > headers.size()) {
                parsed.getWarnings().add(String.format(
                        "Row %d has %d values but only %d headers; extra values were ignored",
                        rowIndex, record.size(), headers.size()));
            }

            Map<String, String> values = new LinkedHashMap<>();
            boolean hasData = false;
            for (int c = 0; c < headers.size(); c++) {
                String value = c < record.size() ? record.get(c).trim() : "";
                values.put(headers.get(c), value);
                hasData |= !value.isEmpty();
            }

            // 全部空白的列直接略過
            if (hasData) {
                parsed.getRows().add(new RawRow(rowIndex, values));
            }
        }
        return parsed;
    }

    private static boolean isBlank(CSVRecord record) {
        for (String value : record) {
            if (!value.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private void validate(ParsedFile parsed) {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        List<String> headers = parsed.getHeaders();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header.isEmpty()) {
                errors.add("Column " + (i + 1) + " has an empty header");
            } else if (!seen.add(header.toLowerCase(Locale.ROOT))) {
                errors.add("Duplicate column header '" + header + "'");
            }
        }

        if (errors.isEmpty() && parsed.getRows().isEmpty()) {
            errors.add("No data rows found in file");
        }

        if (parsed.getRows().size() > config.getMaxRows()) {
            errors.add(String.format("At most %d rows can be imported at once; file has %d",
                    config.getMaxRows(), parsed.getRows().size()));
        }

        if (!errors.isEmpty()) {
            log.warn("CSV 檔案驗證失敗：{} - {}", parsed.getFileName(), errors);
            throw new FileParsingException(errors, parsed.getWarnings());
        }
    }

    private boolean isSpreadsheetName(String fileName) {
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xlsx") || lower.endsWith(".xls");
    }

    /**
     * xlsx 是 zip（PK\3\4），xls 是 OLE2 複合文件（D0 CF 11 E0）。
     */
    private boolean isSpreadsheetBinary(byte[] bytes) {
        if (bytes.length < 4) {
            return false;
        }
        boolean zip = bytes[0] == 'P' && bytes[1] == 'K' && bytes[2] == 3 && bytes[3] == 4;
        boolean ole2 = (bytes[0] & 0xFF) == 0xD0 && (bytes[1] & 0xFF) == 0xCF
                && (bytes[2] & 0xFF) == 0x11 && (bytes[3] & 0xFF) == 0xE0;
        return zip || ole2;
    }
}
