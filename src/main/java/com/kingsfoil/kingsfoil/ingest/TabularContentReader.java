package com.kingsfoil.kingsfoil.ingest;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Decodes uploaded bytes into raw text rows. Supports CSV, tab/pipe/comma delimited TXT and DAT,
 * XLSX and XLS workbooks (first sheet), and ZIP archives holding one of those.
 */
@Component
public class TabularContentReader {

    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");
    private static final char[] CANDIDATE_DELIMITERS = {'\t', '|', ','};

    private final IngestProperties ingestProperties;

    public TabularContentReader(IngestProperties ingestProperties) {
        this.ingestProperties = ingestProperties;
    }

    public TabularContent read(String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            throw new StructuralException(IngestConstants.MSG_FILE_EMPTY.formatted(fileName));
        }
        String extension = requireSupportedExtension(fileName);

        TabularContent result;
        if (IngestConstants.FILE_EXT_ZIP.equals(extension)) {
            result = readZip(fileName, content);
        } else if (IngestConstants.FILE_EXT_XLSX.equals(extension) || IngestConstants.FILE_EXT_XLS.equals(extension)) {
            result = readWorkbook(fileName, content);
        } else {
            result = readDelimited(fileName, extension, content);
        }

        if (result.rows().isEmpty()) {
            throw new StructuralException(IngestConstants.MSG_NO_ROWS.formatted(fileName));
        }
        return result;
    }

    /**
     * Lower-cased extension of a file name, or null when it has none.
     */
    static String extensionOf(String fileName) {
        if (fileName == null) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Strict UTF-8 first; CMS files that are not valid UTF-8 are windows-1252. A leading BOM is dropped.
     */
    static String decode(byte[] content) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException ex) {
            text = new String(content, WINDOWS_1252);
        }
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    /**
     * Picks the candidate delimiter occurring most often in the leading sample; comma on a tie with nothing.
     */
    static char sniffDelimiter(String text) {
        String sample = text.length() > IngestConstants.DELIMITER_SAMPLE_CHARS
                ? text.substring(0, IngestConstants.DELIMITER_SAMPLE_CHARS)
                : text;
        char best = ',';
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = 0;
            for (int i = 0; i < sample.length(); i++) {
                if (sample.charAt(i) == candidate) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private String requireSupportedExtension(String fileName) {
        String extension = extensionOf(fileName);
        if (extension == null) {
            throw new StructuralException(IngestConstants.MSG_NO_EXTENSION.formatted(fileName));
        }
        if (!ingestProperties.getAllowedExtensions().contains(extension)) {
            throw new StructuralException(IngestConstants.MSG_UNSUPPORTED_EXTENSION.formatted(
                    extension, String.join(", ", ingestProperties.getAllowedExtensions())));
        }
        return extension;
    }

    private TabularContent readDelimited(String fileName, String extension, byte[] content) {
        String text = decode(content);
        char delimiter = IngestConstants.FILE_EXT_CSV.equals(extension) ? ',' : sniffDelimiter(text);
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(false)
                .setTrim(false)
                .build();

        int[] lineStarts = lineStarts(text);
        List<TabularRow> rows = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(text))) {
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(value);
                }
                rows.add(new TabularRow(lineAt(lineStarts, record.getCharacterPosition()), cells));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new StructuralException(IngestConstants.MSG_CSV_PARSE_FAILED.formatted(fileName), ex);
        }
        return new TabularContent(fileName, rows);
    }

    /**
     * Offsets at which each physical line of {@code text} starts. CRLF, LF and a lone CR each end a line.
     */
    static int[] lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 == text.length() || text.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }

    /**
     * 1-based physical line holding the character at {@code position}.
     */
    static int lineAt(int[] lineStarts, long position) {
        int index = Arrays.binarySearch(lineStarts, (int) position);
        return index >= 0 ? index + 1 : -index - 1;
    }

    private TabularContent readWorkbook(String fileName, byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return new TabularContent(fileName, List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.US);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            List<TabularRow> rows = new ArrayList<>();
            for (int rowIndex = 0; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                org.apache.poi.ss.usermodel.Row sheetRow = sheet.getRow(rowIndex);
                List<String> cells = new ArrayList<>();
                if (sheetRow != null) {
                    for (int cellIndex = 0; cellIndex < sheetRow.getLastCellNum(); cellIndex++) {
                        cells.add(cellText(sheetRow.getCell(cellIndex), formatter, evaluator));
                    }
                }
                rows.add(new TabularRow(rowIndex + 1, cells));
            }
            return new TabularContent(fileName, rows);
        } catch (IOException | RuntimeException ex) {
            throw new StructuralException(IngestConstants.MSG_WORKBOOK_READ_FAILED.formatted(fileName), ex);
        }
    }

    private static String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate().toString();
        }
        return formatter.formatCellValue(cell, evaluator);
    }

    /**
     * Reads the first supported, non-archive entry of a ZIP payload.
     */
    private TabularContent readZip(String fileName, byte[] zipBytes) {
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(zipBytes))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                String entryName = entry.getName();
                String extension = extensionOf(entryName);
                if (!entry.isDirectory()
                        && !entryName.startsWith("__MACOSX/")
                        && extension != null
                        && !IngestConstants.FILE_EXT_ZIP.equals(extension)
                        && ingestProperties.getAllowedExtensions().contains(extension)) {
                    byte[] entryBytes = zis.readAllBytes();
                    if (entryBytes.length == 0) {
                        continue;
                    }
                    if (IngestConstants.FILE_EXT_XLSX.equals(extension) || IngestConstants.FILE_EXT_XLS.equals(extension)) {
                        return readWorkbook(entryName, entryBytes);
                    }
                    return readDelimited(entryName, extension, entryBytes);
                }
            }
        } catch (IOException ex) {
            throw new StructuralException(IngestConstants.MSG_ZIP_READ_FAILED.formatted(fileName), ex);
        }
        throw new StructuralException(IngestConstants.MSG_ZIP_NO_DATA_FILE.formatted(fileName));
    }
}
