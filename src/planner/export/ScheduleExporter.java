package planner.export;

import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes a schedule as CSV, Excel or PDF. All three share the same rows, ordered by start date.
 */
public class ScheduleExporter {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleExporter.class);

    public static final String[] HEADER = {"Id", "Title", "Kind", "Conference", "Start", "End", "Days", "Deadline", "Status"};

    public static final String ON_TIME = "On time";
    public static final String LATE = "Late";
    public static final String NO_DEADLINE = "No deadline";

    /**
     * Data rows, without the header.
     */
    public static List<String[]> toRows(ScheduleView schedule, Config config) {
        List<Map.Entry<String, Interval>> entries = new ArrayList<>(schedule.getIntervals().entrySet());
        entries.sort(Comparator.comparing((Map.Entry<String, Interval> e) -> e.getValue().getStartDate())
                .thenComparing(Map.Entry::getKey));

        List<String[]> rows = new ArrayList<>();
        for (Map.Entry<String, Interval> e : entries) {
            Interval iv = e.getValue();
            Optional<Submission> s = config.getSubmission(e.getKey());
            Optional<LocalDate> dl = s.flatMap(config::deadlineOf);
            String status = dl.isEmpty() ? NO_DEADLINE : (iv.getEndDate().isAfter(dl.get()) ? LATE : ON_TIME);
            rows.add(new String[]{
                    e.getKey(),
                    s.map(Submission::getTitle).orElse(""),
                    s.map(x -> x.getKind().getKey()).orElse(""),
                    s.flatMap(Submission::getConferenceId).orElse(""),
                    iv.getStartDate().toString(),
                    iv.getEndDate().toString(),
                    String.valueOf(iv.getDurationDays()),
                    dl.map(LocalDate::toString).orElse(""),
                    status
            });
        }
        return rows;
    }

    public static void exportCsv(List<String[]> rows, Path outputPath) throws IOException {
        try (Writer w = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            w.write(csvLine(HEADER));
            for (String[] row : rows) {
                w.write(csvLine(row));
            }
        }
        LOG.info("Wrote {} row(s) to {}", rows.size(), outputPath);
    }

    static String csvLine(String[] cells) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < cells.length; c++) {
            if (c > 0) sb.append(',');
            String v = cells[c] == null ? "" : cells[c];
            if (v.contains(",") || v.contains("\"") || v.contains("\n")) {
                v = "\"" + v.replace("\"", "\"\"") + "\"";
            }
            sb.append(v);
        }
        return sb.append('\n').toString();
    }

    public static void exportExcel(List<String[]> rows, Path outputPath) throws IOException {
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("Schedule");

            CellStyle bold = wb.createCellStyle();
            XSSFFont font = wb.createFont();
            font.setBold(true);
            bold.setFont(font);

            int r = 0;
            Row headerRow = sheet.createRow(r++);
            for (int c = 0; c < HEADER.length; c++) {
                Cell cell = headerRow.createCell(c);
                cell.setCellValue(HEADER[c]);
                cell.setCellStyle(bold);
            }

            for (String[] rowData : rows) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < rowData.length; c++) {
                    String v = rowData[c] == null ? "" : rowData[c];
                    if (c == 6 && !v.isEmpty()) {
                        row.createCell(c).setCellValue(Long.parseLong(v));
                    } else {
                        row.createCell(c).setCellValue(v);
                    }
                }
            }

            // needs AWT font metrics, missing on some headless hosts
            try {
                for (int c = 0; c < HEADER.length; c++) {
                    sheet.autoSizeColumn(c);
                }
            } catch (RuntimeException | LinkageError | InternalError e) {
                LOG.warn("Keeping default column widths in {}: {}", outputPath, e.toString());
            }

            try (OutputStream out = Files.newOutputStream(outputPath)) {
                wb.write(out);
            }
        }
        LOG.info("Wrote {} row(s) to {}", rows.size(), outputPath);
    }

    public static void exportPdf(List<String[]> rows, Path outputPath) throws IOException {
        if (outputPath == null) throw new IllegalArgumentException("outputPath is null");

        // Build in memory first so a failure never leaves a partial file
        ByteArrayOutputStream baos = new ByteArrayOutputStream(64 * 1024);
        Document doc = new Document(PageSize.A4.rotate());
        try {
            PdfWriter.getInstance(doc, baos);
            doc.open();

            Font titleFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
            Paragraph title = new Paragraph("Submission Schedule", titleFont);
            title.setAlignment(Element.ALIGN_CENTER);
            doc.add(title);
            doc.add(new Paragraph(" "));

            PdfPTable table = new PdfPTable(HEADER.length);
            table.setWidthPercentage(100);
            table.setHeaderRows(1);

            Font headerFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 9);
            Font cellFont = FontFactory.getFont(FontFactory.HELVETICA, 9);

            for (String h : HEADER) {
                PdfPCell hc = new PdfPCell(new Phrase(h, headerFont));
                hc.setHorizontalAlignment(Element.ALIGN_CENTER);
                hc.setPadding(4f);
                table.addCell(hc);
            }
            for (String[] row : rows) {
                for (int c = 0; c < HEADER.length; c++) {
                    String v = (c < row.length && row[c] != null) ? row[c] : "";
                    PdfPCell cc = new PdfPCell(new Phrase(v, cellFont));
                    cc.setPadding(3f);
                    table.addCell(cc);
                }
            }
            doc.add(table);
        } catch (DocumentException e) {
            throw new IOException("Could not render PDF " + outputPath, e);
        } finally {
            if (doc.isOpen()) doc.close();
        }

        Files.write(outputPath, baos.toByteArray());
        LOG.info("Wrote {} row(s) to {}", rows.size(), outputPath);
    }

    /**
     * Writes schedule.csv, schedule.xlsx and schedule.pdf into {@code dir}, prefixed with {@code prefix}.
     */
    public static List<Path> exportAll(ScheduleView schedule, Config config, Path dir, String prefix) throws IOException {
        Files.createDirectories(dir);
        List<String[]> rows = toRows(schedule, config);
        List<Path> written = new ArrayList<>();
        Path csv = dir.resolve(prefix + "schedule.csv");
        exportCsv(rows, csv);
        written.add(csv);
        Path xlsx = dir.resolve(prefix + "schedule.xlsx");
        exportExcel(rows, xlsx);
        written.add(xlsx);
        Path pdf = dir.resolve(prefix + "schedule.pdf");
        exportPdf(rows, pdf);
        written.add(pdf);
        return written;
    }
}
