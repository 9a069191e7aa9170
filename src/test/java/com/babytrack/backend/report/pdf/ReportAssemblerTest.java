package com.babytrack.backend.report.pdf;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.IntakeRecord;
import com.babytrack.backend.report.aggregate.DailyBucket;
import com.babytrack.backend.report.aggregate.DateBucketAggregator;
import com.babytrack.backend.report.aggregate.DateWindow;
import com.babytrack.backend.report.chart.ChartComposer;
import com.babytrack.backend.report.chart.IntakeChartSpecs;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportAssemblerTest {

    private static final ZoneId JAKARTA = ZoneId.of("Asia/Jakarta");

    private final DateBucketAggregator aggregator = new DateBucketAggregator();
    private final ChartComposer composer = new ChartComposer();
    private final ReportAssembler assembler = new ReportAssembler();

    private static ReportHeader header(DateWindow window, String name) {
        return new ReportHeader(null, name, window, ZonedDateTime.of(2024, 1, 7, 20, 0, 0, 0, JAKARTA));
    }

    private static String text(byte[] pdf) throws Exception {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return new PDFTextStripper().getText(doc);
        }
    }

    @Test
    void seven_day_example_totals_and_average_over_window_length() throws Exception {
        DateWindow window = new DateWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));
        List<DailyBucket> buckets = aggregator.aggregate(List.of(
                new IntakeRecord(Instant.parse("2024-01-01T03:00:00Z"), IntakeCategory.MPASI, new BigDecimal("120"), null),
                new IntakeRecord(Instant.parse("2024-01-03T03:00:00Z"), IntakeCategory.MPASI, new BigDecimal("150"), null)
        ), window, JAKARTA);
        byte[] png = composer.compose(buckets, IntakeChartSpecs.intake("Alya", window, buckets));

        IntakeReport report = assembler.assemble(png, buckets, header(window, "Alya"));

        ReportSpec spec = report.spec();
        assertThat(spec.tableRows()).hasSize(7);
        assertThat(spec.tableRows().get(1).quantity(IntakeCategory.MPASI)).isEqualByComparingTo("0");
        assertThat(spec.totalRow().quantity(IntakeCategory.MPASI)).isEqualByComparingTo("270");
        assertThat(spec.averageRow().quantity(IntakeCategory.MPASI)).isEqualByComparingTo("38.57");
        assertThat(report.pageCount()).isEqualTo(1);

        String text = text(report.pdf());
        assertThat(text).contains("MPASI & Milk Intake Report");
        assertThat(text).contains("User: Alya");
        assertThat(text).contains("2024-01-01 to 2024-01-07");
        assertThat(text).contains("TOTAL").contains("AVERAGE");
        assertThat(text).contains("270.0").contains("38.6");
        assertThat(text).contains("2024-01-02"); // zero day still listed
        assertThat(text).contains("Notes");
    }

    @Test
    void long_window_paginates_and_keeps_every_row() throws Exception {
        DateWindow window = DateWindow.endingOn(LocalDate.of(2024, 3, 31), 90);
        List<DailyBucket> buckets = aggregator.aggregate(List.of(
                new IntakeRecord(Instant.parse("2024-03-30T03:00:00Z"), IntakeCategory.MILK, new BigDecimal("300"), new BigDecimal("201"))
        ), window, JAKARTA);
        byte[] png = composer.compose(buckets, IntakeChartSpecs.intake("Budi", window, buckets));

        IntakeReport report = assembler.assemble(png, buckets, header(window, "Budi"));

        assertThat(report.pageCount()).isGreaterThan(1);
        String text = text(report.pdf());
        for (LocalDate d : window.dates()) {
            assertThat(text).contains(d.toString());
        }
        // column header repeated on every page that carries rows (the last page may hold only notes)
        try (PDDocument doc = Loader.loadPDF(report.pdf())) {
            for (int page = 1; page < report.pageCount(); page++) {
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                assertThat(stripper.getText(doc)).as("page %d", page).contains("Total Cal");
            }
        }
    }

    @Test
    void one_assembler_renders_concurrent_reports_independently() throws Exception {
        DateWindow window = new DateWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));
        List<DailyBucket> buckets = aggregator.aggregate(List.of(
                new IntakeRecord(Instant.parse("2024-01-02T03:00:00Z"), IntakeCategory.MPASI, new BigDecimal("80"), null)
        ), window, JAKARTA);
        byte[] png = composer.compose(buckets, IntakeChartSpecs.intake("Alya", window, buckets));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<IntakeReport>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                String name = "Child " + (char) ('A' + i);
                Callable<IntakeReport> job = () -> assembler.assemble(png, buckets, header(window, name));
                futures.add(pool.submit(job));
            }
            for (int i = 0; i < futures.size(); i++) {
                String text = text(futures.get(i).get().pdf());
                assertThat(text).contains("User: Child " + (char) ('A' + i)).contains("Total Cal");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void non_latin_names_do_not_break_the_pdf() throws Exception {
        DateWindow window = DateWindow.endingOn(LocalDate.of(2024, 1, 7), 7);
        List<DailyBucket> buckets = aggregator.aggregate(List.of(), window, JAKARTA);
        byte[] png = composer.compose(buckets, IntakeChartSpecs.intake("小明", window, buckets));

        IntakeReport report = assembler.assemble(png, buckets, header(window, "小明 José"));

        assertThat(text(report.pdf())).contains("José");
    }

    @Test
    void garbage_chart_bytes_surface_as_rendering_failure() {
        DateWindow window = DateWindow.endingOn(LocalDate.of(2024, 1, 7), 7);
        List<DailyBucket> buckets = aggregator.aggregate(List.of(), window, JAKARTA);

        assertThatThrownBy(() -> assembler.assemble(new byte[]{1, 2, 3}, buckets, header(window, "x")))
                .isInstanceOf(ReportRenderingException.class);
    }

    @Test
    void sanitize_replaces_characters_outside_winansi() {
        assertThat(ReportAssembler.sanitize("Ana María 😀")).isEqualTo("Ana María ??");
        assertThat(ReportAssembler.sanitize(null)).isEmpty();
    }
}
