package org.fusionqa.app.service;

import org.fusionqa.app.api.QualityAssessmentUseCases;
import org.fusionqa.app.api.dto.MetricOption;
import org.fusionqa.app.api.dto.MetricScore;
import org.fusionqa.app.api.dto.QualityReport;
import org.fusionqa.io.RasterSource;
import org.fusionqa.metrics.MetricOptions;
import org.fusionqa.metrics.MetricResult;
import org.fusionqa.model.Projection;
import org.fusionqa.model.RasterGrid;
import org.fusionqa.model.RasterImage;
import org.fusionqa.model.ShapeMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class QualityAssessmentServiceTest {

    private final QualityAssessmentUseCases service = new QualityAssessmentService();

    /* ============================================================
       Helpers
       ============================================================ */

    private static RasterGrid grid() {
        return new RasterGrid(2, 2, new Projection("EPSG:32633", 10.0, 0.0, 20.0));
    }

    private static RasterImage rgb(double offset) {
        return RasterImage.builder(grid())
                .band("red", 1 + offset, 2 + offset, 3 + offset, 4 + offset)
                .band("green", 10 + offset, 20 + offset, 30 + offset, 40 + offset)
                .band("blue", 5 + offset, 5 + offset, 6 + offset, 6 + offset)
                .build();
    }

    private static RasterSource inMemory(String id, RasterImage image) {
        return new RasterSource() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RasterImage load() {
                return image;
            }
        };
    }

    private static String json(double... red) {
        String values = Arrays.stream(red).mapToObj(Double::toString).collect(Collectors.joining(", "));
        return "{\"crs\": \"EPSG:32633\", \"scale\": 10, \"origin\": [0, 20], \"width\": 2, \"height\": 2,"
                + "\"bands\": [{\"name\": \"red\", \"values\": [" + values + "]}]}";
    }

    /* ============================================================
       Metric registry
       ============================================================ */

    @Nested
    @DisplayName("Metric registry")
    class Registry {

        @Test
        void listsMetricsInOrder() {
            List<String> ids = service.availableMetrics().stream().map(MetricOption::id).collect(Collectors.toList());
            assertEquals(List.of("mse", "psnr", "ergas", "q"), ids);
            assertEquals("Mean squared error", service.availableMetrics().get(0).toString());
        }

        @Test
        void assessByIdIgnoresCase() {
            MetricResult result = service.assess(" MSE ", rgb(0), rgb(1), null);
            assertEquals("mse", result.metric());
            assertEquals(1.0, result.value(), 1e-12);
        }

        @Test
        void unknownMetricIsRejected() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> service.assess("sam", rgb(0), rgb(0), MetricOptions.defaults()));
            assertTrue(e.getMessage().contains("sam"));
            assertThrows(IllegalArgumentException.class, () -> service.assess(null, rgb(0), rgb(0), null));
        }
    }

    /* ============================================================
       Reports
       ============================================================ */

    @Nested
    @DisplayName("Reports")
    class Reports {

        @Test
        void assessAllRunsEveryMetricPerBand() {
            QualityReport report = service.assessAll(inMemory("ref", rgb(0)), inMemory("fused", rgb(1)), null);

            assertEquals("ref", report.referenceId());
            assertEquals("fused", report.assessmentId());
            assertEquals(List.of("red", "green", "blue"), report.bandNames());
            assertEquals(4, report.scores().size());

            MetricScore mse = report.score("mse").orElseThrow();
            assertEquals(List.of(1.0, 1.0, 1.0), mse.perBand());
            assertEquals(1.0, mse.mean(), 1e-12);

            MetricScore q = report.score("q").orElseThrow();
            assertEquals(3, q.perBand().size());
            assertTrue(report.score("sam").isEmpty());
        }

        @Test
        void bandCountMismatchNamesBothSources() {
            RasterImage redOnly = rgb(0).select("red");
            ShapeMismatchException e = assertThrows(ShapeMismatchException.class,
                    () -> service.assessAll(inMemory("ref", rgb(0)), inMemory("pan", redOnly), null));
            assertTrue(e.getMessage().contains("ref vs pan"), e.getMessage());
        }

        @Test
        void assessFilesAndWriteReport(@TempDir Path dir) throws Exception {
            Path ref = dir.resolve("ref.json");
            Path fused = dir.resolve("fused.json");
            Files.writeString(ref, json(10, 10, 10, 10));
            Files.writeString(fused, json(12, 12, 12, 12));

            QualityReport report = service.assessFiles(ref, fused, MetricOptions.defaults());
            assertEquals("ref.json", report.referenceId());
            assertEquals(4.0, report.score("mse").orElseThrow().mean(), 1e-12);
            assertEquals(20.0, report.score("ergas").orElseThrow().mean(), 1e-12);

            Path out = dir.resolve("out").resolve("report.json");
            service.writeReport(report, out);
            String written = Files.readString(out);
            assertTrue(written.contains("\"ergas\""), written);
            assertTrue(written.contains("fused.json"), written);
        }
    }

    /* ============================================================
       Image preparation
       ============================================================ */

    @Nested
    @DisplayName("Image preparation")
    class Preparation {

        @Test
        void intensityUsesRgbBandNames() {
            RasterImage intensity = service.intensity(rgb(0), 1.0, 0.0, 2.0);
            assertEquals(List.of("intensity"), intensity.bandNames());
            assertArrayEquals(new double[]{11, 12, 15, 16}, intensity.bandValues(0), 1e-12);
        }

        @Test
        void missingWeightIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> service.intensity(rgb(0), 1.0, null, 1.0));
        }

        @Test
        void rescaleDelegates() {
            RasterImage pan = rgb(0).select("red");
            RasterImage green = rgb(0).select("green");
            RasterImage out = service.rescale(pan, green, false);
            assertArrayEquals(new double[]{10, 20, 30, 40}, out.bandValues(0), 1e-9);
        }
    }
}
