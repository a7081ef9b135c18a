package com.project.coronal.tracking;

import com.project.coronal.tracking.model.BoundaryPoint;
import com.project.coronal.tracking.model.Contour;
import com.project.coronal.tracking.model.Frame;
import com.project.coronal.tracking.model.Raster;
import com.project.coronal.tracking.service.BoundaryExtractor;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BoundaryExtractorTest {
    private static final Instant OBSERVED = Instant.parse("2011-04-01T06:00:00Z");

    private final BoundaryExtractor extractor = new BoundaryExtractor(
            BoundaryExtractor.DEFAULT_BINARY_THRESHOLD, BoundaryExtractor.DEFAULT_AREA_THRESHOLD);

    @Test
    void extract_twoDarkSquares_ignoresSmallNoise() {
        Raster sun = bright(100, 100);
        paint(sun, 10, 10, 20, 20, 10);
        paint(sun, 60, 60, 30, 30, 10);
        paint(sun, 45, 80, 3, 3, 10);

        Frame frame = extractor.extract(sun, 7, OBSERVED);

        List<Contour> contours = frame.getContours().stream()
                .sorted(Comparator.comparingDouble(Contour::getCentroidX))
                .toList();
        assertThat(contours).hasSize(2);
        assertThat(contours.get(0).getCentroidX()).isCloseTo(19.5, within(0.01));
        assertThat(contours.get(0).getCentroidY()).isCloseTo(19.5, within(0.01));
        assertThat(contours.get(1).getCentroidX()).isCloseTo(74.5, within(0.01));
        assertThat(contours.get(1).getCentroidY()).isCloseTo(74.5, within(0.01));
        assertThat(contours).allMatch(c -> !c.hasIdentity());
    }

    @Test
    void extract_keepsSequenceNumberTimestampAndSize() {
        Raster sun = bright(40, 60);
        paint(sun, 5, 5, 20, 20, 0);

        Frame frame = extractor.extract(sun, 12, OBSERVED);

        assertThat(frame.getSequenceNumber()).isEqualTo(12);
        assertThat(frame.getTimestamp()).isEqualTo(OBSERVED);
        assertThat(frame.getRows()).isEqualTo(40);
        assertThat(frame.getCols()).isEqualTo(60);
        assertThat(frame.size()).isEqualTo(1);
    }

    @Test
    void extract_thresholdValueItselfCountsAsDark() {
        Raster atThreshold = bright(50, 50);
        paint(atThreshold, 10, 10, 20, 20, 55);
        Raster aboveThreshold = bright(50, 50);
        paint(aboveThreshold, 10, 10, 20, 20, 56);

        assertThat(extractor.extract(atThreshold, 0, OBSERVED).size()).isEqualTo(1);
        assertThat(extractor.extract(aboveThreshold, 0, OBSERVED).size()).isZero();
    }

    @Test
    void extract_ringReportsOnlyOuterBoundary() {
        Raster sun = bright(100, 100);
        paint(sun, 20, 20, 60, 60, 10);
        paint(sun, 40, 40, 20, 20, 200);

        Frame frame = extractor.extract(sun, 0, OBSERVED);

        assertThat(frame.size()).isEqualTo(1);
        assertThat(frame.getContours().get(0).getPolygonArea()).isCloseTo(59.0 * 59.0, within(1e-9));
    }

    @Test
    void extract_areaThresholdIsExclusive() {
        // a 9x9 square has a boundary polygon of area exactly 64
        Raster sun = bright(40, 40);
        paint(sun, 10, 10, 9, 9, 0);

        assertThat(new BoundaryExtractor(55, 64).extract(sun, 0, OBSERVED).size()).isZero();
        assertThat(new BoundaryExtractor(55, 63.5).extract(sun, 0, OBSERVED).size()).isEqualTo(1);
    }

    @Test
    void extractPeriodic_joinsRegionCrossingTheLongitudeSeam() {
        // 61 columns: the last one samples the same longitude as the first
        Raster sun = bright(40, 61);
        paint(sun, 0, 10, 8, 16, 10);
        paint(sun, 53, 10, 8, 16, 10);
        paint(sun, 20, 30, 12, 7, 10);

        Frame plain = extractor.extract(sun, 0, OBSERVED);
        Frame periodic = extractor.extractPeriodic(sun, 0, OBSERVED);

        assertThat(plain.size()).isEqualTo(3);
        assertThat(periodic.size()).isEqualTo(2);
        assertThat(periodic.getCols()).isEqualTo(61);
        Contour seam = periodic.getContours().stream()
                .filter(c -> c.getCentroidX() > 40)
                .findFirst().orElseThrow();
        assertThat(seam.getBoundary()).extracting(BoundaryPoint::x).contains(53, 67);
        assertThat(seam.getCentroidX()).isCloseTo(60.0, within(0.01));
    }

    @Test
    void extractPeriodic_keepsBandAroundTheWholeCircleOnce() {
        Raster sun = bright(40, 61);
        paint(sun, 0, 30, 61, 6, 10);

        Frame periodic = extractor.extractPeriodic(sun, 0, OBSERVED);

        assertThat(periodic.size()).isEqualTo(1);
    }

    @Test
    void extract_emptyRaster_givesEmptyFrame() {
        Frame frame = extractor.extract(new Raster(0, 0), 3, OBSERVED);

        assertThat(frame.isEmpty()).isTrue();
        assertThat(frame.getSequenceNumber()).isEqualTo(3);
    }

    @Test
    void extract_thresholdOutOfRange_givesEmptyFrame() {
        Raster sun = bright(50, 50);
        paint(sun, 10, 10, 20, 20, 0);

        assertThat(new BoundaryExtractor(300, 50).extract(sun, 0, OBSERVED).isEmpty()).isTrue();
        assertThat(new BoundaryExtractor(-1, 50).extract(sun, 0, OBSERVED).isEmpty()).isTrue();
    }

    @Test
    void extract_uniformBrightImage_findsNothing() {
        assertThat(extractor.extract(bright(64, 64), 0, OBSERVED).isEmpty()).isTrue();
    }

    private static Raster bright(int rows, int cols) {
        int[] data = new int[rows * cols];
        Arrays.fill(data, 200);
        return new Raster(rows, cols, data);
    }

    private static void paint(Raster raster, int x, int y, int width, int height, int value) {
        for (int r = y; r < y + height; r++) {
            for (int c = x; c < x + width; c++) {
                raster.set(r, c, value);
            }
        }
    }
}
