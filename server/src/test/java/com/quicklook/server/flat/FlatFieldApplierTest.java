package com.quicklook.server.flat;

import com.quicklook.server.RecordingNotifier;
import com.quicklook.server.frame.Frame;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FlatFieldApplierTest {

    private final RecordingNotifier notifier = new RecordingNotifier();
    private final FlatFieldApplier applier = new FlatFieldApplier(notifier);

    private static double[][] filled(int h, int w, double v) {
        double[][] a = new double[h][w];
        for (double[] row : a) {
            Arrays.fill(row, v);
        }
        return a;
    }

    private static FlatFieldSet setOf(int detectorId, double[][] flat) {
        Map<Integer, double[][]> m = new HashMap<>();
        m.put(detectorId, flat);
        return new FlatFieldSet(m, 1, 1, "/flats");
    }

    @Test
    public void testAllOnesFlatIsIdentity() {
        double[][] data = { { 1.5, -2.0, 3.25 }, { 0.0, 1e6, 7.0 } };
        FlatApplication result = applier.apply(data, 4, setOf(4, filled(2, 3, 1.0)), true);

        assertTrue(result.isApplied());
        for (int r = 0; r < data.length; r++) {
            assertArrayEquals(data[r], result.getData()[r], 1e-12);
        }
        assertTrue(notifier.warnings.isEmpty());
    }

    @Test
    public void testDivision() {
        double[][] data = filled(2, 2, 10.0);
        double[][] flat = { { 2.0, 4.0 }, { 0.5, 0.0 } };
        double[][] out = applier.apply(data, 4, setOf(4, flat), true).getData();

        assertEquals(5.0, out[0][0]);
        assertEquals(2.5, out[0][1]);
        assertEquals(20.0, out[1][0]);
        // zero flat pixel leaves the value alone
        assertEquals(10.0, out[1][1]);
        // input untouched
        assertEquals(10.0, data[0][0]);
    }

    @Test
    public void testDisabledOrEmptyIsSilentPassThrough() {
        double[][] data = filled(2, 2, 3.0);
        assertSame(data, applier.apply(data, 4, setOf(4, filled(2, 2, 2.0)), false).getData());
        assertSame(data, applier.apply(data, 4, FlatFieldSet.empty(), true).getData());
        assertSame(data, applier.apply(data, 4, null, true).getData());
        assertTrue(notifier.warnings.isEmpty());
    }

    @Test
    public void testMissingDetectorIsReported() {
        double[][] data = filled(2, 2, 3.0);
        FlatApplication result = applier.apply(data, 7, setOf(4, filled(2, 2, 2.0)), true);
        assertFalse(result.isApplied());
        assertSame(data, result.getData());
        assertEquals(1, notifier.warnings.size());

        applier.apply(data, Frame.UNKNOWN_DETECTOR, setOf(4, filled(2, 2, 2.0)), true);
        assertEquals(2, notifier.warnings.size());
    }

    @Test
    public void testShapeMismatchIsReported() {
        double[][] data = filled(2, 2, 3.0);
        FlatApplication result = applier.apply(data, 4, setOf(4, filled(3, 2, 2.0)), true);
        assertFalse(result.isApplied());
        assertSame(data, result.getData());
        assertTrue(notifier.warnings.get(0).contains("detector 4"));
    }

    @Test
    public void testIncompleteSetIsNotApplied() {
        Map<Integer, double[][]> m = new HashMap<>();
        m.put(4, filled(2, 2, 2.0));
        FlatFieldSet partial = new FlatFieldSet(m, 10, 1, "/flats");
        double[][] data = filled(2, 2, 3.0);
        assertFalse(applier.apply(data, 4, partial, true).isApplied());
        assertEquals(1, notifier.warnings.size());
    }
}
