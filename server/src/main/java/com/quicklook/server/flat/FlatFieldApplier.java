package com.quicklook.server.flat;

import com.quicklook.server.OperatorNotifier;
import com.quicklook.server.frame.Frame;
import com.quicklook.util.ArrayMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Divides a corrected frame by the flat of its detector. Flat fielding is best
 * effort: any problem is logged and reported, and the frame continues
 * unflattened.
 */
public class FlatFieldApplier {

    private static final Logger logger = LoggerFactory.getLogger(FlatFieldApplier.class);

    private final OperatorNotifier notifier;

    public FlatFieldApplier(OperatorNotifier notifier) {
        this.notifier = notifier;
    }

    public FlatApplication apply(double[][] corrected, int detectorId, FlatFieldSet flats, boolean enabled) {
        if (!enabled || flats == null || flats.isEmpty()) {
            return new FlatApplication(corrected, false);
        }
        if (!flats.isComplete()) {
            report("Flat field set is incomplete (" + flats.getLoadedCount() + "/" + flats.getExpectedCount()
                    + "), not applied");
            return new FlatApplication(corrected, false);
        }
        if (detectorId == Frame.UNKNOWN_DETECTOR || !flats.contains(detectorId)) {
            report("Error applying flat field: no flat for detector " + detectorId);
            return new FlatApplication(corrected, false);
        }
        double[][] flat = flats.get(detectorId);
        if (!ArrayMath.sameShape(corrected, flat)) {
            report(String.format("Error applying flat field: detector %d flat is %dx%d, frame is %dx%d",
                    detectorId, width(flat), flat.length, width(corrected), corrected.length));
            return new FlatApplication(corrected, false);
        }

        double[][] out = new double[corrected.length][];
        for (int r = 0; r < corrected.length; r++) {
            double[] src = corrected[r];
            double[] f = flat[r];
            double[] dst = new double[src.length];
            for (int c = 0; c < src.length; c++) {
                // zero divisors count as 1.0
                dst[c] = f[c] == 0.0 ? src[c] : src[c] / f[c];
            }
            out[r] = dst;
        }
        return new FlatApplication(out, true);
    }

    private void report(String message) {
        logger.warn(message);
        notifier.warn(message);
    }

    private static int width(double[][] a) {
        return a.length == 0 ? 0 : a[0].length;
    }
}
