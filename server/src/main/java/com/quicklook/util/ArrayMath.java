package com.quicklook.util;

import java.util.Arrays;

public class ArrayMath {

    /**
     * Median of values[from, to). Even counts return the mean of the two middle
     * values. The input array is not modified.
     */
    public static double median(double[] values, int from, int to) {
        int n = to - from;
        if (n <= 0) {
            throw new IllegalArgumentException("Median of empty range");
        }
        double[] copy = Arrays.copyOfRange(values, from, to);
        Arrays.sort(copy);
        int mid = n / 2;
        if (n % 2 == 1) {
            return copy[mid];
        }
        return (copy[mid - 1] + copy[mid]) / 2.0;
    }

    public static double median(double[] values) {
        return median(values, 0, values.length);
    }

    public static boolean sameShape(double[][] a, double[][] b) {
        if (a.length != b.length) {
            return false;
        }
        for (int r = 0; r < a.length; r++) {
            if (a[r].length != b[r].length) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {min, max, mean} over all finite values, or NaNs if there are none.
     */
    public static double[] stats(double[][] data) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        long count = 0;
        for (double[] row : data) {
            for (double v : row) {
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    continue;
                }
                if (v < min)
                    min = v;
                if (v > max)
                    max = v;
                sum += v;
                count++;
            }
        }
        if (count == 0) {
            return new double[] { Double.NaN, Double.NaN, Double.NaN };
        }
        return new double[] { min, max, sum / count };
    }
}
