package com.quicklook.server.frame;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.ArrayFuncs;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads frames with nom.tam.fits. Keywords of the primary header and of the
 * first 2-D image HDU are merged (image HDU wins); pixels are scaled with
 * BSCALE/BZERO into doubles.
 */
public class FitsFrameReader implements FrameReader {

    private static final Logger logger = LoggerFactory.getLogger(FitsFrameReader.class);

    @Override
    public RawFrame read(Path path) throws IOException {
        Frame frame = Frame.fromPath(path.toString())
                .orElse(new Frame(path.toString(), "", ' ', -1, Frame.UNKNOWN_DETECTOR));

        try (Fits fits = new Fits(path.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length == 0) {
                throw new IOException("No HDUs in " + path);
            }

            Map<String, Object> keywords = new LinkedHashMap<>();
            collectKeywords(hdus[0].getHeader(), keywords);

            for (BasicHDU<?> hdu : hdus) {
                Object kernel = hdu.getData() == null ? null : hdu.getData().getKernel();
                if (isTwoDimensional(kernel)) {
                    if (hdu != hdus[0]) {
                        collectKeywords(hdu.getHeader(), keywords);
                    }
                    Header header = hdu.getHeader();
                    double bzero = header.getDoubleValue("BZERO", 0.0);
                    double bscale = header.getDoubleValue("BSCALE", 1.0);
                    double[][] pixels = toDoubles(kernel, bscale, bzero);

                    FrameMetadata metadata = new FrameMetadata(keywords);
                    logger.debug("Read {} ({}x{}, DET-ID={})", path, pixels.length,
                            pixels.length == 0 ? 0 : pixels[0].length, metadata.getDetectorId());
                    return new RawFrame(frame.withDetectorId(metadata.getDetectorId()), metadata, pixels);
                }
            }
            throw new IOException("No 2-D image data in " + path);
        } catch (FitsException e) {
            throw new IOException("Failed to read FITS file " + path, e);
        }
    }

    private static void collectKeywords(Header header, Map<String, Object> keywords) {
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            String key = card.getKey();
            String value = card.getValue();
            if (key == null || key.isEmpty() || value == null) {
                continue;
            }
            keywords.put(key, value);
        }
    }

    private static boolean isTwoDimensional(Object kernel) {
        return kernel instanceof byte[][] || kernel instanceof short[][] || kernel instanceof int[][]
                || kernel instanceof long[][] || kernel instanceof float[][] || kernel instanceof double[][];
    }

    static double[][] toDoubles(Object kernel, double bscale, double bzero) {
        double[][] out;
        if (kernel instanceof byte[][]) {
            // BITPIX 8 is unsigned, ArrayFuncs would sign-extend
            byte[][] src = (byte[][]) kernel;
            out = new double[src.length][];
            for (int r = 0; r < src.length; r++) {
                out[r] = new double[src[r].length];
                for (int c = 0; c < src[r].length; c++) {
                    out[r][c] = src[r][c] & 0xff;
                }
            }
        } else if (isTwoDimensional(kernel)) {
            out = (double[][]) ArrayFuncs.convertArray(kernel, double.class);
        } else {
            throw new IllegalArgumentException("Unsupported pixel kernel: "
                    + (kernel == null ? "null" : kernel.getClass().getSimpleName()));
        }
        if (bscale != 1.0 || bzero != 0.0) {
            for (double[] row : out) {
                for (int c = 0; c < row.length; c++) {
                    row[c] = row[c] * bscale + bzero;
                }
            }
        }
        return out;
    }
}
