package com.quicklook.server.frame;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identity of one on-disk capture unit, parsed from a frame id such as
 * {@code SUPA00001234.fits}: three-letter instrument code, one-letter frame
 * type, eight-digit frame number.
 */
public class Frame {

    public static final int UNKNOWN_DETECTOR = -1;

    private static final Pattern FRAME_ID = Pattern.compile("^([A-Z]{3})([A-Z])(\\d{8})$");

    private final String path;
    private final String inscode;
    private final char frameType;
    private final int number;
    private final int detectorId;

    public Frame(String path, String inscode, char frameType, int number, int detectorId) {
        this.path = path;
        this.inscode = inscode;
        this.frameType = frameType;
        this.number = number;
        this.detectorId = detectorId;
    }

    /**
     * Parses a frame from a file path. Returns empty if the file name is not a
     * frame id.
     */
    public static Optional<Frame> fromPath(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Path fileName = Paths.get(path).getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.indexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        Matcher m = FRAME_ID.matcher(name.toUpperCase());
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Frame(path, m.group(1), m.group(2).charAt(0), Integer.parseInt(m.group(3)),
                UNKNOWN_DETECTOR));
    }

    public static Optional<Frame> fromFrameId(String frameId) {
        return fromPath(frameId);
    }

    public Frame withDetectorId(int detectorId) {
        return new Frame(path, inscode, frameType, number, detectorId);
    }

    public Frame withNumber(int number) {
        return new Frame(path, inscode, frameType, number, detectorId);
    }

    public String getPath() {
        return path;
    }

    public String getInscode() {
        return inscode;
    }

    public char getFrameType() {
        return frameType;
    }

    public int getNumber() {
        return number;
    }

    public int getDetectorId() {
        return detectorId;
    }

    public String getFrameId() {
        return String.format("%s%c%08d", inscode, frameType, number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame other = (Frame) o;
        return number == other.number && frameType == other.frameType && detectorId == other.detectorId
                && Objects.equals(inscode, other.inscode) && Objects.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, inscode, frameType, number, detectorId);
    }

    @Override
    public String toString() {
        return getFrameId();
    }
}
