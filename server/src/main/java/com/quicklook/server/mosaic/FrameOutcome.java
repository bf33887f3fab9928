package com.quicklook.server.mosaic;

import com.quicklook.server.frame.Frame;

/**
 * Result of processing one frame: either a corrected frame or the error that
 * dropped it. Errors stay inside the outcome so one bad frame never aborts a
 * batch.
 */
public class FrameOutcome {
    private final Frame frame;
    private final CorrectedFrame corrected;
    private final Exception error;

    private FrameOutcome(Frame frame, CorrectedFrame corrected, Exception error) {
        this.frame = frame;
        this.corrected = corrected;
        this.error = error;
    }

    public static FrameOutcome success(CorrectedFrame corrected) {
        return new FrameOutcome(corrected.getFrame(), corrected, null);
    }

    public static FrameOutcome failure(Frame frame, Exception error) {
        return new FrameOutcome(frame, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Frame getFrame() {
        return frame;
    }

    public CorrectedFrame getCorrected() {
        return corrected;
    }

    public Exception getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "FrameOutcome{" + frame + ": ok}"
                : "FrameOutcome{" + frame + ": " + error.getClass().getSimpleName() + " " + error.getMessage() + "}";
    }
}
