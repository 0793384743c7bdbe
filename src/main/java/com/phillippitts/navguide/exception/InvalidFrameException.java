package com.phillippitts.navguide.exception;

/**
 * Thrown when a frame is structurally unusable: non-positive image dimensions
 * a missing detection list or a null entry in it. Out-of-range values inside a detection are clamped
 * by the normalizer and never raise this exception.
 */
public class InvalidFrameException extends NavGuideException {

    private final int imageWidth;
    private final int imageHeight;
    private final String reason;

    public InvalidFrameException(String reason) {
        super("Invalid frame: " + reason);
        this.imageWidth = 0;
        this.imageHeight = 0;
        this.reason = reason;
    }

    public InvalidFrameException(int imageWidth, int imageHeight, String reason) {
        super("Invalid frame (" + imageWidth + "x" + imageHeight + "): " + reason);
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.reason = reason;
    }

    public int getImageWidth() {
        return imageWidth;
    }

    public int getImageHeight() {
        return imageHeight;
    }

    public String getReason() {
        return reason;
    }
}
