package com.quicklook.server.mosaic;

/**
 * A required geometry or gain keyword is missing or not numeric.
 */
public class MalformedMetadataException extends Exception {

    private final String keyword;

    public MalformedMetadataException(String keyword, String message) {
        super(message);
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
