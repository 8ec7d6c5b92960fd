package org.caseview.api;

/**
 * Thrown at open time when the store's {@code format_version} is not one this
 * reader knows how to decode.
 */
public class UnsupportedFormatVersionException extends CaseStoreException {

    private final int formatVersion;

    /**
     * Creates a new UnsupportedFormatVersionException.
     *
     * @param formatVersion the version tag read from the metadata row.
     */
    public UnsupportedFormatVersionException(int formatVersion) {
        super("Case store has an unhandled format version: " + formatVersion);
        this.formatVersion = formatVersion;
    }

    public int getFormatVersion() {
        return formatVersion;
    }
}
