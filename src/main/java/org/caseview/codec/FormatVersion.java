package org.caseview.codec;

import org.caseview.api.UnsupportedFormatVersionException;

/**
 * The storage format versions this reader understands.
 * <p>
 * Each constant carries everything that differs between versions: how values
 * are encoded and which tables or columns the version guarantees. Components
 * outside {@code codec} and {@code metadata} query these properties instead of
 * comparing version numbers.
 */
public enum FormatVersion {

    V1(1, ValueEncoding.LEGACY_BINARY, false, false),
    V2(2, ValueEncoding.LEGACY_BINARY, true, false),
    V3(3, ValueEncoding.STRUCTURED_TEXT, true, false),
    V4(4, ValueEncoding.STRUCTURED_TEXT, true, true);

    /**
     * How variable values and metadata maps are serialized.
     */
    public enum ValueEncoding {
        /** numpy {@code .npy} record arrays for values, Python pickles for metadata. */
        LEGACY_BINARY,
        /** JSON text for values and metadata. */
        STRUCTURED_TEXT
    }

    public static final FormatVersion CURRENT = V4;

    private final int tag;
    private final ValueEncoding encoding;
    private final boolean optionalTablesGuaranteed;
    private final boolean variableSettings;

    FormatVersion(int tag, ValueEncoding encoding, boolean optionalTablesGuaranteed, boolean variableSettings) {
        this.tag = tag;
        this.encoding = encoding;
        this.optionalTablesGuaranteed = optionalTablesGuaranteed;
        this.variableSettings = variableSettings;
    }

    /**
     * Resolves the integer tag stored in the metadata row.
     *
     * @param tag the stored {@code format_version}.
     * @return the matching version.
     * @throws UnsupportedFormatVersionException if the tag is not supported.
     */
    public static FormatVersion of(int tag) throws UnsupportedFormatVersionException {
        for (FormatVersion version : values()) {
            if (version.tag == tag) {
                return version;
            }
        }
        throw new UnsupportedFormatVersionException(tag);
    }

    public int tag() {
        return tag;
    }

    public ValueEncoding encoding() {
        return encoding;
    }

    /**
     * Whether {@code driver_derivatives} and {@code problem_cases} must exist.
     * Early version-1 stores were written before those tables were introduced.
     */
    public boolean guaranteesOptionalTables() {
        return optionalTablesGuaranteed;
    }

    /**
     * Whether the metadata row carries a {@code var_settings} column.
     */
    public boolean hasVariableSettings() {
        return variableSettings;
    }
}
