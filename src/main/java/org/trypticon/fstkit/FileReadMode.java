package org.trypticon.fstkit;

import javax.annotation.Nonnull;

/**
 * How a file is materialised when an FST is read from it.
 */
public enum FileReadMode {

    /**
     * Copy the data into memory.
     */
    READ("read"),

    /**
     * Map the file into memory, for implementations which support it.
     */
    MAP("map");

    private final String value;

    FileReadMode(String value) {
        this.value = value;
    }

    /**
     * Gets the configuration string for this mode.
     *
     * @return {@code "read"} or {@code "map"}.
     */
    public String getValue() {
        return value;
    }

    /**
     * Resolves a configuration string. Unknown values are reported and fall back to {@link #READ}.
     *
     * @param value the configuration string.
     * @param infoStream where to report an unknown value.
     * @return the mode.
     */
    public static FileReadMode parse(@Nonnull String value, @Nonnull InfoStream infoStream) {
        for (FileReadMode mode : values()) {
            if (mode.value.equals(value)) {
                return mode;
            }
        }
        infoStream.message("FileReadMode", "Unknown file read mode " + value);
        return READ;
    }
}
