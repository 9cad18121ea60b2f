package org.trypticon.fstkit;

import javax.annotation.Nonnull;

/**
 * Describes how an FST is written.
 */
public final class FstWriteOptions {

    @Nonnull
    private final String source;

    private final boolean writeHeader;
    private final boolean writeInputSymbols;
    private final boolean writeOutputSymbols;
    private final boolean align;

    /**
     * Creates options which write the header and any symbol tables.
     *
     * @param source the name of the destination, for error messages.
     * @param align whether to pad arrays to aligned offsets, where the format supports it.
     */
    public FstWriteOptions(@Nonnull String source, boolean align) {
        this(source, true, true, true, align);
    }

    public FstWriteOptions(@Nonnull String source, boolean writeHeader, boolean writeInputSymbols,
                           boolean writeOutputSymbols, boolean align) {
        this.source = source;
        this.writeHeader = writeHeader;
        this.writeInputSymbols = writeInputSymbols;
        this.writeOutputSymbols = writeOutputSymbols;
        this.align = align;
    }

    @Nonnull
    public String getSource() {
        return source;
    }

    public boolean isWriteHeader() {
        return writeHeader;
    }

    public boolean isWriteInputSymbols() {
        return writeInputSymbols;
    }

    public boolean isWriteOutputSymbols() {
        return writeOutputSymbols;
    }

    public boolean isAlign() {
        return align;
    }

    @Override
    public String toString() {
        return "source: \"" + source + "\" write_header: \"" + writeHeader + "\" write_isymbols: \"" +
                writeInputSymbols + "\" write_osymbols: \"" + writeOutputSymbols + "\" align: \"" + align + "\"";
    }
}
