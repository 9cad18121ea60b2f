package org.trypticon.fstkit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Describes how to materialise an FST from an input. Carries intent only; the
 * codec doing the reading is responsible for honouring it.
 */
public final class FstReadOptions {

    @Nonnull
    private final String source;

    @Nonnull
    private final FileReadMode mode;

    @Nullable
    private final FstHeader header;

    @Nullable
    private final SymbolTable inputSymbols;

    @Nullable
    private final SymbolTable outputSymbols;

    private final boolean readInputSymbols;
    private final boolean readOutputSymbols;

    /**
     * Creates options which read both symbol tables from the input, if present there.
     *
     * @param source the name of the source, for error messages.
     * @param mode the read mode.
     */
    public FstReadOptions(@Nonnull String source, @Nonnull FileReadMode mode) {
        this(source, mode, null, null, null, true, true);
    }

    /**
     * Creates options with a header already read from the input and externally supplied symbol tables.
     *
     * @param source the name of the source, for error messages.
     * @param mode the read mode.
     * @param header the header, or {@code null} to read it from the input.
     * @param inputSymbols input symbols to attach, overriding any in the input.
     * @param outputSymbols output symbols to attach, overriding any in the input.
     */
    public FstReadOptions(@Nonnull String source, @Nonnull FileReadMode mode, @Nullable FstHeader header,
                          @Nullable SymbolTable inputSymbols, @Nullable SymbolTable outputSymbols) {
        this(source, mode, header, inputSymbols, outputSymbols, true, true);
    }

    private FstReadOptions(@Nonnull String source, @Nonnull FileReadMode mode, @Nullable FstHeader header,
                           @Nullable SymbolTable inputSymbols, @Nullable SymbolTable outputSymbols,
                           boolean readInputSymbols, boolean readOutputSymbols) {
        this.source = source;
        this.mode = mode;
        this.header = header;
        this.inputSymbols = inputSymbols;
        this.outputSymbols = outputSymbols;
        this.readInputSymbols = readInputSymbols;
        this.readOutputSymbols = readOutputSymbols;
    }

    @Nonnull
    public String getSource() {
        return source;
    }

    @Nonnull
    public FileReadMode getMode() {
        return mode;
    }

    /**
     * Gets the header already read from the input.
     *
     * @return the header. Returns {@code null} if the reader must read it itself.
     */
    @Nullable
    public FstHeader getHeader() {
        return header;
    }

    @Nullable
    public SymbolTable getInputSymbols() {
        return inputSymbols;
    }

    @Nullable
    public SymbolTable getOutputSymbols() {
        return outputSymbols;
    }

    /**
     * Tests whether an input symbol table present in the input should be attached to the FST.
     *
     * @return {@code true} to attach it.
     */
    public boolean isReadInputSymbols() {
        return readInputSymbols;
    }

    public boolean isReadOutputSymbols() {
        return readOutputSymbols;
    }

    public FstReadOptions withHeader(@Nullable FstHeader header) {
        return new FstReadOptions(source, mode, header, inputSymbols, outputSymbols,
                readInputSymbols, readOutputSymbols);
    }

    public FstReadOptions withMode(@Nonnull FileReadMode mode) {
        return new FstReadOptions(source, mode, header, inputSymbols, outputSymbols,
                readInputSymbols, readOutputSymbols);
    }

    /**
     * Returns options which skip (or keep) symbol tables found in the input.
     *
     * @param readInputSymbols whether to attach input symbols found in the input.
     * @param readOutputSymbols whether to attach output symbols found in the input.
     * @return the new options.
     */
    public FstReadOptions withReadSymbols(boolean readInputSymbols, boolean readOutputSymbols) {
        return new FstReadOptions(source, mode, header, inputSymbols, outputSymbols,
                readInputSymbols, readOutputSymbols);
    }

    @Override
    public String toString() {
        return "source: \"" + source + "\" mode: \"" + mode + "\" read_isymbols: \"" + readInputSymbols +
                "\" read_osymbols: \"" + readOutputSymbols + "\" header: \"" + (header != null ? "set" : "null") +
                "\" isymbols: \"" + (inputSymbols != null ? "set" : "null") +
                "\" osymbols: \"" + (outputSymbols != null ? "set" : "null") + "\"";
    }
}
