package org.trypticon.fstkit;

import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.IndexInput;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bidirectional mapping between label ids and their printable symbols. Only
 * the parts needed to persist tables alongside an FST live here.
 */
public final class SymbolTable {

    /**
     * Magic number at the start of every persisted symbol table.
     */
    public static final int MAGIC_NUMBER = 2125658996;

    public static final long NO_SYMBOL = -1;

    @Nonnull
    private final String name;

    private final Map<Long, String> symbols = new LinkedHashMap<>();
    private final Map<String, Long> keys = new HashMap<>();

    private long availableKey;

    public SymbolTable(@Nonnull String name) {
        this.name = name;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Adds a symbol with the next free key, or returns its existing key.
     *
     * @param symbol the symbol.
     * @return the key.
     */
    public long addSymbol(@Nonnull String symbol) {
        Long existing = keys.get(symbol);
        if (existing != null) {
            return existing;
        }
        return addSymbol(symbol, availableKey);
    }

    /**
     * Adds a symbol with an explicit key, or returns its existing key.
     *
     * @param symbol the symbol.
     * @param key the key.
     * @return the key actually associated with the symbol.
     */
    public long addSymbol(@Nonnull String symbol, long key) {
        Long existing = keys.get(symbol);
        if (existing != null) {
            return existing;
        }
        symbols.put(key, symbol);
        keys.put(symbol, key);
        if (key >= availableKey) {
            availableKey = key + 1;
        }
        return key;
    }

    /**
     * Finds the symbol for a key.
     *
     * @param key the key.
     * @return the symbol. Returns {@code null} if the key is not present.
     */
    @Nullable
    public String findSymbol(long key) {
        return symbols.get(key);
    }

    /**
     * Finds the key for a symbol.
     *
     * @param symbol the symbol.
     * @return the key, or {@link #NO_SYMBOL}.
     */
    public long findKey(@Nonnull String symbol) {
        Long key = keys.get(symbol);
        return key == null ? NO_SYMBOL : key;
    }

    public int numSymbols() {
        return symbols.size();
    }

    /**
     * Returns an independent copy of this table.
     *
     * @return the copy.
     */
    public SymbolTable copy() {
        SymbolTable copy = new SymbolTable(name);
        copy.symbols.putAll(symbols);
        copy.keys.putAll(keys);
        copy.availableKey = availableKey;
        return copy;
    }

    /**
     * Reads a table written by {@link #write(DataOutput)}.
     *
     * @param in the input.
     * @param source the name of the source, for error messages.
     * @return the table.
     * @throws IOException if an I/O error occurs or the data is not a symbol table.
     */
    public static SymbolTable read(@Nonnull IndexInput in, @Nonnull String source) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC_NUMBER) {
            throw new CorruptFstException("Bad symbol table magic number " + magic, source);
        }
        SymbolTable table = new SymbolTable(FstIO.readString(in));
        long availableKey = in.readLong();
        long size = in.readLong();
        if (size < 0) {
            throw new CorruptFstException("Negative symbol table size " + size, source);
        }
        for (long i = 0; i < size; i++) {
            String symbol = FstIO.readString(in);
            long key = in.readLong();
            table.addSymbol(symbol, key);
        }
        table.availableKey = Math.max(table.availableKey, availableKey);
        return table;
    }

    /**
     * Writes this table.
     *
     * @param out the output.
     * @throws IOException if an I/O error occurs.
     */
    public void write(@Nonnull DataOutput out) throws IOException {
        out.writeInt(MAGIC_NUMBER);
        FstIO.writeString(out, name);
        out.writeLong(availableKey);
        out.writeLong(symbols.size());
        for (Map.Entry<Long, String> entry : symbols.entrySet()) {
            FstIO.writeString(out, entry.getValue());
            out.writeLong(entry.getKey());
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof SymbolTable)) {
            return false;
        }
        SymbolTable other = (SymbolTable) obj;
        return name.equals(other.name) && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, symbols);
    }

    @Override
    public String toString() {
        return "SymbolTable(" + name + ", " + symbols.size() + " symbols)";
    }
}
