package org.trypticon.fstkit;

import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.IndexInput;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Objects;

/**
 * The fixed-layout header in front of every persisted FST:
 * <pre>
 * magic:int32 | fst_type:string | arc_type:string | version:int32 | flags:int32
 *   | properties:uint64 | start:int64 | num_states:int64 | num_arcs:int64
 * </pre>
 * The magic number is checked before anything else is read, so a header can be
 * probed for without committing to the format.
 */
public final class FstHeader {

    /**
     * Magic number at the start of every persisted FST.
     */
    public static final int MAGIC_NUMBER = 2125659606;

    /**
     * Flag: an input symbol table follows the header.
     */
    public static final int HAS_ISYMBOLS = 0x1;

    /**
     * Flag: an output symbol table follows the header.
     */
    public static final int HAS_OSYMBOLS = 0x2;

    /**
     * Flag: the body's arrays are padded to {@link #ALIGNMENT}-byte boundaries.
     */
    public static final int IS_ALIGNED = 0x4;

    /**
     * Alignment used when {@link #IS_ALIGNED} is set.
     */
    public static final int ALIGNMENT = 16;

    private static final String COMPONENT = "FstHeader";

    @Nonnull
    private String fstType = "";

    @Nonnull
    private String arcType = "";

    private int version;
    private int flags;
    private long properties;
    private long start = Fst.NO_STATE_ID;
    private long numStates;
    private long numArcs;

    /**
     * Reads a header.
     *
     * @param in the input.
     * @param source the name of the source, for error messages.
     * @param rewind {@code true} to leave the input where it was when this method was
     *               called, whatever the outcome.
     * @param infoStream where to report failures.
     * @return the header. Returns {@code null} if the input does not start with a valid header.
     */
    @Nullable
    public static FstHeader read(@Nonnull IndexInput in, @Nonnull String source, boolean rewind,
                                 @Nonnull InfoStream infoStream) {
        long pos = in.getFilePointer();
        FstHeader header = new FstHeader();
        try {
            int magicNumber = in.readInt();
            if (magicNumber != MAGIC_NUMBER) {
                if (infoStream.isEnabled(COMPONENT)) {
                    infoStream.message(COMPONENT, "Bad FST header: " + source +
                            ". Magic number not matched. Got: " + magicNumber);
                }
                header = null;
            } else {
                header.fstType = FstIO.readString(in);
                header.arcType = FstIO.readString(in);
                header.version = in.readInt();
                header.flags = in.readInt();
                header.properties = in.readLong();
                header.start = in.readLong();
                header.numStates = in.readLong();
                header.numArcs = in.readLong();
            }
        } catch (IOException e) {
            infoStream.message(COMPONENT, "Read failed: " + source);
            header = null;
        }
        if (rewind && !seek(in, pos, source, infoStream)) {
            return null;
        }
        return header;
    }

    private static boolean seek(IndexInput in, long pos, String source, InfoStream infoStream) {
        try {
            in.seek(pos);
            return true;
        } catch (IOException e) {
            infoStream.message(COMPONENT, "Could not rewind: " + source + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Writes this header.
     *
     * @param out the output.
     * @throws IOException if an I/O error occurs.
     */
    public void write(@Nonnull DataOutput out) throws IOException {
        out.writeInt(MAGIC_NUMBER);
        FstIO.writeString(out, fstType);
        FstIO.writeString(out, arcType);
        out.writeInt(version);
        out.writeInt(flags);
        out.writeLong(properties);
        out.writeLong(start);
        out.writeLong(numStates);
        out.writeLong(numArcs);
    }

    /**
     * Writes this header, reporting failure instead of throwing.
     *
     * @param out the output.
     * @param source the name of the destination, for error messages.
     * @param infoStream where to report failures.
     * @return {@code true} if the header was written.
     */
    public boolean write(@Nonnull DataOutput out, @Nonnull String source, @Nonnull InfoStream infoStream) {
        try {
            write(out);
            return true;
        } catch (IOException e) {
            infoStream.message(COMPONENT, "Write failed: " + source + ": " + e.getMessage());
            return false;
        }
    }

    @Nonnull
    public String getFstType() {
        return fstType;
    }

    public void setFstType(@Nonnull String fstType) {
        this.fstType = fstType;
    }

    @Nonnull
    public String getArcType() {
        return arcType;
    }

    public void setArcType(@Nonnull String arcType) {
        this.arcType = arcType;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public long getProperties() {
        return properties;
    }

    public void setProperties(long properties) {
        this.properties = properties;
    }

    public long getStart() {
        return start;
    }

    public void setStart(long start) {
        this.start = start;
    }

    public long getNumStates() {
        return numStates;
    }

    public void setNumStates(long numStates) {
        this.numStates = numStates;
    }

    public long getNumArcs() {
        return numArcs;
    }

    public void setNumArcs(long numArcs) {
        this.numArcs = numArcs;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof FstHeader)) {
            return false;
        }
        FstHeader other = (FstHeader) obj;
        return fstType.equals(other.fstType) && arcType.equals(other.arcType) && version == other.version
                && flags == other.flags && properties == other.properties && start == other.start
                && numStates == other.numStates && numArcs == other.numArcs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fstType, arcType, version, flags, properties, start, numStates, numArcs);
    }

    /**
     * Renders every field for diagnostics. Not meant to be parsed.
     */
    @Override
    public String toString() {
        return "fsttype: \"" + fstType + "\" arctype: \"" + arcType + "\" version: \"" + version +
                "\" flags: \"" + flags + "\" properties: \"" + Long.toUnsignedString(properties) + "\" start: \"" + start +
                "\" numstates: \"" + numStates + "\" numarcs: \"" + numArcs + "\"";
    }
}
