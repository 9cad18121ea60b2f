package org.trypticon.fstkit;

import org.apache.lucene.store.ByteBuffersDataInput;
import org.apache.lucene.store.ByteBuffersIndexInput;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.store.MMapDirectory;
import org.apache.lucene.store.NIOFSDirectory;

import javax.annotation.Nonnull;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * The primitives of the persisted FST formats which Lucene's little-endian
 * {@link DataInput} and {@link DataOutput} don't have: strings with an int32
 * byte length, floating point weights and padding to an alignment.
 */
public final class FstIO {
    private FstIO() {} // no instance

    private static final byte[] ZEROES = new byte[FstHeader.ALIGNMENT];

    /**
     * Opens a file. In {@link FileReadMode#MAP} mode the file is memory-mapped,
     * otherwise it is read through a channel.
     *
     * @param path the file.
     * @param mode the read mode.
     * @return the input. The caller owns it.
     * @throws IOException if the file does not exist or cannot be opened.
     */
    public static IndexInput openInput(@Nonnull Path path, @Nonnull FileReadMode mode) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        Path absolute = path.toAbsolutePath();
        try (Directory directory = mode == FileReadMode.MAP
                ? new MMapDirectory(absolute.getParent())
                : new NIOFSDirectory(absolute.getParent())) {
            return directory.openInput(absolute.getFileName().toString(), IOContext.READ);
        }
    }

    /**
     * Wraps bytes already in memory.
     *
     * @param bytes the bytes.
     * @param source the name of the source.
     * @return the input.
     */
    public static IndexInput wrap(@Nonnull byte[] bytes, @Nonnull String source) {
        return new ByteBuffersIndexInput(new ByteBuffersDataInput(List.of(ByteBuffer.wrap(bytes))), source);
    }

    /**
     * Reads a string written by {@link #writeString(DataOutput, String)}.
     *
     * @param in the input.
     * @return the string.
     * @throws IOException if an I/O error occurs or the length runs past the end of the input.
     */
    public static String readString(@Nonnull IndexInput in) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > in.length() - in.getFilePointer()) {
            throw new EOFException("Invalid string length " + length + " at position " + in.getFilePointer() +
                    ": " + in);
        }
        byte[] bytes = new byte[length];
        in.readBytes(bytes, 0, length);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Writes a string as an int32 length followed by its UTF-8 bytes.
     *
     * @param out the output.
     * @param s the string.
     * @throws IOException if an I/O error occurs.
     */
    public static void writeString(@Nonnull DataOutput out, @Nonnull String s) throws IOException {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.writeBytes(bytes, bytes.length);
    }

    public static float readFloat(@Nonnull DataInput in) throws IOException {
        return Float.intBitsToFloat(in.readInt());
    }

    public static void writeFloat(@Nonnull DataOutput out, float f) throws IOException {
        out.writeInt(Float.floatToIntBits(f));
    }

    public static double readDouble(@Nonnull DataInput in) throws IOException {
        return Double.longBitsToDouble(in.readLong());
    }

    public static void writeDouble(@Nonnull DataOutput out, double d) throws IOException {
        out.writeLong(Double.doubleToLongBits(d));
    }

    /**
     * Skips the padding written by {@link #align(IndexOutput, int)}.
     *
     * @param in the input.
     * @param alignment the alignment.
     * @throws IOException if the padding runs past the end of the input.
     */
    public static void align(@Nonnull IndexInput in, int alignment) throws IOException {
        long remainder = in.getFilePointer() % alignment;
        if (remainder != 0) {
            long target = in.getFilePointer() + alignment - remainder;
            if (target > in.length()) {
                throw new EOFException("Padding runs past the end of the input: " + in);
            }
            in.seek(target);
        }
    }

    /**
     * Pads with zero bytes until the position is a multiple of {@code alignment}.
     *
     * @param out the output.
     * @param alignment the alignment, at most {@link FstHeader#ALIGNMENT}.
     * @throws IOException if an I/O error occurs.
     */
    public static void align(@Nonnull IndexOutput out, int alignment) throws IOException {
        int remainder = (int) (out.getFilePointer() % alignment);
        if (remainder != 0) {
            out.writeBytes(ZEROES, alignment - remainder);
        }
    }
}
