package org.trypticon.fstkit;

import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.store.ByteBuffersIndexOutput;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.store.OutputStreamDataOutput;
import org.apache.lucene.util.IOUtils;
import org.trypticon.fstkit.algorithm.Verify;
import org.trypticon.fstkit.constfst.ConstFst;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Handle on an FST whose implementation and arc type are only known at runtime,
 * such as one just read from a file. Failures are reported to the configuration's
 * info stream and returned as {@code null} or {@code false}.
 */
public class FstClass {

    private static final String COMPONENT = "FstClass";

    @Nonnull
    private final Fst<?> fst;

    @Nonnull
    private final FstConfig config;

    /**
     * Wraps an FST.
     *
     * @param fst the FST.
     * @param config the configuration used for its reads, writes and logging.
     */
    public FstClass(@Nonnull Fst<?> fst, @Nonnull FstConfig config) {
        this.fst = fst;
        this.config = config;
    }

    /**
     * Wraps an FST in the most capable handle for it.
     *
     * @param fst the FST.
     * @param config the configuration.
     * @return a {@link MutableFstClass} if the FST is mutable, otherwise a plain handle.
     */
    public static FstClass wrap(@Nonnull Fst<?> fst, @Nonnull FstConfig config) {
        if (fst instanceof MutableFst) {
            return new MutableFstClass((MutableFst<?>) fst, config);
        }
        return new FstClass(fst, config);
    }

    /**
     * Reads an FST from a file, copying or mapping it according to the configured read mode.
     * A mapped file stays mapped for as long as the FST read from it is reachable.
     *
     * @param path the file.
     * @param config the configuration.
     * @return the FST. Returns {@code null} if it could not be read.
     */
    @Nullable
    public static FstClass read(@Nonnull Path path, @Nonnull FstConfig config) {
        IndexInput in;
        try {
            in = FstIO.openInput(path, config.getReadMode());
        } catch (IOException e) {
            config.getInfoStream().message(COMPONENT, "Could not open file: " + path + ": " + e.getMessage());
            return null;
        }
        FstClass fst = null;
        try {
            fst = read(in, config.readOptions(path.toString()), config);
            return fst;
        } finally {
            // a mapped const FST holds slices of the input
            if (fst == null || !(fst.getFst() instanceof ConstFst && ((ConstFst<?>) fst.getFst()).isMapped())) {
                IOUtils.closeWhileHandlingException(in);
            }
        }
    }

    /**
     * Reads an FST from a stream. Streams cannot be mapped, so the data is always copied.
     *
     * @param stream the stream.
     * @param source the name of the source, for error messages.
     * @param config the configuration.
     * @return the FST. Returns {@code null} if it could not be read.
     */
    @Nullable
    public static FstClass read(@Nonnull InputStream stream, @Nonnull String source, @Nonnull FstConfig config) {
        byte[] bytes;
        try {
            bytes = stream.readAllBytes();
        } catch (IOException e) {
            config.getInfoStream().message(COMPONENT, "Read failed: " + source + ": " + e.getMessage());
            return null;
        }
        return read(FstIO.wrap(bytes, source), config.readOptions(source).withMode(FileReadMode.READ), config);
    }

    /**
     * Reads an FST, choosing the implementation and arc type from its header.
     *
     * @param in the input, positioned at the header. In {@link FileReadMode#MAP} mode it must
     *           stay open for as long as the FST is used.
     * @param options the read options.
     * @param config the configuration.
     * @return the FST. Returns {@code null} if it could not be read.
     */
    @Nullable
    public static FstClass read(@Nonnull IndexInput in, @Nonnull FstReadOptions options,
                                @Nonnull FstConfig config) {
        InfoStream infoStream = config.getInfoStream();
        String source = options.getSource();
        FstHeader header = FstHeader.read(in, source, true, infoStream);
        if (header == null) {
            return null;
        }

        FstRegistry registry = config.getRegistry();
        FstCodec codec = registry.getCodec(header.getFstType());
        if (codec == null) {
            infoStream.message(COMPONENT, "Unknown FST type \"" + header.getFstType() + "\" (arc type = \"" +
                    header.getArcType() + "\"): " + source);
            return null;
        }
        ArcType<?> arcType = registry.getArcType(header.getArcType());
        if (arcType == null) {
            infoStream.message(COMPONENT, "Unknown arc type \"" + header.getArcType() + "\": " + source);
            return null;
        }

        Fst<?> fst;
        try {
            fst = codec.read(in, options, arcType, config);
        } catch (IOException e) {
            infoStream.message(COMPONENT, "Read failed: " + e.getMessage());
            return null;
        }
        if (!Verify.verify(fst, infoStream)) {
            infoStream.message(COMPONENT, "Verify failed: " + source);
            return null;
        }
        return wrap(fst, config);
    }

    /**
     * Writes this FST to a file.
     *
     * @param path the file.
     * @return {@code true} if the FST was written.
     */
    public boolean write(@Nonnull Path path) {
        try (OutputStream stream = Files.newOutputStream(path)) {
            return write(stream, path.toString());
        } catch (IOException e) {
            config.getInfoStream().message(COMPONENT, "Could not open file: " + path + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Writes this FST to a stream. The stream is flushed but not closed.
     *
     * @param stream the stream.
     * @param source the name of the destination, for error messages.
     * @return {@code true} if the FST was written.
     */
    public boolean write(@Nonnull OutputStream stream, @Nonnull String source) {
        ByteBuffersDataOutput buffer = new ByteBuffersDataOutput();
        if (!write(new ByteBuffersIndexOutput(buffer, source, source), config.writeOptions(source))) {
            return false;
        }
        try {
            buffer.copyTo(new OutputStreamDataOutput(stream));
            stream.flush();
            return true;
        } catch (IOException e) {
            config.getInfoStream().message(COMPONENT, "Write failed: " + source + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Writes this FST in the format of its own type.
     *
     * @param out the output. Alignment is relative to its start.
     * @param options the write options.
     * @return {@code true} if the FST was written.
     */
    public boolean write(@Nonnull IndexOutput out, @Nonnull FstWriteOptions options) {
        FstCodec codec = config.getRegistry().getCodec(fstType());
        if (codec == null) {
            config.getInfoStream().message(COMPONENT, "Unknown FST type \"" + fstType() + "\": " +
                    options.getSource());
            return false;
        }
        try {
            codec.write(fst, out, options);
            return true;
        } catch (IOException e) {
            config.getInfoStream().message(COMPONENT, "Write failed: " + options.getSource() + ": " +
                    e.getMessage());
            return false;
        }
    }

    public String fstType() {
        return fst.fstType();
    }

    public String arcType() {
        return fst.arcType().getName();
    }

    public String weightType() {
        return fst.arcType().weightType();
    }

    public long properties(long mask, boolean test) {
        return fst.properties(mask, test);
    }

    public int start() {
        return fst.start();
    }

    public int numStates() {
        return fst.numStates();
    }

    public int numArcs(int state) {
        return fst.numArcs(state);
    }

    public Weight finalWeight(int state) {
        return fst.finalWeight(state);
    }

    public List<? extends Arc<?>> arcs(int state) {
        return fst.arcs(state);
    }

    @Nullable
    public SymbolTable inputSymbols() {
        return fst.inputSymbols();
    }

    @Nullable
    public SymbolTable outputSymbols() {
        return fst.outputSymbols();
    }

    @Nonnull
    public Fst<?> getFst() {
        return fst;
    }

    /**
     * Gets the FST with its weight type known.
     *
     * @param arcType the expected arc type.
     * @param <W> the weight type.
     * @return the FST. Returns {@code null} if the FST has a different arc type.
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public <W extends Weight> Fst<W> getFst(@Nonnull ArcType<W> arcType) {
        if (!isArcType(fst, arcType)) {
            return null;
        }
        return (Fst<W>) fst;
    }

    static boolean isArcType(Fst<?> fst, ArcType<?> arcType) {
        return fst.arcType().getName().equals(arcType.getName())
                && fst.arcType().weightClass() == arcType.weightClass();
    }

    @Nonnull
    public FstConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + fst + ")";
    }
}
