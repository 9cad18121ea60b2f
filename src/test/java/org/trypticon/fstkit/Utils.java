package org.trypticon.fstkit;

import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.store.ByteBuffersIndexOutput;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Helpers for getting FSTs in and out of bytes and files in tests.
 */
public class Utils {
    /**
     * Something which writes to an output.
     */
    public interface Writer {
        void write(IndexOutput out) throws IOException;
    }

    public static IndexInput input(byte[] bytes) {
        return FstIO.wrap(bytes, "test");
    }

    public static byte[] bytes(Writer writer) throws IOException {
        ByteBuffersDataOutput buffer = new ByteBuffersDataOutput();
        try (IndexOutput out = new ByteBuffersIndexOutput(buffer, "test", "test")) {
            writer.write(out);
        }
        return buffer.toArrayCopy();
    }

    /**
     * Writes bytes to a file in a directory.
     *
     * @param dir the directory.
     * @param name the file name.
     * @param bytes the content.
     * @return the file.
     * @throws IOException if the file could not be written.
     */
    public static Path writeFile(Path dir, String name, byte[] bytes) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, bytes);
        return file;
    }
}
