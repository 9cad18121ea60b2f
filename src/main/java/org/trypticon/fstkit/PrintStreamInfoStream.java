package org.trypticon.fstkit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.Set;

/**
 * Info stream which prints messages to a {@link PrintStream} as
 * {@code component: line}, optionally only those of some components.
 */
public class PrintStreamInfoStream implements InfoStream {

    @Nonnull
    private final PrintStream stream;

    @Nullable
    private final Set<String> components;

    /**
     * Creates an info stream printing messages from every component.
     *
     * @param stream the stream to print to.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this(stream, null);
    }

    /**
     * Creates an info stream printing messages from some components.
     *
     * @param stream the stream to print to.
     * @param components the components to print, e.g. {@code "FstClass"}.
     *                   {@code null} prints every component.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream, @Nullable Set<String> components) {
        this.stream = stream;
        this.components = components == null ? null : Set.copyOf(components);
    }

    @Override
    public void message(String component, String line) {
        if (isEnabled(component)) {
            stream.println(component + ": " + line);
        }
    }

    @Override
    public boolean isEnabled(String component) {
        return components == null || components.contains(component);
    }
}
