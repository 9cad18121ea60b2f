package org.trypticon.fstkit;

/**
 * Receives fstkit's diagnostics. Reads, writes and conversions never throw for bad
 * input: they return {@code null} or {@code false} after describing the problem
 * here, tagged with the component which noticed it ({@code FstHeader},
 * {@code FstClass}, {@code Verify}, {@code TopSort} and so on).
 */
public interface InfoStream {

    /**
     * An info stream which drops everything and reports every component as disabled.
     */
    InfoStream NO_OUTPUT = new InfoStream() {
        @Override
        public void message(String component, String line) {
        }

        @Override
        public boolean isEnabled(String component) {
            return false;
        }
    };

    /**
     * Logs a line for a component.
     *
     * @param component the component name.
     * @param line the line, without the component name.
     */
    void message(String component, String line);

    /**
     * Tests whether lines for a component are wanted. Components check this before
     * building a message which is costly to format.
     *
     * @param component the component name.
     * @return {@code true} if lines for that component will be kept.
     */
    boolean isEnabled(String component);
}
