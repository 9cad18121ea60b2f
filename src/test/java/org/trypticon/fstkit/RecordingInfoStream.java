package org.trypticon.fstkit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Info stream which keeps every message, formatted as {@code component: line}.
 * Can be told to report some components as disabled; messages sent to those
 * anyway are still kept, so tests can see when a caller didn't check.
 */
public class RecordingInfoStream implements InfoStream {
    private final List<String> messages = new ArrayList<>();
    private final Set<String> disabled;

    public RecordingInfoStream(String... disabled) {
        this.disabled = Set.of(disabled);
    }

    @Override
    public void message(String component, String line) {
        messages.add(component + ": " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return !disabled.contains(component);
    }

    public List<String> getMessages() {
        return messages;
    }
}
