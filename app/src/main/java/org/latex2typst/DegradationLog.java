package org.latex2typst;

import java.util.*;

import com.google.gson.GsonBuilder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// Collects degradations of one conversion, in the order they happened
public class DegradationLog implements DegradationSink {
    private static final Logger log = LogManager.getLogger("degradation");

    private final ArrayList<Degradation> entries = new ArrayList<>();
    private int nextId = 1;

    @Override
    public void record(DegradationKind kind, String name, String message, Optional<String> snippet) {
        var id = "loss-" + this.nextId++;
        log.debug("{} {} {}: {}", id, kind, name, message);
        this.entries.add(new Degradation(id, kind, name, message, snippet));
    }

    public List<Degradation> entries() {
        return Collections.unmodifiableList(this.entries);
    }

    public List<Degradation> ofKind(DegradationKind kind) {
        return this.entries.stream()
            .filter(d -> d.kind() == kind)
            .toList();
    }

    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    public int size() {
        return this.entries.size();
    }

    @Override
    public String toString() {
        var gson = new GsonBuilder()
            .registerTypeHierarchyAdapter(Optional.class, new OptionalAdapter())
            .setPrettyPrinting()
            .create();

        return gson.toJson(this.entries);
    }
}
