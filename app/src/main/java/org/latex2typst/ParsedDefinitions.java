package org.latex2typst;

import java.util.*;

import com.google.gson.GsonBuilder;

// Result of scanning a token sequence for definitions: the definitions in
// source order, and every token that wasn't part of one
public record ParsedDefinitions(List<Definition> definitions, TokenList remaining) {
    public ParsedDefinitions {
        definitions = List.copyOf(definitions);
    }

    @Override
    public String toString() {
        var gson = new GsonBuilder()
            .registerTypeHierarchyAdapter(Optional.class, new OptionalAdapter())
            .setPrettyPrinting()
            .create();

        return gson.toJson(Map.of(
            "definitions", definitions,
            "remaining", remaining.detokenize()
        ));
    }
}
