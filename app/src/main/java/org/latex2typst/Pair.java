package org.latex2typst;

import java.text.MessageFormat;
import java.util.Comparator;

// Ordered pair, mostly used for (from, to) character spans and rule ranges
public record Pair<K extends Comparable<K>, V extends Comparable<V>>(K first, V second) implements Comparable<Pair<K, V>> {
    public static <K extends Comparable<K>, V extends Comparable<V>> Pair<K, V> of(K first, V second) {
        return new Pair<>(first, second);
    }

    @Override
    public String toString() {
        return MessageFormat.format("({0}, {1})", first, second);
    }

    @Override
    public int compareTo(Pair<K, V> other) {
        return Comparator.comparing((Pair<K, V> p) -> p.first())
            .thenComparing((Pair<K, V> p) -> p.second())
            .compare(this, other);
    }
}
