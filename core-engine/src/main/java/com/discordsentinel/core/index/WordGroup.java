package com.discordsentinel.core.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * All start positions whose window encodes to the same SAX word, in
 * insertion (ascending) order.
 *
 * @since 1.0.0
 */
public final class WordGroup {

    private final String word;
    private final List<Integer> positions = new ArrayList<>();

    WordGroup(String word) {
        this.word = Objects.requireNonNull(word, "Word must not be null");
    }

    void add(int position) {
        positions.add(position);
    }

    public String getWord() {
        return word;
    }

    /**
     * @return unmodifiable view of the positions
     */
    public List<Integer> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public int size() {
        return positions.size();
    }

    int[] toArray() {
        return positions.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return "WordGroup{word='" + word + "', size=" + positions.size() + '}';
    }
}
