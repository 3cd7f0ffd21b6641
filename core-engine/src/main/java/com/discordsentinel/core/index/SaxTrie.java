package com.discordsentinel.core.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Trie over SAX words whose leaves collect the start positions producing each
 * word.
 *
 * <p>
 * All words stored in one trie must have the same length. Groups are
 * reported in the order their word was first added, so a trie built by
 * adding positions in ascending order yields groups sorted by first
 * occurrence, each holding ascending positions.
 * </p>
 *
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class SaxTrie {

    private static final class Node {
        private final Map<Character, Node> children = new TreeMap<>();
        private WordGroup group;
    }

    private final Node root = new Node();
    private final List<WordGroup> groups = new ArrayList<>();
    private int wordLength = -1;
    private int size;

    /**
     * Build a trie from words indexed by start position.
     *
     * @param words one word per start position
     * @return the populated trie
     */
    public static SaxTrie of(String[] words) {
        Objects.requireNonNull(words, "Words must not be null");
        SaxTrie trie = new SaxTrie();
        for (int position = 0; position < words.length; position++) {
            trie.add(words[position], position);
        }
        return trie;
    }

    /**
     * Record that the window at {@code position} encodes to {@code word}.
     *
     * @throws IllegalArgumentException if the word is empty or its length
     *                                  differs from previously added words
     */
    public void add(String word, int position) {
        Objects.requireNonNull(word, "Word must not be null");
        if (word.isEmpty()) {
            throw new IllegalArgumentException("An empty word cannot be added to the trie");
        }
        if (wordLength < 0) {
            wordLength = word.length();
        } else if (word.length() != wordLength) {
            throw new IllegalArgumentException("All words must have length " + wordLength
                    + ", got '" + word + "'");
        }

        Node node = root;
        for (int i = 0; i < word.length(); i++) {
            node = node.children.computeIfAbsent(word.charAt(i), c -> new Node());
        }
        if (node.group == null) {
            node.group = new WordGroup(word);
            groups.add(node.group);
        }
        node.group.add(position);
        size++;
    }

    /**
     * @return positions recorded for {@code word}, empty if the word is unknown
     */
    public List<Integer> positions(String word) {
        Objects.requireNonNull(word, "Word must not be null");
        Node node = root;
        for (int i = 0; i < word.length() && node != null; i++) {
            node = node.children.get(word.charAt(i));
        }
        if (node == null || node.group == null) {
            return Collections.emptyList();
        }
        return node.group.getPositions();
    }

    /**
     * @return unmodifiable list of groups in first-occurrence order
     */
    public List<WordGroup> groups() {
        return Collections.unmodifiableList(groups);
    }

    /**
     * @return common length of the stored words, or {@code -1} if empty
     */
    public int wordLength() {
        return wordLength;
    }

    /**
     * @return total number of positions stored
     */
    public int size() {
        return size;
    }
}
