package com.example.morphan.dictionary;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Character trie supporting common-prefix search. Keys are inserted through {@link Builder} and the
 * finished trie is flattened into parallel arrays: the children of every node occupy a contiguous,
 * label-sorted slice so a transition is a binary search.
 */
final class PrefixTrie {

    /** Receives one match of a common-prefix search. */
    @FunctionalInterface
    interface MatchVisitor {
        void visit(int length, int value);
    }

    private final char[] labels;
    private final int[] firstChild;
    private final int[] childCount;
    private final int[] valueStart;
    private final int[] valueCount;
    private final int[] values;

    private PrefixTrie(char[] labels,
                       int[] firstChild,
                       int[] childCount,
                       int[] valueStart,
                       int[] valueCount,
                       int[] values) {
        this.labels = labels;
        this.firstChild = firstChild;
        this.childCount = childCount;
        this.valueStart = valueStart;
        this.valueCount = valueCount;
        this.values = values;
    }

    /**
     * Walks {@code text} from {@code position} and reports the values of every key that is a prefix
     * of the remaining text, shortest keys first.
     */
    void commonPrefixSearch(CharSequence text, int position, MatchVisitor visitor) {
        int node = 0;
        for (int i = position; i < text.length(); i++) {
            node = child(node, text.charAt(i));
            if (node < 0) {
                return;
            }
            int count = valueCount[node];
            if (count > 0) {
                int start = valueStart[node];
                int length = i - position + 1;
                for (int k = 0; k < count; k++) {
                    visitor.visit(length, values[start + k]);
                }
            }
        }
    }

    int nodeCount() {
        return labels.length;
    }

    private int child(int node, char label) {
        int low = firstChild[node];
        int high = low + childCount[node] - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            char midLabel = labels[mid];
            if (midLabel < label) {
                low = mid + 1;
            } else if (midLabel > label) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    static final class Builder {
        private final MutableNode root = new MutableNode('\0');
        private int valueTotal;

        Builder put(String key, int value) {
            Objects.requireNonNull(key, "key");
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Trie keys must not be empty");
            }
            MutableNode node = root;
            for (int i = 0; i < key.length(); i++) {
                char c = key.charAt(i);
                node = node.children.computeIfAbsent(c, MutableNode::new);
            }
            node.values.add(value);
            valueTotal++;
            return this;
        }

        PrefixTrie build() {
            List<MutableNode> order = new ArrayList<>();
            Deque<MutableNode> queue = new ArrayDeque<>();
            queue.add(root);
            while (!queue.isEmpty()) {
                MutableNode node = queue.poll();
                node.index = order.size();
                order.add(node);
                queue.addAll(node.children.values());
            }

            int size = order.size();
            char[] labels = new char[size];
            int[] firstChild = new int[size];
            int[] childCount = new int[size];
            int[] valueStart = new int[size];
            int[] valueCount = new int[size];
            int[] values = new int[valueTotal];
            int cursor = 0;
            for (MutableNode node : order) {
                int i = node.index;
                labels[i] = node.label;
                childCount[i] = node.children.size();
                // breadth-first numbering keeps siblings contiguous and sorted by label
                firstChild[i] = node.children.isEmpty() ? 0 : node.children.values().iterator().next().index;
                valueStart[i] = cursor;
                valueCount[i] = node.values.size();
                for (int value : node.values) {
                    values[cursor++] = value;
                }
            }
            return new PrefixTrie(labels, firstChild, childCount, valueStart, valueCount, values);
        }
    }

    private static final class MutableNode {
        private final char label;
        private final Map<Character, MutableNode> children = new TreeMap<>();
        private final List<Integer> values = new ArrayList<>(1);
        private int index;

        private MutableNode(char label) {
            this.label = label;
        }
    }
}
