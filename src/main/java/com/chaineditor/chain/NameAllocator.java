package com.chaineditor.chain;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Node name helpers.
 *
 * Rules:
 *   - The root of a name is the name with its maximal trailing digit run removed.
 *   - A colliding name is incremented from its own trailing number:
 *     "Fetch" -> "Fetch1" -> "Fetch2", "Step2" -> "Step3" (never "Step21").
 */
public final class NameAllocator {

    private NameAllocator() {
    }

    /**
     * Split a name into its root and trailing number. "Load12" -> ("Load", 12), "Load" -> ("Load", null).
     */
    public static NameRoot rootOf(String name) {
        if (name == null) {
            return new NameRoot("", null);
        }
        int end = name.length();
        int start = end;
        while (start > 0 && isAsciiDigit(name.charAt(start - 1))) {
            start--;
        }
        if (start == end) {
            return new NameRoot(name, null);
        }
        return new NameRoot(name.substring(0, start), new BigInteger(name.substring(start)));
    }

    /**
     * Return {@code base} if no taken name equals it, otherwise the first free candidate
     * produced by incrementing the trailing number.
     */
    public static String generateUniqueName(String base, Collection<String> takenNames) {
        Set<String> taken = new HashSet<>();
        for (String name : takenNames) {
            if (name != null) {
                taken.add(name);
            }
        }
        String candidate = base == null ? "" : base;
        while (taken.contains(candidate)) {
            NameRoot parts = rootOf(candidate);
            BigInteger current = parts.getNumber() != null ? parts.getNumber() : BigInteger.ZERO;
            candidate = parts.getRoot() + current.add(BigInteger.ONE);
        }
        return candidate;
    }

    /**
     * Same as {@link #generateUniqueName(String, Collection)} but ignores the name at
     * {@code excludeIndex}, so a node may keep its own name.
     */
    public static String generateUniqueName(String base, List<String> namesInOrder, int excludeIndex) {
        List<String> others = new ArrayList<>(namesInOrder.size());
        for (int i = 0; i < namesInOrder.size(); i++) {
            if (i != excludeIndex) {
                others.add(namesInOrder.get(i));
            }
        }
        return generateUniqueName(base, others);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static final class NameRoot {
        private final String root;
        private final BigInteger number;

        public NameRoot(String root, BigInteger number) {
            this.root = root;
            this.number = number;
        }

        public String getRoot() {
            return root;
        }

        /** Trailing number, or null when the name has no digit suffix. */
        public BigInteger getNumber() {
            return number;
        }

        public boolean hasNumber() {
            return number != null;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof NameRoot)) return false;
            NameRoot other = (NameRoot) o;
            return root.equals(other.root) && Objects.equals(number, other.number);
        }

        @Override
        public int hashCode() {
            return Objects.hash(root, number);
        }

        @Override
        public String toString() {
            return "NameRoot{root='" + root + "', number=" + number + '}';
        }
    }
}
