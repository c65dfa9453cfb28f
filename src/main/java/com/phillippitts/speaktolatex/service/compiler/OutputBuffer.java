package com.phillippitts.speaktolatex.service.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered list of emitted LaTeX fragments.
 *
 * <p>Fragments stay separate until a construct closes so bounds can still be written into an
 * earlier fragment and the last operand can still be pulled back as a numerator or base.
 */
public final class OutputBuffer {

    private static final Pattern TRAILING_CONTROL_WORD = Pattern.compile("\\\\[A-Za-z]+$");

    private final List<String> fragments = new ArrayList<>();

    /** @return index of the appended fragment */
    public int append(String fragment) {
        fragments.add(fragment);
        return fragments.size() - 1;
    }

    /**
     * Appends an operand, inserting a space where LaTeX would otherwise fuse it with the
     * previous fragment ({@code \pi x}, {@code 1 2}).
     */
    public int appendOperand(String operand) {
        if (!fragments.isEmpty() && needsSeparator(lastOrEmpty(), operand)) {
            return append(" " + operand);
        }
        return append(operand);
    }

    public void appendToLast(String suffix) {
        if (fragments.isEmpty()) {
            fragments.add(suffix);
        } else {
            int last = fragments.size() - 1;
            fragments.set(last, fragments.get(last) + suffix);
        }
    }

    /** @throws IllegalStateException if the buffer is empty */
    public String removeLast() {
        if (fragments.isEmpty()) {
            throw new IllegalStateException("Output buffer is empty");
        }
        return fragments.remove(fragments.size() - 1);
    }

    public String get(int index) {
        return fragments.get(index);
    }

    public void set(int index, String fragment) {
        fragments.set(index, fragment);
    }

    /** Joins every fragment from {@code index} to the end into a single fragment at {@code index}. */
    public void collapseFrom(int index) {
        if (index < 0 || index >= fragments.size()) {
            throw new IndexOutOfBoundsException("Cannot collapse from " + index + ", size " + fragments.size());
        }
        List<String> tail = fragments.subList(index, fragments.size());
        String joined = String.join("", tail);
        tail.clear();
        fragments.add(joined);
    }

    public String lastOrEmpty() {
        return fragments.isEmpty() ? "" : fragments.get(fragments.size() - 1);
    }

    public int size() {
        return fragments.size();
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public int lastIndex() {
        return fragments.size() - 1;
    }

    public List<String> fragments() {
        return Collections.unmodifiableList(fragments);
    }

    private static boolean needsSeparator(String previous, String next) {
        if (previous.isEmpty() || next.isEmpty()) {
            return false;
        }
        char first = next.charAt(0);
        char last = previous.charAt(previous.length() - 1);
        if (Character.isLetter(first) && TRAILING_CONTROL_WORD.matcher(previous).find()) {
            return true;
        }
        return Character.isDigit(first) && Character.isDigit(last);
    }
}
