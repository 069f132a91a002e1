package org.handhistory.service.parsing;

import java.util.List;

/**
 * Hand history text cut into fragments, plus the positions of the empty fragments that separate
 * the header, the betting rounds and the summary. The first boundary precedes the hole cards
 * section, the last one precedes the summary.
 */
public final class SplitText {

    private final List<String> fragments;
    private final List<Integer> boundaries;

    SplitText(List<String> fragments, List<Integer> boundaries) {
        this.fragments = List.copyOf(fragments);
        this.boundaries = List.copyOf(boundaries);
    }

    public List<String> getFragments() { return fragments; }
    public List<Integer> getBoundaries() { return boundaries; }

    public int size() { return fragments.size(); }

    public String fragment(int index) {
        if (index < 0 || index >= fragments.size()) {
            throw new MalformedStageLineException("no fragment at index " + index + " (" + fragments.size() + " fragments)", index);
        }
        return fragments.get(index);
    }

    /** n-th boundary; negative n counts from the end, so -1 is the summary boundary. */
    public int boundary(int n) {
        int i = n < 0 ? boundaries.size() + n : n;
        if (i < 0 || i >= boundaries.size()) {
            throw new MalformedStageLineException("document has no boundary #" + n + " (" + boundaries.size() + " found)", -1);
        }
        return boundaries.get(i);
    }

    public int firstBoundary() { return boundary(0); }
    public int lastBoundary() { return boundary(-1); }

    /** First boundary strictly after {@code index}, or the fragment count when there is none. */
    public int nextBoundaryAfter(int index) {
        for (int b : boundaries) {
            if (b > index) return b;
        }
        return fragments.size();
    }

    /** Index of the fragment equal to {@code marker}. */
    public int indexOf(String marker) {
        int i = fragments.indexOf(marker);
        if (i < 0) throw new SectionNotFoundException(marker);
        return i;
    }

    public boolean contains(String marker) {
        return fragments.contains(marker);
    }

    /** Fragments in [from, to), clamped to the text. */
    public List<String> slice(int from, int to) {
        int start = Math.max(0, from);
        int end = Math.min(fragments.size(), to);
        return start >= end ? List.of() : fragments.subList(start, end);
    }
}
