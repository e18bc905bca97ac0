package nl.nfi.djlcfrs.tree;

import java.util.Arrays;
import java.util.List;

import static java.util.stream.Collectors.joining;

public final class Span {

    private static final Span EMPTY = new Span(new int[0]);

    private final int[] positions;

    private Span(final int[] positions) {
        this.positions = positions;
    }

    public static Span empty() {
        return EMPTY;
    }

    public static Span of(final int... positions) {
        final int[] sorted = positions.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] < 0) {
                throw new IllegalArgumentException("Negative terminal position: %d".formatted(sorted[i]));
            }
            if (i > 0 && sorted[i] == sorted[i - 1]) {
                throw new IllegalArgumentException("Duplicate terminal position: %d".formatted(sorted[i]));
            }
        }
        return new Span(sorted);
    }

    // a single span is taken over as is, several are merged and sorted
    public static Span union(final List<Span> spans) {
        if (spans.size() == 1) {
            return spans.get(0);
        }
        final int[] merged = new int[spans.stream().mapToInt(Span::size).sum()];
        int offset = 0;
        for (final Span span : spans) {
            System.arraycopy(span.positions, 0, merged, offset, span.positions.length);
            offset += span.positions.length;
        }
        return of(merged);
    }

    public int size() {
        return positions.length;
    }

    public boolean isEmpty() {
        return positions.length == 0;
    }

    public int positionAt(final int index) {
        return positions[index];
    }

    public int min() {
        if (isEmpty()) {
            throw new IllegalStateException("Empty span has no minimum");
        }
        return positions[0];
    }

    public int[] positions() {
        return positions.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(positions, ((Span) o).positions);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(positions);
    }

    @Override
    public String toString() {
        return Arrays.stream(positions).mapToObj(Integer::toString).collect(joining(",", "{", "}"));
    }
}
