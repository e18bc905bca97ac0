package nl.nfi.djlcfrs.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpanTest {

    @Test
    void unionIsSorted() {
        final Span union = Span.union(List.of(Span.of(3), Span.of(0, 2), Span.of(1)));

        assertThat(union.positions()).containsExactly(0, 1, 2, 3);
        assertThat(union).hasToString("{0,1,2,3}");
    }

    @Test
    void overlappingUnion() {
        assertThatThrownBy(() -> Span.union(List.of(Span.of(0, 1), Span.of(1))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptySpanHasNoMinimum() {
        assertThat(Span.empty().isEmpty()).isTrue();
        assertThatThrownBy(() -> Span.empty().min()).isInstanceOf(IllegalStateException.class);
    }
}
