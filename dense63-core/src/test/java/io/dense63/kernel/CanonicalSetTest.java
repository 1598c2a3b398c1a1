package io.dense63.kernel;

import io.dense63.core.NegativeElementException;
import io.dense63.testutil.LumpyMasks;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.NoSuchElementException;
import java.util.Random;

import static io.dense63.testutil.SetAssertions.assertCanonical;
import static io.dense63.testutil.SetAssertions.assertMatchesMask;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalSetTest {

    @Test
    void shouldBuildCanonicalFormFromUnorderedDuplicates() {
        var set = CanonicalSet.of(1, 2, 3, 4, 3, 2, 1, 16, 18, 17, 19);

        assertCanonical(set);
        assertThat(set.size()).isEqualTo(4);
        assertThat(set.count()).isEqualTo(8);
        assertThat(set.span()).isEqualTo(new Span(1, 19));
        assertThat(set.span().count()).isEqualTo(19);
        assertThat(set.interval(1)).isEqualTo(DyadicInterval.of(2, 1));
        assertThat(set.intervals()).containsExactly(
                DyadicInterval.singleton(1),
                DyadicInterval.of(2, 1),
                DyadicInterval.singleton(4),
                DyadicInterval.of(16, 2));
    }

    @Test
    void shouldContainExactlyTheGivenElements() {
        var set = CanonicalSet.of(1, 2, 3, 4, 3, 2, 1, 16, 18, 17, 19);
        var members = new long[] {1, 2, 3, 4, 16, 17, 18, 19};

        for (var e = -2L; e < 40; e++) {
            var expected = false;
            for (var m : members) {
                expected |= m == e;
            }
            assertThat(set.contains(e)).as("contains %d", e).isEqualTo(expected);
        }
    }

    @Test
    void shouldVisitElementsAndRunsInOrder() {
        var set = CanonicalSet.of(19, 1, 2, 3, 4, 16, 17, 18);

        var elements = new ArrayList<Long>();
        set.forEach(elements::add);
        assertThat(elements).containsExactly(1L, 2L, 3L, 4L, 16L, 17L, 18L, 19L);

        var runs = new ArrayList<Span>();
        set.forEachInterval((first, last) -> runs.add(new Span(first, last)));
        assertThat(runs).containsExactly(new Span(1, 4), new Span(16, 19));
        assertThat(set.runs()).isEqualTo(runs);
    }

    @Test
    void shouldStopVisitingWhenVisitorReturnsFalse() {
        var set = CanonicalSet.interval(0, 1_000);

        var elements = new ArrayList<Long>();
        set.forEach(e -> {
            elements.add(e);
            return e < 2;
        });
        assertThat(elements).containsExactly(0L, 1L, 2L);

        var calls = new int[1];
        CanonicalSet.of(1, 5, 9).forEachInterval((first, last) -> ++calls[0] < 2);
        assertThat(calls[0]).isEqualTo(2);
    }

    @Test
    void shouldStartEmpty() {
        var set = CanonicalSet.of();

        assertThat(set.isEmpty()).isTrue();
        assertThat(set.size()).isZero();
        assertThat(set.count()).isZero();
        assertThat(set.span()).isEqualTo(Span.EMPTY);
        assertThat(set.span().isEmpty()).isTrue();
        assertThat(set.span().count()).isZero();
        assertThat(set.span().toString()).isEqualTo("∅");
        assertThat(set.toLongArray()).isEmpty();
        assertThat(set.enumerator().hasNext()).isFalse();
        assertThat(set.union(set).isEmpty()).isTrue();
        assertThat(set.intersection(set).isEmpty()).isTrue();
        assertThat(set).isSameAs(CanonicalSets.empty());
        assertThat(set.toString()).isEqualTo("∅");
    }

    @Test
    void shouldSpanWholeDomainWhenFull() {
        var full = CanonicalSets.universe();

        assertThat(full.span()).isEqualTo(new Span(0, Long.MAX_VALUE));
        assertThat(full.span().count()).isEqualTo(Long.MIN_VALUE);
        // 2^63 as unsigned
        assertThat(full.count()).isEqualTo(Long.MIN_VALUE);
        assertThat(Long.toUnsignedString(full.count())).isEqualTo("9223372036854775808");
        assertThat(full.contains(0)).isTrue();
        assertThat(full.contains(Long.MAX_VALUE)).isTrue();
        assertThat(full.contains(-1)).isFalse();
        assertThat(full).isEqualTo(CanonicalSet.interval(0, Long.MAX_VALUE));
        assertThat(full.toString()).isEqualTo("[0, 9223372036854775807]");
    }

    @Test
    void shouldRejectNegativeElements() {
        assertThatThrownBy(() -> CanonicalSet.of(3, -1, 4))
                .isInstanceOf(NegativeElementException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
        assertThatThrownBy(() -> CanonicalSet.interval(-5, 10))
                .isInstanceOfSatisfying(NegativeElementException.class, e -> assertThat(e.element()).isEqualTo(-5));
        assertThatThrownBy(() -> CanonicalSets.singleton(-7))
                .isInstanceOf(NegativeElementException.class);
    }

    @Test
    void shouldTreatInvertedRangeAsEmpty() {
        assertThat(CanonicalSet.interval(5, 3).isEmpty()).isTrue();
        assertThat(CanonicalSet.interval(5, 5)).isEqualTo(CanonicalSet.of(5));
    }

    @Test
    void shouldDecomposeRangesIntoAlignedIntervals() {
        var set = CanonicalSet.interval(3, 17);

        assertCanonical(set);
        assertThat(set.intervals()).containsExactly(
                DyadicInterval.singleton(3),
                DyadicInterval.of(4, 2),
                DyadicInterval.of(8, 3),
                DyadicInterval.of(16, 1));
        assertThat(set.runs()).containsExactly(new Span(3, 17));
        assertThat(set.count()).isEqualTo(15);
    }

    @Test
    void shouldMatchRandomRanges() {
        var random = new Random(7);
        for (var n = 0; n < 1000; n++) {
            long min = random.nextInt(64);
            long max = random.nextInt(64);
            if (min > max) {
                var swap = min;
                min = max;
                max = swap;
            }
            var set = CanonicalSet.interval(min, max);

            assertCanonical(set);
            assertThat(set.count()).isEqualTo(max - min + 1);
            for (var i = 0L; i < 64; i++) {
                assertThat(set.contains(i)).isEqualTo(min <= i && i <= max);
            }
            assertThat(set.runs()).containsExactly(new Span(min, max));
        }
    }

    @Test
    void shouldReproduceRandomMasks() {
        for (var mask : LumpyMasks.sample(42, 500, 8, 6)) {
            var set = CanonicalSets.fromMask(mask);

            assertCanonical(set);
            assertMatchesMask(set, mask);
            assertThat(set.count()).isEqualTo(Long.bitCount(mask));
            assertThat(CanonicalSet.of(LumpyMasks.elements(mask))).isEqualTo(set);
        }
    }

    @Test
    void shouldEnumerateLazilyAndRestart() {
        var set = CanonicalSet.of(5, 6, 7, 40);

        var first = set.enumerator();
        assertThat(first.nextLong()).isEqualTo(5);
        assertThat(first.nextLong()).isEqualTo(6);

        var second = set.enumerator();
        var values = new ArrayList<Long>();
        while (second.hasNext()) {
            values.add(second.nextLong());
        }
        assertThat(values).containsExactly(5L, 6L, 7L, 40L);
        assertThatThrownBy(second::nextLong).isInstanceOf(NoSuchElementException.class);
        assertThat(first.nextLong()).isEqualTo(7);
    }

    @Test
    void shouldSnapshotElementsIntoArray() {
        var set = CanonicalSet.interval(10, 13).union(CanonicalSet.of(100));

        assertThat(set.toLongArray()).containsExactly(10L, 11L, 12L, 13L, 100L);
        assertThatThrownBy(() -> CanonicalSets.universe().toLongArray())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRenderRunsAsClosedIntervals() {
        assertThat(CanonicalSet.of(1, 2, 3, 4, 16, 17, 18, 19).toString()).isEqualTo("[1, 4] ∪ [16, 19]");
        assertThat(CanonicalSet.of(9).toString()).isEqualTo("[9, 9]");
    }

    @Test
    void shouldCompareByRepresentation() {
        var a = CanonicalSet.of(0, 1, 2, 3);
        var b = CanonicalSet.interval(0, 3);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(CanonicalSet.of(0, 1, 2));
        assertThat(a).isNotEqualTo(CanonicalSet.of());
        assertThat(CanonicalSet.of()).isNotEqualTo(a);
    }

    @Test
    void shouldRoundTripPackedIntervals() {
        var set = CanonicalSet.of(1, 2, 3, 4, 16, 17, 18, 19);

        assertThat(CanonicalSet.ofPacked(set.toPackedArray())).isEqualTo(set);
        assertThat(CanonicalSet.ofPacked(DyadicInterval.universe().packed())).isEqualTo(CanonicalSets.universe());
    }

    @Test
    void shouldReportAnomaliesInPackedInput() {
        var zero = DyadicInterval.singleton(0).packed();
        var one = DyadicInterval.singleton(1).packed();
        var block = DyadicInterval.of(0, 2).packed();

        assertThatThrownBy(() -> CanonicalSet.ofPacked(one, zero))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not canonical");
        assertThatThrownBy(() -> CanonicalSet.ofPacked(zero, one))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CanonicalSet.ofPacked(zero, block))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CanonicalSet.ofPacked(zero, zero))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CanonicalSet.ofPacked(0L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNullOperands() {
        var set = CanonicalSet.of(1);

        assertThatThrownBy(() -> set.union(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> set.intersection(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> set.intersects(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
