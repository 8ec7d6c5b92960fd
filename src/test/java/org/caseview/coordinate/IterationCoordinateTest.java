package org.caseview.coordinate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class IterationCoordinateTest {

    @Test
    void segments_driverCoordinate_shouldHaveTwoSegments() {
        final IterationCoordinate coord = IterationCoordinate.of("rank0:SLSQP|0");

        assertThat(coord.segments()).containsExactly("rank0:SLSQP", "");
        assertEquals(2, coord.segmentCount());
    }

    @Test
    void segments_nestedCoordinates_shouldCountIdentifiers() {
        assertEquals(3, IterationCoordinate.of("rank0:SLSQP|0|root._solve_nonlinear|0").segmentCount());
        assertEquals(4, IterationCoordinate.of("rank0:SLSQP|0|root._solve_nonlinear|0|NLRunOnce|0").segmentCount());
        assertThat(IterationCoordinate.of("rank0:root._solve_nonlinear|12|NonlinearBlockGS|3").segments())
            .containsExactly("rank0:root._solve_nonlinear", "NonlinearBlockGS", "");
    }

    @Test
    void of_emptyOrNull_shouldBeTheRoot() {
        assertSame(IterationCoordinate.ROOT, IterationCoordinate.of(""));
        assertSame(IterationCoordinate.ROOT, IterationCoordinate.of(null));
        assertTrue(IterationCoordinate.ROOT.isRoot());
        assertEquals(IterationCoordinate.ROOT_LENGTH, IterationCoordinate.ROOT.segmentCount());
        assertThat(IterationCoordinate.ROOT.segments()).isEmpty();
    }

    @Test
    void isPrefixOf_shouldRequireDelimiterAfterPrefix() {
        final IterationCoordinate parent = IterationCoordinate.of("rank0:SLSQP|1");

        assertTrue(parent.isPrefixOf(IterationCoordinate.of("rank0:SLSQP|1|root._solve_nonlinear|1")));
        assertFalse(parent.isPrefixOf(IterationCoordinate.of("rank0:SLSQP|10|root._solve_nonlinear|10")));
        assertFalse(parent.isPrefixOf(parent));
        assertFalse(parent.isPrefixOf(IterationCoordinate.of("rank0:SLSQP|2")));
    }

    @Test
    void isPrefixOf_root_shouldPrefixEveryNonRootCoordinate() {
        assertTrue(IterationCoordinate.ROOT.isPrefixOf(IterationCoordinate.of("rank0:SLSQP|0")));
        assertFalse(IterationCoordinate.ROOT.isPrefixOf(IterationCoordinate.ROOT));
    }

    @Test
    void equality_shouldFollowText() {
        assertEquals(IterationCoordinate.of("a|1"), IterationCoordinate.of("a|1"));
        assertEquals(IterationCoordinate.of("a|1").hashCode(), IterationCoordinate.of("a|1").hashCode());
        assertEquals("a|1", IterationCoordinate.of("a|1").toString());
    }
}
