package com.example.narrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimelineTest {

    @Test
    void singleSegmentStartsAtZero() {
        Timeline timeline = new Timeline();

        TimelineSegment segment = timeline.append("s1-l1", 2.5);

        assertThat(segment.start()).isZero();
        assertThat(segment.end()).isEqualTo(2.5);
        assertThat(timeline.totalDuration()).isEqualTo(2.5);
    }

    @Test
    void secondSegmentStartsWhereFirstEnded() {
        Timeline timeline = new Timeline();
        timeline.append("a", 1.2);
        TimelineSegment second = timeline.append("b", 0.8);

        assertThat(second.start()).isEqualTo(1.2);
        assertThat(second.end()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void fiftySegmentsStayGapless() {
        Timeline timeline = new Timeline();
        for (int i = 0; i < 50; i++) {
            timeline.append("line-" + i, 0.1 + (i % 7) * 0.37);
        }

        List<TimelineSegment> segments = timeline.segments();
        assertThat(segments).hasSize(50);
        assertThat(segments.get(0).start()).isZero();
        for (int i = 0; i < segments.size() - 1; i++) {
            assertThat(segments.get(i).end()).isEqualTo(segments.get(i + 1).start());
            assertThat(segments.get(i + 1).end()).isGreaterThan(segments.get(i).end());
        }
        assertThat(timeline.totalDuration()).isEqualTo(segments.get(49).end());
    }

    @Test
    void zeroDurationIsAllowedButNegativeIsNot() {
        Timeline timeline = new Timeline();
        timeline.append("silent", 0.0);

        assertThatThrownBy(() -> timeline.append("bad", -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timeline.append("nan", Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timeline.append(" ", 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(timeline.size()).isEqualTo(1);
    }

    @Test
    void lineIdCanOnlyBeAppendedOnce() {
        Timeline timeline = new Timeline();
        timeline.append("s1-l1", 1.0);

        assertThatThrownBy(() -> timeline.append("s1-l1", 2.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("s1-l1");
        assertThat(timeline.size()).isEqualTo(1);
        assertThat(timeline.totalDuration()).isEqualTo(1.0);
    }

    @Test
    void byLineIdKeepsAppendOrder() {
        Timeline timeline = new Timeline();
        timeline.append("z", 1);
        timeline.append("a", 1);

        assertThat(timeline.byLineId().keySet()).containsExactly("z", "a");
    }
}
