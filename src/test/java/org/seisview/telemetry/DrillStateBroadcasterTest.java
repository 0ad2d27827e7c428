package org.seisview.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("DrillStateBroadcaster")
class DrillStateBroadcasterTest {

    private final DrillStateBroadcaster broadcaster = new DrillStateBroadcaster();

    private static DrillStateUpdate bitAt(double lon, double lat, double md) {
        return new DrillStateUpdate(List.of(lon, lat, -md), md, null);
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Should start with an empty path and zero depth")
        void initialState() {
            DrillState state = broadcaster.current();

            assertThat(state.path()).isEmpty();
            assertThat(state.bit()).isNull();
            assertThat(state.md()).isZero();
        }

        @Test
        @DisplayName("Should keep fields an update leaves out")
        void partialUpdates() {
            broadcaster.update(new DrillStateUpdate(null, null, List.of(List.of(1.0, 2.0), List.of(1.0, 2.0, -50.0))));
            DrillState merged = broadcaster.update(bitAt(1.0, 2.0, 75.0));

            assertThat(merged.path()).hasSize(2);
            assertThat(merged.bit()).containsExactly(1.0, 2.0, -75.0);
            assertThat(merged.md()).isEqualTo(75.0);

            DrillState afterEmptyPath = broadcaster.update(new DrillStateUpdate(null, null, List.of()));
            assertThat(afterEmptyPath.path()).hasSize(2);
            assertThat(afterEmptyPath.md()).isEqualTo(75.0);
        }

        @Test
        @DisplayName("Should reject malformed positions and leave the state untouched")
        void rejectsMalformedUpdates() {
            broadcaster.update(bitAt(1.0, 2.0, 10.0));

            assertThatThrownBy(() -> broadcaster.update(new DrillStateUpdate(List.of(1.0), null, null)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> broadcaster.update(new DrillStateUpdate(null, Double.NaN, null)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> broadcaster.update(
                new DrillStateUpdate(null, null, List.of(List.of(1.0, Double.POSITIVE_INFINITY)))))
                .isInstanceOf(IllegalArgumentException.class);

            assertThat(broadcaster.current().md()).isEqualTo(10.0);
        }
    }

    @Nested
    @DisplayName("Fan-out")
    class FanOut {

        @Test
        @DisplayName("Should deliver the current state on subscribe and every update afterwards")
        void deliversInOrder() {
            List<Double> received = Collections.synchronizedList(new ArrayList<>());
            broadcaster.update(bitAt(0, 0, 5));

            assertThat(broadcaster.subscribe(state -> received.add(state.md()))).isTrue();
            broadcaster.update(bitAt(0, 0, 6));
            broadcaster.update(bitAt(0, 0, 7));

            assertThat(received).containsExactly(5.0, 6.0, 7.0);
        }

        @Test
        @DisplayName("Should drop a failing subscriber and keep serving the others")
        void dropsFailingSubscriber() throws Exception {
            DrillStateListener healthy = mock(DrillStateListener.class);
            DrillStateListener broken = mock(DrillStateListener.class);
            broadcaster.subscribe(healthy);
            broadcaster.subscribe(broken);
            doThrow(new IOException("connection reset")).when(broken).onDrillState(any());

            broadcaster.update(bitAt(0, 0, 1));
            broadcaster.update(bitAt(0, 0, 2));

            assertThat(broadcaster.subscriberCount()).isEqualTo(1);
            verify(healthy, times(3)).onDrillState(any());
            verify(broken, times(2)).onDrillState(any());
        }

        @Test
        @DisplayName("Should report a subscriber that fails its initial delivery")
        void initialDeliveryFailure() {
            boolean subscribed = broadcaster.subscribe(state -> {
                throw new IllegalStateException("closed");
            });

            assertThat(subscribed).isFalse();
            assertThat(broadcaster.subscriberCount()).isZero();
        }

        @Test
        @DisplayName("Should stop delivering after unsubscribe")
        void unsubscribe() {
            List<DrillState> received = new ArrayList<>();
            DrillStateListener listener = received::add;
            broadcaster.subscribe(listener);

            broadcaster.unsubscribe(listener);
            broadcaster.update(bitAt(0, 0, 1));

            assertThat(received).hasSize(1);
            assertThat(broadcaster.subscriberCount()).isZero();
        }
    }
}
