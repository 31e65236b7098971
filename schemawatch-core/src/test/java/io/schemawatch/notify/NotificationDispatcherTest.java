package io.schemawatch.notify;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationDispatcherTest {

    @Test
    void failingChannelShouldNotBlockOthers() {
        RecordingChannel disabled = new RecordingChannel("disabled", false, false);
        RecordingChannel failing = new RecordingChannel("failing", true, true);
        RecordingChannel working = new RecordingChannel("working", true, false);

        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(disabled, failing, working));
        int delivered = dispatcher.dispatch(new NotificationEvent("nightly", "success", null, "done"));

        assertThat(delivered).isEqualTo(1);
        assertThat(disabled.received).isEmpty();
        assertThat(failing.received).hasSize(1);
        assertThat(working.received).singleElement()
                .satisfies(e -> assertThat(e.source()).isEqualTo("nightly"));
    }

    @Test
    void noChannelsShouldBeANoOp() {
        assertThat(NotificationDispatcher.none().dispatch(new NotificationEvent("x", "error", null, null)))
                .isZero();
        assertThat(NotificationDispatcher.none().dispatch(null)).isZero();
    }

    @Test
    void statusTitleShouldCapitalize() {
        assertThat(new NotificationEvent("x", "changed", null, null).statusTitle()).isEqualTo("Changed");
    }

    static class RecordingChannel implements NotificationChannel {
        final String name;
        final boolean enabled;
        final boolean fail;
        final List<NotificationEvent> received = new ArrayList<>();

        RecordingChannel(String name, boolean enabled, boolean fail) {
            this.name = name;
            this.enabled = enabled;
            this.fail = fail;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public void deliver(NotificationEvent event) {
            received.add(event);
            if (fail) {
                throw new IllegalStateException("boom");
            }
        }
    }
}
