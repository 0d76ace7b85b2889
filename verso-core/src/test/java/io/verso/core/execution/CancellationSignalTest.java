package io.verso.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CancellationSignal")
class CancellationSignalTest {

    @Test
    void shouldKeepFirstReason() {
        CancellationSignal signal = CancellationSignal.create();
        assertThat(signal.isCancelled()).isFalse();
        assertThat(signal.reason()).isNull();

        signal.cancel("user request");
        signal.cancel("shutdown");

        assertThat(signal.isCancelled()).isTrue();
        assertThat(signal.reason()).isEqualTo("user request");
    }

    @Test
    void shouldNotifyCallbacksRegisteredBeforeAndAfter() {
        CancellationSignal signal = CancellationSignal.create();
        List<String> seen = new ArrayList<>();
        signal.onCancel(seen::add);

        signal.cancel(null);
        signal.onCancel(reason -> seen.add("late:" + reason));

        assertThat(seen).containsExactly("cancelled", "late:cancelled");
    }
}
