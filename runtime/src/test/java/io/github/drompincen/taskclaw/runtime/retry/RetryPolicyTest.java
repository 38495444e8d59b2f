package io.github.drompincen.taskclaw.runtime.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void backoffGrowsExponentially() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ZERO);
        assertThat(policy.delayBefore(2)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayBefore(3)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayBefore(4)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void rejectsNonsense() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(2, Duration.ZERO, 0.5, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
