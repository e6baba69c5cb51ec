package alerthub.health;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void doublesUntilCap() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(20));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(40));
        assertThat(policy.delayFor(6)).isEqualTo(Duration.ofSeconds(320));
        assertThat(policy.delayFor(7)).isEqualTo(Duration.ofMinutes(10));
        assertThat(policy.delayFor(1000)).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void delayNeverDecreasesAsFailuresGrow() {
        BackoffPolicy policy = BackoffPolicy.defaults();
        Duration previous = Duration.ZERO;
        for (int failCount = 1; failCount <= 64; failCount++) {
            Duration delay = policy.delayFor(failCount);
            assertThat(delay).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(Duration.ofMinutes(10));
            previous = delay;
        }
    }

    @Test
    void rejectsCapBelowBase() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofMinutes(1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
