package alerthub.health;

import java.time.Duration;

/**
 * 指数退避：base * 2^(failCount-1)，上限cap
 */
public class BackoffPolicy {
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CAP = Duration.ofMinutes(10);

    private final Duration base;
    private final Duration cap;

    public BackoffPolicy(Duration base, Duration cap) {
        if (base.isNegative() || base.isZero() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("退避参数非法: base=" + base + ", cap=" + cap);
        }
        this.base = base;
        this.cap = cap;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_CAP);
    }

    public Duration delayFor(int failCount) {
        int exponent = Math.max(0, failCount - 1);
        // 超过30次左移必然溢出上限，直接返回cap
        if (exponent >= 30) {
            return cap;
        }
        long millis = base.toMillis() * (1L << exponent);
        return millis >= cap.toMillis() ? cap : Duration.ofMillis(millis);
    }
}
