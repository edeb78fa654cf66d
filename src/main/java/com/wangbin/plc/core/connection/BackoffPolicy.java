package com.wangbin.plc.core.connection;

/**
 * 重连退避策略：延迟 = min(2^重试次数, 上限) 秒
 */
public class BackoffPolicy {

    public static final long DEFAULT_CAP_SECONDS = 300;

    private final long capSeconds;

    public BackoffPolicy() {
        this(DEFAULT_CAP_SECONDS);
    }

    public BackoffPolicy(long capSeconds) {
        this.capSeconds = Math.max(1, capSeconds);
    }

    public long delaySeconds(int retryCount) {
        if (retryCount <= 0) {
            return 1;
        }
        if (retryCount >= 62) {
            return capSeconds;
        }
        return Math.min(1L << retryCount, capSeconds);
    }

    /**
     * 距上次尝试未超过退避延迟时不再重连
     */
    public boolean shouldAttempt(long lastAttemptTime, long now, int retryCount) {
        if (retryCount <= 0 || lastAttemptTime <= 0) {
            return true;
        }
        return now - lastAttemptTime >= delaySeconds(retryCount) * 1000L;
    }

    public long getCapSeconds() {
        return capSeconds;
    }
}
