package com.example.syncroom.client;

/**
 * Attempt counter over a {@link ReconnectPolicy}. Reset after every successful connect.
 */
public class ReconnectBackoff {
    private final ReconnectPolicy policy;
    private int attempts;

    public ReconnectBackoff(ReconnectPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return delay before the next attempt, or -1 once the attempts are used up
     */
    public synchronized long nextDelayMs() {
        if (attempts >= policy.getMaxAttempts()) return -1;
        return policy.delayForAttempt(attempts++);
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized boolean isExhausted() {
        return attempts >= policy.getMaxAttempts();
    }

    public synchronized void reset() {
        attempts = 0;
    }
}
