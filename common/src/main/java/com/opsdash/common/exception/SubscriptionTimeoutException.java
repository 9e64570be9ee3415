package com.opsdash.common.exception;

import java.time.Duration;

/**
 * Exception raised when a channel does not confirm it is live within the configured window.
 * HTTP Status: 504 Gateway Timeout
 */
public final class SubscriptionTimeoutException extends OpsDashException {

    private final String channelName;
    private final Duration timeout;

    public SubscriptionTimeoutException(String channelName, Duration timeout) {
        super("Channel " + channelName + " did not become live within " + timeout.toMillis() + " ms");
        this.channelName = channelName;
        this.timeout = timeout;
    }

    public String getChannelName() {
        return channelName;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String getErrorCode() {
        return "SUBSCRIPTION_TIMEOUT";
    }
}
