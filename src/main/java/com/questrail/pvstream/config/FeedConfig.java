package com.questrail.pvstream.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Where to find the detector channel.
 *
 * @param channelName    channel to subscribe to, e.g. {@code 13SIM1:Pva1:Image}
 * @param serverAddress  frame server to connect to
 * @param connectTimeout bound on the connect wait inside {@code subscribe}
 */
public record FeedConfig(
    String channelName,
    InetSocketAddress serverAddress,
    Duration connectTimeout
) {
    public static final int DEFAULT_PORT = 5075;

    public FeedConfig {
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(serverAddress, "serverAddress");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (channelName.isBlank()) {
            throw new IllegalArgumentException("channelName must not be blank");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String channelName;
        private InetSocketAddress serverAddress = new InetSocketAddress("localhost", DEFAULT_PORT);
        private Duration connectTimeout = Duration.ofSeconds(5);

        public Builder withChannelName(String channelName) {
            this.channelName = channelName;
            return this;
        }

        public Builder withServerAddress(InetSocketAddress serverAddress) {
            this.serverAddress = serverAddress;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public FeedConfig build() {
            return new FeedConfig(channelName, serverAddress, connectTimeout);
        }
    }
}
