package app.jira.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

@Validated
@ConfigurationProperties(prefix = "jira.dispatch")
public class DispatchProperties {

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);

    /**
     * Upper bound for a single HTTP exchange, including reading the body.
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(60);

    /**
     * Retries after transient transport failures (timeouts, resets, refused connections).
     */
    @Min(0)
    private int maxTransportRetries = 3;

    /**
     * Retries after 429 or 5xx answers. 429 honours Retry-After.
     */
    @Min(0)
    private int maxStatusRetries = 1;

    @NotNull
    private Duration minBackoff = Duration.ofMillis(200);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(5);

    /**
     * Longest Retry-After hint that is still waited out. Longer hints return the 429 at once.
     */
    @NotNull
    private Duration maxRetryAfter = Duration.ofSeconds(60);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitter = 0.5;

    @NotNull
    private Duration pollInterval = Duration.ofSeconds(2);

    @NotNull
    private Duration maxWait = Duration.ofMinutes(5);

    /**
     * Largest response body buffered in memory, in bytes. Attachments count against it.
     */
    @Min(1024)
    private int maxInMemorySize = 32 * 1024 * 1024;

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getMaxTransportRetries() {
        return maxTransportRetries;
    }

    public void setMaxTransportRetries(int maxTransportRetries) {
        this.maxTransportRetries = maxTransportRetries;
    }

    public int getMaxStatusRetries() {
        return maxStatusRetries;
    }

    public void setMaxStatusRetries(int maxStatusRetries) {
        this.maxStatusRetries = maxStatusRetries;
    }

    public Duration getMinBackoff() {
        return minBackoff;
    }

    public void setMinBackoff(Duration minBackoff) {
        this.minBackoff = minBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public Duration getMaxRetryAfter() {
        return maxRetryAfter;
    }

    public void setMaxRetryAfter(Duration maxRetryAfter) {
        this.maxRetryAfter = maxRetryAfter;
    }

    public double getJitter() {
        return jitter;
    }

    public void setJitter(double jitter) {
        this.jitter = jitter;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
        this.maxWait = maxWait;
    }

    public int getMaxInMemorySize() {
        return maxInMemorySize;
    }

    public void setMaxInMemorySize(int maxInMemorySize) {
        this.maxInMemorySize = maxInMemorySize;
    }
}
