package com.fitcoach.backend.resolution.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.program-resolution")
public class ProgramResolutionProperties {

    /**
     * true：任一讀取失敗就整個 call 失敗（503）
     * false：失敗的那一種當作空，其他照常（degradedKinds 會標出來）
     */
    private boolean strictConsistency = false;

    /** 單一讀取的 timeout（預設 5 秒） */
    private Duration readTimeout = Duration.ofSeconds(5);

    /** 「今天」用哪個時區算（steps 的 synthetic entry 日期） */
    private String zone = "UTC";

    private int fetchPoolSize = 8;

    private int fetchQueueCapacity = 200;

    // getters/setters
    public boolean isStrictConsistency() { return strictConsistency; }
    public void setStrictConsistency(boolean strictConsistency) { this.strictConsistency = strictConsistency; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public int getFetchPoolSize() { return fetchPoolSize; }
    public void setFetchPoolSize(int fetchPoolSize) { this.fetchPoolSize = fetchPoolSize; }

    public int getFetchQueueCapacity() { return fetchQueueCapacity; }
    public void setFetchQueueCapacity(int fetchQueueCapacity) { this.fetchQueueCapacity = fetchQueueCapacity; }
}
