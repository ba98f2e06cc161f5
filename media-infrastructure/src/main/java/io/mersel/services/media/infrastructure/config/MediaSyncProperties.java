package io.mersel.services.media.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Medya senkronizasyonu yapılandırma özellikleri.
 * <p>
 * {@code asc.media} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code base-url} — App Store Connect API kök adresi (testlerde WireMock)</li>
 *   <li>{@code connect-timeout-ms} / {@code read-timeout-ms} — HTTP zaman aşımları</li>
 *   <li>{@code transfer-parallelism} — tek bir asset için eşzamanlı chunk aktarımı</li>
 *   <li>{@code transfer-max-attempts} — chunk başına deneme sayısı</li>
 *   <li>{@code api-max-attempts} — API çağrısı başına deneme sayısı (429/5xx)</li>
 *   <li>{@code retry-backoff-ms} — denemeler arası doğrusal bekleme birimi</li>
 *   <li>{@code reserve-restart-attempts} — presigned URL süresi dolduğunda rezervasyondan yeniden başlama</li>
 *   <li>{@code poll-interval-ms} / {@code poll-timeout-ms} — işlenme bekleme döngüsü</li>
 *   <li>{@code page-limit} — liste uç noktalarında sayfa boyutu</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "asc.media")
public class MediaSyncProperties {

    private static final Logger log = LoggerFactory.getLogger(MediaSyncProperties.class);

    private String baseUrl = "https://api.appstoreconnect.apple.com";
    private int connectTimeoutMs = 10000;
    private int readTimeoutMs = 60000;
    private int transferParallelism = 4;
    private int transferMaxAttempts = 3;
    private int apiMaxAttempts = 3;
    private long retryBackoffMs = 1000;
    private int reserveRestartAttempts = 1;
    private long pollIntervalMs = 5000;
    private long pollTimeoutMs = 300000;
    private int pageLimit = 50;

    @PostConstruct
    void validate() {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.warn("base-url boş, varsayılan App Store Connect adresi kullanılıyor");
            baseUrl = "https://api.appstoreconnect.apple.com";
        }
        if (connectTimeoutMs <= 0) {
            log.warn("connect-timeout-ms değeri pozitif olmalı (verilen: {}), varsayılan 10000 ms kullanılıyor", connectTimeoutMs);
            connectTimeoutMs = 10000;
        }
        if (readTimeoutMs <= 0) {
            log.warn("read-timeout-ms değeri pozitif olmalı (verilen: {}), varsayılan 60000 ms kullanılıyor", readTimeoutMs);
            readTimeoutMs = 60000;
        }
        if (transferParallelism <= 0) {
            log.warn("transfer-parallelism değeri pozitif olmalı (verilen: {}), varsayılan 4 kullanılıyor", transferParallelism);
            transferParallelism = 4;
        }
        if (transferMaxAttempts <= 0) {
            log.warn("transfer-max-attempts değeri pozitif olmalı (verilen: {}), varsayılan 3 kullanılıyor", transferMaxAttempts);
            transferMaxAttempts = 3;
        }
        if (apiMaxAttempts <= 0) {
            log.warn("api-max-attempts değeri pozitif olmalı (verilen: {}), varsayılan 3 kullanılıyor", apiMaxAttempts);
            apiMaxAttempts = 3;
        }
        if (retryBackoffMs < 0) {
            log.warn("retry-backoff-ms negatif olamaz (verilen: {}), varsayılan 1000 ms kullanılıyor", retryBackoffMs);
            retryBackoffMs = 1000;
        }
        if (reserveRestartAttempts < 0) {
            log.warn("reserve-restart-attempts negatif olamaz (verilen: {}), varsayılan 1 kullanılıyor", reserveRestartAttempts);
            reserveRestartAttempts = 1;
        }
        if (pollIntervalMs <= 0) {
            log.warn("poll-interval-ms değeri pozitif olmalı (verilen: {}), varsayılan 5000 ms kullanılıyor", pollIntervalMs);
            pollIntervalMs = 5000;
        }
        if (pollTimeoutMs <= 0) {
            log.warn("poll-timeout-ms değeri pozitif olmalı (verilen: {}), varsayılan 300000 ms kullanılıyor", pollTimeoutMs);
            pollTimeoutMs = 300000;
        }
        if (pageLimit <= 0 || pageLimit > 200) {
            log.warn("page-limit 1-200 aralığında olmalı (verilen: {}), varsayılan 50 kullanılıyor", pageLimit);
            pageLimit = 50;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getTransferParallelism() {
        return transferParallelism;
    }

    public void setTransferParallelism(int transferParallelism) {
        this.transferParallelism = transferParallelism;
    }

    public int getTransferMaxAttempts() {
        return transferMaxAttempts;
    }

    public void setTransferMaxAttempts(int transferMaxAttempts) {
        this.transferMaxAttempts = transferMaxAttempts;
    }

    public int getApiMaxAttempts() {
        return apiMaxAttempts;
    }

    public void setApiMaxAttempts(int apiMaxAttempts) {
        this.apiMaxAttempts = apiMaxAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public int getReserveRestartAttempts() {
        return reserveRestartAttempts;
    }

    public void setReserveRestartAttempts(int reserveRestartAttempts) {
        this.reserveRestartAttempts = reserveRestartAttempts;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public int getPageLimit() {
        return pageLimit;
    }

    public void setPageLimit(int pageLimit) {
        this.pageLimit = pageLimit;
    }
}
