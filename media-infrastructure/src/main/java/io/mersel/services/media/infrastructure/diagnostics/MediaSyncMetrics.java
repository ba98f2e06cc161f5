package io.mersel.services.media.infrastructure.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Medya senkronizasyonu metrikleri.
 * <p>
 * Yükleme, indirme, onarım, yeniden sıralama ve chunk yeniden denemelerini sayar.
 */
@Component
public class MediaSyncMetrics {

    private final MeterRegistry registry;

    public MediaSyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Tek bir asset yüklemesini kaydet.
     *
     * @param kind       "screenshot" veya "preview"
     * @param success    Commit başarılı mı
     * @param durationMs Reserve → commit süresi (milisaniye)
     */
    public void recordUpload(String kind, boolean success, long durationMs) {
        Counter.builder("asc_media_upload_total")
                .tag("kind", kind)
                .tag("status", success ? "success" : "failure")
                .description("Asset yükleme sayısı")
                .register(registry)
                .increment();

        Timer.builder("asc_media_upload_duration_seconds")
                .tag("kind", kind)
                .description("Asset yükleme süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Tek bir asset indirmesini kaydet.
     */
    public void recordDownload(String kind, boolean success, long bytes) {
        Counter.builder("asc_media_download_total")
                .tag("kind", kind)
                .tag("status", success ? "success" : "failure")
                .description("Asset indirme sayısı")
                .register(registry)
                .increment();

        if (success) {
            Counter.builder("asc_media_download_bytes_total")
                    .tag("kind", kind)
                    .description("İndirilen toplam byte")
                    .register(registry)
                    .increment(bytes);
        }
    }

    /**
     * Onarım (sil + yeniden yükle) sonucunu kaydet.
     */
    public void recordRepair(boolean success) {
        Counter.builder("asc_media_repair_total")
                .tag("status", success ? "success" : "failure")
                .description("Takılı asset onarım sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Chunk aktarımının tekrar denenmesini kaydet.
     */
    public void recordChunkRetry() {
        Counter.builder("asc_media_chunk_retry_total")
                .description("Chunk aktarımı yeniden deneme sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Set sıralama güncellemesini kaydet.
     */
    public void recordReorder(String kind, int itemCount) {
        Counter.builder("asc_media_reorder_total")
                .tag("kind", kind)
                .description("Set sıralama güncelleme sayısı")
                .register(registry)
                .increment();

        Counter.builder("asc_media_reorder_items_total")
                .tag("kind", kind)
                .description("Sıralaması gönderilen toplam öğe")
                .register(registry)
                .increment(itemCount);
    }

    /**
     * Sunucu tarafı işlenme bekleme sonucu.
     *
     * @param result "complete", "failed" veya "timed_out"
     */
    public void recordProcessingWait(String result, long durationMs) {
        Counter.builder("asc_media_processing_wait_total")
                .tag("result", result)
                .description("İşlenme bekleme sonucu")
                .register(registry)
                .increment();

        Timer.builder("asc_media_processing_wait_duration_seconds")
                .description("İşlenme bekleme süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }
}
