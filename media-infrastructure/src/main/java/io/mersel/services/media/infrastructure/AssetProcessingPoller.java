package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.interfaces.TransportException;
import io.mersel.services.media.application.models.ProcessingPollResult;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.infrastructure.config.MediaSyncProperties;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Commit sonrası sunucu tarafı işlenmenin bitmesini sınırlı bir döngüyle bekler.
 * <p>
 * Push kanalı olmadığından asset belirli aralıklarla okunur; {@code COMPLETE}, {@code FAILED}
 * veya süre dolması ile döner.
 */
@Component
public class AssetProcessingPoller {

    private static final Logger log = LoggerFactory.getLogger(AssetProcessingPoller.class);

    /** Test için değiştirilebilir bekleme. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final IMediaApiClient apiClient;
    private final MediaSyncProperties properties;
    private final MediaSyncMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public AssetProcessingPoller(IMediaApiClient apiClient, MediaSyncProperties properties,
                                 MediaSyncMetrics metrics, Clock clock) {
        this(apiClient, properties, metrics, clock, Thread::sleep);
    }

    AssetProcessingPoller(IMediaApiClient apiClient, MediaSyncProperties properties,
                          MediaSyncMetrics metrics, Clock clock, Sleeper sleeper) {
        this.apiClient = apiClient;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public ProcessingPollResult await(String assetId, AssetKind kind) throws MediaSyncException {
        return await(assetId, kind, Duration.ofMillis(properties.getPollIntervalMs()),
                Duration.ofMillis(properties.getPollTimeoutMs()));
    }

    public ProcessingPollResult await(String assetId, AssetKind kind, Duration interval, Duration deadline)
            throws MediaSyncException {
        long start = clock.millis();
        int attempts = 0;
        ProcessingPollResult result;

        while (true) {
            attempts++;
            RemoteAsset asset = apiClient.fetchAsset(assetId, kind);
            if (asset.state() == AssetDeliveryState.COMPLETE) {
                result = ProcessingPollResult.complete(asset, attempts);
                break;
            }
            if (asset.state() == AssetDeliveryState.FAILED) {
                result = ProcessingPollResult.failed(asset, attempts);
                break;
            }
            if (clock.millis() - start + interval.toMillis() >= deadline.toMillis()) {
                result = ProcessingPollResult.timedOut(asset, attempts);
                break;
            }
            log.debug("Asset {} henüz işlenmedi ({}), {} ms sonra tekrar bakılacak",
                    assetId, asset.state(), interval.toMillis());
            try {
                sleeper.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("İşlenme beklemesi kesildi: " + assetId, e);
            }
        }

        metrics.recordProcessingWait(result.status().name().toLowerCase(Locale.ROOT), clock.millis() - start);
        return result;
    }
}
