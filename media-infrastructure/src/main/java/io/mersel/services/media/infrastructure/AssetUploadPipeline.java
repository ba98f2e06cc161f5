package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.IntegrityException;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.interfaces.TransportException;
import io.mersel.services.media.application.models.AssetReservation;
import io.mersel.services.media.application.models.LocalAssetFile;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.infrastructure.config.MediaSyncProperties;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Tek bir dosyanın yükleme protokolü: rezervasyon → parça aktarımı → checksum commit.
 * <p>
 * Commit ancak tüm parçalar aktarıldıktan sonra yapılır ve asset'i {@code UPLOAD_COMPLETE}
 * durumuna geçiren tek çağrıdır. Checksum reddi {@link IntegrityException}
 * olarak, ağ hataları {@link TransportException} olarak ayrı yüzeye çıkar.
 * <p>
 * Presigned URL'nin süresi dolmuşsa yarım kalan rezervasyon silinir ve yükleme rezervasyondan
 * yeniden başlar ({@code asc.media.reserve-restart-attempts}).
 */
@Component
public class AssetUploadPipeline {

    private static final Logger log = LoggerFactory.getLogger(AssetUploadPipeline.class);

    private final IMediaApiClient apiClient;
    private final ChunkTransferExecutor transferExecutor;
    private final MediaSyncProperties properties;
    private final MediaSyncMetrics metrics;

    public AssetUploadPipeline(IMediaApiClient apiClient, ChunkTransferExecutor transferExecutor,
                               MediaSyncProperties properties, MediaSyncMetrics metrics) {
        this.apiClient = apiClient;
        this.transferExecutor = transferExecutor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Dosyayı verilen sete yükler.
     *
     * @return commit sonrası uzak asset
     */
    public RemoteAsset upload(LocalAssetFile file, String setId) throws MediaSyncException {
        long startTime = System.currentTimeMillis();
        boolean success = false;
        try {
            String checksum = checksumOf(file);
            RemoteAsset asset = reserveTransferCommit(file, setId, checksum);
            success = true;
            log.info("  {} yüklendi → {} ({})", file.fileName(), asset.id(), asset.state());
            return asset;
        } finally {
            metrics.recordUpload(file.kind().label(), success, System.currentTimeMillis() - startTime);
        }
    }

    private RemoteAsset reserveTransferCommit(LocalAssetFile file, String setId, String checksum)
            throws MediaSyncException {
        int maxRestarts = properties.getReserveRestartAttempts();
        for (int restart = 0; ; restart++) {
            AssetReservation reservation = apiClient.reserveAsset(setId, file.kind(), file.fileName(), file.fileSize());
            try {
                transferExecutor.transferAll(file.path(), reservation.operations());
            } catch (TransportException e) {
                discardReservation(reservation, file);
                if (e.isUploadUrlExpired() && restart < maxRestarts) {
                    log.warn("  {} için upload URL'lerinin süresi doldu, rezervasyon yenileniyor ({}/{})",
                            file.fileName(), restart + 1, maxRestarts);
                    continue;
                }
                throw e;
            }
            try {
                return apiClient.commitAsset(reservation.assetId(), file.kind(), checksum, true);
            } catch (IntegrityException e) {
                discardReservation(reservation, file);
                throw new IntegrityException(file.fileName(), e.getDetail());
            } catch (MediaSyncException e) {
                discardReservation(reservation, file);
                throw e;
            }
        }
    }

    /**
     * {@code --replace} ön koşulu: setteki tüm öğeleri sırayla siler.
     * Herhangi bir silme başarısız olursa istisna yükselir ve o set için yükleme yapılmamalıdır.
     */
    public void clearSet(RemoteAssetSet set) throws MediaSyncException {
        log.info("[{}] mevcut {} öğe siliniyor", set.groupKey(), set.items().size());
        for (RemoteAsset asset : set.items()) {
            apiClient.deleteAsset(asset.id(), set.kind());
        }
    }

    /**
     * Aktarımı ya da commit'i tamamlanamayan rezervasyonu siler; aksi halde yetim asset
     * sette kalır ve grubun sıralama isteği reddedilir.
     */
    private void discardReservation(AssetReservation reservation, LocalAssetFile file) {
        try {
            apiClient.deleteAsset(reservation.assetId(), file.kind());
        } catch (MediaSyncException e) {
            log.warn("  {} için yarım rezervasyon ({}) silinemedi: {}", file.fileName(),
                    reservation.assetId(), e.getMessage());
        }
    }

    private static String checksumOf(LocalAssetFile file) throws MediaSyncException {
        try {
            return FileChecksums.md5Hex(file.path());
        } catch (IOException e) {
            throw new MediaSyncException("Dosya okunamadı: " + file.path() + " — " + e.getMessage(), e);
        }
    }
}
