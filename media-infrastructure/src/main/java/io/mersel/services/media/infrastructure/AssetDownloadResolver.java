package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.models.DeliveryDescriptor;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Uzak asset'in teslim tanımını byte'a çevirip {@code <root>/<locale>/<displayType>/} altına yazar.
 * <p>
 * Görsel teslim URL'leri {@code {w}}, {@code {h}}, {@code {f}} yer tutucuları içeren şablonlardır;
 * asset'in kendi genişlik, yükseklik ve biçimi yerine konur. Video URL'leri doğrudan kullanılır.
 * Aynı sette aynı adı taşıyan öğeler birbirini ezmesin diye dosya adları uzak pozisyona göre
 * {@code 01_}, {@code 02_} ... önekini alır.
 */
@Component
public class AssetDownloadResolver {

    private static final Logger log = LoggerFactory.getLogger(AssetDownloadResolver.class);

    private final IMediaApiClient apiClient;
    private final MediaSyncMetrics metrics;

    public AssetDownloadResolver(IMediaApiClient apiClient, MediaSyncMetrics metrics) {
        this.apiClient = apiClient;
        this.metrics = metrics;
    }

    /**
     * @param asset     indirilecek asset
     * @param kind      asset türü
     * @param position  setteki 1 tabanlı uzak pozisyon
     * @param targetDir hedef klasör (yoksa oluşturulur)
     * @return yazılan dosya
     */
    public Path download(RemoteAsset asset, AssetKind kind, int position, Path targetDir) throws MediaSyncException {
        String url = resolveUrl(asset);
        Path target = targetDir.resolve(outputFileName(position, originalName(asset, kind)));

        byte[] bytes;
        try {
            bytes = apiClient.fetchBytes(url);
        } catch (MediaSyncException e) {
            metrics.recordDownload(kind.label(), false, 0);
            throw e;
        }

        try {
            Files.createDirectories(targetDir);
            Path temp = Files.createTempFile(targetDir, ".download-", ".part");
            try {
                Files.write(temp, bytes);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            metrics.recordDownload(kind.label(), false, 0);
            throw new MediaSyncException("Dosya yazılamadı: " + target + " — " + e.getMessage(), e);
        }

        metrics.recordDownload(kind.label(), true, bytes.length);
        log.debug("  {} indirildi ({} byte)", target.getFileName(), bytes.length);
        return target;
    }

    /**
     * Teslim tanımından somut indirme URL'si üretir.
     *
     * @throws MediaSyncException asset henüz teslim URL'si taşımıyorsa (ör. işlenmesi bitmemiş)
     */
    public static String resolveUrl(RemoteAsset asset) throws MediaSyncException {
        DeliveryDescriptor delivery = asset.delivery();
        if (delivery == null || delivery.url() == null || delivery.url().isBlank()) {
            throw new MediaSyncException("Asset " + asset.id() + " için teslim URL'si yok (durum: "
                    + asset.state() + ")");
        }
        if (delivery.type() == DeliveryDescriptor.Type.VIDEO_URL) {
            return delivery.url();
        }
        return delivery.url()
                .replace("{w}", String.valueOf(delivery.width()))
                .replace("{h}", String.valueOf(delivery.height()))
                .replace("{f}", imageFormat(asset.fileName()));
    }

    public static String outputFileName(int position, String originalName) {
        return String.format("%02d_%s", position, originalName);
    }

    static String imageFormat(String fileName) {
        String extension = fileName == null ? "" : LocalAssetIndexer.extension(fileName);
        return extension.equals("jpg") || extension.equals("jpeg") ? "jpg" : "png";
    }

    private static String originalName(RemoteAsset asset, AssetKind kind) {
        if (asset.fileName() != null && !asset.fileName().isBlank()) {
            return Path.of(asset.fileName()).getFileName().toString();
        }
        return asset.id() + (kind == AssetKind.SCREENSHOT ? ".png" : ".mp4");
    }
}
