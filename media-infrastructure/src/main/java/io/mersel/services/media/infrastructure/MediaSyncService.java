package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.IMediaSyncService;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.interfaces.RemoteNotFoundException;
import io.mersel.services.media.application.models.AssetGroupKey;
import io.mersel.services.media.application.models.ItemResult;
import io.mersel.services.media.application.models.LocalAssetFile;
import io.mersel.services.media.application.models.LocalAssetIndex;
import io.mersel.services.media.application.models.ProcessingPollResult;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.SyncSummary;
import io.mersel.services.media.application.models.UploadOptions;
import io.mersel.services.media.application.models.VerifyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Medya senkronizasyonu orkestrasyonu.
 * <ul>
 *   <li>upload: tarama → set çözümleme → dosya başına yükleme → sıralama</li>
 *   <li>download: uzak setler → asset başına indirme</li>
 *   <li>verify: durum sınıflama (salt okunur)</li>
 *   <li>repair: takılı öğeleri pozisyona göre yeniden yükleme → sıralama</li>
 * </ul>
 * Dosya/asset seviyesindeki hatalar özet içinde toplanır, kardeş öğelerin işlenmesini durdurmaz.
 * Her komut uzak durumu baştan okur.
 */
@Service
public class MediaSyncService implements IMediaSyncService {

    private static final Logger log = LoggerFactory.getLogger(MediaSyncService.class);

    private final LocalAssetIndexer indexer;
    private final IMediaApiClient apiClient;
    private final RemoteSetResolver setResolver;
    private final AssetUploadPipeline uploadPipeline;
    private final SetReorderCoordinator reorderCoordinator;
    private final AssetDownloadResolver downloadResolver;
    private final AssetStateVerifier stateVerifier;
    private final AssetRepairCoordinator repairCoordinator;
    private final AssetProcessingPoller processingPoller;

    public MediaSyncService(LocalAssetIndexer indexer,
                            IMediaApiClient apiClient,
                            RemoteSetResolver setResolver,
                            AssetUploadPipeline uploadPipeline,
                            SetReorderCoordinator reorderCoordinator,
                            AssetDownloadResolver downloadResolver,
                            AssetStateVerifier stateVerifier,
                            AssetRepairCoordinator repairCoordinator,
                            AssetProcessingPoller processingPoller) {
        this.indexer = indexer;
        this.apiClient = apiClient;
        this.setResolver = setResolver;
        this.uploadPipeline = uploadPipeline;
        this.reorderCoordinator = reorderCoordinator;
        this.downloadResolver = downloadResolver;
        this.stateVerifier = stateVerifier;
        this.repairCoordinator = repairCoordinator;
        this.processingPoller = processingPoller;
    }

    @Override
    public LocalAssetIndex scan(Path root) throws MediaSyncException {
        return indexer.scan(root);
    }

    @Override
    public SyncSummary upload(Path root, String versionId, UploadOptions options) throws MediaSyncException {
        long startTime = System.currentTimeMillis();
        LocalAssetIndex index = indexer.scan(root);
        SyncSummary.Builder summary = SyncSummary.builder("upload").warnings(index.warnings());

        log.info("Yükleme başlıyor: sürüm={}, {} grup, mod={}", versionId, index.groups().size(),
                options.replace() ? "replace" : "append");
        List<RemoteAssetSet> snapshot = apiClient.listSets(versionId);

        for (Map.Entry<AssetGroupKey, List<LocalAssetFile>> entry : index.groups().entrySet()) {
            summary.addAll(uploadGroup(versionId, snapshot, entry.getKey(), entry.getValue(), options));
        }

        SyncSummary result = summary.durationMs(System.currentTimeMillis() - startTime).build();
        log.info("Yükleme tamamlandı: {} başarılı, {} başarısız, {} atlandı ({}ms)",
                result.succeeded(), result.failed(), result.skipped(), result.getDurationMs());
        return result;
    }

    private List<ItemResult> uploadGroup(String versionId, List<RemoteAssetSet> snapshot, AssetGroupKey group,
                                         List<LocalAssetFile> files, UploadOptions options) {
        List<ItemResult> results = new ArrayList<>();
        log.info("[{}] {} dosya", group, files.size());

        Optional<RemoteAssetSet> existing = setResolver.find(snapshot, group);
        if (options.replace() && existing.isPresent() && !existing.get().items().isEmpty()) {
            try {
                uploadPipeline.clearSet(existing.get());
            } catch (MediaSyncException e) {
                log.error("[{}] mevcut öğeler silinemedi, set atlanıyor: {}", group, e.getMessage());
                files.forEach(f -> results.add(ItemResult.failed(itemName(f),
                        "mevcut öğeler silinemedi: " + e.getMessage())));
                return results;
            }
        }

        RemoteAssetSet set;
        try {
            set = setResolver.resolveOrCreate(versionId, snapshot, group);
        } catch (RemoteNotFoundException e) {
            log.warn("[{}] sürümde bu locale yok, atlanıyor", group.locale());
            files.forEach(f -> results.add(ItemResult.skipped(itemName(f), "locale bu sürümde yok")));
            return results;
        } catch (MediaSyncException e) {
            log.error("[{}] set çözümlenemedi: {}", group, e.getMessage());
            files.forEach(f -> results.add(ItemResult.failed(itemName(f), e.getMessage())));
            return results;
        }

        List<String> keptIds = options.replace() ? List.of() : set.itemIds();
        List<String> uploadedIds = new ArrayList<>();

        for (LocalAssetFile file : files) {
            try {
                RemoteAsset asset = uploadPipeline.upload(file, set.id());
                uploadedIds.add(asset.id());
                results.add(options.waitForProcessing()
                        ? awaitProcessing(file, asset)
                        : ItemResult.succeeded(itemName(file)));
            } catch (MediaSyncException e) {
                log.error("  {} yüklenemedi: {}", file.fileName(), e.getMessage());
                results.add(ItemResult.failed(itemName(file), e.getMessage()));
            }
        }

        if (!uploadedIds.isEmpty()) {
            try {
                reorderCoordinator.reorder(set.id(), set.kind(),
                        SetReorderCoordinator.appendOrder(keptIds, uploadedIds));
            } catch (MediaSyncException e) {
                log.error("[{}] sıralama başarısız: {}", group, e.getMessage());
                results.add(ItemResult.failed(group + " (sıralama)", e.getMessage()));
            }
        }
        return results;
    }

    private ItemResult awaitProcessing(LocalAssetFile file, RemoteAsset asset) throws MediaSyncException {
        ProcessingPollResult poll = processingPoller.await(asset.id(), file.kind());
        return switch (poll.status()) {
            case COMPLETE -> ItemResult.succeeded(itemName(file));
            case FAILED -> ItemResult.failed(itemName(file),
                    "sunucu işlemesi başarısız: " + String.join("; ", poll.asset().errors()));
            case TIMED_OUT -> {
                log.warn("  {} işlenmesi süre içinde bitmedi (durum: {}), verify ile takip edin",
                        file.fileName(), poll.asset().state());
                yield ItemResult.succeeded(itemName(file));
            }
        };
    }

    @Override
    public SyncSummary download(Path root, String versionId) throws MediaSyncException {
        long startTime = System.currentTimeMillis();
        SyncSummary.Builder summary = SyncSummary.builder("download");

        List<RemoteAssetSet> sets = apiClient.listSets(versionId).stream()
                .sorted(Comparator.comparing(RemoteAssetSet::locale)
                        .thenComparing(RemoteAssetSet::displayType)
                        .thenComparing(RemoteAssetSet::kind))
                .toList();

        for (RemoteAssetSet set : sets) {
            if (set.items().isEmpty()) {
                continue;
            }
            Path targetDir = root.resolve(set.locale()).resolve(set.displayType());
            log.info("[{}] {} öğe indiriliyor", set.groupKey(), set.items().size());

            for (int i = 0; i < set.items().size(); i++) {
                RemoteAsset asset = set.items().get(i);
                String item = set.groupKey() + " #" + (i + 1);
                try {
                    Path written = downloadResolver.download(asset, set.kind(), i + 1, targetDir);
                    summary.add(ItemResult.succeeded(item + " → " + written.getFileName()));
                } catch (MediaSyncException e) {
                    log.warn("  {} indirilemedi: {}", item, e.getMessage());
                    summary.add(ItemResult.failed(item, e.getMessage()));
                }
            }
        }

        SyncSummary result = summary.durationMs(System.currentTimeMillis() - startTime).build();
        log.info("İndirme tamamlandı: {} başarılı, {} başarısız ({}ms)",
                result.succeeded(), result.failed(), result.getDurationMs());
        return result;
    }

    @Override
    public VerifyReport verify(String versionId) throws MediaSyncException {
        return stateVerifier.verify(versionId);
    }

    @Override
    public SyncSummary repair(VerifyReport report, Path root) throws MediaSyncException {
        long startTime = System.currentTimeMillis();
        LocalAssetIndex index = indexer.scan(root);
        List<ItemResult> results = repairCoordinator.repair(report, index);

        SyncSummary result = SyncSummary.builder("repair")
                .warnings(index.warnings())
                .addAll(results)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        log.info("Onarım tamamlandı: {} başarılı, {} başarısız, {} atlandı",
                result.succeeded(), result.failed(), result.skipped());
        return result;
    }

    private static String itemName(LocalAssetFile file) {
        return file.locale() + "/" + file.displayType() + "/" + file.fileName();
    }
}
