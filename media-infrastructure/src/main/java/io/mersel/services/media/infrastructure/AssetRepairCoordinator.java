package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.interfaces.CardinalityMismatchException;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.interfaces.RemoteNotFoundException;
import io.mersel.services.media.application.models.AssetGroupKey;
import io.mersel.services.media.application.models.AssetStatus;
import io.mersel.services.media.application.models.ItemResult;
import io.mersel.services.media.application.models.LocalAssetFile;
import io.mersel.services.media.application.models.LocalAssetIndex;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.SetVerification;
import io.mersel.services.media.application.models.VerifyReport;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Takılı veya başarısız asset'leri onarır: uzak asset silinir, aynı alfabetik pozisyondaki
 * yerel dosya yeniden yüklenir ve set sırası geri yüklenir.
 * <p>
 * Eşleştirme anahtarı dosya adı değil pozisyondur. Bu yüzden grubun yerel dosya sayısı
 * uzak öğe sayısına eşit değilse o grup onarılmaz ve uyuşmazlık raporlanır. Diğer gruplar etkilenmez.
 */
@Component
public class AssetRepairCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AssetRepairCoordinator.class);

    private final IMediaApiClient apiClient;
    private final AssetUploadPipeline uploadPipeline;
    private final SetReorderCoordinator reorderCoordinator;
    private final MediaSyncMetrics metrics;

    public AssetRepairCoordinator(IMediaApiClient apiClient, AssetUploadPipeline uploadPipeline,
                                  SetReorderCoordinator reorderCoordinator, MediaSyncMetrics metrics) {
        this.apiClient = apiClient;
        this.uploadPipeline = uploadPipeline;
        this.reorderCoordinator = reorderCoordinator;
        this.metrics = metrics;
    }

    public List<ItemResult> repair(VerifyReport report, LocalAssetIndex index) {
        List<ItemResult> results = new ArrayList<>();
        for (SetVerification verification : report.setsNeedingAttention()) {
            results.addAll(repairSet(verification, index));
        }
        return results;
    }

    private List<ItemResult> repairSet(SetVerification verification, LocalAssetIndex index) {
        RemoteAssetSet set = verification.set();
        AssetGroupKey group = set.groupKey();
        List<ItemResult> results = new ArrayList<>();

        // Rapor eski olabilir; setin güncel hali okunur
        List<RemoteAsset> current;
        try {
            current = apiClient.listAssets(set.id(), set.kind());
        } catch (RemoteNotFoundException e) {
            log.warn("[{}] set artık yok, onarım atlanıyor", group);
            verification.attentionItems().forEach(s ->
                    results.add(ItemResult.skipped(itemName(group, s.position()), "set bulunamadı")));
            return results;
        } catch (MediaSyncException e) {
            verification.attentionItems().forEach(s ->
                    results.add(ItemResult.failed(itemName(group, s.position()), e.getMessage())));
            return results;
        }

        List<LocalAssetFile> localFiles = index.files(group);
        if (localFiles.size() != current.size()) {
            CardinalityMismatchException mismatch =
                    new CardinalityMismatchException(group, localFiles.size(), current.size());
            log.warn("{}", mismatch.getMessage());
            verification.attentionItems().forEach(s ->
                    results.add(ItemResult.failed(itemName(group, s.position()), mismatch.getMessage())));
            return results;
        }

        List<String> orderedIds = new ArrayList<>(current.stream().map(RemoteAsset::id).toList());
        boolean mutated = false;

        for (AssetStatus status : verification.attentionItems()) {
            String assetId = status.asset().id();
            int slot = orderedIds.indexOf(assetId);
            if (slot < 0) {
                results.add(ItemResult.skipped(itemName(group, status.position()),
                        "asset artık sette değil: " + assetId));
                continue;
            }
            int position = slot + 1;
            String item = itemName(group, position);

            Optional<LocalAssetFile> local = index.fileAt(group, position);
            if (local.isEmpty()) {
                results.add(ItemResult.skipped(item, "eşleşen yerel dosya yok"));
                continue;
            }

            try {
                apiClient.deleteAsset(assetId, set.kind());
            } catch (RemoteNotFoundException e) {
                log.info("  {} zaten silinmiş, yeniden yükleniyor", assetId);
            } catch (MediaSyncException e) {
                log.warn("  {} silinemedi, onarım atlanıyor: {}", item, e.getMessage());
                metrics.recordRepair(false);
                results.add(ItemResult.failed(item, "silme başarısız: " + e.getMessage()));
                continue;
            }
            mutated = true;

            try {
                RemoteAsset uploaded = uploadPipeline.upload(local.get(), set.id());
                orderedIds.set(slot, uploaded.id());
                metrics.recordRepair(true);
                results.add(ItemResult.succeeded(item + " (" + local.get().fileName() + ")"));
            } catch (MediaSyncException e) {
                orderedIds.set(slot, null);
                log.warn("  {} yeniden yüklenemedi: {}", item, e.getMessage());
                metrics.recordRepair(false);
                results.add(ItemResult.failed(item, e.getMessage()));
            }
        }

        if (mutated) {
            List<String> finalOrder = orderedIds.stream().filter(Objects::nonNull).toList();
            try {
                reorderCoordinator.reorder(set.id(), set.kind(), finalOrder);
            } catch (MediaSyncException e) {
                log.warn("[{}] onarım sonrası sıralama başarısız: {}", group, e.getMessage());
                results.add(ItemResult.failed(group + " (sıralama)", e.getMessage()));
            }
        }
        return results;
    }

    private static String itemName(AssetGroupKey group, int position) {
        return group + " #" + position;
    }
}
