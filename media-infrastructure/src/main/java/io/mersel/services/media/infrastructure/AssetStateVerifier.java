package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.models.AssetStatus;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.SetVerification;
import io.mersel.services.media.application.models.VerifyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sürümdeki tüm setlerin ve öğelerin işlenme durumunu sınıflar. Yalnızca okur.
 * <p>
 * Zaman eşiği uygulanmaz: {@code COMPLETE} ve {@code FAILED} dışındaki her öğe "takılı"
 * sayılır ve onarım kararı operatöre bırakılır.
 */
@Component
public class AssetStateVerifier {

    private static final Logger log = LoggerFactory.getLogger(AssetStateVerifier.class);

    private static final Comparator<RemoteAssetSet> SET_ORDER = Comparator
            .comparing(RemoteAssetSet::locale)
            .thenComparing(RemoteAssetSet::displayType)
            .thenComparing(RemoteAssetSet::kind);

    private final IMediaApiClient apiClient;

    public AssetStateVerifier(IMediaApiClient apiClient) {
        this.apiClient = apiClient;
    }

    public VerifyReport verify(String versionId) throws MediaSyncException {
        List<SetVerification> verifications = new ArrayList<>();
        for (RemoteAssetSet set : apiClient.listSets(versionId).stream().sorted(SET_ORDER).toList()) {
            verifications.add(verifySet(set));
        }
        VerifyReport report = new VerifyReport(versionId, verifications);
        log.info("Doğrulama: {} öğe, {} tamam, {} takılı, {} başarısız",
                report.total(), report.completeCount(), report.stuckCount(), report.failedCount());
        return report;
    }

    static SetVerification verifySet(RemoteAssetSet set) {
        List<AssetStatus> statuses = new ArrayList<>();
        for (int i = 0; i < set.items().size(); i++) {
            RemoteAsset asset = set.items().get(i);
            statuses.add(new AssetStatus(asset, i + 1, classify(asset)));
        }
        AssetDeliveryState setState = set.state();
        if (setState != AssetDeliveryState.COMPLETE) {
            log.debug("[{}] set durumu: {}", set.groupKey(), setState);
        }
        return new SetVerification(set, statuses);
    }

    static AssetStatus.Classification classify(RemoteAsset asset) {
        if (asset.isComplete()) {
            return AssetStatus.Classification.COMPLETE;
        }
        if (asset.state() == AssetDeliveryState.FAILED) {
            return AssetStatus.Classification.FAILED;
        }
        return AssetStatus.Classification.STUCK;
    }
}
