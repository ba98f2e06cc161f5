package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Setin öğe sırasını yerel alfabetik sıraya göre tek bir ilişki güncellemesiyle gönderir.
 * <p>
 * Aynı sete aynı anda yalnızca bir sıralama çağrısı yapılır.
 */
@Component
public class SetReorderCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SetReorderCoordinator.class);

    private final IMediaApiClient apiClient;
    private final MediaSyncMetrics metrics;
    private final Map<String, ReentrantLock> setLocks = new ConcurrentHashMap<>();

    public SetReorderCoordinator(IMediaApiClient apiClient, MediaSyncMetrics metrics) {
        this.apiClient = apiClient;
        this.metrics = metrics;
    }

    public void reorder(String setId, AssetKind kind, List<String> orderedAssetIds) throws MediaSyncException {
        if (orderedAssetIds.isEmpty()) {
            log.debug("Set {} boş, sıralama atlanıyor", setId);
            return;
        }
        ReentrantLock lock = setLocks.computeIfAbsent(setId, id -> new ReentrantLock());
        lock.lock();
        try {
            apiClient.reorderSet(setId, kind, orderedAssetIds);
            metrics.recordReorder(kind.label(), orderedAssetIds.size());
            log.debug("Set {} sıralandı: {} öğe", setId, orderedAssetIds.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ekleme modunda hedef sıra: sette zaten olan öğeler kendi sıralarıyla önde,
     * yeni yüklenenler yerel sırayla arkada.
     */
    public static List<String> appendOrder(List<String> existingIds, List<String> uploadedIds) {
        LinkedHashSet<String> order = new LinkedHashSet<>(existingIds);
        order.addAll(uploadedIds);
        return new ArrayList<>(order);
    }
}
