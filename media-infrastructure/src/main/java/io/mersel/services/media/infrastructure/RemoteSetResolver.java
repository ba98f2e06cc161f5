package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.models.AssetGroupKey;
import io.mersel.services.media.application.models.RemoteAssetSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * (locale, displayType, kind) anahtarını uzak set kimliğine eşler.
 * <p>
 * "Bu türde set yok" ile "set var ama boş" ayrı durumlardır; yalnızca ilki set oluşturur.
 * Oluşturmadan önce sürümün setleri tazeden okunur, başka bir çalıştırmanın aynı seti
 * yeni oluşturmuş olma ihtimaline karşı.
 */
@Component
public class RemoteSetResolver {

    private static final Logger log = LoggerFactory.getLogger(RemoteSetResolver.class);

    private final IMediaApiClient apiClient;

    public RemoteSetResolver(IMediaApiClient apiClient) {
        this.apiClient = apiClient;
    }

    /**
     * Verilen anlık görüntüde anahtara karşılık gelen seti arar.
     *
     * @return set yoksa boş; set varsa (öğesi olmasa bile) dolu
     */
    public Optional<RemoteAssetSet> find(List<RemoteAssetSet> sets, AssetGroupKey key) {
        return sets.stream()
                .filter(s -> s.groupKey().equals(key))
                .findFirst();
    }

    /**
     * Var olan seti döndürür veya yeni boş bir set oluşturur.
     *
     * @param versionId App Store sürüm kimliği
     * @param snapshot  komut başında okunan setler
     * @param key       hedef grup
     */
    public RemoteAssetSet resolveOrCreate(String versionId, List<RemoteAssetSet> snapshot, AssetGroupKey key)
            throws MediaSyncException {
        Optional<RemoteAssetSet> existing = find(snapshot, key);
        if (existing.isPresent()) {
            return existing.get();
        }

        Optional<RemoteAssetSet> recheck = find(apiClient.listSets(versionId), key);
        if (recheck.isPresent()) {
            log.info("Set [{}] bu arada başka bir işlemle oluşturulmuş, mevcut set kullanılıyor: {}",
                    key, recheck.get().id());
            return recheck.get();
        }

        String setId = apiClient.createSet(versionId, key.locale(), key.displayType(), key.kind());
        return new RemoteAssetSet(setId, key.locale(), key.displayType(), key.kind(), List.of());
    }
}
