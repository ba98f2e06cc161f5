package io.mersel.services.media.application.models;

import java.util.List;

/**
 * Tek bir set'in doğrulama sonucu.
 *
 * @param set      Doğrulanan set (öğeleri sorgu anındaki sırasıyla)
 * @param statuses Öğe bazında sınıflandırma, uzak sırayla
 */
public record SetVerification(RemoteAssetSet set, List<AssetStatus> statuses) {

    /** Tüm öğeler tamamlandıysa rapor tek satıra indirgenir. */
    public boolean isCompact() {
        return statuses.stream().noneMatch(AssetStatus::needsAttention);
    }

    public long stuckCount() {
        return statuses.stream()
                .filter(s -> s.classification() == AssetStatus.Classification.STUCK)
                .count();
    }

    public long failedCount() {
        return statuses.stream()
                .filter(s -> s.classification() == AssetStatus.Classification.FAILED)
                .count();
    }

    public List<AssetStatus> attentionItems() {
        return statuses.stream().filter(AssetStatus::needsAttention).toList();
    }
}
