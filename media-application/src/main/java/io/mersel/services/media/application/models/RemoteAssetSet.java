package io.mersel.services.media.application.models;

import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.enums.AssetKind;

import java.util.List;

/**
 * Bir locale × display type için uzak set ve sıralı öğeleri.
 * <p>
 * {@code displayType} her zaman yerel klasör adı biçimindedir; önizleme setleri için
 * REST istemcisi {@code IPHONE_67 → APP_IPHONE_67} dönüşümünü yapar.
 *
 * @param id          Set kimliği
 * @param locale      Locale
 * @param displayType Display type klasör adı
 * @param kind        Set türü
 * @param items       Uzak sıraya göre öğeler
 */
public record RemoteAssetSet(
        String id,
        String locale,
        String displayType,
        AssetKind kind,
        List<RemoteAsset> items
) {

    public AssetGroupKey groupKey() {
        return new AssetGroupKey(locale, displayType, kind);
    }

    public List<String> itemIds() {
        return items.stream().map(RemoteAsset::id).toList();
    }

    /**
     * Set'in toplu durumu: en geride kalan öğenin durumu. Boş set {@code COMPLETE} sayılır.
     */
    public AssetDeliveryState state() {
        if (items.stream().anyMatch(a -> a.state() == AssetDeliveryState.FAILED)) {
            return AssetDeliveryState.FAILED;
        }
        return items.stream()
                .map(RemoteAsset::state)
                .filter(s -> s != AssetDeliveryState.COMPLETE)
                .min(Enum::compareTo)
                .orElse(AssetDeliveryState.COMPLETE);
    }
}
