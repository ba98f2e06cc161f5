package io.mersel.services.media.application.models;

import io.mersel.services.media.application.enums.AssetDeliveryState;

import java.util.List;

/**
 * Uzak set içindeki tek bir ekran görüntüsü veya önizleme.
 *
 * @param id         Asset kimliği
 * @param fileName   Yüklenirken bildirilen dosya adı
 * @param fileSize   Bildirilen boyut (byte)
 * @param checksum   Commit sırasında gönderilen MD5 (henüz commit edilmediyse {@code null})
 * @param state      İşlenme durumu
 * @param delivery   Teslim tanımı ({@code null}: henüz işlenmedi)
 * @param errors     Sunucunun {@code assetDeliveryState.errors} içinde bildirdiği hata kodları
 */
public record RemoteAsset(
        String id,
        String fileName,
        long fileSize,
        String checksum,
        AssetDeliveryState state,
        DeliveryDescriptor delivery,
        List<String> errors
) {

    public boolean isComplete() {
        return state == AssetDeliveryState.COMPLETE;
    }
}
