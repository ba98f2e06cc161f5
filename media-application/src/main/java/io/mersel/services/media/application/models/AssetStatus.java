package io.mersel.services.media.application.models;

/**
 * Doğrulama sırasında tek bir uzak asset'in sınıflandırması.
 *
 * @param asset          Uzak asset
 * @param position       Set içindeki 1 tabanlı uzak sıra
 * @param classification Sınıf
 */
public record AssetStatus(RemoteAsset asset, int position, Classification classification) {

    /**
     * {@code STUCK}: tamamlanmamış ve başarısız da olmamış; operatör kararı bekler.
     * Otomatik zaman aşımı eşiği uygulanmaz.
     */
    public enum Classification { COMPLETE, STUCK, FAILED }

    public boolean needsAttention() {
        return classification != Classification.COMPLETE;
    }
}
