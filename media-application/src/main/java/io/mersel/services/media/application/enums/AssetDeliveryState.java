package io.mersel.services.media.application.enums;

import java.util.Locale;

/**
 * Uzak asset'in işlenme durumu ({@code assetDeliveryState.state}).
 * <p>
 * Yaşam döngüsü: {@code AWAITING_UPLOAD → UPLOAD_COMPLETE → COMPLETE}, ya da terminal {@code FAILED}.
 * {@code COMPLETE} geçişini yalnızca sunucu yapar; istemci sadece sorgulayabilir.
 */
public enum AssetDeliveryState {

    AWAITING_UPLOAD,
    UPLOAD_COMPLETE,
    COMPLETE,
    FAILED,

    /** API durum alanını hiç döndürmediğinde veya tanınmayan bir değer geldiğinde */
    UNKNOWN;

    /**
     * API'den gelen ham değeri enum'a çevirir. Tanınmayan değerler {@link #UNKNOWN} olur.
     */
    public static AssetDeliveryState fromApiValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
