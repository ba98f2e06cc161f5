package io.mersel.services.media.application.interfaces;

/**
 * Herhangi bir HTTP çağrısında ağ veya sunucu hatası.
 * <p>
 * İşlem seviyesinde tekrar denenebilir; denemeler tükenirse kapsayan asset için ölümcüldür.
 * Presigned URL'nin geçerlilik süresi dolduysa ({@link #isUploadUrlExpired()}) aynı aralığı
 * tekrar denemek anlamsızdır; yükleme rezervasyondan yeniden başlamalıdır.
 */
public class TransportException extends MediaSyncException {

    private final int statusCode;
    private final boolean uploadUrlExpired;

    public TransportException(String message, int statusCode) {
        this(message, statusCode, false, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, -1, false, cause);
    }

    public TransportException(String message, int statusCode, boolean uploadUrlExpired, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.uploadUrlExpired = uploadUrlExpired;
    }

    /** HTTP durum kodu; bağlantı hatalarında {@code -1}. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isUploadUrlExpired() {
        return uploadUrlExpired;
    }

    /** Bağlantı hataları, 429 ve 5xx tekrar denenebilir; diğer 4xx yanıtları kalıcıdır. */
    @Override
    public boolean isRetryable() {
        if (uploadUrlExpired) {
            return false;
        }
        return statusCode < 400 || statusCode == 429 || statusCode >= 500;
    }
}
