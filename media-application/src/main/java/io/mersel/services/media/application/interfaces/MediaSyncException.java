package io.mersel.services.media.application.interfaces;

/**
 * Medya senkronizasyonu sırasında oluşan tüm uzak/yerel hataların temel sınıfı.
 * <p>
 * Alt sınıflar hatanın tekrar denenebilir olup olmadığını belirler; servisler bu istisnaları
 * öğe bazında yakalayıp özet rapora dönüştürür.
 */
public class MediaSyncException extends Exception {

    public MediaSyncException(String message) {
        super(message);
    }

    public MediaSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Aynı işlemin tekrar denenmesi anlamlı mı?
     */
    public boolean isRetryable() {
        return false;
    }
}
