package io.mersel.services.media.application.models;

/**
 * Yükleme komutu seçenekleri.
 *
 * @param replace           Yüklemeden önce eşleşen setteki tüm öğeleri sil
 * @param waitForProcessing Her commit sonrası sunucu işlemesini bekle
 */
public record UploadOptions(boolean replace, boolean waitForProcessing) {

    public static UploadOptions defaults() {
        return new UploadOptions(false, false);
    }
}
