package io.mersel.services.media.application.interfaces;

import io.mersel.services.media.application.models.LocalAssetIndex;
import io.mersel.services.media.application.models.SyncSummary;
import io.mersel.services.media.application.models.UploadOptions;
import io.mersel.services.media.application.models.VerifyReport;

import java.nio.file.Path;

/**
 * Yerel medya klasörü ile App Store Connect setleri arasındaki senkronizasyon servisi.
 * <p>
 * Klasör yapısı: {@code <root>/<locale>/<displayType>/<dosya>}. Yerel alfabetik sıra, uzak
 * set sırası için doğruluk kaynağıdır. Uzak durum hiçbir zaman önbelleğe alınmaz; her komut
 * işlem öncesi taze durumu çeker.
 */
public interface IMediaSyncService {

    /**
     * Yerel klasörü tarar. Uzak tarafa dokunmaz.
     */
    LocalAssetIndex scan(Path root) throws MediaSyncException;

    /**
     * Yerel dosyaları yükler ve her set'in sırasını yerel sıraya göre düzenler.
     *
     * @param root      Medya kök dizini
     * @param versionId Hedef sürüm
     * @param options   Replace / bekleme seçenekleri
     * @return Dosya bazında özet
     */
    SyncSummary upload(Path root, String versionId, UploadOptions options) throws MediaSyncException;

    /**
     * Tüm uzak asset'leri {@code <root>/<locale>/<displayType>/NN_<ad>} olarak indirir.
     */
    SyncSummary download(Path root, String versionId) throws MediaSyncException;

    /**
     * Tüm setlerin işlenme durumunu sorgular. Hiçbir değişiklik yapmaz.
     */
    VerifyReport verify(String versionId) throws MediaSyncException;

    /**
     * Rapordaki takılı/başarısız öğeleri siler, aynı konumdaki yerel dosyayı yeniden yükler
     * ve set sırasını geri yükler.
     *
     * @param report Az önce alınmış doğrulama raporu
     * @param root   Medya kök dizini
     */
    SyncSummary repair(VerifyReport report, Path root) throws MediaSyncException;
}
