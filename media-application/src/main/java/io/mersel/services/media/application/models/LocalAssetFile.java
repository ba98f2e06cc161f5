package io.mersel.services.media.application.models;

import io.mersel.services.media.application.enums.AssetKind;

import java.nio.file.Path;

/**
 * Yerel klasörde bulunan tek bir medya dosyası.
 * <p>
 * Her taramada yeniden hesaplanır, kalıcı değildir. {@code position} aynı grup içindeki
 * büyük/küçük harf duyarlı alfabetik sıradan gelir ve 1'den başlar; grup içinde yoğun ve tekildir.
 *
 * @param path        Dosyanın mutlak yolu
 * @param locale      Locale klasör adı
 * @param displayType Display type klasör adı
 * @param kind        Dosya türü
 * @param position    Grup içindeki 1 tabanlı sıra
 * @param fileName    Dosya adı
 * @param fileSize    Dosya boyutu (byte)
 */
public record LocalAssetFile(
        Path path,
        String locale,
        String displayType,
        AssetKind kind,
        int position,
        String fileName,
        long fileSize
) {

    public AssetGroupKey groupKey() {
        return new AssetGroupKey(locale, displayType, kind);
    }
}
