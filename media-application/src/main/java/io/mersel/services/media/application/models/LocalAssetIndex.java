package io.mersel.services.media.application.models;

import io.mersel.services.media.application.enums.AssetKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Yerel medya klasörünün taranmış hali.
 * <p>
 * {@code groups} anahtarları locale, display type ve tür sırasıyla sıralı tutulur;
 * her grubun dosya listesi {@link LocalAssetFile#position()} sırasındadır.
 *
 * @param root     Taranan kök dizin
 * @param groups   Grup anahtarı → sıralı dosya listesi
 * @param warnings Atlanan dosya/klasör uyarıları
 */
public record LocalAssetIndex(
        Path root,
        Map<AssetGroupKey, List<LocalAssetFile>> groups,
        List<ScanWarning> warnings
) {

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public List<LocalAssetFile> files(AssetGroupKey key) {
        return groups.getOrDefault(key, List.of());
    }

    /**
     * Belirli bir gruptaki {@code position} sırasındaki dosya.
     */
    public Optional<LocalAssetFile> fileAt(AssetGroupKey key, int position) {
        return files(key).stream()
                .filter(f -> f.position() == position)
                .findFirst();
    }

    public int count(AssetKind kind) {
        return groups.entrySet().stream()
                .filter(e -> e.getKey().kind() == kind)
                .mapToInt(e -> e.getValue().size())
                .sum();
    }
}
