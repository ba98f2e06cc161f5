package io.mersel.services.media.application.models;

import io.mersel.services.media.application.enums.AssetKind;

/**
 * Yerel ve uzak taraf arasındaki eşleştirme anahtarı: locale × display type × tür.
 * <p>
 * Uzak tarafta her anahtar en fazla bir set'e karşılık gelir.
 *
 * @param locale      Locale klasör adı (örn: "en-US")
 * @param displayType Display type klasör adı (örn: "APP_IPHONE_67")
 * @param kind        Ekran görüntüsü veya önizleme
 */
public record AssetGroupKey(String locale, String displayType, AssetKind kind) {

    @Override
    public String toString() {
        return locale + "/" + displayType + "/" + kind.label();
    }
}
