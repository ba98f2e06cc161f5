package io.mersel.services.media.application.enums;

import java.util.Optional;
import java.util.Set;

/**
 * App Store ekran görüntüsü display type kataloğu.
 * <p>
 * Yerel klasör yapısındaki ikinci seviye klasör adları bu enum'un sabit adlarıyla
 * birebir eşleşmelidir (örn: {@code en-US/APP_IPHONE_67/}). Katalogda olmayan klasörler
 * tarama sırasında uyarı ile atlanır.
 * <p>
 * Önizleme tipi türetme kuralı: {@code APP_<X>} → {@code <X>}, yalnızca {@code <X>} bilinen bir
 * önizleme tipiyse. {@code APP_WATCH_*} ve {@code IMESSAGE_*} aileleri ekran görüntüsü-only'dir.
 */
public enum ScreenshotDisplayType {

    // ── iPhone ──
    APP_IPHONE_67,
    APP_IPHONE_61,
    APP_IPHONE_65,
    APP_IPHONE_58,
    APP_IPHONE_55,
    APP_IPHONE_47,
    APP_IPHONE_40,
    APP_IPHONE_35,

    // ── iPad ──
    APP_IPAD_PRO_3GEN_129,
    APP_IPAD_PRO_3GEN_11,
    APP_IPAD_PRO_129,
    APP_IPAD_105,
    APP_IPAD_97,

    // ── Diğer platformlar ──
    APP_DESKTOP,
    APP_APPLE_TV,
    APP_APPLE_VISION_PRO,

    // ── Apple Watch (ekran görüntüsü-only) ──
    APP_WATCH_ULTRA,
    APP_WATCH_SERIES_10,
    APP_WATCH_SERIES_7,
    APP_WATCH_SERIES_4,
    APP_WATCH_SERIES_3,

    // ── iMessage eklentisi (ekran görüntüsü-only) ──
    IMESSAGE_APP_IPHONE_67,
    IMESSAGE_APP_IPHONE_61,
    IMESSAGE_APP_IPHONE_65,
    IMESSAGE_APP_IPHONE_58,
    IMESSAGE_APP_IPHONE_55,
    IMESSAGE_APP_IPHONE_47,
    IMESSAGE_APP_IPHONE_40,
    IMESSAGE_APP_IPAD_PRO_3GEN_129,
    IMESSAGE_APP_IPAD_PRO_3GEN_11,
    IMESSAGE_APP_IPAD_PRO_129,
    IMESSAGE_APP_IPAD_105,
    IMESSAGE_APP_IPAD_97;

    private static final String APP_PREFIX = "APP_";

    /** {@code appPreviewSets.previewType} değerleri */
    private static final Set<String> PREVIEW_TYPES = Set.of(
            "IPHONE_67", "IPHONE_61", "IPHONE_65", "IPHONE_58", "IPHONE_55", "IPHONE_47",
            "IPHONE_40", "IPHONE_35",
            "IPAD_PRO_3GEN_129", "IPAD_PRO_3GEN_11", "IPAD_PRO_129", "IPAD_105", "IPAD_97",
            "DESKTOP", "APPLE_TV", "APPLE_VISION_PRO"
    );

    /**
     * Klasör adını display type'a çevirir. Büyük/küçük harf duyarlıdır.
     */
    public static Optional<ScreenshotDisplayType> fromFolderName(String folderName) {
        if (folderName == null) {
            return Optional.empty();
        }
        for (ScreenshotDisplayType type : values()) {
            if (type.name().equals(folderName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Bu display type için önizleme videosu tipi.
     *
     * @return önizleme tipi (örn: {@code IPHONE_67}); ekran görüntüsü-only ailelerde boş
     */
    public Optional<String> previewType() {
        if (isScreenshotOnly()) {
            return Optional.empty();
        }
        String raw = name().substring(APP_PREFIX.length());
        return PREVIEW_TYPES.contains(raw) ? Optional.of(raw) : Optional.empty();
    }

    /**
     * Watch ve iMessage aileleri video kabul etmez.
     */
    public boolean isScreenshotOnly() {
        return name().startsWith("APP_WATCH_") || name().startsWith("IMESSAGE_");
    }

    /**
     * Uzak önizleme set tipini yerel klasör adına çevirir ({@code IPHONE_67 → APP_IPHONE_67}).
     */
    public static String folderNameForPreviewType(String previewType) {
        return APP_PREFIX + previewType;
    }

    /**
     * Yerel klasör adını uzak önizleme set tipine çevirir ({@code APP_IPHONE_67 → IPHONE_67}).
     *
     * @throws IllegalArgumentException klasör önizleme desteklemiyorsa
     */
    public static String previewTypeForFolderName(String folderName) {
        return fromFolderName(folderName)
                .flatMap(ScreenshotDisplayType::previewType)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Önizleme desteklemeyen display type: " + folderName));
    }
}
