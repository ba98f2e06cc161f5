package io.mersel.services.media.application.enums;

/**
 * Bir medya dosyasının türü.
 * <p>
 * Dosya uzantısından ve display-type klasörünün ekran görüntüsü-only olup olmamasından
 * türetilir. Her tür uzak tarafta ayrı bir set tipine karşılık gelir.
 */
public enum AssetKind {

    /** Ekran görüntüsü (.png, .jpg, .jpeg) — appScreenshotSets / appScreenshots */
    SCREENSHOT("screenshot"),

    /** Önizleme videosu (.mp4, .mov) — appPreviewSets / appPreviews */
    PREVIEW("preview");

    private final String label;

    AssetKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
