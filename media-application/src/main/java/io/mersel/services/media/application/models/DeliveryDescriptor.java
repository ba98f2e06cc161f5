package io.mersel.services.media.application.models;

/**
 * Uzak asset'in teslim tanımı.
 * <p>
 * Ekran görüntüleri için {@code url} genişlik/yükseklik/format yer tutucuları
 * ({@code {w}}, {@code {h}}, {@code {f}}) içeren bir şablondur; videolar için doğrudan URL'dir.
 *
 * @param type   Şablon veya doğrudan URL
 * @param url    Ham URL
 * @param width  Görselin bildirilen genişliği (video için 0)
 * @param height Görselin bildirilen yüksekliği (video için 0)
 */
public record DeliveryDescriptor(Type type, String url, int width, int height) {

    public enum Type { IMAGE_TEMPLATE, VIDEO_URL }

    public static DeliveryDescriptor imageTemplate(String templateUrl, int width, int height) {
        return new DeliveryDescriptor(Type.IMAGE_TEMPLATE, templateUrl, width, height);
    }

    public static DeliveryDescriptor video(String videoUrl) {
        return new DeliveryDescriptor(Type.VIDEO_URL, videoUrl, 0, 0);
    }
}
