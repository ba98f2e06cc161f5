package io.mersel.services.media.application.models;

/**
 * Tek bir dosya/asset işleminin sonucu.
 *
 * @param item    Öğe etiketi (örn: "en-US/APP_IPHONE_67/01.png")
 * @param outcome Sonuç
 * @param message Hata veya atlama nedeni (başarıda {@code null})
 */
public record ItemResult(String item, Outcome outcome, String message) {

    public enum Outcome { SUCCEEDED, FAILED, SKIPPED }

    public static ItemResult succeeded(String item) {
        return new ItemResult(item, Outcome.SUCCEEDED, null);
    }

    public static ItemResult failed(String item, String message) {
        return new ItemResult(item, Outcome.FAILED, message);
    }

    public static ItemResult skipped(String item, String message) {
        return new ItemResult(item, Outcome.SKIPPED, message);
    }
}
