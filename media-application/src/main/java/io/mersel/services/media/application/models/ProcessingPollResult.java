package io.mersel.services.media.application.models;

/**
 * Sunucu tarafı işlemenin sınırlı süreli yoklama sonucu.
 *
 * @param status   Sonuç
 * @param asset    Son gözlenen asset durumu
 * @param attempts Yapılan sorgu sayısı
 */
public record ProcessingPollResult(Status status, RemoteAsset asset, int attempts) {

    public enum Status { COMPLETE, FAILED, TIMED_OUT }

    public static ProcessingPollResult complete(RemoteAsset asset, int attempts) {
        return new ProcessingPollResult(Status.COMPLETE, asset, attempts);
    }

    public static ProcessingPollResult failed(RemoteAsset asset, int attempts) {
        return new ProcessingPollResult(Status.FAILED, asset, attempts);
    }

    public static ProcessingPollResult timedOut(RemoteAsset asset, int attempts) {
        return new ProcessingPollResult(Status.TIMED_OUT, asset, attempts);
    }
}
