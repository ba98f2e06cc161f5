package io.mersel.services.media.infrastructure.client;

/**
 * API çağrıları için bearer token kaynağı.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * Geçerli bir bearer token döndürür.
     *
     * @throws IllegalStateException anahtar bilgileri eksik veya okunamıyorsa
     */
    String bearerToken();
}
