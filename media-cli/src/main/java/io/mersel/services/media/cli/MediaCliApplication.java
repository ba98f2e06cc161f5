package io.mersel.services.media.cli;

import io.mersel.services.media.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * ASC Media Sync - komut satırı giriş noktası.
 * <p>
 * App Store sürümünün ekran görüntüsü ve önizleme videolarını yerel klasörle eşitler:
 * {@code upload}, {@code download}, {@code verify}.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class MediaCliApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MediaCliApplication.class, args)));
    }
}
