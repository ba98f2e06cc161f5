package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.enums.ScreenshotDisplayType;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.models.AssetGroupKey;
import io.mersel.services.media.application.models.LocalAssetFile;
import io.mersel.services.media.application.models.LocalAssetIndex;
import io.mersel.services.media.application.models.ScanWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Yerel medya klasörünü tarar: {@code <root>/<locale>/<displayType>/<dosya>}.
 * <p>
 * Yalnızca iki seviye okunur; daha derin veya daha sığ dosyalar yok sayılır. Dosyalar uzantıya göre
 * ekran görüntüsü ({@code png, jpg, jpeg}) veya önizleme ({@code mp4, mov}) olarak sınıflanır.
 * Grup içi sıra, büyük/küçük harf duyarlı dosya adı sıralamasıdır ve 1'den başlayan pozisyonu belirler.
 * Desteklenmeyen dosyalar tarama uyarısı olarak raporlanır, taramayı durdurmaz.
 */
@Component
public class LocalAssetIndexer {

    private static final Logger log = LoggerFactory.getLogger(LocalAssetIndexer.class);

    static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg");
    static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov");

    public LocalAssetIndex scan(Path root) throws MediaSyncException {
        if (!Files.isDirectory(root)) {
            throw new MediaSyncException("Medya klasörü bulunamadı: " + root);
        }

        Map<AssetGroupKey, List<LocalAssetFile>> groups = new LinkedHashMap<>();
        List<ScanWarning> warnings = new ArrayList<>();

        try {
            for (Path localeDir : listDirectories(root)) {
                String locale = localeDir.getFileName().toString();
                for (Path typeDir : listDirectories(localeDir)) {
                    scanDisplayTypeFolder(locale, typeDir, groups, warnings);
                }
            }
        } catch (IOException e) {
            throw new MediaSyncException("Medya klasörü okunamadı: " + root + " — " + e.getMessage(), e);
        }

        if (groups.isEmpty()) {
            log.warn("'{}' altında tanınan medya dosyası bulunamadı", root);
        } else {
            log.info("Tarama tamamlandı: {} grup, {} ekran görüntüsü, {} önizleme, {} uyarı",
                    groups.size(), count(groups, AssetKind.SCREENSHOT), count(groups, AssetKind.PREVIEW),
                    warnings.size());
        }
        return new LocalAssetIndex(root, groups, List.copyOf(warnings));
    }

    private void scanDisplayTypeFolder(String locale, Path typeDir,
                                       Map<AssetGroupKey, List<LocalAssetFile>> groups,
                                       List<ScanWarning> warnings) throws IOException {
        String folderName = typeDir.getFileName().toString();
        Optional<ScreenshotDisplayType> displayType = ScreenshotDisplayType.fromFolderName(folderName);
        if (displayType.isEmpty()) {
            warn(warnings, new ScanWarning(locale, folderName, null, "bilinmeyen display type klasörü"));
            return;
        }

        List<LocalAssetFile> screenshots = new ArrayList<>();
        List<LocalAssetFile> previews = new ArrayList<>();

        for (Path file : listFiles(typeDir)) {
            String fileName = file.getFileName().toString();
            String extension = extension(fileName);

            if (IMAGE_EXTENSIONS.contains(extension)) {
                screenshots.add(toAssetFile(file, locale, folderName, AssetKind.SCREENSHOT, screenshots.size() + 1));
            } else if (VIDEO_EXTENSIONS.contains(extension)) {
                if (displayType.get().previewType().isEmpty()) {
                    warn(warnings, new ScanWarning(locale, folderName, fileName,
                            "bu display type önizleme videosu desteklemiyor"));
                    continue;
                }
                previews.add(toAssetFile(file, locale, folderName, AssetKind.PREVIEW, previews.size() + 1));
            } else {
                warn(warnings, new ScanWarning(locale, folderName, fileName,
                        "desteklenmeyen uzantı '." + extension + "'"));
            }
        }

        if (!screenshots.isEmpty()) {
            groups.put(new AssetGroupKey(locale, folderName, AssetKind.SCREENSHOT), List.copyOf(screenshots));
        }
        if (!previews.isEmpty()) {
            groups.put(new AssetGroupKey(locale, folderName, AssetKind.PREVIEW), List.copyOf(previews));
        }
    }

    private LocalAssetFile toAssetFile(Path file, String locale, String displayType, AssetKind kind, int position)
            throws IOException {
        return new LocalAssetFile(file, locale, displayType, kind, position,
                file.getFileName().toString(), Files.size(file));
    }

    private void warn(List<ScanWarning> warnings, ScanWarning warning) {
        warnings.add(warning);
        log.warn("Tarama uyarısı: {}", warning.message());
    }

    private static List<Path> listDirectories(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(p -> !isHidden(p))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> !isHidden(p))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    private static boolean isHidden(Path path) {
        return path.getFileName().toString().startsWith(".");
    }

    static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static int count(Map<AssetGroupKey, List<LocalAssetFile>> groups, AssetKind kind) {
        return groups.entrySet().stream()
                .filter(e -> e.getKey().kind() == kind)
                .mapToInt(e -> e.getValue().size())
                .sum();
    }
}
