package io.mersel.services.media.cli.commands;

import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaSyncService;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.models.LocalAssetIndex;
import io.mersel.services.media.application.models.SyncSummary;
import io.mersel.services.media.application.models.UploadOptions;
import io.mersel.services.media.application.models.VerifyReport;
import io.mersel.services.media.cli.infrastructure.CliExitCodeMapper;
import io.mersel.services.media.cli.infrastructure.ConsoleIO;
import io.mersel.services.media.cli.infrastructure.ReportPrinter;
import io.mersel.services.media.infrastructure.MediaPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code upload}, {@code download} ve {@code verify} komutlarını çalıştırır.
 * <p>
 * Seçenekler {@code --ad=değer} biçimindedir; bayraklar ({@code --replace}, {@code --wait},
 * {@code --yes}) değer almaz. Başarısız öğe varsa çıkış kodu 1 olur.
 */
@Component
public class MediaCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MediaCommandRunner.class);

    static final String USAGE = """
            Usage:
              upload   --version-id=<id> --folder=<root> [--replace] [--wait] [--yes]
              download --version-id=<id> --folder=<root>
              verify   --version-id=<id> [--folder=<root>] [--yes]""";

    private final IMediaSyncService syncService;
    private final ConsoleIO console;
    private final ReportPrinter printer;
    private int exitCode = 0;

    public MediaCommandRunner(IMediaSyncService syncService, ConsoleIO console, ReportPrinter printer) {
        this.syncService = syncService;
        this.console = console;
        this.printer = printer;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            console.println(USAGE);
            exitCode = CliExitCodeMapper.EXIT_CONFIGURATION;
            return;
        }

        String command = commands.get(0);
        log.debug("Komut: {}", command);
        switch (command) {
            case "upload" -> upload(args);
            case "download" -> download(args);
            case "verify" -> verify(args);
            default -> {
                console.println("Unknown command: " + command);
                console.println(USAGE);
                exitCode = CliExitCodeMapper.EXIT_CONFIGURATION;
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void upload(ApplicationArguments args) throws MediaSyncException {
        String versionId = requireOption(args, "version-id");
        Path root = MediaPaths.sanitize(requireOption(args, "folder"));
        boolean replace = args.containsOption("replace");

        LocalAssetIndex index = syncService.scan(root);
        if (index.isEmpty()) {
            printer.printWarnings(index.warnings());
            console.println("No media files found in '" + root + "'.");
            return;
        }

        printer.printPlan(index, versionId, replace);
        int fileCount = index.count(AssetKind.SCREENSHOT) + index.count(AssetKind.PREVIEW);
        String prompt = (replace ? "Replace media with " : "Upload ") + fileCount + " file"
                + (fileCount == 1 ? "" : "s") + "? [y/N] ";
        if (!args.containsOption("yes") && !console.confirm(prompt)) {
            console.println("Cancelled.");
            return;
        }

        SyncSummary summary = syncService.upload(root, versionId,
                new UploadOptions(replace, args.containsOption("wait")));
        printer.printSummary(summary);
        exitCode = summary.isSuccessful() ? 0 : CliExitCodeMapper.EXIT_FAILED_ITEMS;
    }

    private void download(ApplicationArguments args) throws MediaSyncException {
        String versionId = requireOption(args, "version-id");
        Path root = MediaPaths.sanitize(requireOption(args, "folder"));

        SyncSummary summary = syncService.download(root, versionId);
        if (summary.getItems().isEmpty()) {
            console.println("No media found for this version.");
            printer.printSummary(summary);
            return;
        }
        printer.printSummary(summary);
        console.println("Saved to " + root);
        exitCode = summary.isSuccessful() ? 0 : CliExitCodeMapper.EXIT_FAILED_ITEMS;
    }

    private void verify(ApplicationArguments args) throws MediaSyncException {
        String versionId = requireOption(args, "version-id");

        VerifyReport report = syncService.verify(versionId);
        printer.printVerifyReport(report);
        if (report.isEmpty() || report.isAllComplete()) {
            return;
        }

        String folder = optionValue(args, "folder");
        if (folder == null) {
            console.println();
            console.println("Use --folder to provide the media folder and retry stuck uploads.");
            return;
        }

        Path root = MediaPaths.sanitize(folder);
        long retryCount = report.stuckCount() + report.failedCount();
        console.println();
        if (!args.containsOption("yes")
                && !console.confirm("Retry " + retryCount + " item" + (retryCount == 1 ? "" : "s") + "? [y/N] ")) {
            console.println("Cancelled.");
            return;
        }

        SyncSummary summary = syncService.repair(report, root);
        printer.printWarnings(summary.getWarnings());
        printer.printSummary(summary);

        console.println();
        console.println("Re-verifying...");
        console.println();
        printer.printVerifyReport(syncService.verify(versionId));
        console.println();
        console.println(summary.succeeded() + " retried successfully, " + summary.failed() + " failed.");
        exitCode = summary.isSuccessful() ? 0 : CliExitCodeMapper.EXIT_FAILED_ITEMS;
    }

    private static String requireOption(ApplicationArguments args, String name) {
        String value = optionValue(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " parametresi gerekli");
        }
        return value;
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
