package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.TransportException;
import io.mersel.services.media.application.models.UploadOperation;
import io.mersel.services.media.infrastructure.config.MediaSyncProperties;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rezervasyonun upload operasyonlarını presigned URL'lere paralel aktarır.
 * <p>
 * Her operasyon bağımsızdır; dosyadan kendi byte aralığını okur ve ağ hatalarında
 * {@code asc.media.transfer-max-attempts} kadar aynı aralığı yeniden dener; 429 dışındaki 4xx
 * yanıtları kalıcıdır. Metot ancak tüm operasyonlar bittiğinde döner; biri başarısızsa
 * henüz başlamamış olanlar atlanır.
 */
@Component
public class ChunkTransferExecutor {

    private static final Logger log = LoggerFactory.getLogger(ChunkTransferExecutor.class);

    private final IMediaApiClient apiClient;
    private final MediaSyncProperties properties;
    private final MediaSyncMetrics metrics;
    private final ExecutorService executor;

    public ChunkTransferExecutor(IMediaApiClient apiClient, MediaSyncProperties properties,
                                 MediaSyncMetrics metrics) {
        this.apiClient = apiClient;
        this.properties = properties;
        this.metrics = metrics;
        this.executor = Executors.newFixedThreadPool(properties.getTransferParallelism(), r -> {
            Thread t = new Thread(r, "chunk-transfer");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    public void transferAll(Path file, List<UploadOperation> operations) throws TransportException {
        AtomicBoolean aborted = new AtomicBoolean(false);
        if (operations.size() == 1) {
            transferWithRetry(file, operations.get(0), aborted);
            return;
        }

        List<Future<Void>> futures = new ArrayList<>(operations.size());
        for (UploadOperation operation : operations) {
            futures.add(executor.submit(() -> {
                if (!aborted.get()) {
                    transferWithRetry(file, operation, aborted);
                }
                return null;
            }));
        }

        // Hata sonrası bekleyen aralıklar başlamaz, süren PUT'lar bitene kadar beklenir;
        // çağıran rezervasyonu ancak hiçbir aktarım kalmadığında siler.
        TransportException failure = null;
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                if (failure == null) {
                    aborted.set(true);
                    failure = e.getCause() instanceof TransportException te
                            ? te
                            : new TransportException("Parça aktarımı başarısız: " + e.getCause().getMessage(),
                            e.getCause());
                } else {
                    log.debug("Ek parça hatası: {}", e.getCause().getMessage());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                aborted.set(true);
                futures.forEach(f -> f.cancel(true));
                throw new TransportException("Parça aktarımı kesildi", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void transferWithRetry(Path file, UploadOperation operation, AtomicBoolean aborted)
            throws TransportException {
        byte[] bytes;
        try {
            bytes = readRange(file, operation.offset(), operation.length());
        } catch (IOException e) {
            throw new TransportException("Dosya aralığı okunamadı: " + file.getFileName()
                    + " (offset=" + operation.offset() + ")", e);
        }

        int maxAttempts = properties.getTransferMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                apiClient.putChunk(operation, bytes);
                return;
            } catch (TransportException e) {
                if (!e.isRetryable() || attempt >= maxAttempts || aborted.get()) {
                    throw e;
                }
                metrics.recordChunkRetry();
                log.warn("{} parçası (offset={}) başarısız: {}, tekrar deneniyor ({}/{})",
                        file.getFileName(), operation.offset(), e.getMessage(), attempt, maxAttempts);
                pause(attempt);
            }
        }
    }

    private void pause(int attempt) throws TransportException {
        long delay = properties.getRetryBackoffMs() * attempt;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Parça aktarımı kesildi", e);
        }
    }

    static byte[] readRange(Path file, long offset, long length) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long available = Math.max(0, channel.size() - offset);
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(length, available));
            channel.position(offset);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            return buffer.array();
        }
    }
}
