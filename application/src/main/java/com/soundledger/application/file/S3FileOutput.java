package com.soundledger.application.file;

import com.soundledger.domain.error.PersistenceException;
import com.soundledger.domain.port.driven.file.CsvRecordMapping;
import com.soundledger.domain.port.driven.file.FileOutputPort;
import de.siegmar.fastcsv.writer.CsvWriter;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static com.soundledger.application.FunctionUtils.sleep;

/**
 * Streams CSV rows straight into an S3 object. Rows are rendered on a writer thread that feeds a pipe
 * the MinIO client reads from, so a statement is never fully buffered in memory.
 */
public final class S3FileOutput<T> implements FileOutputPort<T> {

    private static final Logger log = LoggerFactory.getLogger(S3FileOutput.class);

    private static final int PIPE_BUFFER_BYTES = 64 * 1024;
    private static final long PART_SIZE_BYTES = 10L * 1024 * 1024; // 10 MiB, the S3 multipart minimum is 5
    private static final Duration SHUTDOWN_POLL = Duration.ofMillis(50);
    private static final String CONTENT_TYPE = "text/csv; charset=utf-8";

    private final String bucket;
    private final MinioClient client;

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile boolean stopping = false;

    public S3FileOutput(String bucket, MinioClient client) {
        this.bucket = Objects.requireNonNull(bucket, "bucket is required");
        this.client = Objects.requireNonNull(client, "client is required");
    }

    @Override
    public void emit(Stream<T> contents, String objectKey, CsvRecordMapping<T> mapping) {
        if (stopping) throw new IllegalStateException("S3FileOutput for bucket %s is shutting down".formatted(bucket));

        inFlight.incrementAndGet();
        try (contents) {
            var rows = upload(objectKey, contents, mapping);
            log.info("Wrote {} rows to S3 object {}/{}", rows, bucket, objectKey);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * Rejects new writes and blocks until the ones already running are done.
     */
    public void close() {
        stopping = true;
        while (inFlight.get() > 0 && !Thread.currentThread().isInterrupted()) {
            sleep(SHUTDOWN_POLL);
        }
        log.info("S3 output for bucket {} shut down", bucket);
    }

    private long upload(String objectKey, Stream<T> contents, CsvRecordMapping<T> mapping) {
        var rows = new AtomicLong();
        var writerFailure = new AtomicReference<Throwable>();

        try (var in = new PipedInputStream(PIPE_BUFFER_BYTES);
             var out = new PipedOutputStream(in)) {

            var writer = new Thread(
                    () -> writeCsv(contents, out, mapping, rows, writerFailure),
                    "s3-csv-writer-" + objectKey
            );
            writer.setDaemon(true);
            writer.start();

            try {
                client.putObject(
                        PutObjectArgs.builder()
                                .bucket(bucket)
                                .object(objectKey)
                                .stream(in, -1, PART_SIZE_BYTES)
                                .contentType(CONTENT_TYPE)
                                .build()
                );
            } finally {
                awaitWriter(writer);
            }
        } catch (Exception e) {
            throw new PersistenceException("Failed writing S3 object %s/%s".formatted(bucket, objectKey), e);
        }

        var failure = writerFailure.get();
        if (failure != null) {
            throw new PersistenceException(
                    "Failed writing S3 object %s/%s: csv rendering failed".formatted(bucket, objectKey),
                    failure
            );
        }
        return rows.get();
    }

    private void writeCsv(
            Stream<T> contents,
            PipedOutputStream out,
            CsvRecordMapping<T> mapping,
            AtomicLong rows,
            AtomicReference<Throwable> writerFailure
    ) {
        try (var buffered = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
             var csv = CsvWriter.builder().build(buffered)
        ) {
            if (!mapping.header().isEmpty()) csv.writeRecord(mapping.header());

            contents.map(mapping.toFields()).forEach(fields -> {
                csv.writeRecord(fields);
                rows.incrementAndGet();
            });
        } catch (Throwable t) {
            writerFailure.set(t);
            closeQuietly(out);
        }
    }

    private static void awaitWriter(Thread writer) {
        try {
            writer.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(PipedOutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            log.debug("Closing csv pipe after a writer failure failed as well", e);
        }
    }
}
