package io.roundrelay.participant;

import io.roundrelay.transport.DirectoryLayout;
import io.roundrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Participant half of the directory transport: answers every {@code *.request} under this participant's
 * endpoint folder that does not have a {@code .response} yet.
 */
public final class DirectoryResponder {
    private static final Logger LOG = LoggerFactory.getLogger(DirectoryResponder.class);

    private final DirectoryLayout layout;
    private final String ownAddress;
    private final RequestHandler handler;
    private final Duration pollInterval;
    private final CountDownLatch stopSignal;

    public DirectoryResponder(DirectoryLayout layout, String ownAddress, RequestHandler handler, Duration pollInterval) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.layout = layout;
        this.ownAddress = ownAddress;
        this.handler = handler;
        this.pollInterval = pollInterval;
        this.stopSignal = new CountDownLatch(1);
    }

    /**
     * Processes every outstanding request once.
     *
     * @return the number of responses written
     */
    public int pollOnce() {
        Path endpointDir = layout.endpointDir(ownAddress);
        if (!Files.isDirectory(endpointDir)) {
            return 0;
        }
        int written = 0;
        for (Path requestFile : listRequests(endpointDir)) {
            if (isStopped()) {
                break;
            }
            if (process(requestFile)) {
                written++;
            }
        }
        return written;
    }

    /**
     * Polls until {@link #stop()} is called from another thread.
     */
    public void run() {
        try {
            Files.createDirectories(layout.endpointDir(ownAddress));
        } catch (IOException e) {
            throw new RuntimeException("Failed to create endpoint directory for " + ownAddress, e);
        }
        LOG.info("Responder for {} polling {} every {} ms",
                ownAddress, layout.endpointDir(ownAddress), pollInterval.toMillis());
        while (!isStopped()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                LOG.error("Error in poll loop for {}", ownAddress, e);
            }
            try {
                if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("Responder for {} stopped", ownAddress);
    }

    public void stop() {
        stopSignal.countDown();
    }

    public boolean isStopped() {
        return stopSignal.getCount() == 0L;
    }

    private boolean process(Path requestFile) {
        Path responseFile = DirectoryLayout.responseFileFor(requestFile);
        if (Files.exists(responseFile)) {
            return false;
        }
        byte[] body;
        try {
            body = Files.readAllBytes(requestFile);
        } catch (IOException e) {
            // Released by the coordinator between listing and reading.
            LOG.debug("Request {} vanished before it could be read", requestFile.getFileName());
            return false;
        }
        byte[] reply;
        try {
            LOG.debug("Processing request {} ({} bytes)", requestFile.getFileName(), body.length);
            reply = handler.handle(body);
        } catch (Exception e) {
            LOG.error("Error processing request {}", requestFile, e);
            reply = errorBody(e);
        }
        if (reply == null) {
            return false;
        }
        try {
            DirectoryLayout.writeAtomically(responseFile, reply);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write response " + responseFile, e);
        }
        LOG.debug("Wrote response {}", responseFile.getFileName());
        return true;
    }

    private static byte[] errorBody(Exception e) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("error", String.valueOf(e.getMessage()));
        row.put("timestamp", Instant.now().toString());
        return Jsons.toCompactJson(row).getBytes(StandardCharsets.UTF_8);
    }

    private static List<Path> listRequests(Path endpointDir) {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(endpointDir)) {
            walk.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(DirectoryLayout.REQUEST_SUFFIX))
                    .forEach(files::add);
        } catch (IOException | UncheckedIOException e) {
            throw new RuntimeException("Failed to list requests under " + endpointDir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
