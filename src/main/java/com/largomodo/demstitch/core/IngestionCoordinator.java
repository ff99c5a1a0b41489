package com.largomodo.demstitch.core;

import com.largomodo.demstitch.core.domain.TileRecord;
import com.largomodo.demstitch.core.domain.TileShape;
import com.largomodo.demstitch.service.TileDecodeException;
import com.largomodo.demstitch.service.TileDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Decodes tile sources on a bounded worker pool with per-tile failure isolation.
 * <p>
 * Strategy: fixed thread pool, bounded queue of {@code 2 * threads} for backpressure,
 * CallerRunsPolicy throttles submission when the queue is full. Every task catches its own
 * failures and returns an outcome; only this coordinator aggregates them, so decode tasks
 * share no mutable state.
 * <p>
 * Standard tile shape: when enforcement is on and no shape is configured, sources are
 * decoded one by one in discovery order until one succeeds, and its shape becomes the
 * standard for the rest of the run.
 * <p>
 * Accepted tiles are returned in discovery order regardless of completion order.
 * There is no per-tile timeout; a stalled decode stalls the run.
 */
public class IngestionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final TileDecoder decoder;
    private final int threads;
    private final TileShape configuredShape;
    private final boolean enforceShape;

    /**
     * @param decoder         Tile decoder shared by all workers
     * @param threads         Worker pool size
     * @param configuredShape Standard tile shape, or null to auto-detect
     * @param enforceShape    Reject tiles that differ from the standard shape
     */
    public IngestionCoordinator(TileDecoder decoder, int threads, TileShape configuredShape, boolean enforceShape) {
        if (decoder == null) {
            throw new IllegalArgumentException("decoder must not be null");
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive, got: " + threads);
        }
        this.decoder = decoder;
        this.threads = threads;
        this.configuredShape = configuredShape;
        this.enforceShape = enforceShape;
    }

    /**
     * Decode all sources.
     *
     * @param sources  tile files in discovery order
     * @param observer lifecycle callbacks (invoked from worker threads)
     * @return accepted tiles and failure counts
     * @throws NoValidTilesException if sources is empty or no tile decodes
     * @throws InterruptedException  if interrupted while waiting for workers
     */
    public IngestionResult ingest(List<Path> sources, IngestionObserver observer) throws InterruptedException {
        if (sources == null || sources.isEmpty()) {
            throw new NoValidTilesException(NoValidTilesException.Reason.NO_TILES_FOUND,
                    "no tile sources to decode");
        }
        IngestionObserver callbacks = observer != null ? observer : new IngestionObserver() {};

        List<DecodeOutcome> outcomes = new ArrayList<>(sources.size());
        TileShape standardShape = enforceShape ? configuredShape : null;
        int next = 0;

        if (enforceShape && standardShape == null) {
            while (next < sources.size() && standardShape == null) {
                DecodeOutcome outcome = decodeOne(sources.get(next), next, null, callbacks);
                outcomes.add(outcome);
                next++;
                if (outcome.tile() != null) {
                    standardShape = outcome.tile().shape();
                    log.info("Standard tile size detected: ({}, {})", standardShape.rows(), standardShape.cols());
                }
            }
        }

        if (next < sources.size()) {
            outcomes.addAll(decodeInPool(sources, next, standardShape, callbacks));
        }

        List<TileRecord> accepted = new ArrayList<>();
        Map<TileDecodeException.Kind, Integer> failures = new EnumMap<>(TileDecodeException.Kind.class);
        for (DecodeOutcome outcome : outcomes) {
            if (outcome.tile() != null) {
                accepted.add(outcome.tile());
            } else {
                failures.merge(outcome.failure(), 1, Integer::sum);
            }
        }

        int failed = sources.size() - accepted.size();
        if (accepted.isEmpty()) {
            throw new NoValidTilesException(NoValidTilesException.Reason.NO_TILES_DECODED,
                    "0 of " + sources.size() + " tile sources decoded " + failures);
        }
        if (failed > 0) {
            log.warn("Decoded {} of {} tiles, {} skipped {}", accepted.size(), sources.size(), failed, failures);
        } else {
            log.info("Decoded {} of {} tiles", accepted.size(), sources.size());
        }

        return new IngestionResult(accepted, sources.size(), failures, standardShape);
    }

    private List<DecodeOutcome> decodeInPool(List<Path> sources, int from, TileShape expected,
                                             IngestionObserver callbacks) throws InterruptedException {
        ExecutorService executor = new ThreadPoolExecutor(
                threads,                // Core pool size
                threads,                // Max pool size: fixed
                0L,                     // Keep-alive: threads never time out
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * threads),    // Bounded queue: limits decoded tiles held in flight
                new ThreadPoolExecutor.CallerRunsPolicy()  // Overflow: submitting thread decodes the tile itself
        );

        List<Future<DecodeOutcome>> futures = new ArrayList<>(sources.size() - from);
        try {
            for (int i = from; i < sources.size(); i++) {
                Path source = sources.get(i);
                int discoveryIndex = i;
                futures.add(executor.submit(() -> decodeOne(source, discoveryIndex, expected, callbacks)));
            }

            List<DecodeOutcome> outcomes = new ArrayList<>(futures.size());
            for (Future<DecodeOutcome> future : futures) {
                try {
                    outcomes.add(future.get());
                } catch (ExecutionException e) {
                    // decodeOne catches every Exception; only Errors get here
                    throw new IllegalStateException("Decode worker failed unexpectedly", e.getCause());
                }
            }
            return outcomes;
        } finally {
            // Standard two-phase shutdown: graceful (1 min) then forceful
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    log.warn("Ingestion workers did not terminate within one minute");
                    executor.shutdownNow();  // Interrupt in-flight decodes if timeout exceeded
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private DecodeOutcome decodeOne(Path source, int discoveryIndex, TileShape expected,
                                    IngestionObserver callbacks) {
        try {
            MDC.put("tile", String.valueOf(source.getFileName()));
            callbacks.onStart(source);
            TileRecord tile = decoder.decode(source, discoveryIndex, expected);
            callbacks.onSuccess(source, tile);
            return DecodeOutcome.success(tile);
        } catch (TileDecodeException e) {
            log.warn("Skip {} [{}]: {}", source.getFileName(), e.getKind(), e.getMessage());
            callbacks.onFailure(source, e);
            return DecodeOutcome.failure(e.getKind());
        } catch (Exception e) {
            // Catch everything so one pathological tile never aborts the batch
            log.warn("Skip {} [{}]: {}", source.getFileName(), TileDecodeException.Kind.MALFORMED_SOURCE, e.toString());
            callbacks.onFailure(source, e);
            return DecodeOutcome.failure(TileDecodeException.Kind.MALFORMED_SOURCE);
        } finally {
            MDC.remove("tile");
        }
    }

    private record DecodeOutcome(TileRecord tile, TileDecodeException.Kind failure) {
        static DecodeOutcome success(TileRecord tile) {
            return new DecodeOutcome(tile, null);
        }

        static DecodeOutcome failure(TileDecodeException.Kind kind) {
            return new DecodeOutcome(null, kind);
        }
    }
}
