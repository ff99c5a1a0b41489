package com.largomodo.demstitch.core;

import com.largomodo.demstitch.core.domain.TileRecord;
import com.largomodo.demstitch.core.domain.TileShape;
import com.largomodo.demstitch.generators.TileRecordFactory;
import com.largomodo.demstitch.service.TileDecodeException;
import com.largomodo.demstitch.service.TileDecodeException.Kind;
import com.largomodo.demstitch.service.TileDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IngestionCoordinator with a mocked decoder.
 * <p>
 * Tests verify:
 * - Per-tile failures are isolated and counted by kind
 * - Accepted tiles come back in discovery order whatever the completion order
 * - Standard shape detection and enforcement
 * - Fatal conditions when nothing is found or decoded
 */
class IngestionCoordinatorTest {

    private TileDecoder decoder;
    private List<Path> sources;

    @BeforeEach
    void setUp() throws TileDecodeException {
        decoder = mock(TileDecoder.class);
        sources = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            sources.add(Path.of("tile_" + i + ".xml"));
        }
        when(decoder.decode(any(), anyInt(), any())).thenAnswer(inv -> tileFor(inv.getArgument(1)));
    }

    @Test
    void testConstructorRejectsNullDecoder() {
        assertThrows(IllegalArgumentException.class, () -> new IngestionCoordinator(null, 2, null, true));
    }

    @Test
    void testConstructorRejectsNonPositiveThreads() {
        assertThrows(IllegalArgumentException.class, () -> new IngestionCoordinator(decoder, 0, null, true));
    }

    @Test
    void testAllTilesAcceptedInDiscoveryOrder() throws Exception {
        when(decoder.decode(any(), anyInt(), any())).thenAnswer(inv -> {
            int index = inv.getArgument(1);
            // Later tiles finish first
            Thread.sleep((12 - index) * 3L);
            return tileFor(index);
        });

        IngestionResult result = new IngestionCoordinator(decoder, 4, null, true).ingest(sources, null);

        assertEquals(12, result.accepted().size());
        assertEquals(12, result.sourceCount());
        assertEquals(0, result.failedCount());
        for (int i = 0; i < 12; i++) {
            assertEquals(i, result.accepted().get(i).discoveryIndex(), "Accepted tiles must keep discovery order");
        }
    }

    @Test
    void testFailuresAreIsolatedAndCountedByKind() throws Exception {
        when(decoder.decode(eq(sources.get(3)), anyInt(), any()))
                .thenThrow(new TileDecodeException(Kind.MALFORMED_SOURCE, sources.get(3), "broken"));
        when(decoder.decode(eq(sources.get(5)), anyInt(), any()))
                .thenThrow(new TileDecodeException(Kind.SIZE_MISMATCH, sources.get(5), "wrong size"));
        when(decoder.decode(eq(sources.get(7)), anyInt(), any()))
                .thenThrow(new IllegalStateException("unexpected"));

        IngestionResult result = new IngestionCoordinator(decoder, 3, null, true).ingest(sources, null);

        assertEquals(9, result.accepted().size());
        assertEquals(3, result.failedCount());
        assertEquals(2, result.failures(Kind.MALFORMED_SOURCE), "Unexpected exceptions count as malformed");
        assertEquals(1, result.failures(Kind.SIZE_MISMATCH));
        assertEquals(0, result.failures(Kind.UNREADABLE));
    }

    @Test
    void testStandardShapeDetectedFromFirstDecodableTile() throws Exception {
        when(decoder.decode(eq(sources.get(0)), anyInt(), any()))
                .thenThrow(new TileDecodeException(Kind.UNREADABLE, sources.get(0), "gone"));

        IngestionResult result = new IngestionCoordinator(decoder, 2, null, true).ingest(sources, null);

        assertEquals(new TileShape(3, 4), result.standardShape());
        verify(decoder).decode(eq(sources.get(0)), eq(0), isNull());
        verify(decoder).decode(eq(sources.get(1)), eq(1), isNull());
        verify(decoder).decode(eq(sources.get(2)), eq(2), eq(new TileShape(3, 4)));
        verify(decoder).decode(eq(sources.get(11)), eq(11), eq(new TileShape(3, 4)));
    }

    @Test
    void testConfiguredShapeIsPassedToEveryDecode() throws Exception {
        TileShape shape = new TileShape(3, 4);

        IngestionResult result = new IngestionCoordinator(decoder, 2, shape, true).ingest(sources, null);

        assertEquals(shape, result.standardShape());
        verify(decoder, times(12)).decode(any(), anyInt(), eq(shape));
    }

    @Test
    void testMixedSizesSkipShapeChecks() throws Exception {
        IngestionResult result = new IngestionCoordinator(decoder, 2, new TileShape(3, 4), false)
                .ingest(sources, null);

        assertNull(result.standardShape());
        verify(decoder, times(12)).decode(any(), anyInt(), isNull());
    }

    @Test
    void testObserverSeesEveryTile() throws Exception {
        when(decoder.decode(eq(sources.get(4)), anyInt(), any()))
                .thenThrow(new TileDecodeException(Kind.MALFORMED_SOURCE, sources.get(4), "broken"));
        IngestionObserver observer = mock(IngestionObserver.class);

        new IngestionCoordinator(decoder, 3, null, true).ingest(sources, observer);

        verify(observer, times(12)).onStart(any());
        verify(observer, times(11)).onSuccess(any(), any());
        verify(observer).onFailure(eq(sources.get(4)), any(TileDecodeException.class));
    }

    @Test
    void testWorkerErrorLetsInFlightDecodesFinish() throws Exception {
        List<Path> pair = sources.subList(0, 2);
        AtomicBoolean finished = new AtomicBoolean();
        AtomicBoolean interrupted = new AtomicBoolean();
        when(decoder.decode(eq(pair.get(0)), anyInt(), any())).thenThrow(new AssertionError("decoder bug"));
        when(decoder.decode(eq(pair.get(1)), anyInt(), any())).thenAnswer(inv -> {
            try {
                Thread.sleep(300);
                finished.set(true);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
            return tileFor(1);
        });

        IngestionCoordinator coordinator = new IngestionCoordinator(decoder, 2, null, false);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> coordinator.ingest(pair, null));

        assertInstanceOf(AssertionError.class, e.getCause());
        assertTrue(finished.get(), "Pool shutdown must wait for the decode already running");
        assertFalse(interrupted.get(), "Running decodes must not be interrupted on a graceful shutdown");
    }

    @Test
    void testEmptySourcesIsFatal() {
        NoValidTilesException ex = assertThrows(NoValidTilesException.class,
                () -> new IngestionCoordinator(decoder, 2, null, true).ingest(List.of(), null));
        assertEquals(NoValidTilesException.Reason.NO_TILES_FOUND, ex.getReason());
    }

    @Test
    void testNothingDecodedIsFatal() throws Exception {
        when(decoder.decode(any(), anyInt(), any()))
                .thenThrow(new TileDecodeException(Kind.MALFORMED_SOURCE, Path.of("x"), "broken"));

        NoValidTilesException ex = assertThrows(NoValidTilesException.class,
                () -> new IngestionCoordinator(decoder, 2, null, true).ingest(sources, null));
        assertEquals(NoValidTilesException.Reason.NO_TILES_DECODED, ex.getReason());
        assertTrue(ex.getMessage().startsWith("No tiles decoded"));
    }

    private static TileRecord tileFor(int index) {
        return TileRecordFactory.cell(index / 4, index % 4, 3, 4, 1.0f + index, index);
    }
}
