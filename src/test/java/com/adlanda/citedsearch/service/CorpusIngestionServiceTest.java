package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.config.IngestionProperties;
import com.adlanda.citedsearch.exception.IndexQueryException;
import com.adlanda.citedsearch.exception.IngestionInProgressException;
import com.adlanda.citedsearch.health.IngestionHealthIndicator;
import com.adlanda.citedsearch.model.Chunk;
import com.adlanda.citedsearch.model.IngestionReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CorpusIngestionServiceTest {

    private static final Path CHUNKS_DIR = Path.of("chunks");
    private static final List<Chunk> CHUNKS = List.of(
            new Chunk("c1", "text", Map.of("filename", "manual.pdf", "product_category", "Valves")));

    @Mock
    private ChunkFileLoader chunkFileLoader;

    @Mock
    private IngestionService ingestionService;

    @Mock
    private IngestionReportWriter reportWriter;

    private DocumentCatalog documentCatalog;
    private IngestionHealthIndicator healthIndicator;
    private CorpusIngestionService service;

    @BeforeEach
    void setUp() {
        documentCatalog = new DocumentCatalog();
        healthIndicator = new IngestionHealthIndicator();
        IngestionProperties properties = new IngestionProperties();
        properties.setChunksPath(CHUNKS_DIR.toString());
        service = new CorpusIngestionService(chunkFileLoader, documentCatalog, ingestionService,
                reportWriter, healthIndicator, properties);
    }

    @Test
    void ingestConfiguredDirectory_loadsCatalogsIngestsAndWritesReport() {
        IngestionReport report = new IngestionReport(1, 0, 0, 0, List.of(), 0.2);
        when(chunkFileLoader.loadDirectory(CHUNKS_DIR)).thenReturn(CHUNKS);
        when(ingestionService.ingest(CHUNKS)).thenReturn(report);

        IngestionReport result = service.ingestConfiguredDirectory();

        assertThat(result).isEqualTo(report);
        assertThat(documentCatalog.categories()).containsExactly("Valves");
        verify(reportWriter).write(report);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void ingestDirectory_noChunks_reportsEmptyRunWithoutIngesting() {
        when(chunkFileLoader.loadDirectory(CHUNKS_DIR)).thenReturn(List.of());

        IngestionReport result = service.ingestDirectory(CHUNKS_DIR);

        assertThat(result.processed()).isZero();
        verifyNoInteractions(ingestionService);
    }

    @Test
    void ingestDirectory_reportWriteFails_stillReturnsReport() {
        IngestionReport report = new IngestionReport(1, 0, 0, 0, List.of(), 0.2);
        when(chunkFileLoader.loadDirectory(CHUNKS_DIR)).thenReturn(CHUNKS);
        when(ingestionService.ingest(CHUNKS)).thenReturn(report);
        when(reportWriter.write(any())).thenThrow(new UncheckedIOException(new IOException("disk full")));

        assertThat(service.ingestDirectory(CHUNKS_DIR)).isEqualTo(report);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void ingestDirectory_ingestionAborts_marksHealthDownAndRethrows() {
        when(chunkFileLoader.loadDirectory(CHUNKS_DIR)).thenReturn(CHUNKS);
        when(ingestionService.ingest(anyList())).thenThrow(new IndexQueryException("index unreachable"));

        assertThatThrownBy(() -> service.ingestDirectory(CHUNKS_DIR))
                .isInstanceOf(IndexQueryException.class);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
        assertThat(healthIndicator.health().getDetails()).containsEntry("error", "index unreachable");
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void ingestDirectory_whileAnotherRunIsInProgress_throwsException() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(chunkFileLoader.loadDirectory(CHUNKS_DIR)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });

        CompletableFuture<IngestionReport> first = CompletableFuture.supplyAsync(() -> service.ingestDirectory(CHUNKS_DIR));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.ingestDirectory(CHUNKS_DIR))
                .isInstanceOf(IngestionInProgressException.class);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).processed()).isZero();
        assertThat(service.isRunning()).isFalse();
    }
}
