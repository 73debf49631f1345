package com.cario.catalog.app.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.cario.catalog.app.exception.ImageNotFoundException;
import com.cario.catalog.app.model.OrchestrationResult;
import com.cario.catalog.app.model.ProcessedImageRecord;
import com.cario.catalog.app.repository.ResultSink;
import com.cario.catalog.app.repository.dynamodb.ProcessedImageRepository;
import com.cario.catalog.app.service.storage.ImageResolver;
import com.cario.catalog.app.service.storage.ResolvedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ImageCatalogServiceTest {

  @Mock private ImageResolver resolver;
  @Mock private DualPathOrchestrator orchestrator;
  @Mock private ResultSink sink;

  @TempDir Path dir;

  private ResolvedImage tempImage() throws IOException {
    Path tmp = Files.write(dir.resolve("catalog-image-1.jpg"), new byte[] {1});
    return ResolvedImage.temporaryCopy("img-1", tmp, "s3://bucket/img-1");
  }

  @Test
  void processesPersistsAndCleansUp() throws IOException {
    ResolvedImage image = tempImage();
    OrchestrationResult result =
        OrchestrationResult.builder().success(true).method("ai_only").build();
    when(resolver.resolve("img-1")).thenReturn(image);
    when(orchestrator.processImage(image.getPath())).thenReturn(result);

    OrchestrationResult out =
        new ImageCatalogService(resolver, orchestrator, sink).processAndStore("img-1");

    assertSame(result, out);
    verify(sink).save("img-1", "s3://bucket/img-1", result);
    assertFalse(Files.exists(image.getPath()));
  }

  @Test
  void persistenceFailurePropagatesAfterCleanup() throws IOException {
    ResolvedImage image = tempImage();
    OrchestrationResult result = OrchestrationResult.builder().success(true).build();
    when(resolver.resolve("img-1")).thenReturn(image);
    when(orchestrator.processImage(image.getPath())).thenReturn(result);
    doThrow(new IllegalStateException("table missing"))
        .when(sink)
        .save("img-1", "s3://bucket/img-1", result);

    ImageCatalogService service = new ImageCatalogService(resolver, orchestrator, sink);

    assertThrows(IllegalStateException.class, () -> service.processAndStore("img-1"));
    assertFalse(Files.exists(image.getPath()));
  }

  @Test
  void unknownImageNeverReachesPipeline() {
    when(resolver.resolve("nope")).thenThrow(new ImageNotFoundException("nope"));

    ImageCatalogService service = new ImageCatalogService(resolver, orchestrator, sink);

    assertThrows(ImageNotFoundException.class, () -> service.processAndStore("nope"));
    verifyNoInteractions(orchestrator, sink);
  }

  @Test
  void storedRecordLookupNeedsQueryableSink() {
    ProcessedImageRepository repository = mock(ProcessedImageRepository.class);
    ProcessedImageRecord record = ProcessedImageRecord.builder().imageId("img-1").build();
    when(repository.find("img-1")).thenReturn(Optional.of(record));

    assertEquals(
        Optional.of(record),
        new ImageCatalogService(resolver, orchestrator, repository).findProcessed("img-1"));
    assertTrue(
        new ImageCatalogService(resolver, orchestrator, sink).findProcessed("img-1").isEmpty());
  }
}
