package com.cario.catalog.app.service.storage;

import com.cario.catalog.app.exception.ImageNotFoundException;
import com.cario.catalog.app.exception.ImageResolutionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/** Downloads {@code s3://bucket/prefix + imageId} into a temp file for the duration of a call. */
@Log4j2
public class S3ImageResolver implements ImageResolver {

  private final S3Client s3Client;
  private final String bucket;
  private final String prefix;

  public S3ImageResolver(S3Client s3Client, String bucket, String prefix) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("catalog.storage.bucket must be set for S3 storage");
    }
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public ResolvedImage resolve(String imageId) {
    if (imageId == null || imageId.isBlank()) {
      throw new IllegalArgumentException("imageId must not be blank");
    }
    String key = prefix + imageId;
    String uri = "s3://" + bucket + "/" + key;
    Path tmp = null;
    try (ResponseInputStream<GetObjectResponse> in =
        s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build())) {
      tmp = Files.createTempFile("catalog-image-", suffixOf(imageId));
      copy(in, tmp);
      log.info(
          "image.resolve.s3 imageId={} uri={} bytes={}", imageId, uri, Files.size(tmp));
      return ResolvedImage.temporaryCopy(imageId, tmp, uri);
    } catch (NoSuchKeyException e) {
      deleteQuietly(tmp);
      throw new ImageNotFoundException(imageId);
    } catch (SdkException | IOException e) {
      deleteQuietly(tmp);
      log.error("image.resolve.failed imageId={} uri={} msg={}", imageId, uri, e.getMessage());
      throw new ImageResolutionException("Unable to fetch " + uri, e);
    }
  }

  private static void copy(InputStream in, Path target) throws IOException {
    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
  }

  static String suffixOf(String imageId) {
    int dot = imageId.lastIndexOf('.');
    int slash = imageId.lastIndexOf('/');
    return dot > slash && dot < imageId.length() - 1 ? imageId.substring(dot) : ".img";
  }

  private static void deleteQuietly(Path tmp) {
    if (tmp == null) return;
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("image.cleanup.failed path={} msg={}", tmp, e.getMessage());
    }
  }
}
