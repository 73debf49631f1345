package com.cario.catalog.app.service.vision;

import com.cario.catalog.app.prompt.PromptConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

/** Loads prompt documents from S3 or the classpath. YAML is tried first, then JSON. */
@Log4j2
public class PromptLoaderService {

  private final S3Client s3Client;

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper jsonMapper = new ObjectMapper();

  /** @param s3Client may be null when prompts only come from the classpath */
  public PromptLoaderService(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  public PromptConfig load(String bucket, String key) {
    if (s3Client == null) {
      throw new IllegalStateException(
          "No S3 client configured for prompt s3://" + bucket + "/" + key);
    }
    String source = "s3://" + bucket + "/" + key;
    try {
      ResponseBytes<?> bytes =
          s3Client.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
      return parse(bytes.asString(StandardCharsets.UTF_8), source);
    } catch (RuntimeException e) {
      log.error("prompt.load.failed source={}", source, e);
      throw new IllegalStateException("Failed to load prompt from " + source, e);
    }
  }

  public PromptConfig loadClasspath(String resource) {
    String source = "classpath:" + resource;
    try (InputStream in = new ClassPathResource(resource).getInputStream()) {
      return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), source);
    } catch (IOException e) {
      log.error("prompt.load.failed source={}", source, e);
      throw new UncheckedIOException("Failed to load prompt from " + source, e);
    }
  }

  PromptConfig parse(String raw, String source) {
    try {
      Map<String, Object> map = yamlMapper.readValue(raw, new TypeReference<>() {});
      if (map != null && map.get("system") != null) {
        PromptConfig cfg = new PromptConfig();
        cfg.setSystemTemplate(asString(map.get("system")));
        cfg.setUserTemplate(asString(map.get("user")));
        cfg.setRules(toStringMap(map.get("rules")));
        log.info("prompt.loaded source={} format=yaml", source);
        return cfg;
      }
    } catch (IOException | RuntimeException yamlErr) {
      log.warn("prompt.yaml.failed source={} msg={}, trying JSON", source, yamlErr.getMessage());
    }

    try {
      PromptConfig cfg = jsonMapper.readValue(raw, PromptConfig.class);
      if (cfg == null || cfg.getSystemTemplate() == null) {
        throw new IllegalStateException("Prompt " + source + " has no system template");
      }
      if (cfg.getRules() == null) {
        cfg.setRules(Map.of());
      }
      log.info("prompt.loaded source={} format=json", source);
      return cfg;
    } catch (IOException e) {
      throw new IllegalStateException("Prompt " + source + " is neither YAML nor JSON", e);
    }
  }

  private static String asString(Object o) {
    return (o == null) ? null : o.toString();
  }

  private static Map<String, String> toStringMap(Object node) {
    if (!(node instanceof Map<?, ?> src)) {
      return Map.of();
    }
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : src.entrySet()) {
      out.put(
          Objects.toString(e.getKey(), ""), e.getValue() == null ? null : e.getValue().toString());
    }
    return out;
  }
}
