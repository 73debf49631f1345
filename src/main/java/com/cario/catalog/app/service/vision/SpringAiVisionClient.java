package com.cario.catalog.app.service.vision;

import com.cario.catalog.app.exception.VisionApiException;
import com.cario.catalog.app.exception.VisionApiException.Category;
import java.util.Locale;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.client.ResourceAccessException;

/** {@link VisionClient} over the Spring AI OpenAI chat model. The image goes as user media. */
@Log4j2
public class SpringAiVisionClient implements VisionClient {

  private final ChatClient chat;

  public SpringAiVisionClient(ChatClient.Builder builder) {
    this.chat = builder.build();
  }

  @Override
  public String complete(VisionRequest request) {
    OpenAiChatOptions.Builder options =
        OpenAiChatOptions.builder()
            .model(request.getModel())
            .temperature(request.getTemperature())
            .maxTokens(request.getMaxTokens());
    if (request.getResponseSchema() != null) {
      options.responseFormat(
          ResponseFormat.builder()
              .type(ResponseFormat.Type.JSON_SCHEMA)
              .jsonSchema(
                  ResponseFormat.JsonSchema.builder()
                      .name(VisionSchemaFactory.SCHEMA_NAME)
                      .schema(request.getResponseSchema())
                      .strict(true)
                      .build())
              .build());
    }

    String content;
    try {
      content =
          chat.prompt()
              .system(request.getSystemPrompt())
              .user(
                  u ->
                      u.text(request.getUserPrompt())
                          .media(
                              MimeTypeUtils.parseMimeType(request.getMimeType()),
                              new ByteArrayResource(request.getImageBytes())))
              .options(options.build())
              .call()
              .content();
    } catch (RuntimeException e) {
      Category category = categorize(e);
      log.error(
          "vision.call.failed model={} category={} msg={}",
          request.getModel(),
          category,
          e.getMessage());
      throw new VisionApiException(category, "Vision model call failed: " + e.getMessage(), e);
    }

    if (content == null || content.isBlank()) {
      throw new VisionApiException(Category.UNKNOWN, "Vision model returned no content", null);
    }
    log.debug("vision.call.ok model={} chars={}", request.getModel(), content.length());
    return content;
  }

  static Category categorize(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      String msg = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
      if (msg.contains("401")
          || msg.contains("403")
          || msg.contains("invalid_api_key")
          || msg.contains("unauthorized")) {
        return Category.AUTHENTICATION;
      }
      if (msg.contains("429") || msg.contains("rate limit") || msg.contains("rate_limit")) {
        return Category.RATE_LIMIT;
      }
    }
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof ResourceAccessException
          || t instanceof TransientAiException
          || t instanceof java.io.IOException) {
        return Category.TRANSPORT;
      }
    }
    return Category.UNKNOWN;
  }
}
