package com.cario.catalog.app.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring AI wiring for the vision model.
 *
 * <p>{@link OpenAiChatModel} is autoconfigured from {@code spring.ai.openai.*} in
 * application.yaml; the model id, temperature and token limit are set per request from {@code
 * catalog.vision.*}.
 */
@Configuration
public class ChatGptConfig {

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }
}
