package com.flamingo.ai.contextlab.config;

import com.flamingo.ai.contextlab.agent.TagExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Tag extraction agent used by auto-tagging. Returns the raw JSON text of the model reply. */
  @Bean
  public TagExtractionAgent tagExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(TagExtractionAgent.class).chatModel(chatModel).build();
  }
}
