package com.flamingo.ai.contextlab.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that extracts topics, keywords, entities and categories from arbitrary content.
 *
 * <p>Returns the model's raw reply. Callers parse it leniently because models occasionally wrap
 * the JSON in code fences or add trailing commas.
 */
public interface TagExtractionAgent {

  @SystemMessage("You are a helpful assistant that extracts tags and keywords from content.")
  @UserMessage(
      """
        You are an expert at analyzing content and extracting relevant tags and keywords.

        Given the following content, extract:
        1. Main topics (high-level themes)
        2. Keywords (important terms and concepts)
        3. Entities (people, organizations, locations, products)
        4. Categories (content classification)

        Content:
        {{content}}

        Respond with a JSON object in the following format:
        {
            "topics": ["topic1", "topic2", ...],
            "keywords": ["keyword1", "keyword2", ...],
            "entities": ["entity1", "entity2", ...],
            "categories": ["category1", "category2", ...]
        }

        Keep the response concise and relevant. Limit each array to 10 items maximum.
        """)
  String extractTags(@V("content") String content);
}
