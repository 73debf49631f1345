package com.cario.catalog.app.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;

/** Prompt document with keys {@code system}, {@code user} and {@code rules}. */
@Data
public class PromptConfig {
  @JsonProperty("system")
  private String systemTemplate;

  @JsonProperty("user")
  private String userTemplate;

  @JsonProperty("rules")
  private Map<String, String> rules;

  /** System template followed by the rules as a bullet list, in document order. */
  public String renderSystem() {
    StringBuilder sb = new StringBuilder(systemTemplate == null ? "" : systemTemplate.strip());
    if (rules != null && !rules.isEmpty()) {
      sb.append("\n\n## RULES:\n");
      rules.forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append('\n'));
    }
    return sb.toString().strip();
  }
}
