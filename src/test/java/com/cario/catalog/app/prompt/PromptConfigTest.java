package com.cario.catalog.app.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PromptConfigTest {

  @Test
  void rulesAreAppendedInOrder() {
    PromptConfig config = new PromptConfig();
    config.setSystemTemplate("  Read the label.\n");
    Map<String, String> rules = new LinkedHashMap<>();
    rules.put("accuracy", "copy text exactly");
    rules.put("uncertainty", "say so");
    config.setRules(rules);

    assertEquals(
        "Read the label.\n\n## RULES:\n- accuracy: copy text exactly\n- uncertainty: say so",
        config.renderSystem());
  }

  @Test
  void missingPartsRenderEmpty() {
    assertEquals("", new PromptConfig().renderSystem());
  }
}
