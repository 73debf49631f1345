package com.cario.catalog.app.service.vision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class VisionSchemaFactoryTest {

  @Test
  @SuppressWarnings("unchecked")
  void responseSchemaIsStrictAtEveryLevel() {
    Map<String, Object> schema = VisionSchemaFactory.responseSchema();

    assertEquals("object", schema.get("type"));
    assertEquals(false, schema.get("additionalProperties"));
    assertNull(schema.get("$schema"));
    Map<String, Object> props = (Map<String, Object>) schema.get("properties");
    assertEquals(
        Set.of(
            "extracted_text",
            "detected_objects",
            "description",
            "confidence",
            "text_locations",
            "extraction_notes"),
        props.keySet());
    assertEquals(Set.copyOf(props.keySet()), Set.copyOf((List<String>) schema.get("required")));

    Map<String, Object> locations = (Map<String, Object>) props.get("text_locations");
    assertEquals(false, locations.get("additionalProperties"));
    assertEquals(
        Set.of("brand", "model", "barcode", "specifications"),
        Set.copyOf((List<String>) locations.get("required")));
  }

  @Test
  @SuppressWarnings("unchecked")
  void enforceStrictWalksArraysAndComposites() {
    Map<String, Object> inner = new HashMap<>();
    inner.put("type", "object");
    inner.put("properties", new LinkedHashMap<>(Map.of("x", Map.of("type", "string"))));
    Map<String, Object> member = new HashMap<>();
    member.put("type", "object");
    member.put("properties", new LinkedHashMap<>(Map.of("y", Map.of("type", "number"))));
    Map<String, Object> root = new HashMap<>();
    root.put("type", "array");
    root.put("items", inner);
    root.put("anyOf", List.of(member));

    VisionSchemaFactory.enforceStrict(root);

    assertEquals(false, inner.get("additionalProperties"));
    assertEquals(List.of("x"), inner.get("required"));
    assertEquals(false, member.get("additionalProperties"));
    assertEquals(List.of("y"), member.get("required"));
    assertFalse(root.containsKey("additionalProperties"));
  }
}
