package com.cario.catalog.app.service.vision;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import java.util.List;
import java.util.Map;

/**
 * Builds the strict structured-output schema from {@link VisionResponse}: every property required
 * and no additional properties, at every level.
 */
public final class VisionSchemaFactory {

  public static final String SCHEMA_NAME = "ProductVisionExtraction";

  private static final ObjectMapper om = new ObjectMapper();

  private VisionSchemaFactory() {}

  public static Map<String, Object> responseSchema() {
    SchemaGeneratorConfigBuilder cfgBuilder =
        new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
            .with(new JacksonModule());
    SchemaGenerator generator = new SchemaGenerator(cfgBuilder.build());
    JsonNode schemaNode = generator.generateSchema(VisionResponse.class);

    Map<String, Object> schema = om.convertValue(schemaNode, new TypeReference<>() {});
    schema.remove("$schema");
    schema.remove("$id");
    schema.put("type", "object");
    enforceStrict(schema);
    return schema;
  }

  @SuppressWarnings("unchecked")
  static void enforceStrict(Map<String, Object> schema) {
    if (schema == null) return;

    if ("object".equals(schema.get("type"))) {
      schema.put("additionalProperties", false);
      if (schema.get("properties") instanceof Map<?, ?> props) {
        schema.put("required", props.keySet().stream().map(Object::toString).toList());
        for (Object child : props.values()) {
          if (child instanceof Map<?, ?>) {
            enforceStrict((Map<String, Object>) child);
          }
        }
      }
    }

    if ("array".equals(schema.get("type")) && schema.get("items") instanceof Map<?, ?>) {
      enforceStrict((Map<String, Object>) schema.get("items"));
    }

    for (String composite : List.of("anyOf", "oneOf", "allOf")) {
      if (schema.get(composite) instanceof List<?> members) {
        for (Object member : members) {
          if (member instanceof Map<?, ?>) {
            enforceStrict((Map<String, Object>) member);
          }
        }
      }
    }
  }
}
