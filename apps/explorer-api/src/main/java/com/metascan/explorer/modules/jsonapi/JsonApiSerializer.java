package com.metascan.explorer.modules.jsonapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.modules.query.ResolvedPage;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Renders records into the {@code {data, meta?}} envelope. Record attributes use snake_case names.
 */
@Component
public class JsonApiSerializer {

    private static final DateTimeFormatter ISO_UTC = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    private final ObjectMapper mapper;

    public JsonApiSerializer(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public ObjectNode resource(JsonApiRecord record) {
        return resource(record.resourceType(), record.resourceId(), attributes(record));
    }

    /**
     * Resource with some attributes left out, e.g. bulky call params in list views.
     */
    public ObjectNode resource(JsonApiRecord record, Collection<String> excludedAttributes) {
        ObjectNode attributes = attributes(record);
        attributes.remove(excludedAttributes);
        return resource(record.resourceType(), record.resourceId(), attributes);
    }

    public ObjectNode resource(String type, String id, ObjectNode attributes) {
        ObjectNode resource = mapper.createObjectNode();
        resource.put("type", type);
        resource.put("id", id);
        resource.set("attributes", attributes);
        return resource;
    }

    public ObjectNode attributes(Object value) {
        return mapper.valueToTree(value);
    }

    public JsonNode tree(Object value) {
        return mapper.valueToTree(value);
    }

    public ObjectNode objectNode() {
        return mapper.createObjectNode();
    }

    public ArrayNode arrayNode() {
        return mapper.createArrayNode();
    }

    /**
     * Adds {@code relationships.<name>.data} holding the given rendered resources.
     */
    public ObjectNode withRelationship(ObjectNode resource, String name, List<ObjectNode> related) {
        ObjectNode relationships = resource.has("relationships")
                ? (ObjectNode) resource.get("relationships")
                : resource.putObject("relationships");
        ArrayNode data = relationships.putObject(name).putArray("data");
        related.forEach(data::add);
        return resource;
    }

    public <T extends JsonApiRecord> ObjectNode withRelatedRecords(ObjectNode resource, String name, Collection<T> related) {
        return withRelationship(resource, name, related.stream().map(this::resource).toList());
    }

    public ObjectNode document(JsonNode data) {
        ObjectNode document = mapper.createObjectNode();
        document.set("data", data);
        return document;
    }

    public <T> ObjectNode listDocument(ResolvedPage<T> page, Function<T, ObjectNode> render) {
        ArrayNode data = mapper.createArrayNode();
        page.getItems().forEach(item -> data.add(render.apply(item)));
        ObjectNode document = document(data);
        ObjectNode meta = document.putObject("meta");
        meta.put("page_number", page.getNumber());
        meta.put("page_size", page.getSize());
        meta.put("total_count", page.getTotal());
        return document;
    }

    /**
     * A list document for results that are not paged, such as reports.
     */
    public ObjectNode listDocument(List<? extends JsonNode> items) {
        ArrayNode data = mapper.createArrayNode();
        items.forEach(data::add);
        return document(data);
    }

    public String write(JsonNode document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render response document", e);
        }
    }

    public static String isoUtc(LocalDateTime datetime) {
        return datetime == null ? null : datetime.atOffset(ZoneOffset.UTC).format(ISO_UTC);
    }
}
