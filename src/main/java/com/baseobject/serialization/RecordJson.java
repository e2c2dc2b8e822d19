package com.baseobject.serialization;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.baseobject.core.BaseObject;
import com.baseobject.core.SortOrder;
import com.baseobject.core.exception.SerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON text projection of records.
 *
 * Records are written as their field mappings, in insertion order unless keys
 * are sorted; sorting applies to every nested mapping. Reading parses a JSON
 * object into an insertion-ordered mapping and builds the record from it.
 */
public class RecordJson {

    private static final Logger log = LoggerFactory.getLogger(RecordJson.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAPPING = new TypeReference<>() {
    };

    private static final RecordJson DEFAULTS = new RecordJson(RecordJsonConfig.builder().build());

    private final RecordJsonConfig config;
    private final ObjectMapper mapper;

    public RecordJson(RecordJsonConfig config) {
        this.config = config;
        JsonMapper.Builder builder = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(new RecordJsonModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (config.isIndentOutput()) {
            builder.enable(SerializationFeature.INDENT_OUTPUT);
        }
        this.mapper = builder.build();
    }

    /**
     * Shared instance writing compact, unsorted JSON.
     */
    public static RecordJson defaults() {
        return DEFAULTS;
    }

    public RecordJsonConfig getConfig() {
        return config;
    }

    public String write(BaseObject record) {
        return write(record, null, config.isSortKeys());
    }

    public String write(BaseObject record, Collection<String> exclude, boolean sortKeys) {
        return writeMapping(record.toMapping(exclude, SortOrder.NONE), sortKeys);
    }

    public String writeMapping(Map<String, ?> mapping, boolean sortKeys) {
        ObjectWriter writer = sortKeys
                ? mapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                : mapper.writer();
        try {
            return writer.writeValueAsString(mapping);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write record as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws SerializationException when the text is not a JSON object
     */
    public Map<String, Object> readMapping(String text) {
        if (text == null || text.isBlank()) {
            throw new SerializationException("Expected a JSON object, got empty text", null);
        }
        Map<String, Object> mapping;
        try {
            mapping = mapper.readValue(text, MAPPING);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to read JSON object: " + e.getOriginalMessage(), e);
        }
        if (mapping == null) {
            throw new SerializationException("Expected a JSON object, got null", null);
        }
        log.debug("Read {} fields from JSON", mapping.size());
        return mapping;
    }

    public <T extends BaseObject> T read(Class<T> type, String text) {
        return BaseObject.fromMapping(type, readMapping(text));
    }
}
