package cronarchy.scheduler.service;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import cronarchy.scheduler.exceptions.StorageException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes job arguments to the stored JSON form.
 *
 * <p>Arguments are written as a JSON array, with map keys and bean properties
 * sorted, so two equal argument lists always produce the same string. Values
 * that JSON cannot tell apart from another Java type ({@code Long},
 * {@code Float}, {@code BigDecimal}, nested lists and maps) carry their class
 * as a {@code ["java.lang.Long", 42]} wrapper, so they read back equal to
 * what was written. Strings, booleans, {@code Integer} and {@code Double}
 * stay plain JSON.
 *
 * <p>Other objects (beans, enums, dates) are stored in their Jackson JSON
 * form and read back as maps and strings. When reading, a JSON object with
 * numeric keys is accepted as a sparse positional mapping and flattened in
 * ascending key order.
 */
public final class ArgsCodec {

    private static final TypeReference<List<Object>> ARGS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> MAPPING_TYPE = new TypeReference<>() {
    };

    private static final PolymorphicTypeValidator STORED_TYPES = BasicPolymorphicTypeValidator.builder()
            .allowIfSubType(Number.class)
            .allowIfSubType(ArrayList.class)
            .allowIfSubType(LinkedHashMap.class)
            .build();

    private static final ObjectMapper PLAIN = baseMapper().build();

    private static final ObjectMapper TYPED = baseMapper()
            .activateDefaultTyping(STORED_TYPES, ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT,
                    JsonTypeInfo.As.WRAPPER_ARRAY)
            .build();

    private static final ObjectWriter WRITER = TYPED.writerFor(ARGS_TYPE);

    private ArgsCodec() {
    }

    private static JsonMapper.Builder baseMapper() {
        return JsonMapper.builder()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .findAndAddModules();
    }

    public static String serialize(List<?> args) {
        List<Object> normalized = new ArrayList<>();
        if (args != null) {
            for (Object arg : args) {
                normalized.add(normalize(arg));
            }
        }
        try {
            return WRITER.writeValueAsString(normalized);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job arguments are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public static List<Object> deserialize(String stored) {
        if (stored == null || stored.isBlank()) {
            return new ArrayList<>();
        }
        String json = stored.strip();
        try {
            if (json.startsWith("[")) {
                return new ArrayList<>(TYPED.readValue(json, ARGS_TYPE));
            }
            if (json.startsWith("{")) {
                return fromSparseMapping(TYPED.readValue(json, MAPPING_TYPE));
            }
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored job arguments are not valid JSON", e);
        }
        throw new StorageException("Stored job arguments are neither a list nor a mapping: " + stored);
    }

    private static List<Object> fromSparseMapping(Map<String, Object> mapping) {
        TreeMap<Long, Object> ordered = new TreeMap<>();
        for (Map.Entry<String, Object> entry : mapping.entrySet()) {
            try {
                ordered.put(Long.parseLong(entry.getKey()), entry.getValue());
            } catch (NumberFormatException e) {
                throw new StorageException("Non-numeric argument position '" + entry.getKey() + "'", e);
            }
        }
        return new ArrayList<>(ordered.values());
    }

    /**
     * Reduce a value to JSON scalars, {@link ArrayList} and {@link LinkedHashMap},
     * the only containers the stored type ids name.
     */
    private static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            for (Object item : items) {
                list.add(normalize(item));
            }
            return list;
        }
        if (value instanceof Map<?, ?> entries) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                map.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return map;
        }
        try {
            return normalize(PLAIN.convertValue(value, Object.class));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Job argument of type " + value.getClass().getName()
                    + " is not serializable: " + e.getMessage(), e);
        }
    }
}
