package com.chatdirecto.repositorios.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Conversión entre entidades y filas JSON del almacén: columnas en snake_case,
 * fechas ISO-8601 y columnas desconocidas ignoradas (las filas pueden traer joins).
 */
public final class RowJson {

    private static final ObjectMapper MAPPER = createMapper();

    private RowJson() {
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode toRecord(Object row) {
        return MAPPER.valueToTree(row);
    }

    /**
     * @throws IllegalArgumentException si la fila no corresponde al tipo pedido
     */
    public static <T> T fromRecord(JsonNode record, Class<T> type) {
        try {
            return MAPPER.treeToValue(record, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Fila inválida para " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public static String toJson(JsonNode record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar la fila", e);
        }
    }
}
