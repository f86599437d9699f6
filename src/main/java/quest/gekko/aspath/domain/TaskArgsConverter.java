package quest.gekko.aspath.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class TaskArgsConverter implements AttributeConverter<List<String>, String> {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> ARGS = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<String> args) {
        try {
            return MAPPER.writeValueAsString(args == null ? List.of() : args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize task args " + args, e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return List.of();
        try {
            return MAPPER.readValue(column, ARGS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt task args column: " + column, e);
        }
    }
}
