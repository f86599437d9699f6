package quest.gekko.aspath.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores an AS path as space separated AS numbers, origin last.
 */
@Converter
public class AsPathConverter implements AttributeConverter<List<Long>, String> {

    @Override
    public String convertToDatabaseColumn(List<Long> path) {
        if (path == null) return null;
        return path.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }

    @Override
    public List<Long> convertToEntityAttribute(String column) {
        return parse(column);
    }

    public static List<Long> parse(String column) {
        if (column == null || column.isBlank()) return List.of();
        return Arrays.stream(column.trim().split("\\s+"))
                .map(Long::valueOf)
                .toList();
    }
}
