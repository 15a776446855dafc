package org.probenet.server.geolocation;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps US state names as reported by providers ("Texas", "District of Columbia") to ANSI codes.
 */
public class UsStateMapper {

    private final Map<String, String> nameToCode;

    public UsStateMapper(String usStatesCsv) {
        nameToCode = Arrays.stream(usStatesCsv.split("\n"))
                .filter(StringUtils::isNotBlank)
                .map(UsStateMapper::parseRow)
                .collect(Collectors.toUnmodifiableMap(
                        tokens -> LocationNormalizer.normalizedName(tokens[0]),
                        tokens -> tokens[1].trim()));
    }

    /**
     * Returns the ANSI code of a state given by name or already by code, null when unknown.
     */
    public String toCode(String state) {
        final String normalizedState = LocationNormalizer.normalizedName(state);
        if (normalizedState.isEmpty()) {
            return null;
        }

        final String code = nameToCode.get(normalizedState);
        if (code != null) {
            return code;
        }

        final String stateCode = normalizedState.toUpperCase(Locale.ROOT);
        return nameToCode.containsValue(stateCode) ? stateCode : null;
    }

    private static String[] parseRow(String row) {
        final String[] tokens = row.split(",");
        if (tokens.length != 2 || tokens[1].trim().length() != 2) {
            throw new IllegalArgumentException(
                    "Invalid csv file format: row \"%s\" must contain state name and code".formatted(row));
        }

        return tokens;
    }
}
