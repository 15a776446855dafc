package org.probenet.server.geolocation;

import org.apache.commons.lang3.StringUtils;
import org.probenet.server.geolocation.model.RegionInfo;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static country table: ISO-3166-1-alpha-2 code to continent code and geographic region.
 * <p>
 * Built once from CSV rows of {@code alpha2,continent,region}; unknown countries map to empty values.
 */
public class CountryRegionMapper {

    private static final RegionInfo UNKNOWN_REGION = RegionInfo.of(StringUtils.EMPTY, StringUtils.EMPTY);

    private final Map<String, CountryRow> countries;

    public CountryRegionMapper(String countryRegionsCsv) {
        countries = Arrays.stream(countryRegionsCsv.split("\n"))
                .filter(StringUtils::isNotBlank)
                .map(CountryRegionMapper::parseRow)
                .collect(Collectors.toUnmodifiableMap(CountryRow::alpha2, Function.identity(), (o1, o2) -> o1));
    }

    public RegionInfo regionFor(String countryCode) {
        final CountryRow row = countries.get(LocationNormalizer.normalizeCountry(countryCode));
        return row != null ? row.region() : UNKNOWN_REGION;
    }

    public String continentFor(String countryCode) {
        final CountryRow row = countries.get(LocationNormalizer.normalizeCountry(countryCode));
        return row != null ? row.continent() : StringUtils.EMPTY;
    }

    private static CountryRow parseRow(String row) {
        final String[] tokens = row.split(",", -1);
        if (tokens.length != 3 || tokens[0].trim().length() != 2 || tokens[1].trim().length() != 2) {
            throw new IllegalArgumentException(
                    "Invalid csv file format: row \"%s\" must contain country code, continent code and region"
                            .formatted(row));
        }

        final String region = LocationNormalizer.displayName(tokens[2]);
        return new CountryRow(
                LocationNormalizer.normalizeCountry(tokens[0]),
                LocationNormalizer.normalizeCountry(tokens[1]),
                RegionInfo.of(region, LocationNormalizer.normalizedName(region)));
    }

    private record CountryRow(String alpha2, String continent, RegionInfo region) {
    }
}
