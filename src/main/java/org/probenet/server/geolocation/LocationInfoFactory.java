package org.probenet.server.geolocation;

import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.probenet.server.geolocation.model.LocationInfo;
import org.probenet.server.geolocation.model.RawLocation;

import java.util.Objects;

/**
 * Builds normalized {@link LocationInfo} from raw provider values.
 */
public class LocationInfoFactory {

    private static final String US_COUNTRY_CODE = "US";

    private final CountryRegionMapper countryRegionMapper;
    private final UsStateMapper usStateMapper;

    public LocationInfoFactory(CountryRegionMapper countryRegionMapper, UsStateMapper usStateMapper) {
        this.countryRegionMapper = Objects.requireNonNull(countryRegionMapper);
        this.usStateMapper = Objects.requireNonNull(usStateMapper);
    }

    public LocationInfo create(RawLocation raw) {
        final String country = LocationNormalizer.normalizeCountry(raw.getCountry());
        final String continent = StringUtils.isNotBlank(raw.getContinent())
                ? LocationNormalizer.normalizeCountry(raw.getContinent())
                : countryRegionMapper.continentFor(country);

        return LocationInfo.builder()
                .continent(continent)
                .country(country)
                .state(US_COUNTRY_CODE.equals(country) ? usStateMapper.toCode(raw.getState()) : null)
                .city(LocationNormalizer.displayName(raw.getCity()))
                .normalizedCity(LocationNormalizer.normalizedName(raw.getCity()))
                .latitude(ObjectUtils.defaultIfNull(raw.getLatitude(), 0d))
                .longitude(ObjectUtils.defaultIfNull(raw.getLongitude(), 0d))
                .network(LocationNormalizer.displayName(raw.getNetwork()))
                .normalizedNetwork(LocationNormalizer.normalizedName(raw.getNetwork()))
                .asn(ObjectUtils.defaultIfNull(raw.getAsn(), 0L))
                .build();
    }
}
