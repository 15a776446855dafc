package org.probenet.server.geolocation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.probenet.server.geolocation.model.RegionInfo;
import org.probenet.server.util.ResourceUtil;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class CountryRegionMapperTest {

    private CountryRegionMapper target;

    @BeforeEach
    public void setUp() throws IOException {
        target = new CountryRegionMapper(ResourceUtil.readFromClasspath("geolocation/country-regions.csv"));
    }

    @Test
    public void regionForShouldReturnDisplayAndNormalizedRegion() {
        assertThat(target.regionFor("US")).isEqualTo(RegionInfo.of("Northern America", "northern america"));
        assertThat(target.regionFor("AR")).isEqualTo(RegionInfo.of("South America", "south america"));
        assertThat(target.regionFor("BR")).isEqualTo(RegionInfo.of("South America", "south america"));
        assertThat(target.regionFor("DE")).isEqualTo(RegionInfo.of("Western Europe", "western europe"));
    }

    @Test
    public void regionForShouldIgnoreCountryCodeCase() {
        assertThat(target.regionFor(" jp ")).isEqualTo(RegionInfo.of("Eastern Asia", "eastern asia"));
    }

    @Test
    public void regionForShouldReturnEmptyRegionForUnknownCountry() {
        assertThat(target.regionFor("ZZ")).isEqualTo(RegionInfo.of("", ""));
        assertThat(target.regionFor(null)).isEqualTo(RegionInfo.of("", ""));
    }

    @Test
    public void continentForShouldReturnContinentCode() {
        assertThat(target.continentFor("US")).isEqualTo("NA");
        assertThat(target.continentFor("AR")).isEqualTo("SA");
        assertThat(target.continentFor("")).isEmpty();
    }

    @Test
    public void creationShouldFailOnMalformedRow() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new CountryRegionMapper("US,NA\n"))
                .withMessageContaining("US,NA");
    }
}
