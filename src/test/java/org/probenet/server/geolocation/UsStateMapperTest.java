package org.probenet.server.geolocation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.probenet.server.util.ResourceUtil;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

public class UsStateMapperTest {

    private UsStateMapper target;

    @BeforeEach
    public void setUp() throws IOException {
        target = new UsStateMapper(ResourceUtil.readFromClasspath("geolocation/us-states.csv"));
    }

    @Test
    public void toCodeShouldMapStateName() {
        assertThat(target.toCode("Texas")).isEqualTo("TX");
        assertThat(target.toCode("new  york")).isEqualTo("NY");
    }

    @Test
    public void toCodeShouldMapNameContainingOf() {
        assertThat(target.toCode("District of Columbia")).isEqualTo("DC");
    }

    @Test
    public void toCodeShouldAcceptCode() {
        assertThat(target.toCode("tx")).isEqualTo("TX");
    }

    @Test
    public void toCodeShouldReturnNullForUnknownState() {
        assertThat(target.toCode("Ontario")).isNull();
        assertThat(target.toCode("")).isNull();
        assertThat(target.toCode(null)).isNull();
    }
}
