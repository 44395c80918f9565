package com.phillippitts.selfspy.config.properties;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FlushPropertiesTest {

    @Test
    void backoffGrowsGeometrically() {
        FlushProperties props = new FlushProperties();

        assertThat(props.backoffAfter(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(props.backoffAfter(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(props.backoffAfter(3)).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    void backoffIsCapped() {
        FlushProperties props = new FlushProperties();
        props.setMaxBackoff(Duration.ofMillis(500));

        assertThat(props.backoffAfter(10)).isEqualTo(Duration.ofMillis(500));
    }
}
