package me.golemcore.progression;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ProgressionApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ProgressionApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ProgressionApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ProgressionApplication.class.getMethod("main", String[].class));
    }
}
