package com.testament.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TestamentPropertiesTest {

    @Test
    @DisplayName("defaults match a plain command-line run")
    void defaults() {
        var props = new TestamentProperties();
        assertEquals(20, props.getRun().getMaxWorkers());
        assertFalse(props.getRun().isNoConcurrency());
        assertFalse(props.getRun().isStopOnFail());
        assertNull(props.getRun().getSeed());
        assertEquals("logs", props.getLogs().getFolder());
        assertEquals(10, props.getLogs().getMaxSubFolders());
        assertEquals(".testament/last-failed", props.getLastFailedFile());
        assertTrue(props.getSuiteAlias().isEmpty());
        assertTrue(props.getSuiteDisabled().isEmpty());
    }

    @Test
    @DisplayName("binds run knobs, log settings and alias maps")
    void binds() {
        var source = new MapConfigurationPropertySource(Map.of(
                "testament.run.max-workers", "4",
                "testament.run.stop-on-fail", "true",
                "testament.run.seed", "1234",
                "testament.logs.folder", "build/test-logs",
                "testament.logs.max-sub-folders", "2",
                "testament.suite-alias.smoke", "pkg.smoke,pkg.api",
                "testament.suite-disabled.flaky", "pkg.flaky"));

        TestamentProperties props = new Binder(source)
                .bind("testament", TestamentProperties.class)
                .get();

        assertEquals(4, props.getRun().getMaxWorkers());
        assertTrue(props.getRun().isStopOnFail());
        assertEquals(1234L, props.getRun().getSeed());
        assertEquals("build/test-logs", props.getLogs().getFolder());
        assertEquals(2, props.getLogs().getMaxSubFolders());
        assertEquals("pkg.smoke,pkg.api", props.getSuiteAlias().get("smoke"));
        assertEquals("pkg.flaky", props.getSuiteDisabled().get("flaky"));
    }
}
