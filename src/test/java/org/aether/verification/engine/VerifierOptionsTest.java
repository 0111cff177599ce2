package org.aether.verification.engine;

import org.aether.verification.vcgen.VcGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class VerifierOptionsTest {

    @Test
    @DisplayName("从类路径配置文件加载")
    void testLoad_FromClasspath() {
        VerifierOptions options = VerifierOptions.load();
        assertAll(
                () -> assertEquals(10_000, options.getSolverTimeoutMs()),
                () -> assertEquals(VcGenerator.DEFAULT_MAX_PATHS, options.getMaxPaths()),
                () -> assertTrue(options.isCacheEnabled()),
                () -> assertTrue(options.isProofCertificates()),
                () -> assertTrue(options.getThreads() > 0)
        );
    }

    @Test
    @DisplayName("属性覆盖对应的配置项，未出现的键保持原值")
    void testApply_OverridesPresentKeys() {
        Properties properties = new Properties();
        properties.setProperty(VerifierOptions.KEY_TIMEOUT, " 2500 ");
        properties.setProperty(VerifierOptions.KEY_THREADS, "3");
        properties.setProperty(VerifierOptions.KEY_CACHE, "false");
        VerifierOptions options = new VerifierOptions().maxPaths(7).apply(properties);
        assertAll(
                () -> assertEquals(2500, options.getSolverTimeoutMs()),
                () -> assertEquals(3, options.getThreads()),
                () -> assertFalse(options.isCacheEnabled()),
                () -> assertTrue(options.isProofCertificates()),
                () -> assertEquals(7, options.getMaxPaths())
        );
    }

    @Test
    @DisplayName("非正值被拒绝")
    void testSetters_RejectNonPositive() {
        VerifierOptions options = new VerifierOptions();
        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> options.solverTimeoutMs(0)),
                () -> assertThrows(IllegalArgumentException.class, () -> options.threads(-1)),
                () -> assertThrows(IllegalArgumentException.class, () -> options.maxPaths(0)),
                () -> assertThrows(NumberFormatException.class, () -> options.apply(propertiesWith(VerifierOptions.KEY_THREADS, "many")))
        );
    }

    private static Properties propertiesWith(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return properties;
    }
}
