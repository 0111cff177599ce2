package org.aether.verification.engine;

import lombok.Getter;
import org.aether.verification.vcgen.VcGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 验证引擎的配置。
 * 默认值可以被类路径上的 {@value #RESOURCE} 覆盖，也可以逐项链式设置。
 */
@Getter
public class VerifierOptions {

    private static final Logger logger = LoggerFactory.getLogger(VerifierOptions.class);

    public static final String RESOURCE = "aether-verifier.properties";

    public static final String KEY_TIMEOUT = "verifier.solver.timeout-ms";
    public static final String KEY_THREADS = "verifier.threads";
    public static final String KEY_CACHE = "verifier.cache.enabled";
    public static final String KEY_CERTIFICATES = "verifier.proof-certificates";
    public static final String KEY_MAX_PATHS = "verifier.vcgen.max-paths";

    public static final long DEFAULT_TIMEOUT_MS = 10_000;

    private long solverTimeoutMs = DEFAULT_TIMEOUT_MS;
    private int threads = Runtime.getRuntime().availableProcessors();
    private boolean cacheEnabled = true;
    private boolean proofCertificates = true;
    private int maxPaths = VcGenerator.DEFAULT_MAX_PATHS;

    /**
     * 读取类路径上的配置文件；文件不存在时使用默认值。
     */
    public static VerifierOptions load() {
        VerifierOptions options = new VerifierOptions();
        try (InputStream in = VerifierOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("类路径上没有 {}，使用默认配置", RESOURCE);
                return options;
            }
            Properties properties = new Properties();
            properties.load(in);
            options.apply(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取 " + RESOURCE, e);
        }
        logger.info("已加载验证配置: {}", options);
        return options;
    }

    /**
     * 用给定属性覆盖对应的配置项，未出现的键保持原值。
     */
    public VerifierOptions apply(Properties properties) {
        String value = properties.getProperty(KEY_TIMEOUT);
        if (value != null) {
            solverTimeoutMs(Long.parseLong(value.trim()));
        }
        value = properties.getProperty(KEY_THREADS);
        if (value != null) {
            threads(Integer.parseInt(value.trim()));
        }
        value = properties.getProperty(KEY_CACHE);
        if (value != null) {
            cacheEnabled(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(KEY_CERTIFICATES);
        if (value != null) {
            proofCertificates(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(KEY_MAX_PATHS);
        if (value != null) {
            maxPaths(Integer.parseInt(value.trim()));
        }
        return this;
    }

    /**
     * 单次可满足性检查的超时，超时的 VC 记为未决。
     */
    public VerifierOptions solverTimeoutMs(long solverTimeoutMs) {
        if (solverTimeoutMs <= 0) {
            throw new IllegalArgumentException("超时必须为正: " + solverTimeoutMs);
        }
        this.solverTimeoutMs = solverTimeoutMs;
        return this;
    }

    /**
     * verifyProgram 使用的工作线程数。
     */
    public VerifierOptions threads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("线程数必须为正: " + threads);
        }
        this.threads = threads;
        return this;
    }

    public VerifierOptions cacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
        return this;
    }

    public VerifierOptions proofCertificates(boolean proofCertificates) {
        this.proofCertificates = proofCertificates;
        return this;
    }

    public VerifierOptions maxPaths(int maxPaths) {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("路径上限必须为正: " + maxPaths);
        }
        this.maxPaths = maxPaths;
        return this;
    }

    @Override
    public String toString() {
        return "VerifierOptions{timeoutMs=" + solverTimeoutMs + ", threads=" + threads + ", cache=" + cacheEnabled
                + ", certificates=" + proofCertificates + ", maxPaths=" + maxPaths + "}";
    }
}
