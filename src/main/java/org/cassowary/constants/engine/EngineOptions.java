package org.cassowary.constants.engine;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 引擎配置。不可变，通过 builder、Properties 或 classpath 上的配置文件创建。
 */
@Getter
@Builder(toBuilder = true)
public final class EngineOptions {

    private static final Logger logger = LoggerFactory.getLogger(EngineOptions.class);

    public static final String RESOURCE_NAME = "cassowary-constants.properties";

    static final String KEY_NO_VARIABLES_POLICY = "engine.noVariablesPolicy";
    static final String KEY_ZERO_TOLERANCE = "engine.zeroTolerance";
    static final String KEY_SATISFACTION_TOLERANCE = "engine.satisfactionTolerance";

    @Builder.Default
    private final NoVariablesPolicy noVariablesPolicy = NoVariablesPolicy.REJECT;

    /**
     * 合并同类项后绝对值不超过此值的系数视为零。默认只丢弃恰好抵消的项。
     */
    @Builder.Default
    private final double zeroTolerance = 0.0;

    /**
     * 判断只剩常数的关系是否成立时使用的容差。
     */
    @Builder.Default
    private final double satisfactionTolerance = 1e-9;

    public static EngineOptions defaults() {
        return builder().build();
    }

    /**
     * 从 Properties 读取配置，缺失的键使用默认值。
     * @throws IllegalArgumentException 值无法解析或容差为负。
     */
    public static EngineOptions fromProperties(Properties properties) {
        EngineOptions defaults = defaults();
        EngineOptionsBuilder builder = defaults.toBuilder();
        try {
            String policy = properties.getProperty(KEY_NO_VARIABLES_POLICY);
            if (policy != null) {
                builder.noVariablesPolicy(NoVariablesPolicy.valueOf(policy.trim().toUpperCase()));
            }
            String zero = properties.getProperty(KEY_ZERO_TOLERANCE);
            if (zero != null) {
                builder.zeroTolerance(Double.parseDouble(zero.trim()));
            }
            String satisfaction = properties.getProperty(KEY_SATISFACTION_TOLERANCE);
            if (satisfaction != null) {
                builder.satisfactionTolerance(Double.parseDouble(satisfaction.trim()));
            }
        } catch (IllegalArgumentException e) {
            logger.error("EngineOptions: 无法解析配置 {}", properties, e);
            throw new IllegalArgumentException("无法解析引擎配置: " + e.getMessage(), e);
        }
        EngineOptions options = builder.build();
        if (options.zeroTolerance < 0 || options.satisfactionTolerance < 0) {
            logger.error("EngineOptions: 容差不能为负数 {}", options);
            throw new IllegalArgumentException("容差不能为负数: " + options);
        }
        return options;
    }

    /**
     * 读取 classpath 上的 {@value #RESOURCE_NAME}；不存在时返回默认配置。
     */
    public static EngineOptions load() {
        try (InputStream in = EngineOptions.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("未找到 {}，使用默认配置", RESOURCE_NAME);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            EngineOptions options = fromProperties(properties);
            logger.info("从 {} 加载引擎配置: {}", RESOURCE_NAME, options);
            return options;
        } catch (IOException e) {
            logger.error("读取 {} 失败", RESOURCE_NAME, e);
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String toString() {
        return "EngineOptions{noVariablesPolicy=" + noVariablesPolicy
                + ", zeroTolerance=" + zeroTolerance
                + ", satisfactionTolerance=" + satisfactionTolerance + "}";
    }
}
