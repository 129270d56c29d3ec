package org.smtbridge.config;

import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * 求解器声明的特性能力，以及求解器的显示名。
 * 由外部配置提供 (预置值见 {@link Solvers}，或从 properties 读入)。
 */
@Builder
public final class SolverCapabilities {

    private static final Logger logger = LoggerFactory.getLogger(SolverCapabilities.class);

    @Getter
    private final String name;
    private final boolean unboundedInts;
    private final boolean reals;
    private final boolean ieee754;
    private final boolean quantifiers;
    private final boolean uninterpretedSorts;
    private final boolean optimization;

    public boolean supportsUnboundedInts() {
        return unboundedInts;
    }

    public boolean supportsReals() {
        return reals;
    }

    public boolean supportsIEEE754() {
        return ieee754;
    }

    public boolean supportsQuantifiers() {
        return quantifiers;
    }

    public boolean supportsUninterpretedSorts() {
        return uninterpretedSorts;
    }

    public boolean supportsOptimization() {
        return optimization;
    }

    /**
     * 从 properties 读取能力描述。键为
     * {@code name, unbounded-integers, reals, ieee754, quantifiers, uninterpreted-sorts, optimization}，
     * 缺省的布尔键视为不支持。
     * @param prefix 键前缀，例如 "solver."；可以为空串。
     * @throws IllegalArgumentException 如果缺少 name 或布尔值无法识别。
     */
    public static SolverCapabilities fromProperties(Properties props, String prefix) {
        Objects.requireNonNull(props, "Properties cannot be null.");
        String p = StringUtils.defaultString(prefix);
        String name = props.getProperty(p + "name");
        if (StringUtils.isBlank(name)) {
            logger.error("求解器能力配置缺少 {}name", p);
            throw new IllegalArgumentException("Solver capability description needs a '" + p + "name' entry");
        }
        SolverCapabilities caps = SolverCapabilities.builder()
                .name(name.trim())
                .unboundedInts(flag(props, p + "unbounded-integers"))
                .reals(flag(props, p + "reals"))
                .ieee754(flag(props, p + "ieee754"))
                .quantifiers(flag(props, p + "quantifiers"))
                .uninterpretedSorts(flag(props, p + "uninterpreted-sorts"))
                .optimization(flag(props, p + "optimization"))
                .build();
        logger.debug("读入求解器能力: {}", caps);
        return caps;
    }

    /**
     * 从类路径资源读取能力描述。
     */
    public static SolverCapabilities fromResource(String resource, String prefix) {
        try (InputStream in = SolverCapabilities.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No such solver capability resource: " + resource);
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props, prefix);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read solver capability resource " + resource, e);
        }
    }

    private static boolean flag(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null) {
            return false;
        }
        v = v.trim();
        if ("true".equalsIgnoreCase(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v)) {
            return false;
        }
        logger.error("无法识别的布尔值 {}={}", key, v);
        throw new IllegalArgumentException("Not a boolean value for " + key + ": " + v);
    }

    @Override
    public String toString() {
        return name + "{unboundedInts=" + unboundedInts
                + ", reals=" + reals
                + ", ieee754=" + ieee754
                + ", quantifiers=" + quantifiers
                + ", uninterpretedSorts=" + uninterpretedSorts
                + ", optimization=" + optimization + "}";
    }
}
