package com.pipesql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Compiler-wide constants.
 *
 * <p>The version is read once from {@code pipesql-version.properties} on the
 * classpath and falls back to {@code 0.0.0} when the resource is missing.
 */
public final class CompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    private static final String VERSION_RESOURCE = "/pipesql-version.properties";

    public static final String COMPILER_NAME = "pipesql";
    public static final String SIGNATURE_URL = "https://prql-lang.org";

    /** Prefix of generated column names. */
    public static final String EXPR_PREFIX = "_expr_";

    /** Prefix of generated table and alias names. */
    public static final String TABLE_PREFIX = "table_";

    public static final String VERSION = loadVersion();

    private static String loadVersion() {
        try (InputStream is = CompilerConfig.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (is == null) {
                logger.debug("{} not found, using version 0.0.0", VERSION_RESOURCE);
                return "0.0.0";
            }
            Properties props = new Properties();
            props.load(is);
            return props.getProperty("version", "0.0.0").trim();
        } catch (IOException e) {
            logger.warn("Failed to read {}", VERSION_RESOURCE, e);
            return "0.0.0";
        }
    }

    /**
     * Returns the trailing comment naming the compiler, its version and the target.
     */
    public static String signature(String targetName) {
        return "-- Generated by %s compiler version:%s target:%s (%s)"
            .formatted(COMPILER_NAME, VERSION, targetName, SIGNATURE_URL);
    }

    private CompilerConfig() {}
}
