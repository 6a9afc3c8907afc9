package io.github.jsummarise.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings from jsummarise.properties on the classpath, overlaid by jsummarise-${env}.properties when the JVM
 * runs with -Denv=..., overlaid by JVM system properties.
 */
public class EnvUtil {
    private static final Logger logger = LoggerFactory.getLogger(EnvUtil.class);

    static final String BASE_NAME = "jsummarise";

    private static Properties properties = null;

    private EnvUtil() {
    }

    public static synchronized String getEnvProperty(String key) {
        String override = System.getProperty(key);
        if (null != override) {
            return override;
        }
        if (null == properties) {
            properties = load();
        }
        return properties.getProperty(key);
    }

    public static String getEnvProperty(String key, String defaultValue) {
        String value = getEnvProperty(key);
        return null == value ? defaultValue : value;
    }

    static synchronized void reset() {
        properties = null;
    }

    private static Properties load() {
        Properties loaded = new Properties();
        loadResource(loaded, BASE_NAME + ".properties", false);
        String env = System.getProperty("env");
        if (null != env) {
            loadResource(loaded, BASE_NAME + "-" + env + ".properties", true);
        }
        return loaded;
    }

    private static void loadResource(Properties properties, String resource, boolean required) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (null == classLoader) {
            classLoader = EnvUtil.class.getClassLoader();
        }
        try (InputStream inputStream = classLoader.getResourceAsStream(resource)) {
            if (null == inputStream) {
                if (required) {
                    throw new IllegalArgumentException("missing " + resource + " for -Denv=" + System.getProperty("env"));
                }
                return;
            }
            properties.load(inputStream);
            logger.debug("loaded {}", resource);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
