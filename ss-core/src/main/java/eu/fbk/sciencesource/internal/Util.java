package eu.fbk.sciencesource.internal;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private Util() {
    }

    /**
     * Returns the version of a Maven artifact on the classpath, as recorded in its
     * {@code pom.properties}.
     *
     * @param groupId
     *            the group ID
     * @param artifactId
     *            the artifact ID
     * @param defaultValue
     *            the value returned if the artifact is not found
     * @return the version
     */
    public static String getVersion(final String groupId, final String artifactId,
            final String defaultValue) {
        final URL url = Util.class.getClassLoader().getResource(
                "META-INF/maven/" + groupId + "/" + artifactId + "/pom.properties");
        String version = defaultValue;
        if (url != null) {
            try {
                final InputStream stream = url.openStream();
                try {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    version = properties.getProperty("version", defaultValue).trim();
                } finally {
                    stream.close();
                }
            } catch (final IOException ex) {
                LOGGER.warn("Cannot read version of " + groupId + ":" + artifactId, ex);
                version = "unknown";
            }
        }
        return version;
    }

    @Nullable
    public static <T> T closeQuietly(@Nullable final T object) {
        if (object instanceof Closeable) {
            try {
                ((Closeable) object).close();
            } catch (final Throwable ex) {
                LOGGER.error("Error closing " + object.getClass().getSimpleName(), ex);
            }
        } else if (object instanceof AutoCloseable) {
            try {
                ((AutoCloseable) object).close();
            } catch (final Throwable ex) {
                LOGGER.error("Error closing " + object.getClass().getSimpleName(), ex);
            }
        }
        return object;
    }

}
