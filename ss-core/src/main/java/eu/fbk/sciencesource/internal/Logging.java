package eu.fbk.sciencesource.internal;

import javax.annotation.Nullable;

import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

public final class Logging {

    public static final String MDC_CONTEXT = "context";

    private Logging() {
    }

    /**
     * Sets the logging context of the current thread, e.g., the article being uploaded.
     *
     * @param context
     *            the new context, null to clear it
     * @return the previous context, possibly null
     */
    @Nullable
    public static String setContext(@Nullable final String context) {
        final String previous = MDC.get(MDC_CONTEXT);
        if (context == null) {
            MDC.remove(MDC_CONTEXT);
        } else {
            MDC.put(MDC_CONTEXT, context);
        }
        return previous;
    }

    @Nullable
    public static String getContext() {
        return MDC.get(MDC_CONTEXT);
    }

    /**
     * Renders the logging context and, for warnings and errors, the logger name, as
     * {@code [context][logger] }.
     */
    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final String context = event.getMDCPropertyMap().get(MDC_CONTEXT);
            final String logger = event.getLevel().toInt() >= Level.WARN_INT ? event
                    .getLoggerName() : null;
            final StringBuilder builder = new StringBuilder();
            if (context != null) {
                builder.append('[').append(context).append(']');
            }
            if (logger != null) {
                builder.append('[').append(logger).append(']');
            }
            return builder.length() == 0 ? "" : builder.append(' ').toString();
        }

    }

}
