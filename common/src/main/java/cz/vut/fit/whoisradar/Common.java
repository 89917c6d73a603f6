package cz.vut.fit.whoisradar;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;

/**
 * Common utility functions and constants.
 *
 * @author WhoisRadar contributors
 */
public final class Common {
    private Common() {
    }

    /**
     * Creates a new Jackson JSON {@link ObjectMapper} builder with the following settings:
     * <ul>
     *     <li>Include source locations in exceptions.</li>
     *     <li>Do not fail on unknown properties.</li>
     * </ul>
     *
     * @return a new {@link MapperBuilder} instance
     */
    public static MapperBuilder<? extends ObjectMapper, ?> makeMapper() {
        return JsonMapper.builder()
                .configure(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates a logger for a specific component. The logger name will be created by concatenating
     * the class name, a dot, and the value of the static field {@code COMPONENT_NAME} in the class.
     *
     * @param clazz the class to get the logger for
     * @return a SLF4J {@link Logger} instance
     */
    public static Logger getComponentLogger(Class<?> clazz) {
        try {
            final String componentName = clazz.getField("COMPONENT_NAME")
                    .get(null).toString();
            return org.slf4j.LoggerFactory.getLogger(clazz.getName() + "." + componentName);
        } catch (IllegalAccessException | NoSuchFieldException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Checks whether a piece of text is null, empty or consists of whitespace only.
     *
     * @param text the text to check
     * @return true if there is nothing but whitespace in the text
     */
    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
