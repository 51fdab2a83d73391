package io.shadycss.util;

/**
 * Holds the loggers used by the shady CSS parser.
 */
public final class Logging {

    public static final String PARSER_LOGGER_NAME = "io.shadycss.parser";

    private static final System.Logger PARSER_LOGGER = System.getLogger(PARSER_LOGGER_NAME);

    private Logging() {}

    public static System.Logger getParserLogger() {
        return PARSER_LOGGER;
    }
}
