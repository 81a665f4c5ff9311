package org.ctyped.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Tunables of the parser, read from the {@code ctyped} configuration block.
 *
 * @param maxNestingDepth The deepest nesting of expressions, statements, declarators and initializers accepted.
 * @param funcNamePlaceholder The name the type of {@code __func__} is reported under.
 * @param verbosity The {@link org.ctyped.compiler.diagnostics.CompilerLogger} level.
 */
public record ParserOptions(int maxNestingDepth, String funcNamePlaceholder, int verbosity) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final String DEFAULT_FUNC_NAME_PLACEHOLDER = "__func_name__";
    public static final int DEFAULT_VERBOSITY = 2;

    public ParserOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        if (funcNamePlaceholder == null || funcNamePlaceholder.isBlank()) {
            throw new IllegalArgumentException("funcNamePlaceholder must not be blank");
        }
    }

    /**
     * @return The built-in defaults, identical to the shipped {@code reference.conf}.
     */
    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_FUNC_NAME_PLACEHOLDER, DEFAULT_VERBOSITY);
    }

    /**
     * Reads the options from a resolved configuration.
     *
     * @param config A configuration containing the {@code ctyped} block.
     * @return The parsed options.
     * @throws ConfigException if a key is missing or has the wrong type.
     */
    public static ParserOptions fromConfig(Config config) {
        return new ParserOptions(
                config.getInt("ctyped.parser.max-nesting-depth"),
                config.getString("ctyped.parser.func-name-placeholder"),
                config.getInt("ctyped.compiler.verbosity"));
    }
}
