package org.callscript.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable settings for one {@link org.callscript.compiler.Compiler} instance.
 *
 * @param strictCallee Whether the token after '(' must be a name.
 * @param verbosity The {@link org.callscript.compiler.diagnostics.CompilerLogger} level to apply, or a negative value to keep the current one.
 * @param dumpPhases Whether intermediate artifacts are logged at DEBUG level.
 * @param maxDepth The deepest call nesting the parser accepts; at least 1.
 */
public record CompilerOptions(
        boolean strictCallee,
        int verbosity,
        boolean dumpPhases,
        int maxDepth
) {

    public CompilerOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, but was " + maxDepth);
        }
    }

    /** Root path of the compiler settings in the configuration. */
    public static final String CONFIG_PATH = "callscript.compiler";

    /**
     * Reads the options from a configuration, falling back to {@code reference.conf} for missing keys.
     *
     * @param config The configuration, e.g. from {@link CompilerConfig#load()}.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config compiler = config
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve()
                .getConfig(CONFIG_PATH);
        return new CompilerOptions(
                compiler.getBoolean("strict-callee"),
                compiler.getInt("verbosity"),
                compiler.getBoolean("dump-phases"),
                compiler.getInt("max-depth")
        );
    }

    /**
     * @return The options defined in {@code reference.conf}.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * @param strict The new callee policy.
     * @return A copy of these options with the given callee policy.
     */
    public CompilerOptions withStrictCallee(boolean strict) {
        return new CompilerOptions(strict, verbosity, dumpPhases, maxDepth);
    }

    /**
     * @param depth The new nesting limit.
     * @return A copy of these options with the given nesting limit.
     */
    public CompilerOptions withMaxDepth(int depth) {
        return new CompilerOptions(strictCallee, verbosity, dumpPhases, depth);
    }
}
