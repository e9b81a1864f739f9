package io.github.cyfko.gdsyntax.core;

import io.github.cyfko.gdsyntax.core.api.ScriptReader;
import io.github.cyfko.gdsyntax.core.config.ReaderPolicy;
import io.github.cyfko.gdsyntax.core.impl.BasicScriptReader;

/**
 * Entry point for obtaining a {@link ScriptReader}.
 *
 * <pre>{@code
 * ScriptReader reader = ScriptReaderFactory.create();
 * ClassDeclaration script = reader.parseFileContent(source);
 *
 * // Tighter limits for untrusted sources
 * ScriptReader strict = ScriptReaderFactory.create(ReaderPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ScriptReaderFactory {

    private ScriptReaderFactory() {}

    /**
     * @return a reader using {@link ReaderPolicy#defaults()}
     */
    public static ScriptReader create() {
        return new BasicScriptReader();
    }

    /**
     * @param policy the limits applied to every read
     * @return a reader using the given policy
     * @throws IllegalArgumentException if policy is null
     */
    public static ScriptReader create(ReaderPolicy policy) {
        return new BasicScriptReader(policy);
    }
}
