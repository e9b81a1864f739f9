module io.github.cyfko.gdsyntax.core {
    requires java.logging;

    exports io.github.cyfko.gdsyntax.core;
    exports io.github.cyfko.gdsyntax.core.api;
    exports io.github.cyfko.gdsyntax.core.config;
    exports io.github.cyfko.gdsyntax.core.exception;
    exports io.github.cyfko.gdsyntax.core.impl;
    exports io.github.cyfko.gdsyntax.core.reading;
    exports io.github.cyfko.gdsyntax.core.syntax;
    exports io.github.cyfko.gdsyntax.core.syntax.tokens;
    exports io.github.cyfko.gdsyntax.core.syntax.expressions;
    exports io.github.cyfko.gdsyntax.core.syntax.types;
    exports io.github.cyfko.gdsyntax.core.syntax.declarations;
    exports io.github.cyfko.gdsyntax.core.syntax.statements;
}
