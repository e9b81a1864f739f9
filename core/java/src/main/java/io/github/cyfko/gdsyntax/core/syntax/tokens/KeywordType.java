package io.github.cyfko.gdsyntax.core.syntax.tokens;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reserved words of the language.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum KeywordType {

    VAR("var"),
    CONST("const"),
    STATIC("static"),
    FUNC("func"),
    CLASS("class"),
    CLASS_NAME("class_name"),
    EXTENDS("extends"),
    TOOL("tool"),
    SIGNAL("signal"),
    ENUM("enum"),
    IF("if"),
    ELIF("elif"),
    ELSE("else"),
    FOR("for"),
    IN("in"),
    WHILE("while"),
    MATCH("match"),
    WHEN("when"),
    PASS("pass"),
    BREAK("break"),
    CONTINUE("continue"),
    RETURN("return"),
    BREAKPOINT("breakpoint"),
    AWAIT("await"),
    NOT("not"),
    AND("and"),
    OR("or"),
    IS("is"),
    AS("as"),
    TRUE("true"),
    FALSE("false"),
    GET("get"),
    SET("set");

    private static final Map<String, KeywordType> BY_TEXT = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(KeywordType::getText, Function.identity()));

    private final String text;

    KeywordType(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public static Optional<KeywordType> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }
}
