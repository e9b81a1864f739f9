package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;

/**
 * A word read at a keyword position. Its {@link KeywordType} is resolved from the text; a word
 * that is not reserved has no type.
 */
public final class Keyword extends CharSequenceToken {

    public Keyword() {}

    private Keyword(String text) {
        super(text);
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not a word
     */
    public static Keyword of(String text) {
        if (!ResolvingHelper.isIdentifier(text)) {
            throw new IllegalArgumentException("Not a keyword: '" + text + "'");
        }
        return new Keyword(text);
    }

    public static Keyword of(KeywordType type) {
        return new Keyword(type.getText());
    }

    /**
     * @return the keyword type, or {@code null} when the word is not reserved
     */
    public KeywordType getType() {
        return KeywordType.fromText(sequence.toString()).orElse(null);
    }

    public boolean is(KeywordType type) {
        return type.getText().contentEquals(sequence);
    }

    @Override
    protected boolean canAppendChar(char c) {
        return ResolvingHelper.isIdentifierChar(c);
    }

    @Override
    public Keyword clone() {
        return new Keyword(getSequence());
    }
}
