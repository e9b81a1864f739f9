package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.ClassMemberResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.IndentedTokensList;

/**
 * The members of a script or of an inner class.
 * <p>
 * Attributes may share their line with the member they annotate:
 * {@code @export var speed := 10.0}, {@code class_name Player extends CharacterBody2D}.
 * </p>
 */
public final class ClassMembersList extends IndentedTokensList<ClassMember> {

    public ClassMembersList(int parentIndentation) {
        super(ClassMember.class, parentIndentation);
    }

    private ClassMembersList() {
        super(ClassMember.class);
    }

    /**
     * @return the members list of a whole script
     */
    public static ClassMembersList root() {
        return new ClassMembersList();
    }

    @Override
    protected boolean allowsElementAfter(ClassMember previous) {
        return previous instanceof CustomAttribute || previous instanceof ClassNameAttribute;
    }

    @Override
    protected void readElement(char c, int lineIndentation, ReadingState state) {
        state.pushAndPass(new ClassMemberResolver(TokenReceiver.of(member -> {
            addElement(member);
            state.push(member);
        }, this::elementSkipped), lineIndentation), c);
    }

    @Override
    protected ClassMembersList createEmptyInstance() {
        return isRoot() ? root() : new ClassMembersList(getParentIndentation());
    }
}
