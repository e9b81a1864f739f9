package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;

import java.util.List;

/**
 * Root of a parsed script: the whole file as the members of one class.
 * <p>
 * The reader pushes the declaration, then its {@linkplain #getMembersList() members list}, which
 * receives every character of the file.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ClassDeclaration extends SyntaxNode implements MembersOwner {

    public enum State implements SlotState { MEMBERS, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.MEMBERS);

    public ClassDeclaration() {
        form.set(State.MEMBERS.slot(), ClassMembersList.root());
        form.setState(State.COMPLETED);
    }

    public ClassMembersList getMembersList() {
        return form.get(State.MEMBERS.slot(), ClassMembersList.class);
    }

    @Override
    public List<ClassMember> getMembers() {
        return getMembersList().getElements();
    }

    @Override
    protected ClassDeclaration createEmptyInstance() {
        return new ClassDeclaration();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
