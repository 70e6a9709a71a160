package com.vidnyan.cstfix.adapter.out.rule.style;

import com.vidnyan.cstfix.domain.mutation.BatchMutation;
import com.vidnyan.cstfix.domain.query.AstQuery;
import com.vidnyan.cstfix.domain.rule.ActionCategory;
import com.vidnyan.cstfix.domain.rule.Applicability;
import com.vidnyan.cstfix.domain.rule.FixKind;
import com.vidnyan.cstfix.domain.rule.Rule;
import com.vidnyan.cstfix.domain.rule.RuleAction;
import com.vidnyan.cstfix.domain.rule.RuleContext;
import com.vidnyan.cstfix.domain.rule.RuleDiagnostic;
import com.vidnyan.cstfix.domain.rule.RuleMetadata;
import com.vidnyan.cstfix.domain.rule.Severity;
import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;
import com.vidnyan.cstfix.domain.syntax.TextRange;
import com.vidnyan.cstfix.domain.syntax.Trivia;
import com.vidnyan.cstfix.domain.syntax.TriviaPiece;
import com.vidnyan.cstfix.domain.syntax.TriviaPieceKind;
import com.vidnyan.cstfix.domain.syntax.ast.JsxClosingElement;
import com.vidnyan.cstfix.domain.syntax.ast.JsxElement;
import com.vidnyan.cstfix.domain.syntax.ast.JsxOpeningElement;
import com.vidnyan.cstfix.domain.syntax.factory.JsxSelfClosingElementBuilder;
import com.vidnyan.cstfix.domain.syntax.factory.SyntaxFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags JSX elements without children and rewrites them as self-closing.
 * <p>
 * {@code <div></div>} becomes {@code <div />}. The opening {@code >}'s leading trivia moves to the
 * new {@code /}; comments written inside the dropped closing tag are kept in front of the {@code /};
 * whitespace inside the closing tag goes away with the tag. A single space is added in front of the
 * {@code /} trivia unless that trivia starts with a blank or line break, or the preceding token
 * already ends with a space.
 */
@Slf4j
@Component
@Order(10)
public class UseSelfClosingElementsRule implements Rule<JsxElement, UseSelfClosingElementsRule.ChildlessElement> {

    static final String MESSAGE = "JSX elements without children should be marked as self-closing. "
            + "In JSX, it is valid for any element to be self-closing.";

    private static final RuleMetadata METADATA = RuleMetadata.builder()
            .name("useSelfClosingElements")
            .group("style")
            .description("Prevent extra closing tags for components without children")
            .recommended(true)
            .severity(Severity.ERROR)
            .fixKind(FixKind.UNSAFE)
            .source("eslint-stylistic/jsx-self-closing-comp")
            .build();

    private static final AstQuery<JsxElement> QUERY = AstQuery.of(SyntaxKind.JSX_ELEMENT, JsxElement::new);

    /**
     * The matched element has an empty child list.
     */
    public record ChildlessElement(TextRange range) {
    }

    @Override
    public RuleMetadata metadata() {
        return METADATA;
    }

    @Override
    public AstQuery<JsxElement> query() {
        return QUERY;
    }

    @Override
    public List<ChildlessElement> run(RuleContext<JsxElement> ctx) {
        JsxElement element = ctx.query();
        boolean childless = element.childList()
                .map(list -> list.children().isEmpty())
                .orElse(false);
        return childless ? List.of(new ChildlessElement(element.range())) : List.of();
    }

    @Override
    public Optional<RuleDiagnostic> diagnostic(RuleContext<JsxElement> ctx, ChildlessElement state) {
        return Optional.of(ctx.newDiagnostic(state.range(), MESSAGE));
    }

    @Override
    public Optional<RuleAction> action(RuleContext<JsxElement> ctx, ChildlessElement state) {
        JsxElement element = ctx.query();
        Optional<JsxOpeningElement> opening = element.openingElement();
        Optional<JsxClosingElement> closing = element.closingElement();
        if (opening.isEmpty() || closing.isEmpty()) {
            return Optional.empty();
        }
        Optional<SyntaxToken> lAngle = opening.get().lAngleToken();
        Optional<SyntaxNode> name = opening.get().name();
        Optional<SyntaxNode> attributes = opening.get().attributes();
        Optional<SyntaxCursor> rAngleCursor = opening.get().rAngle();
        Optional<SyntaxToken> closingRAngle = closing.get().rAngleToken();
        if (lAngle.isEmpty() || name.isEmpty() || attributes.isEmpty()
                || rAngleCursor.isEmpty() || closingRAngle.isEmpty()) {
            return Optional.empty();
        }

        SyntaxToken.TakenTrivia taken = rAngleCursor.get().token().takeLeadingTrivia();
        Trivia slashLeading = taken.trivia().append(commentsOf(closing.get()));

        boolean needsSpace = rAngleCursor.get().previousToken()
                .map(prev -> !prev.token().trailingTrivia().endsWith(' '))
                .orElse(true);
        if (needsSpace && !slashLeading.startsWithWhitespace()) {
            slashLeading = slashLeading.prepend(TriviaPiece.whitespace(1));
        }

        SyntaxToken slash = SyntaxToken.detached(SyntaxKind.SLASH, "/", slashLeading, Trivia.EMPTY);
        SyntaxToken rAngle = taken.token().withTrailingTrivia(
                taken.token().trailingTrivia().append(closingRAngle.get().trailingTrivia()));

        JsxSelfClosingElementBuilder builder = SyntaxFactory.jsxSelfClosingElement(
                lAngle.get(), name.get(), attributes.get(), slash, rAngle);
        opening.get().typeArguments().ifPresent(builder::withTypeArguments);

        BatchMutation mutation = ctx.root().begin().replaceNode(element, builder.build());
        log.debug("Rewriting {} as a self-closing element", element);
        return Optional.of(ctx.newAction(
                ActionCategory.QUICK_FIX,
                Applicability.MAYBE_INCORRECT,
                "Use a SelfClosingElement instead",
                mutation));
    }

    /**
     * Comments found in the closing tag, excluding the trailing trivia of its final {@code >},
     * each followed by the separator it needs before a {@code /}.
     */
    private static Trivia commentsOf(JsxClosingElement closing) {
        List<SyntaxToken> tokens = closing.tokens();
        List<TriviaPiece> kept = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            SyntaxToken token = tokens.get(i);
            collectComments(token.leadingTrivia(), kept);
            if (i < tokens.size() - 1) {
                collectComments(token.trailingTrivia(), kept);
            }
        }
        return Trivia.of(kept);
    }

    private static void collectComments(Trivia trivia, List<TriviaPiece> into) {
        for (TriviaPiece piece : trivia.pieces()) {
            if (!piece.isComment()) {
                continue;
            }
            into.add(piece);
            into.add(piece.kind() == TriviaPieceKind.SINGLE_LINE_COMMENT
                    ? TriviaPiece.newline()
                    : TriviaPiece.whitespace(1));
        }
    }
}
