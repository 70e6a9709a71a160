package com.vidnyan.cstfix.adapter.out.rule.suspicious;

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
import com.vidnyan.cstfix.domain.syntax.SyntaxGrammar;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;
import com.vidnyan.cstfix.domain.syntax.TextRange;
import com.vidnyan.cstfix.domain.syntax.Trivia;
import com.vidnyan.cstfix.domain.syntax.ast.JsBinaryExpression;
import com.vidnyan.cstfix.domain.syntax.ast.JsBinaryOperator;
import com.vidnyan.cstfix.domain.syntax.ast.JsIdentifierExpression;
import com.vidnyan.cstfix.domain.syntax.ast.JsStringLiteralExpression;
import com.vidnyan.cstfix.domain.syntax.ast.JsUnaryExpression;
import com.vidnyan.cstfix.domain.syntax.factory.SyntaxFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Checks that the result of {@code typeof expr} is compared with a valid type name.
 * <p>
 * Recognized shapes, on either side of {@code ==}, {@code ===}, {@code !=} or {@code !==}:
 * a string literal (must be a type name), another {@code typeof} (fine), an identifier
 * (never right, fixable when it spells a type name) and anything else (reported without a fix).
 */
@Slf4j
@Component
@Order(20)
public class UseValidTypeofRule implements Rule<JsBinaryExpression, UseValidTypeofRule.TypeofState> {

    static final String TITLE = "Invalid `typeof` comparison value";

    private static final RuleMetadata METADATA = RuleMetadata.builder()
            .name("useValidTypeof")
            .group("suspicious")
            .description("Require typeof expressions to be compared with valid type names")
            .recommended(true)
            .severity(Severity.ERROR)
            .fixKind(FixKind.UNSAFE)
            .source("eslint/valid-typeof")
            .build();

    private static final AstQuery<JsBinaryExpression> QUERY =
            AstQuery.of(SyntaxKind.JS_BINARY_EXPRESSION, JsBinaryExpression::new);

    /**
     * Kind of problem found in a {@code typeof} comparison.
     */
    public enum ErrorKind {
        /** A string literal that is not a type name. */
        INVALID_LITERAL,
        /** Something other than a string literal or another {@code typeof}. */
        INVALID_EXPRESSION
    }

    /**
     * @param range   what the diagnostic points at
     * @param literal unquoted literal text for {@link ErrorKind#INVALID_LITERAL}, else {@code null}
     */
    public record TypeofError(ErrorKind kind, TextRange range, String literal) {

        static TypeofError invalidLiteral(TextRange range, String literal) {
            return new TypeofError(ErrorKind.INVALID_LITERAL, range, literal);
        }

        static TypeofError invalidExpression(TextRange range) {
            return new TypeofError(ErrorKind.INVALID_EXPRESSION, range, null);
        }
    }

    /**
     * Replace {@code expression} with a string literal of {@code typeName}.
     */
    public record Suggestion(SyntaxCursor expression, JsTypeName typeName) {
    }

    /**
     * @param suggestion fix to offer, {@code null} when no type name is a safe guess
     */
    public record TypeofState(TypeofError error, Suggestion suggestion) {

        public Optional<Suggestion> suggestionIfAny() {
            return Optional.ofNullable(suggestion);
        }
    }

    @Override
    public RuleMetadata metadata() {
        return METADATA;
    }

    @Override
    public AstQuery<JsBinaryExpression> query() {
        return QUERY;
    }

    @Override
    public List<TypeofState> run(RuleContext<JsBinaryExpression> ctx) {
        JsBinaryExpression n = ctx.query();
        boolean comparison = n.operator().map(JsBinaryOperator::isEqualityCheck).orElse(false);
        if (!comparison) {
            return List.of();
        }
        Optional<SyntaxCursor> left = n.left();
        Optional<SyntaxCursor> right = n.right();
        if (left.isEmpty() || right.isEmpty()) {
            return List.of();
        }
        return classify(left.get(), right.get()).map(List::of).orElse(List.of());
    }

    private Optional<TypeofState> classify(SyntaxCursor left, SyntaxCursor right) {
        Optional<JsUnaryExpression> leftUnary = JsUnaryExpression.cast(left);
        Optional<JsUnaryExpression> rightUnary = JsUnaryExpression.cast(right);

        // typeof x == <literal>
        if (leftUnary.isPresent() && isLiteral(right)) {
            return checkLiteral(leftUnary.get(), right);
        }
        if (rightUnary.isPresent() && isLiteral(left)) {
            return checkLiteral(rightUnary.get(), left);
        }

        // typeof x == typeof y
        if (leftUnary.isPresent() && rightUnary.isPresent()) {
            boolean typeofLeft = leftUnary.get().isTypeof();
            boolean typeofRight = rightUnary.get().isTypeof();
            if (typeofLeft && !typeofRight) {
                return invalidExpression(right);
            }
            if (typeofRight && !typeofLeft) {
                return invalidExpression(left);
            }
            return Optional.empty();
        }

        // typeof x == ident
        if (leftUnary.isPresent() && right.kind() == SyntaxKind.JS_IDENTIFIER_EXPRESSION) {
            return checkIdentifier(leftUnary.get(), right);
        }
        if (rightUnary.isPresent() && left.kind() == SyntaxKind.JS_IDENTIFIER_EXPRESSION) {
            return checkIdentifier(rightUnary.get(), left);
        }

        // typeof x == <any other expression>
        if (leftUnary.isPresent()) {
            return leftUnary.get().isTypeof() ? invalidExpression(right) : Optional.empty();
        }
        if (rightUnary.isPresent()) {
            return rightUnary.get().isTypeof() ? invalidExpression(left) : Optional.empty();
        }
        return Optional.empty();
    }

    private Optional<TypeofState> checkLiteral(JsUnaryExpression unary, SyntaxCursor literal) {
        if (!unary.isTypeof()) {
            return Optional.empty();
        }
        Optional<JsStringLiteralExpression> string = JsStringLiteralExpression.cast(literal);
        if (string.isEmpty()) {
            return invalidExpression(literal);
        }
        Optional<SyntaxCursor> token = string.get().valueToken();
        Optional<String> text = string.get().innerString();
        if (token.isEmpty() || text.isEmpty()) {
            return Optional.empty();
        }
        if (JsTypeName.fromName(text.get()).isPresent()) {
            return Optional.empty();
        }
        Suggestion suggestion = JsTypeName.suggest(text.get())
                .map(type -> new Suggestion(literal, type))
                .orElse(null);
        return Optional.of(new TypeofState(
                TypeofError.invalidLiteral(token.get().textRange(), text.get()), suggestion));
    }

    private Optional<TypeofState> checkIdentifier(JsUnaryExpression unary, SyntaxCursor identifier) {
        if (!unary.isTypeof()) {
            return Optional.empty();
        }
        Suggestion suggestion = JsIdentifierExpression.cast(identifier)
                .flatMap(JsIdentifierExpression::name)
                .flatMap(name -> JsTypeName.fromName(name.toLowerCase(java.util.Locale.ROOT)))
                .map(type -> new Suggestion(identifier, type))
                .orElse(null);
        return Optional.of(new TypeofState(TypeofError.invalidExpression(identifier.textRange()), suggestion));
    }

    private static Optional<TypeofState> invalidExpression(SyntaxCursor expression) {
        return Optional.of(new TypeofState(TypeofError.invalidExpression(expression.textRange()), null));
    }

    private static boolean isLiteral(SyntaxCursor expression) {
        return SyntaxGrammar.LITERAL_EXPRESSIONS.contains(expression.kind());
    }

    @Override
    public Optional<RuleDiagnostic> diagnostic(RuleContext<JsBinaryExpression> ctx, TypeofState state) {
        TypeofError error = state.error();
        RuleDiagnostic diagnostic = switch (error.kind()) {
            case INVALID_LITERAL -> ctx.newDiagnostic(error.range(), TITLE)
                    .note("not a valid type name")
                    .description(String.format("%s: \"%s\" is not a valid type name", TITLE, error.literal()));
            case INVALID_EXPRESSION -> ctx.newDiagnostic(error.range(), TITLE)
                    .note("not a string literal")
                    .description(TITLE + ": this expression is not a string literal");
        };
        return Optional.of(diagnostic);
    }

    @Override
    public Optional<RuleAction> action(RuleContext<JsBinaryExpression> ctx, TypeofState state) {
        Optional<Suggestion> suggestion = state.suggestionIfAny();
        if (suggestion.isEmpty()) {
            return Optional.empty();
        }
        SyntaxCursor expression = suggestion.get().expression();
        Trivia leading = expression.firstToken()
                .map(token -> token.token().leadingTrivia())
                .orElse(Trivia.EMPTY);
        Trivia trailing = expression.lastToken()
                .map(token -> token.token().trailingTrivia())
                .orElse(Trivia.EMPTY);
        SyntaxToken literal = SyntaxFactory
                .jsStringLiteral(suggestion.get().typeName().asString(), ctx.preferredQuote())
                .withLeadingTrivia(leading)
                .withTrailingTrivia(trailing);

        BatchMutation mutation = ctx.root().begin()
                .replaceNode(expression, SyntaxFactory.jsStringLiteralExpression(literal));
        log.debug("Suggesting '{}' for {}", suggestion.get().typeName().asString(), expression);
        return Optional.of(ctx.newAction(
                ActionCategory.QUICK_FIX,
                Applicability.MAYBE_INCORRECT,
                "Compare the result of `typeof` with a valid type name",
                mutation));
    }
}
