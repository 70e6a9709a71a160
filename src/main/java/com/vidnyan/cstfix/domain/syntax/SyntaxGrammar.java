package com.vidnyan.cstfix.domain.syntax;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vidnyan.cstfix.domain.syntax.SyntaxKind.*;

/**
 * Shape constraints for every node kind: which kinds may occupy which slot.
 * Consulted when nodes are created and when a mutation lands a replacement in a slot.
 */
public final class SyntaxGrammar {

    public static final Set<SyntaxKind> EXPRESSIONS = Collections.unmodifiableSet(EnumSet.of(
            JS_BINARY_EXPRESSION,
            JS_UNARY_EXPRESSION,
            JS_STRING_LITERAL_EXPRESSION,
            JS_NUMBER_LITERAL_EXPRESSION,
            JS_BOOLEAN_LITERAL_EXPRESSION,
            JS_NULL_LITERAL_EXPRESSION,
            JS_IDENTIFIER_EXPRESSION,
            JS_PARENTHESIZED_EXPRESSION,
            JS_STATIC_MEMBER_EXPRESSION,
            JSX_TAG_EXPRESSION,
            JS_BOGUS_EXPRESSION));

    public static final Set<SyntaxKind> LITERAL_EXPRESSIONS = Collections.unmodifiableSet(EnumSet.of(
            JS_STRING_LITERAL_EXPRESSION,
            JS_NUMBER_LITERAL_EXPRESSION,
            JS_BOOLEAN_LITERAL_EXPRESSION,
            JS_NULL_LITERAL_EXPRESSION));

    public static final Set<SyntaxKind> BINARY_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
            EQ2, EQ3, NEQ, NEQ2, L_ANGLE, R_ANGLE, LTEQ, GTEQ, PLUS, MINUS, STAR, SLASH, AMP2, PIPE2));

    public static final Set<SyntaxKind> UNARY_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
            TYPEOF_KW, VOID_KW, DELETE_KW, PLUS, MINUS, BANG, TILDE));

    public static final Set<SyntaxKind> JSX_TAGS = Collections.unmodifiableSet(EnumSet.of(
            JSX_ELEMENT, JSX_SELF_CLOSING_ELEMENT));

    public static final Set<SyntaxKind> JSX_ELEMENT_NAMES = Collections.unmodifiableSet(EnumSet.of(
            JSX_NAME, JSX_REFERENCE_IDENTIFIER, JSX_MEMBER_NAME));

    private static final Map<SyntaxKind, NodeShape> SHAPES = new EnumMap<>(SyntaxKind.class);

    static {
        fixed(JS_MODULE,
                required("items", JS_MODULE_ITEM_LIST),
                required("eof", EOF));
        list(JS_MODULE_ITEM_LIST, EnumSet.of(JS_EXPRESSION_STATEMENT, JS_BOGUS), null);
        fixed(JS_EXPRESSION_STATEMENT,
                required("expression", EXPRESSIONS),
                optional("semicolon", SEMICOLON));
        fixed(JS_BINARY_EXPRESSION,
                required("left", EXPRESSIONS),
                required("operator", BINARY_OPERATORS),
                required("right", EXPRESSIONS));
        fixed(JS_UNARY_EXPRESSION,
                required("operator", UNARY_OPERATORS),
                required("argument", EXPRESSIONS));
        fixed(JS_STRING_LITERAL_EXPRESSION, required("value", JS_STRING_LITERAL));
        fixed(JS_NUMBER_LITERAL_EXPRESSION, required("value", JS_NUMBER_LITERAL));
        fixed(JS_BOOLEAN_LITERAL_EXPRESSION, required("value", EnumSet.of(TRUE_KW, FALSE_KW)));
        fixed(JS_NULL_LITERAL_EXPRESSION, required("value", NULL_KW));
        fixed(JS_IDENTIFIER_EXPRESSION, required("name", JS_REFERENCE_IDENTIFIER));
        fixed(JS_REFERENCE_IDENTIFIER, required("value", IDENT));
        fixed(JS_PARENTHESIZED_EXPRESSION,
                required("lParen", L_PAREN),
                required("expression", EXPRESSIONS),
                required("rParen", R_PAREN));
        fixed(JS_STATIC_MEMBER_EXPRESSION,
                required("object", EXPRESSIONS),
                required("dot", DOT),
                required("member", JS_NAME));
        fixed(JS_NAME, required("value", IDENT));

        fixed(JSX_TAG_EXPRESSION, required("tag", JSX_TAGS));
        fixed(JSX_ELEMENT,
                required("openingElement", JSX_OPENING_ELEMENT),
                required("children", JSX_CHILD_LIST),
                required("closingElement", JSX_CLOSING_ELEMENT));
        fixed(JSX_OPENING_ELEMENT,
                required("lAngle", L_ANGLE),
                required("name", JSX_ELEMENT_NAMES),
                optional("typeArguments", TS_TYPE_ARGUMENTS),
                required("attributes", JSX_ATTRIBUTE_LIST),
                required("rAngle", R_ANGLE));
        fixed(JSX_CLOSING_ELEMENT,
                required("lAngle", L_ANGLE),
                required("slash", SLASH),
                required("name", JSX_ELEMENT_NAMES),
                required("rAngle", R_ANGLE));
        fixed(JSX_SELF_CLOSING_ELEMENT,
                required("lAngle", L_ANGLE),
                required("name", JSX_ELEMENT_NAMES),
                optional("typeArguments", TS_TYPE_ARGUMENTS),
                required("attributes", JSX_ATTRIBUTE_LIST),
                required("slash", SLASH),
                required("rAngle", R_ANGLE));
        fixed(JSX_NAME, required("value", JSX_IDENT));
        fixed(JSX_REFERENCE_IDENTIFIER, required("value", JSX_IDENT));
        fixed(JSX_MEMBER_NAME,
                required("object", EnumSet.of(JSX_NAME, JSX_REFERENCE_IDENTIFIER, JSX_MEMBER_NAME)),
                required("dot", DOT),
                required("member", JS_NAME));
        list(JSX_ATTRIBUTE_LIST, EnumSet.of(JSX_ATTRIBUTE), null);
        fixed(JSX_ATTRIBUTE,
                required("name", JSX_NAME),
                optional("initializer", JSX_ATTRIBUTE_INITIALIZER_CLAUSE));
        fixed(JSX_ATTRIBUTE_INITIALIZER_CLAUSE,
                required("eq", EQ),
                required("value", EnumSet.of(JSX_STRING, JSX_EXPRESSION_ATTRIBUTE_VALUE)));
        fixed(JSX_STRING, required("value", JSX_STRING_LITERAL));
        fixed(JSX_EXPRESSION_ATTRIBUTE_VALUE,
                required("lCurly", L_CURLY),
                required("expression", EXPRESSIONS),
                required("rCurly", R_CURLY));
        list(JSX_CHILD_LIST, EnumSet.of(JSX_TEXT, JSX_ELEMENT, JSX_SELF_CLOSING_ELEMENT, JSX_EXPRESSION_CHILD), null);
        fixed(JSX_TEXT, required("value", JSX_TEXT_LITERAL));
        fixed(JSX_EXPRESSION_CHILD,
                required("lCurly", L_CURLY),
                optional("expression", EXPRESSIONS),
                required("rCurly", R_CURLY));

        fixed(TS_TYPE_ARGUMENTS,
                required("lAngle", L_ANGLE),
                required("arguments", TS_TYPE_ARGUMENT_LIST),
                required("rAngle", R_ANGLE));
        list(TS_TYPE_ARGUMENT_LIST, EnumSet.of(TS_REFERENCE_TYPE), COMMA);
        fixed(TS_REFERENCE_TYPE, required("name", JS_REFERENCE_IDENTIFIER));

        SHAPES.put(JS_BOGUS, new NodeShape.Bogus());
        SHAPES.put(JS_BOGUS_EXPRESSION, new NodeShape.Bogus());

        for (SyntaxKind kind : SyntaxKind.values()) {
            if (kind.isNode() && !SHAPES.containsKey(kind)) {
                throw new ExceptionInInitializerError("No shape declared for " + kind);
            }
        }
    }

    private SyntaxGrammar() {
    }

    public static NodeShape shapeOf(SyntaxKind kind) {
        NodeShape shape = SHAPES.get(kind);
        if (shape == null) {
            throw new SyntaxConstructionException(kind + " is not a node kind");
        }
        return shape;
    }

    /**
     * Whether an element of {@code childKind} may sit in slot {@code slot} of a {@code parentKind} node.
     */
    public static boolean accepts(SyntaxKind parentKind, int slot, SyntaxKind childKind) {
        return shapeOf(parentKind).accepts(slot, childKind);
    }

    /**
     * Whether slot {@code slot} of a {@code parentKind} node may be left empty.
     */
    public static boolean isOptional(SyntaxKind parentKind, int slot) {
        return shapeOf(parentKind).isOptional(slot);
    }

    private static void fixed(SyntaxKind kind, Slot... slots) {
        SHAPES.put(kind, new NodeShape.Fixed(List.of(slots)));
    }

    private static void list(SyntaxKind kind, Set<SyntaxKind> elements, SyntaxKind separator) {
        SHAPES.put(kind, new NodeShape.ListShape(Collections.unmodifiableSet(EnumSet.copyOf(elements)), separator));
    }

    private static Slot required(String name, SyntaxKind kind) {
        return new Slot(name, EnumSet.of(kind), false);
    }

    private static Slot required(String name, Set<SyntaxKind> kinds) {
        return new Slot(name, EnumSet.copyOf(kinds), false);
    }

    private static Slot optional(String name, SyntaxKind kind) {
        return new Slot(name, EnumSet.of(kind), true);
    }

    private static Slot optional(String name, Set<SyntaxKind> kinds) {
        return new Slot(name, EnumSet.copyOf(kinds), true);
    }

    /**
     * A named child position of a fixed-shape node.
     */
    public record Slot(String name, Set<SyntaxKind> allowed, boolean optional) {
    }

    /**
     * Shape of one node kind.
     */
    public interface NodeShape {

        boolean accepts(int slot, SyntaxKind childKind);

        boolean isOptional(int slot);

        /**
         * Validates a complete child vector, throwing {@link SyntaxConstructionException} on the first misfit.
         */
        void validate(SyntaxKind owner, List<SyntaxElement> slots);

        record Fixed(List<Slot> slots) implements NodeShape {

            @Override
            public boolean accepts(int slot, SyntaxKind childKind) {
                return slot >= 0 && slot < slots.size() && slots.get(slot).allowed().contains(childKind);
            }

            @Override
            public boolean isOptional(int slot) {
                return slot >= 0 && slot < slots.size() && slots.get(slot).optional();
            }

            @Override
            public void validate(SyntaxKind owner, List<SyntaxElement> children) {
                if (children.size() != slots.size()) {
                    throw new SyntaxConstructionException(String.format(
                            "%s expects %d slots but got %d", owner, slots.size(), children.size()));
                }
                for (int i = 0; i < children.size(); i++) {
                    SyntaxElement child = children.get(i);
                    if (child != null && !accepts(i, child.kind())) {
                        Slot slot = slots.get(i);
                        throw new SyntaxConstructionException(String.format(
                                "%s.%s does not accept %s (allowed: %s)", owner, slot.name(), child.kind(), slot.allowed()));
                    }
                }
            }
        }

        record ListShape(Set<SyntaxKind> elements, SyntaxKind separator) implements NodeShape {

            @Override
            public boolean accepts(int slot, SyntaxKind childKind) {
                if (separator == null) {
                    return elements.contains(childKind);
                }
                return slot % 2 == 0 ? elements.contains(childKind) : childKind == separator;
            }

            @Override
            public boolean isOptional(int slot) {
                return false;
            }

            @Override
            public void validate(SyntaxKind owner, List<SyntaxElement> children) {
                for (int i = 0; i < children.size(); i++) {
                    SyntaxElement child = children.get(i);
                    if (child == null) {
                        throw new SyntaxConstructionException(owner + " cannot hold an empty entry at " + i);
                    }
                    if (!accepts(i, child.kind())) {
                        throw new SyntaxConstructionException(String.format(
                                "%s does not accept %s at position %d", owner, child.kind(), i));
                    }
                }
            }
        }

        record Bogus() implements NodeShape {

            @Override
            public boolean accepts(int slot, SyntaxKind childKind) {
                return true;
            }

            @Override
            public boolean isOptional(int slot) {
                return true;
            }

            @Override
            public void validate(SyntaxKind owner, List<SyntaxElement> children) {
                // error recovery nodes take anything
            }
        }
    }
}
