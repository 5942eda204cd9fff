package com.erdforge.core.dsl;

import com.erdforge.core.model.AttributeNode;
import com.erdforge.core.model.Cardinality;
import com.erdforge.core.model.EntityNode;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.ForeignKeyTarget;
import com.erdforge.core.model.Participation;
import com.erdforge.core.model.RelationshipNode;
import com.erdforge.core.model.RelationshipSide;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser for the ER DSL.
 *
 * <h2>Grammar</h2>
 * <pre>
 * program        := (entityDecl | weakEntityDecl | relationDecl | identifyingRelationDecl)*
 * entityDecl     := "Entity" IDENT ":" attribute*
 * weakEntityDecl := "Weak" "Entity" IDENT ":" attribute* ("Identified" "By" fkTarget ("+" fkTarget)*)?
 * attribute      := IDENT ( "PK" | "FK" ("->" fkTarget)? | "Composite" ":" IDENT*
 *                         | "Multivalued" | "Derived" | ":" IDENT )?
 * relationDecl   := "Relation" IDENT side DASH side IDENT ":" IDENT IDENT*
 * identifyingRelationDecl := "Identifying" "Relation" IDENT "(" card ")" DASH "(" card ")" IDENT ":" IDENT
 * side           := "(" card ("," ("total" | "partial"))? ")"
 * fkTarget       := IDENT "." IDENT
 * card           := "1" | "M"
 * </pre>
 *
 * <p>Unknown tokens at the top level or inside an attribute list are skipped. Any
 * other mismatch aborts the whole parse with a {@link DslSyntaxException}; no
 * partial diagram is returned.
 *
 * <p>A parser instance is single-use. {@link #parse(String)} lexes and parses in one call.
 */
public class Parser {

    /**
     * Tokens that, following an identifier, mark it as a new top-level attribute rather than
     * another sub-attribute of the composite being parsed.
     */
    private static final Set<TokenType> ATTRIBUTE_MARKERS = EnumSet.of(
        TokenType.PK, TokenType.FK, TokenType.COMPOSITE, TokenType.MULTIVALUED,
        TokenType.DERIVED, TokenType.COLON
    );

    private final List<Token> tokens;
    private int pos;

    /**
     * Creates a parser over a token list ending with {@link TokenType#EOF}.
     *
     * @param tokens tokens from {@link Lexer#tokenize()}
     */
    public Parser(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
    }

    /**
     * Lexes and parses DSL text.
     *
     * @param source DSL text
     * @return parsed diagram
     * @throws DslSyntaxException if the text is not a valid document
     */
    public static ErDiagram parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseProgram();
    }

    /**
     * Parses the whole token stream.
     *
     * @return parsed diagram
     * @throws DslSyntaxException on the first token mismatch
     */
    public ErDiagram parseProgram() {
        List<EntityNode> entities = new ArrayList<>();
        List<RelationshipNode> relationships = new ArrayList<>();

        while (!isAtEnd()) {
            switch (current().type()) {
                case ENTITY -> entities.add(parseEntity());
                case WEAK -> entities.add(parseWeakEntity());
                case RELATION -> relationships.add(parseRelation());
                case IDENTIFYING -> relationships.add(parseIdentifyingRelation());
                default -> advance();
            }
        }

        return new ErDiagram(entities, relationships);
    }

    private EntityNode parseEntity() {
        expect(TokenType.ENTITY);
        String name = expect(TokenType.IDENTIFIER).text();
        expect(TokenType.COLON);
        return EntityNode.strong(name, parseAttributeList());
    }

    private EntityNode parseWeakEntity() {
        expect(TokenType.WEAK);
        expect(TokenType.ENTITY);
        String name = expect(TokenType.IDENTIFIER).text();
        expect(TokenType.COLON);
        List<AttributeNode> attributes = parseAttributeList();

        List<ForeignKeyTarget> identifiedBy = new ArrayList<>();
        if (check(TokenType.IDENTIFIED)) {
            advance();
            expect(TokenType.BY);
            identifiedBy.add(parseForeignKeyTarget());
            while (check(TokenType.PLUS)) {
                advance();
                identifiedBy.add(parseForeignKeyTarget());
            }
        }

        return EntityNode.weak(name, attributes, identifiedBy);
    }

    private ForeignKeyTarget parseForeignKeyTarget() {
        String entityName = expect(TokenType.IDENTIFIER).text();
        expect(TokenType.DOT);
        String attributeName = expect(TokenType.IDENTIFIER).text();
        return new ForeignKeyTarget(entityName, attributeName);
    }

    private List<AttributeNode> parseAttributeList() {
        List<AttributeNode> attributes = new ArrayList<>();

        while (!isAtEnd() && !current().type().startsDeclaration()) {
            if (check(TokenType.IDENTIFIER)) {
                attributes.add(parseAttribute());
            } else if (check(TokenType.IDENTIFIED)) {
                break;
            } else {
                advance();
            }
        }

        return attributes;
    }

    private AttributeNode parseAttribute() {
        String name = expect(TokenType.IDENTIFIER).text();

        return switch (current().type()) {
            case PK -> {
                advance();
                yield AttributeNode.primaryKey(name);
            }
            case FK -> {
                advance();
                ForeignKeyTarget target = null;
                if (check(TokenType.ARROW)) {
                    advance();
                    target = parseForeignKeyTarget();
                }
                yield AttributeNode.foreignKey(name, target);
            }
            case COMPOSITE -> {
                advance();
                expect(TokenType.COLON);
                yield AttributeNode.composite(name, parseSubAttributeList());
            }
            case MULTIVALUED -> {
                advance();
                yield AttributeNode.multivalued(name);
            }
            case DERIVED -> {
                advance();
                yield AttributeNode.derived(name);
            }
            case COLON -> {
                advance();
                yield AttributeNode.typed(name, expect(TokenType.IDENTIFIER).text());
            }
            default -> AttributeNode.simple(name);
        };
    }

    /**
     * Sub-attributes are bare identifiers. The list ends at the first token that is not an
     * identifier (a declaration keyword, {@code Identified}, EOF) or at an identifier whose
     * follower marks it as the next top-level attribute.
     */
    private List<AttributeNode> parseSubAttributeList() {
        List<AttributeNode> subAttributes = new ArrayList<>();

        while (check(TokenType.IDENTIFIER)) {
            if (ATTRIBUTE_MARKERS.contains(peek(1).type())) {
                break;
            }
            subAttributes.add(AttributeNode.simple(advance().text()));
        }

        return subAttributes;
    }

    private RelationshipNode parseRelation() {
        expect(TokenType.RELATION);
        String leftEntity = expect(TokenType.IDENTIFIER).text();
        SideSpec left = parseSide(true);
        expect(TokenType.DASH);
        SideSpec right = parseSide(true);
        String rightEntity = expect(TokenType.IDENTIFIER).text();
        expect(TokenType.COLON);
        String verb = expect(TokenType.IDENTIFIER).text();

        List<AttributeNode> attributes = new ArrayList<>();
        while (check(TokenType.IDENTIFIER)) {
            attributes.add(AttributeNode.simple(advance().text()));
        }

        return RelationshipNode.normal(verb,
            new RelationshipSide(leftEntity, left.cardinality(), left.participation()),
            new RelationshipSide(rightEntity, right.cardinality(), right.participation()),
            attributes);
    }

    private RelationshipNode parseIdentifyingRelation() {
        expect(TokenType.IDENTIFYING);
        expect(TokenType.RELATION);
        String leftEntity = expect(TokenType.IDENTIFIER).text();
        SideSpec left = parseSide(false);
        expect(TokenType.DASH);
        SideSpec right = parseSide(false);
        String rightEntity = expect(TokenType.IDENTIFIER).text();
        expect(TokenType.COLON);
        String verb = expect(TokenType.IDENTIFIER).text();

        return RelationshipNode.identifying(verb,
            new RelationshipSide(leftEntity, left.cardinality(), Participation.TOTAL),
            new RelationshipSide(rightEntity, right.cardinality(), Participation.TOTAL));
    }

    private SideSpec parseSide(boolean allowParticipation) {
        expect(TokenType.LPAREN);
        Cardinality cardinality = parseCardinality();
        Participation participation = Participation.PARTIAL;
        if (allowParticipation && check(TokenType.COMMA)) {
            advance();
            participation = parseParticipation();
        }
        expect(TokenType.RPAREN);
        return new SideSpec(cardinality, participation);
    }

    private Cardinality parseCardinality() {
        if (check(TokenType.ONE)) {
            advance();
            return Cardinality.ONE;
        }
        if (check(TokenType.MANY)) {
            advance();
            return Cardinality.MANY;
        }
        throw new DslSyntaxException("cardinality (1 or M)", current());
    }

    private Participation parseParticipation() {
        if (check(TokenType.TOTAL)) {
            advance();
            return Participation.TOTAL;
        }
        if (check(TokenType.PARTIAL)) {
            advance();
            return Participation.PARTIAL;
        }
        throw new DslSyntaxException("participation (total or partial)", current());
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private boolean check(TokenType type) {
        return current().type() == type;
    }

    private boolean isAtEnd() {
        return check(TokenType.EOF);
    }

    private Token advance() {
        Token token = current();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw new DslSyntaxException(type.name(), current());
    }

    private record SideSpec(Cardinality cardinality, Participation participation) {
    }
}
