package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;
import com.polygen.core.parser.ParsedSchema;
import com.polygen.core.parser.SchemaSyntaxException;
import com.polygen.core.util.NamingUtils;
import com.polygen.parser.PolygenLexer;
import com.polygen.parser.PolygenParser;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Builds the typed AST of one schema file from its ANTLR parse tree.
 *
 * <p>The builder is deterministic and order-preserving: definitions, fields, variants,
 * constraints and annotations appear in the AST in source order. Literal values are
 * converted here, so an out-of-range number, an unknown timezone word or a misspelled
 * {@code foreign_key} label is reported as a {@link SchemaSyntaxException} at the
 * literal's position.
 *
 * <p>Inline {@code embed { ... }} and {@code enum { ... }} field types become
 * anonymous definitions named after the field in PascalCase.
 */
public class SchemaAstBuilder {

    private static final Logger log = LoggerFactory.getLogger(SchemaAstBuilder.class);

    private static final String DOC_PREFIX = "///";
    private static final String TARGET_LABEL = "target";
    private static final String RELATION_LABEL = "as";
    private static final int MAX_OFFSET_HOURS = 14;

    /**
     * Builds the AST for a parsed file.
     *
     * @param parsed parse tree and tokens of one file
     * @return immutable schema file
     * @throws SchemaSyntaxException if a literal cannot be converted
     */
    public SchemaFile build(ParsedSchema parsed) {
        Objects.requireNonNull(parsed, "parsed must not be null");
        SchemaFile schemaFile = new FileBuilder(parsed.file(), parsed.tokens()).build(parsed.tree());
        log.debug("Built AST for {}: {} imports, {} definitions",
            schemaFile.path(), schemaFile.imports().size(), schemaFile.definitions().size());
        return schemaFile;
    }

    /**
     * Per-file conversion state.
     */
    private static final class FileBuilder {

        private final String file;
        private final CommonTokenStream tokens;

        FileBuilder(String file, CommonTokenStream tokens) {
            this.file = file;
            this.tokens = tokens;
        }

        SchemaFile build(PolygenParser.SchemaContext tree) {
            List<FileImport> imports = new ArrayList<>();
            List<Definition> definitions = new ArrayList<>();
            for (PolygenParser.TopLevelItemContext item : tree.topLevelItem()) {
                if (item.fileImport() != null) {
                    PolygenParser.FileImportContext fileImport = item.fileImport();
                    imports.add(new FileImport(unquote(fileImport.STRING_LITERAL()), location(fileImport.getStart())));
                } else {
                    definitions.add(definition(item.definition()));
                }
            }
            return new SchemaFile(file, imports, definitions);
        }

        private Definition definition(PolygenParser.DefinitionContext ctx) {
            if (ctx.namespaceDecl() != null) {
                return namespace(ctx.namespaceDecl());
            }
            if (ctx.tableDecl() != null) {
                return table(ctx.tableDecl());
            }
            if (ctx.enumDecl() != null) {
                return enumDef(ctx.enumDecl());
            }
            return embed(ctx.embedDecl());
        }

        private NamespaceDef namespace(PolygenParser.NamespaceDeclContext ctx) {
            List<NamespaceImport> imports = new ArrayList<>();
            List<Definition> members = new ArrayList<>();
            for (PolygenParser.NamespaceMemberContext member : ctx.namespaceMember()) {
                if (member.namespaceImport() != null) {
                    PolygenParser.NamespaceImportContext namespaceImport = member.namespaceImport();
                    imports.add(new NamespaceImport(
                        qualifiedName(namespaceImport.qualifiedName()),
                        namespaceImport.STAR() != null,
                        location(namespaceImport.getStart())));
                } else {
                    members.add(definition(member.definition()));
                }
            }
            return new NamespaceDef(
                qualifiedName(ctx.qualifiedName()),
                annotations(ctx.annotation()),
                imports,
                members,
                doc(ctx),
                location(ctx.qualifiedName().getStart()));
        }

        private TableDef table(PolygenParser.TableDeclContext ctx) {
            List<FieldDef> fields = new ArrayList<>();
            List<Definition> nested = new ArrayList<>();
            members(ctx.tableMember(), fields, nested);
            return new TableDef(
                ctx.identifier().getText(),
                annotations(ctx.annotation()),
                fields,
                nested,
                doc(ctx),
                location(ctx.identifier().getStart()));
        }

        private EmbedDef embed(PolygenParser.EmbedDeclContext ctx) {
            List<FieldDef> fields = new ArrayList<>();
            List<Definition> nested = new ArrayList<>();
            members(ctx.tableMember(), fields, nested);
            return new EmbedDef(
                ctx.identifier().getText(),
                annotations(ctx.annotation()),
                fields,
                nested,
                false,
                doc(ctx),
                location(ctx.identifier().getStart()));
        }

        private EnumDef enumDef(PolygenParser.EnumDeclContext ctx) {
            return new EnumDef(
                ctx.identifier().getText(),
                annotations(ctx.annotation()),
                variants(ctx.enumVariant()),
                false,
                doc(ctx),
                location(ctx.identifier().getStart()));
        }

        private void members(List<PolygenParser.TableMemberContext> members, List<FieldDef> fields, List<Definition> nested) {
            for (PolygenParser.TableMemberContext member : members) {
                if (member.fieldDecl() != null) {
                    fields.add(field(member.fieldDecl()));
                } else if (member.enumDecl() != null) {
                    nested.add(enumDef(member.enumDecl()));
                } else {
                    nested.add(embed(member.embedDecl()));
                }
            }
        }

        private List<EnumVariant> variants(List<PolygenParser.EnumVariantContext> contexts) {
            List<EnumVariant> variants = new ArrayList<>(contexts.size());
            for (PolygenParser.EnumVariantContext ctx : contexts) {
                Long value = null;
                if (ctx.signedInteger() != null) {
                    PolygenParser.SignedIntegerContext number = ctx.signedInteger();
                    value = parseLong(number.MINUS() != null ? "-" : "", number.INTEGER_LITERAL());
                }
                variants.add(new EnumVariant(
                    ctx.identifier().getText(),
                    annotations(ctx.annotation()),
                    value,
                    doc(ctx),
                    location(ctx.identifier().getStart())));
            }
            return variants;
        }

        private FieldDef field(PolygenParser.FieldDeclContext ctx) {
            String name = ctx.identifier().getText();
            PolygenParser.FieldTypeContext fieldType = ctx.fieldType();

            Cardinality cardinality = Cardinality.SCALAR;
            if (fieldType.cardinality() != null) {
                cardinality = fieldType.cardinality().QUESTION() != null ? Cardinality.OPTIONAL : Cardinality.ARRAY;
            }

            List<Constraint> constraints = new ArrayList<>();
            for (PolygenParser.ConstraintContext constraint : ctx.constraint()) {
                constraints.add(constraint(constraint));
            }

            Integer fieldNumber = null;
            if (ctx.INTEGER_LITERAL() != null) {
                fieldNumber = parseInt(ctx.INTEGER_LITERAL());
            }

            return new FieldDef(
                name,
                typeExpr(fieldType.typeCore(), name),
                cardinality,
                constraints,
                annotations(ctx.annotation()),
                fieldNumber,
                doc(ctx),
                location(ctx.identifier().getStart()));
        }

        private TypeExpr typeExpr(PolygenParser.TypeCoreContext ctx, String fieldName) {
            if (ctx instanceof PolygenParser.PrimitiveTypeCoreContext primitive) {
                String keyword = primitive.primitiveType().getText();
                return new TypeExpr.Primitive(PrimitiveType.fromKeyword(keyword)
                    .orElseThrow(() -> syntaxError("Unknown primitive type '" + keyword + "'", primitive.getStart())));
            }
            if (ctx instanceof PolygenParser.NamedTypeCoreContext named) {
                return new TypeExpr.Named(qualifiedName(named.qualifiedName()), location(named.getStart()));
            }
            if (ctx instanceof PolygenParser.InlineEmbedTypeCoreContext inlineEmbed) {
                List<FieldDef> fields = new ArrayList<>();
                List<Definition> nested = new ArrayList<>();
                members(inlineEmbed.tableMember(), fields, nested);
                return new TypeExpr.InlineEmbed(new EmbedDef(
                    NamingUtils.toPascalCase(fieldName), List.of(), fields, nested, true, null,
                    location(inlineEmbed.getStart())));
            }
            if (ctx instanceof PolygenParser.InlineEnumTypeCoreContext inlineEnum) {
                return new TypeExpr.InlineEnum(new EnumDef(
                    NamingUtils.toPascalCase(fieldName), List.of(), variants(inlineEnum.enumVariant()), true, null,
                    location(inlineEnum.getStart())));
            }
            throw new IllegalStateException("Unhandled type alternative: " + ctx.getClass().getSimpleName());
        }

        private Constraint constraint(PolygenParser.ConstraintContext ctx) {
            SourceLocation location = location(ctx.getStart());
            if (ctx instanceof PolygenParser.PrimaryKeyConstraintContext) {
                return new Constraint.PrimaryKey(location);
            }
            if (ctx instanceof PolygenParser.UniqueConstraintContext) {
                return new Constraint.Unique(location);
            }
            if (ctx instanceof PolygenParser.IndexConstraintContext) {
                return new Constraint.Index(location);
            }
            if (ctx instanceof PolygenParser.AutoIncrementConstraintContext) {
                return new Constraint.AutoIncrement(location);
            }
            if (ctx instanceof PolygenParser.MaxLengthConstraintContext maxLength) {
                int length = parseInt(maxLength.INTEGER_LITERAL());
                if (length <= 0) {
                    throw syntaxError("max_length must be a positive integer", maxLength.INTEGER_LITERAL().getSymbol());
                }
                return new Constraint.MaxLength(length, location);
            }
            if (ctx instanceof PolygenParser.DefaultConstraintContext defaultValue) {
                return new Constraint.Default(literal(defaultValue.literal()), location);
            }
            if (ctx instanceof PolygenParser.RangeConstraintContext range) {
                return new Constraint.Range(literal(range.literal(0)), literal(range.literal(1)), location);
            }
            if (ctx instanceof PolygenParser.RegexConstraintContext regex) {
                String pattern = unquote(regex.STRING_LITERAL());
                try {
                    Pattern.compile(pattern);
                } catch (PatternSyntaxException e) {
                    throw syntaxError("Invalid regex pattern: " + e.getDescription(), regex.STRING_LITERAL().getSymbol());
                }
                return new Constraint.Regex(pattern, location);
            }
            if (ctx instanceof PolygenParser.ForeignKeyConstraintContext foreignKey) {
                return foreignKey(foreignKey, location);
            }
            if (ctx instanceof PolygenParser.AutoCreateConstraintContext autoCreate) {
                return new Constraint.AutoCreate(timezone(autoCreate.timezone()), location);
            }
            if (ctx instanceof PolygenParser.AutoUpdateConstraintContext autoUpdate) {
                return new Constraint.AutoUpdate(timezone(autoUpdate.timezone()), location);
            }
            throw new IllegalStateException("Unhandled constraint alternative: " + ctx.getClass().getSimpleName());
        }

        private Constraint.ForeignKey foreignKey(PolygenParser.ForeignKeyConstraintContext ctx, SourceLocation location) {
            PolygenParser.ForeignKeyTargetContext target = ctx.foreignKeyTarget();
            if (target.identifier() != null && !TARGET_LABEL.equals(target.identifier().getText())) {
                throw syntaxError("Expected 'target:' in foreign_key, found '" + target.identifier().getText() + ":'",
                    target.identifier().getStart());
            }

            String path = qualifiedName(target.qualifiedName());
            if (path.indexOf('.') < 0) {
                throw syntaxError("foreign_key target must be written as Table.field", target.qualifiedName().getStart());
            }

            String relationName = null;
            PolygenParser.RelationLabelContext label = ctx.relationLabel();
            if (label != null) {
                if (!RELATION_LABEL.equals(label.identifier(0).getText())) {
                    throw syntaxError("Expected 'as:' in foreign_key, found '" + label.identifier(0).getText() + ":'",
                        label.identifier(0).getStart());
                }
                relationName = label.STRING_LITERAL() != null ? unquote(label.STRING_LITERAL()) : label.identifier(1).getText();
            }
            if (ctx.identifier() != null) {
                if (relationName != null) {
                    throw syntaxError("Relation name given twice for foreign_key", ctx.identifier().getStart());
                }
                relationName = ctx.identifier().getText();
            }

            return new Constraint.ForeignKey(
                NamingUtils.parentOf(path), NamingUtils.simpleName(path), relationName, location);
        }

        private Timezone timezone(PolygenParser.TimezoneContext ctx) {
            if (ctx == null) {
                return Timezone.utc();
            }
            if (ctx.STRING_LITERAL() != null) {
                String zone = unquote(ctx.STRING_LITERAL());
                try {
                    ZoneId.of(zone);
                } catch (DateTimeException e) {
                    throw syntaxError("Unknown timezone \"" + zone + "\"", ctx.STRING_LITERAL().getSymbol());
                }
                return Timezone.named(zone);
            }
            if (ctx.identifier() != null) {
                String word = ctx.identifier().getText();
                return switch (word) {
                    case "utc" -> Timezone.utc();
                    case "local" -> Timezone.local();
                    default -> throw syntaxError("Unknown timezone '" + word
                        + "'; expected utc, local, an offset such as +9 or +5:30, or a quoted zone name",
                        ctx.identifier().getStart());
                };
            }

            int sign = ctx.MINUS() != null ? -1 : 1;
            int hours = parseInt(ctx.INTEGER_LITERAL(0));
            int minutes = ctx.INTEGER_LITERAL().size() > 1 ? parseInt(ctx.INTEGER_LITERAL(1)) : 0;
            if (hours > MAX_OFFSET_HOURS || minutes >= 60) {
                throw syntaxError("Timezone offset out of range: " + ctx.getText(), ctx.getStart());
            }
            return Timezone.offset(sign * (hours * 60 + minutes));
        }

        private List<Annotation> annotations(List<PolygenParser.AnnotationContext> contexts) {
            List<Annotation> annotations = new ArrayList<>(contexts.size());
            for (PolygenParser.AnnotationContext ctx : contexts) {
                List<AnnotationArgument> arguments = new ArrayList<>();
                for (PolygenParser.AnnotationArgumentContext argument : ctx.annotationArgument()) {
                    String key = argument.identifier() != null ? argument.identifier().getText() : null;
                    arguments.add(new AnnotationArgument(key, literal(argument.literal())));
                }
                annotations.add(new Annotation(ctx.identifier().getText(), arguments, location(ctx.getStart())));
            }
            return annotations;
        }

        private Literal literal(PolygenParser.LiteralContext ctx) {
            SourceLocation location = location(ctx.getStart());
            String sign = ctx.MINUS() != null ? "-" : "";
            if (ctx.STRING_LITERAL() != null) {
                return new Literal(LiteralKind.STRING, unquote(ctx.STRING_LITERAL()), location);
            }
            if (ctx.INTEGER_LITERAL() != null) {
                return new Literal(LiteralKind.INTEGER, sign + ctx.INTEGER_LITERAL().getText(), location);
            }
            if (ctx.FLOAT_LITERAL() != null) {
                return new Literal(LiteralKind.FLOAT, sign + ctx.FLOAT_LITERAL().getText(), location);
            }
            if (ctx.TRUE() != null || ctx.FALSE() != null) {
                return new Literal(LiteralKind.BOOLEAN, ctx.getText(), location);
            }
            return new Literal(LiteralKind.IDENTIFIER, qualifiedName(ctx.qualifiedName()), location);
        }

        private String qualifiedName(PolygenParser.QualifiedNameContext ctx) {
            return ctx.identifier().stream()
                .map(ParserRuleContext::getText)
                .collect(Collectors.joining("."));
        }

        private String doc(ParserRuleContext ctx) {
            List<Token> hidden = tokens.getHiddenTokensToLeft(ctx.getStart().getTokenIndex(), Token.HIDDEN_CHANNEL);
            if (hidden == null) {
                return null;
            }
            String text = hidden.stream()
                .filter(token -> token.getType() == PolygenLexer.DOC_COMMENT)
                .map(token -> token.getText().substring(DOC_PREFIX.length()).strip())
                .collect(Collectors.joining("\n"));
            return text.isEmpty() ? null : text;
        }

        private int parseInt(TerminalNode node) {
            try {
                return Integer.parseInt(node.getText());
            } catch (NumberFormatException e) {
                throw syntaxError("Integer out of range: " + node.getText(), node.getSymbol());
            }
        }

        private long parseLong(String sign, TerminalNode node) {
            try {
                return Long.parseLong(sign + node.getText());
            } catch (NumberFormatException e) {
                throw syntaxError("Integer out of range: " + sign + node.getText(), node.getSymbol());
            }
        }

        private String unquote(TerminalNode node) {
            String raw = node.getText();
            String body = raw.substring(1, raw.length() - 1);
            StringBuilder sb = new StringBuilder(body.length());
            for (int i = 0; i < body.length(); i++) {
                char c = body.charAt(i);
                if (c != '\\' || i + 1 >= body.length()) {
                    sb.append(c);
                    continue;
                }
                char escaped = body.charAt(++i);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    default -> sb.append(escaped);
                }
            }
            return sb.toString();
        }

        private SourceLocation location(Token token) {
            return new SourceLocation(file, token.getLine(), token.getCharPositionInLine() + 1);
        }

        private SchemaSyntaxException syntaxError(String message, Token token) {
            return new SchemaSyntaxException(message, location(token), token.getText(), null);
        }
    }
}
