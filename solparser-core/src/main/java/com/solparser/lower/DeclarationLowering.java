package com.solparser.lower;

import com.solparser.ast.Block;
import com.solparser.ast.ContractDefinition;
import com.solparser.ast.ContractKind;
import com.solparser.ast.ContractPart;
import com.solparser.ast.CustomErrorDefinition;
import com.solparser.ast.ElementaryTypeName;
import com.solparser.ast.EnumDefinition;
import com.solparser.ast.EnumValue;
import com.solparser.ast.EventDefinition;
import com.solparser.ast.Expression;
import com.solparser.ast.FileLevelConstant;
import com.solparser.ast.FunctionDefinition;
import com.solparser.ast.Identifier;
import com.solparser.ast.ImportDirective;
import com.solparser.ast.InheritanceSpecifier;
import com.solparser.ast.ModifierDefinition;
import com.solparser.ast.ModifierInvocation;
import com.solparser.ast.PragmaDirective;
import com.solparser.ast.SourceUnit;
import com.solparser.ast.SourceUnitPart;
import com.solparser.ast.StateMutability;
import com.solparser.ast.StateVariableDeclaration;
import com.solparser.ast.StorageLocation;
import com.solparser.ast.StringLiteral;
import com.solparser.ast.StructDefinition;
import com.solparser.ast.TypeDefinition;
import com.solparser.ast.TypeName;
import com.solparser.ast.UserDefinedTypeName;
import com.solparser.ast.UsingForDeclaration;
import com.solparser.ast.VariableDeclaration;
import com.solparser.ast.Visibility;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.solparser.grammar.SolidityParser.*;

/**
 * Lowering of file level and contract level declarations, including the resolution of
 * visibility and state mutability.
 */
final class DeclarationLowering {

    private DeclarationLowering() {
    }

    static SourceUnit sourceUnit(LoweringVisitor v, SourceUnitContext ctx) {
        List<ParserRuleContext> parts = new ArrayList<>();
        for (ParseTree child : Trees.children(ctx)) {
            if (child instanceof ParserRuleContext rule) {
                parts.add(rule);
            }
        }
        return new SourceUnit(v.range(ctx), v.items(ctx, parts, SourceUnitPart.class));
    }

    static PragmaDirective pragmaDirective(LoweringVisitor v, PragmaDirectiveContext ctx) {
        String name = v.require(ctx, ctx.pragmaName(), "pragma name").getText();
        PragmaValueContext value = v.require(ctx, ctx.pragmaValue(), "pragma value");
        String text;
        if (value.version() != null) {
            List<String> constraints = new ArrayList<>();
            for (ParseTree child : Trees.children(value.version())) {
                constraints.add(child.getText());
            }
            text = String.join(" ", constraints);
        } else {
            text = value.getText();
        }
        return new PragmaDirective(v.range(ctx), name, text);
    }

    static ImportDirective importDirective(LoweringVisitor v, ImportDirectiveContext ctx) {
        ImportPathContext pathContext = v.require(ctx, ctx.importPath(), "import path");
        String path = Trees.unquote(pathContext.getText());
        StringLiteral pathLiteral = new StringLiteral(v.range(pathContext), path, List.of(path), List.of(false));

        List<IdentifierContext> identifiers = ctx.identifier();
        Identifier unitAlias = null;
        if (identifiers.size() == 1) {
            unitAlias = v.lower(identifiers.get(0), Identifier.class);
        } else if (identifiers.size() == 2) {
            unitAlias = v.lower(identifiers.get(1), Identifier.class);
        }

        List<ImportDirective.SymbolAlias> symbolAliases = null;
        if (Trees.hasToken(ctx, "{")) {
            symbolAliases = new ArrayList<>();
            for (ImportDeclarationContext declaration : ctx.importDeclaration()) {
                List<IdentifierContext> names = declaration.identifier();
                if (names.isEmpty()) {
                    throw v.malformed(declaration, "Missing imported symbol");
                }
                Identifier symbol = v.lower(names.get(0), Identifier.class);
                Identifier alias = names.size() > 1 ? v.lower(names.get(1), Identifier.class) : null;
                symbolAliases.add(new ImportDirective.SymbolAlias(symbol, alias));
            }
            symbolAliases = Collections.unmodifiableList(symbolAliases);
        }

        return new ImportDirective(
            v.range(ctx),
            path,
            pathLiteral,
            unitAlias == null ? null : unitAlias.name(),
            unitAlias,
            symbolAliases);
    }

    static ContractDefinition contractDefinition(LoweringVisitor v, ContractDefinitionContext ctx) {
        ContractKind kind = contractKind(v, ctx);
        String name = v.require(ctx, ctx.identifier(), "contract name").getText();
        List<InheritanceSpecifier> baseContracts = v.each(ctx.inheritanceSpecifier(), InheritanceSpecifier.class);
        List<ContractPart> subNodes = v.enclosed(EnclosingKind.of(kind), name,
            () -> v.items(ctx, ctx.contractPart(), ContractPart.class));
        return new ContractDefinition(v.range(ctx), name, kind, baseContracts, subNodes);
    }

    private static ContractKind contractKind(LoweringVisitor v, ContractDefinitionContext ctx) {
        String keyword = ctx.getChildCount() == 0 ? "" : ctx.getChild(0).getText();
        return switch (keyword) {
            case "abstract" -> ContractKind.ABSTRACT;
            case "contract" -> ContractKind.CONTRACT;
            case "interface" -> ContractKind.INTERFACE;
            case "library" -> ContractKind.LIBRARY;
            default -> throw v.malformed(ctx, "Unknown contract kind '" + keyword + "'");
        };
    }

    static InheritanceSpecifier inheritanceSpecifier(LoweringVisitor v, InheritanceSpecifierContext ctx) {
        UserDefinedTypeName baseName = v.child(ctx, ctx.userDefinedTypeName(), UserDefinedTypeName.class);
        List<Expression> arguments = ctx.expressionList() == null
            ? List.of()
            : v.list(ctx.expressionList(), Expression.class);
        return new InheritanceSpecifier(v.range(ctx), baseName, arguments);
    }

    static StateVariableDeclaration stateVariableDeclaration(LoweringVisitor v, StateVariableDeclarationContext ctx) {
        TypeName typeName = v.child(ctx, ctx.typeName(), TypeName.class);

        List<Visibility> visibilities = new ArrayList<>();
        List<StateMutability> mutabilities = new ArrayList<>();
        List<UserDefinedTypeName> override = null;
        boolean immutable = false;
        for (ParseTree child : Trees.children(ctx)) {
            if (child instanceof ErrorNode) {
                continue;
            }
            if (child instanceof TerminalNode terminal) {
                switch (terminal.getSymbol().getType()) {
                    case PublicKeyword -> visibilities.add(Visibility.PUBLIC);
                    case InternalKeyword -> visibilities.add(Visibility.INTERNAL);
                    case PrivateKeyword -> visibilities.add(Visibility.PRIVATE);
                    case ConstantKeyword -> mutabilities.add(StateMutability.CONSTANT);
                    case ImmutableKeyword -> immutable = true;
                    default -> {
                    }
                }
            } else if (child instanceof OverrideSpecifierContext specifier) {
                override = override(v, specifier, override);
            }
        }

        Identifier identifier = v.child(ctx, ctx.identifier(), Identifier.class);
        Expression initialValue = v.optional(ctx.expression(), Expression.class);

        StateMutability mutability = resolveMutability(v, ctx, mutabilities, typeName);
        if (immutable && mutabilities.contains(StateMutability.CONSTANT)) {
            v.ambiguous(ctx, "State variable '" + identifier.name() + "' is both constant and immutable");
        }
        Visibility visibility = resolveVisibility(v, ctx, visibilities, DeclarationKind.STATE_VARIABLE);

        VariableDeclaration variable = new VariableDeclaration(
            v.range(ctx),
            typeName,
            identifier.name(),
            identifier,
            visibility,
            mutability,
            StorageLocation.STORAGE,
            true,
            mutabilities.contains(StateMutability.CONSTANT),
            false,
            immutable,
            override);
        return new StateVariableDeclaration(v.range(ctx), List.of(variable), initialValue);
    }

    static FileLevelConstant fileLevelConstant(LoweringVisitor v, FileLevelConstantContext ctx) {
        TypeName typeName = v.child(ctx, ctx.typeName(), TypeName.class);
        Identifier identifier = v.child(ctx, ctx.identifier(), Identifier.class);
        Expression initialValue = v.child(ctx, ctx.expression(), Expression.class);
        StateMutability mutability = resolveMutability(v, ctx, List.of(StateMutability.CONSTANT), typeName);
        Visibility visibility = VisibilityTable.defaultFor(DeclarationKind.FILE_CONSTANT, v.enclosingKind());
        return new FileLevelConstant(
            v.range(ctx),
            typeName,
            identifier.name(),
            identifier,
            initialValue,
            visibility,
            mutability,
            true,
            false);
    }

    static CustomErrorDefinition customErrorDefinition(LoweringVisitor v, CustomErrorDefinitionContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "error name").getText();
        List<VariableDeclaration> parameters =
            v.list(v.require(ctx, ctx.parameterList(), "parameter list"), VariableDeclaration.class);
        return new CustomErrorDefinition(v.range(ctx), name, parameters);
    }

    static TypeDefinition typeDefinition(LoweringVisitor v, TypeDefinitionContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "type name").getText();
        ElementaryTypeName definition = v.child(ctx, ctx.elementaryTypeName(), ElementaryTypeName.class);
        return new TypeDefinition(v.range(ctx), name, definition);
    }

    static UsingForDeclaration usingForDeclaration(LoweringVisitor v, UsingForDeclarationContext ctx) {
        UsingForObjectContext target = v.require(ctx, ctx.usingForObject(), "library or function list");
        TypeName typeName = v.optional(ctx.typeName(), TypeName.class);
        boolean global = ctx.GlobalKeyword() != null;

        if (target.userDefinedTypeName() != null) {
            return new UsingForDeclaration(v.range(ctx), typeName, target.userDefinedTypeName().getText(),
                List.of(), List.of(), global);
        }
        List<String> functions = new ArrayList<>();
        List<String> operators = new ArrayList<>();
        for (UsingForObjectDirectiveContext directive : target.usingForObjectDirective()) {
            functions.add(v.require(directive, directive.userDefinedTypeName(), "function name").getText());
            operators.add(directive.userDefinableOperators() == null ? null : directive.userDefinableOperators().getText());
        }
        return new UsingForDeclaration(v.range(ctx), typeName, null,
            Collections.unmodifiableList(functions), Collections.unmodifiableList(operators), global);
    }

    static StructDefinition structDefinition(LoweringVisitor v, StructDefinitionContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "struct name").getText();
        return new StructDefinition(v.range(ctx), name, v.each(ctx.variableDeclaration(), VariableDeclaration.class));
    }

    static ModifierDefinition modifierDefinition(LoweringVisitor v, ModifierDefinitionContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "modifier name").getText();
        List<VariableDeclaration> parameters = v.optionalList(ctx.parameterList(), VariableDeclaration.class);
        List<UserDefinedTypeName> override = null;
        for (OverrideSpecifierContext specifier : ctx.overrideSpecifier()) {
            override = override(v, specifier, override);
        }
        Block body = v.optional(ctx.block(), Block.class);
        return new ModifierDefinition(v.range(ctx), name, parameters, body, !ctx.VirtualKeyword().isEmpty(), override);
    }

    static ModifierInvocation modifierInvocation(LoweringVisitor v, ModifierInvocationContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "modifier name").getText();
        List<Expression> arguments = null;
        if (Trees.hasToken(ctx, "(")) {
            arguments = ctx.expressionList() == null ? List.of() : v.list(ctx.expressionList(), Expression.class);
        }
        return new ModifierInvocation(v.range(ctx), name, arguments);
    }

    static FunctionDefinition functionDefinition(LoweringVisitor v, FunctionDefinitionContext ctx) {
        FunctionDescriptorContext descriptor = v.require(ctx, ctx.functionDescriptor(), "function descriptor");
        String name = null;
        DeclarationKind kind;
        boolean constructor = false;
        boolean fallback = false;
        boolean receiveEther = false;
        if (descriptor.ConstructorKeyword() != null) {
            kind = DeclarationKind.CONSTRUCTOR;
            constructor = true;
        } else if (descriptor.FallbackKeyword() != null) {
            kind = DeclarationKind.FALLBACK;
            fallback = true;
        } else if (descriptor.ReceiveKeyword() != null) {
            kind = DeclarationKind.RECEIVE;
            receiveEther = true;
        } else {
            name = descriptor.identifier() == null ? "" : descriptor.identifier().getText();
            // Before 0.5 constructors were functions named after their contract and the
            // fallback function was the unnamed one.
            constructor = name.equals(v.enclosingContractName());
            fallback = name.isEmpty();
            kind = constructor ? DeclarationKind.CONSTRUCTOR
                : fallback ? DeclarationKind.FALLBACK
                : DeclarationKind.FUNCTION;
        }

        List<VariableDeclaration> parameters =
            v.list(v.require(ctx, ctx.parameterList(), "parameter list"), VariableDeclaration.class);

        ModifierListContext modifierList = v.require(ctx, ctx.modifierList(), "modifier list");
        List<Visibility> visibilities = new ArrayList<>();
        List<StateMutability> mutabilities = new ArrayList<>();
        List<ModifierInvocation> modifiers = new ArrayList<>();
        List<UserDefinedTypeName> override = null;
        boolean virtual = false;
        for (ParseTree child : Trees.children(modifierList)) {
            if (child instanceof ErrorNode) {
                continue;
            }
            if (child instanceof TerminalNode terminal) {
                switch (terminal.getSymbol().getType()) {
                    case ExternalKeyword -> visibilities.add(Visibility.EXTERNAL);
                    case PublicKeyword -> visibilities.add(Visibility.PUBLIC);
                    case InternalKeyword -> visibilities.add(Visibility.INTERNAL);
                    case PrivateKeyword -> visibilities.add(Visibility.PRIVATE);
                    case VirtualKeyword -> virtual = true;
                    default -> {
                    }
                }
            } else if (child instanceof StateMutabilityContext mutability) {
                mutabilities.add(mutabilityKeyword(v, mutability));
            } else if (child instanceof ModifierInvocationContext invocation) {
                modifiers.add(v.lower(invocation, ModifierInvocation.class));
            } else if (child instanceof OverrideSpecifierContext specifier) {
                override = override(v, specifier, override);
            }
        }

        List<VariableDeclaration> returnParameters =
            v.optionalList(ctx.returnParameters(), VariableDeclaration.class);
        Block body = v.optional(ctx.block(), Block.class);

        StateMutability mutability = resolveMutability(v, ctx, mutabilities, null);
        Visibility visibility = resolveVisibility(v, ctx, visibilities, kind);

        return new FunctionDefinition(
            v.range(ctx),
            name,
            parameters,
            returnParameters,
            body,
            visibility,
            mutability,
            Collections.unmodifiableList(modifiers),
            override,
            constructor,
            receiveEther,
            fallback,
            virtual);
    }

    static List<VariableDeclaration> returnParameters(LoweringVisitor v, ReturnParametersContext ctx) {
        return v.list(v.require(ctx, ctx.parameterList(), "parameter list"), VariableDeclaration.class);
    }

    static EventDefinition eventDefinition(LoweringVisitor v, EventDefinitionContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "event name").getText();
        List<VariableDeclaration> parameters =
            v.list(v.require(ctx, ctx.eventParameterList(), "event parameter list"), VariableDeclaration.class);
        return new EventDefinition(v.range(ctx), name, parameters, ctx.AnonymousKeyword() != null);
    }

    static EnumValue enumValue(LoweringVisitor v, EnumValueContext ctx) {
        return new EnumValue(v.range(ctx), v.require(ctx, ctx.identifier(), "enum value").getText());
    }

    static EnumDefinition enumDefinition(LoweringVisitor v, EnumDefinitionContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "enum name").getText();
        return new EnumDefinition(v.range(ctx), name, v.each(ctx.enumValue(), EnumValue.class));
    }

    static List<VariableDeclaration> parameterList(LoweringVisitor v, ParameterListContext ctx) {
        return v.each(ctx.parameter(), VariableDeclaration.class);
    }

    static VariableDeclaration parameter(LoweringVisitor v, ParameterContext ctx) {
        return variable(v, ctx, ctx.typeName(), ctx.storageLocation(), ctx.identifier(), false);
    }

    static List<VariableDeclaration> eventParameterList(LoweringVisitor v, EventParameterListContext ctx) {
        return v.each(ctx.eventParameter(), VariableDeclaration.class);
    }

    static VariableDeclaration eventParameter(LoweringVisitor v, EventParameterContext ctx) {
        return variable(v, ctx, ctx.typeName(), null, ctx.identifier(), ctx.IndexedKeyword() != null);
    }

    static VariableDeclaration variableDeclaration(LoweringVisitor v, VariableDeclarationContext ctx) {
        v.require(ctx, ctx.identifier(), "variable name");
        return variable(v, ctx, ctx.typeName(), ctx.storageLocation(), ctx.identifier(), false);
    }

    static List<UserDefinedTypeName> overrideSpecifier(LoweringVisitor v, OverrideSpecifierContext ctx) {
        return v.each(ctx.userDefinedTypeName(), UserDefinedTypeName.class);
    }

    static Identifier identifier(LoweringVisitor v, IdentifierContext ctx) {
        return new Identifier(v.range(ctx), ctx.getText());
    }

    // ==================== Shared with the other handlers ====================

    /**
     * Builds a non-state variable. Its mutability comes from the type alone, so only
     * {@code address payable} makes it payable.
     */
    static VariableDeclaration variable(LoweringVisitor v, ParserRuleContext owner, TypeNameContext typeContext,
                                        StorageLocationContext storageContext, IdentifierContext identifierContext,
                                        boolean indexed) {
        TypeName typeName = v.child(owner, typeContext, TypeName.class);
        Identifier identifier = v.optional(identifierContext, Identifier.class);
        StorageLocation storage = storageLocation(v, storageContext);
        StateMutability mutability = resolveMutability(v, owner, List.of(), typeName);
        return new VariableDeclaration(
            v.range(owner),
            typeName,
            identifier == null ? null : identifier.name(),
            identifier,
            null,
            mutability,
            storage,
            false,
            false,
            indexed,
            false,
            null);
    }

    static StorageLocation storageLocation(LoweringVisitor v, StorageLocationContext ctx) {
        if (ctx == null) {
            return StorageLocation.DEFAULT;
        }
        return switch (ctx.getText()) {
            case "memory" -> StorageLocation.MEMORY;
            case "storage" -> StorageLocation.STORAGE;
            case "calldata" -> StorageLocation.CALLDATA;
            default -> throw v.malformed(ctx, "Unknown storage location '" + ctx.getText() + "'");
        };
    }

    static StateMutability mutabilityKeyword(LoweringVisitor v, StateMutabilityContext ctx) {
        if (ctx.PureKeyword() != null) {
            return StateMutability.PURE;
        } else if (ctx.ViewKeyword() != null) {
            return StateMutability.VIEW;
        } else if (ctx.PayableKeyword() != null) {
            return StateMutability.PAYABLE;
        } else if (ctx.ConstantKeyword() != null) {
            return StateMutability.CONSTANT;
        }
        throw v.malformed(ctx, "Unknown state mutability '" + ctx.getText() + "'");
    }

    static StateMutability resolveMutability(LoweringVisitor v, ParserRuleContext ctx,
                                             List<StateMutability> declared, TypeName typeName) {
        AttributeResolver.Resolution<StateMutability> resolution =
            AttributeResolver.mutability(declared, AttributeResolver.isPayableType(typeName));
        if (resolution.conflicting()) {
            v.ambiguous(ctx, "Conflicting state mutability keywords " + keywords(declared)
                + ", resolved to " + resolution.value().keyword());
        }
        return resolution.value();
    }

    static Visibility resolveVisibility(LoweringVisitor v, ParserRuleContext ctx,
                                        List<Visibility> declared, DeclarationKind kind) {
        AttributeResolver.Resolution<Visibility> resolution =
            AttributeResolver.visibility(declared, VisibilityTable.defaultFor(kind, v.enclosingKind()));
        if (resolution.conflicting()) {
            v.ambiguous(ctx, "Conflicting visibility keywords " + keywords(declared)
                + ", resolved to " + resolution.value().keyword());
        }
        return resolution.value();
    }

    private static List<UserDefinedTypeName> override(LoweringVisitor v, OverrideSpecifierContext ctx,
                                                      List<UserDefinedTypeName> previous) {
        List<UserDefinedTypeName> override = v.list(ctx, UserDefinedTypeName.class);
        if (previous != null) {
            v.ambiguous(ctx, "Duplicate override specifier");
            return previous;
        }
        return override;
    }

    private static List<String> keywords(List<? extends com.solparser.ast.Keyword> values) {
        List<String> keywords = new ArrayList<>(values.size());
        for (com.solparser.ast.Keyword value : values) {
            keywords.add(value.keyword());
        }
        return keywords;
    }
}
