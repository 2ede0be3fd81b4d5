package com.solparser.lower;

import com.solparser.ast.ArrayTypeName;
import com.solparser.ast.ElementaryTypeName;
import com.solparser.ast.Expression;
import com.solparser.ast.FunctionTypeName;
import com.solparser.ast.Identifier;
import com.solparser.ast.Mapping;
import com.solparser.ast.StateMutability;
import com.solparser.ast.TypeName;
import com.solparser.ast.UserDefinedTypeName;
import com.solparser.ast.VariableDeclaration;
import com.solparser.ast.Visibility;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.List;

import static com.solparser.grammar.SolidityParser.*;

final class TypeNameLowering {

    private TypeNameLowering() {
    }

    static TypeName typeName(LoweringVisitor v, TypeNameContext ctx) {
        if (ctx.typeName() != null) {
            TypeName base = v.lower(ctx.typeName(), TypeName.class);
            Expression length = v.optional(ctx.expression(), Expression.class);
            return new ArrayTypeName(v.range(ctx), base, length);
        }
        if (ctx.PayableKeyword() != null) {
            return new ElementaryTypeName(v.range(ctx), "address", StateMutability.PAYABLE);
        }
        ParserRuleContext only = Trees.onlyRuleChild(ctx);
        if (only == null) {
            throw v.malformed(ctx, "Unrecognized type name '" + ctx.getText() + "'");
        }
        return v.lower(only, TypeName.class);
    }

    static ElementaryTypeName elementaryTypeName(LoweringVisitor v, ElementaryTypeNameContext ctx) {
        return new ElementaryTypeName(v.range(ctx), ctx.getText(), StateMutability.DEFAULT);
    }

    static UserDefinedTypeName userDefinedTypeName(LoweringVisitor v, UserDefinedTypeNameContext ctx) {
        return new UserDefinedTypeName(v.range(ctx), ctx.getText());
    }

    static Mapping mapping(LoweringVisitor v, MappingContext ctx) {
        TypeName keyType = v.child(ctx, ctx.mappingKey(), TypeName.class);
        Identifier keyName = ctx.mappingKeyName() == null
            ? null
            : v.child(ctx.mappingKeyName(), ctx.mappingKeyName().identifier(), Identifier.class);
        TypeName valueType = v.child(ctx, ctx.typeName(), TypeName.class);
        Identifier valueName = ctx.mappingValueName() == null
            ? null
            : v.child(ctx.mappingValueName(), ctx.mappingValueName().identifier(), Identifier.class);
        return new Mapping(v.range(ctx), keyType, keyName, valueType, valueName);
    }

    static FunctionTypeName functionTypeName(LoweringVisitor v, FunctionTypeNameContext ctx) {
        List<FunctionTypeParameterListContext> lists = ctx.functionTypeParameterList();
        if (lists.isEmpty()) {
            throw v.malformed(ctx, "Missing parameter types in function type");
        }
        List<VariableDeclaration> parameterTypes = v.list(lists.get(0), VariableDeclaration.class);
        List<VariableDeclaration> returnTypes = lists.size() > 1
            ? v.list(lists.get(1), VariableDeclaration.class)
            : List.of();

        List<Visibility> visibilities = new ArrayList<>();
        List<StateMutability> mutabilities = new ArrayList<>();
        for (ParseTree child : Trees.children(ctx)) {
            if (Trees.isToken(child, InternalKeyword)) {
                visibilities.add(Visibility.INTERNAL);
            } else if (Trees.isToken(child, ExternalKeyword)) {
                visibilities.add(Visibility.EXTERNAL);
            } else if (child instanceof StateMutabilityContext mutability) {
                mutabilities.add(DeclarationLowering.mutabilityKeyword(v, mutability));
            }
        }
        StateMutability mutability = DeclarationLowering.resolveMutability(v, ctx, mutabilities, null);
        Visibility visibility = DeclarationLowering.resolveVisibility(v, ctx, visibilities, DeclarationKind.FUNCTION_TYPE);
        return new FunctionTypeName(v.range(ctx), parameterTypes, returnTypes, visibility, mutability);
    }

    static List<VariableDeclaration> functionTypeParameterList(LoweringVisitor v, FunctionTypeParameterListContext ctx) {
        return v.each(ctx.functionTypeParameter(), VariableDeclaration.class);
    }

    static VariableDeclaration functionTypeParameter(LoweringVisitor v, FunctionTypeParameterContext ctx) {
        return DeclarationLowering.variable(v, ctx, ctx.typeName(), ctx.storageLocation(), null, false);
    }
}
