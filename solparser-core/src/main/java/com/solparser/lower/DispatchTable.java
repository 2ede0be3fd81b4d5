package com.solparser.lower;

import com.solparser.InvalidInputException;
import com.solparser.grammar.SolidityParser;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.List;

import static com.solparser.grammar.SolidityParser.*;

/**
 * Maps every grammar rule to the way its contexts are lowered.
 *
 * <p>A table is immutable once built and may be shared between visitors. {@link Builder#build()}
 * refuses a table that leaves any rule of the grammar without an entry.</p>
 */
public final class DispatchTable {

    public enum EntryKind {
        /** Lowered by a registered handler. */
        LOWERED,
        /** Lowered by forwarding to its single rule child. */
        PASS_THROUGH,
        /** Read by the handler of its parent and never dispatched on its own. */
        FRAGMENT
    }

    public record Entry(
        int ruleIndex,
        String ruleName,
        EntryKind kind,
        Class<? extends ParserRuleContext> contextType,
        RuleHandler<ParserRuleContext> handler
    ) {
    }

    private final String[] ruleNames;
    private final Entry[] entries;

    private DispatchTable(String[] ruleNames, Entry[] entries) {
        this.ruleNames = ruleNames;
        this.entries = entries;
    }

    /**
     * Returns the entry for a context that may be dispatched.
     *
     * @throws InvalidInputException if the rule has no entry, is a fragment, or the context is
     *                               not of the class registered for the rule
     */
    public Entry lookup(ParserRuleContext ctx) {
        int index = ctx.getRuleIndex();
        Entry entry = entry(index);
        if (entry == null) {
            throw new InvalidInputException("No lowering registered for rule '" + ruleName(index) + "'");
        }
        if (entry.kind() == EntryKind.FRAGMENT) {
            throw new InvalidInputException("Rule '" + entry.ruleName() + "' is lowered by its parent and cannot be dispatched");
        }
        if (!entry.contextType().isInstance(ctx)) {
            throw new InvalidInputException("Rule '" + entry.ruleName() + "' expects " + entry.contextType().getSimpleName()
                + " but was given " + ctx.getClass().getSimpleName());
        }
        return entry;
    }

    public Entry entry(int ruleIndex) {
        return ruleIndex >= 0 && ruleIndex < entries.length ? entries[ruleIndex] : null;
    }

    public String ruleName(int ruleIndex) {
        return ruleIndex >= 0 && ruleIndex < ruleNames.length ? ruleNames[ruleIndex] : "<rule " + ruleIndex + ">";
    }

    public int size() {
        int count = 0;
        for (Entry entry : entries) {
            if (entry != null) {
                count++;
            }
        }
        return count;
    }

    public static Builder builder(String[] ruleNames) {
        return new Builder(ruleNames);
    }

    /**
     * Builds the table for the Solidity grammar.
     */
    public static DispatchTable standard() {
        return builder(SolidityParser.ruleNames)
            // declarations
            .lower(RULE_sourceUnit, SourceUnitContext.class, DeclarationLowering::sourceUnit)
            .lower(RULE_pragmaDirective, PragmaDirectiveContext.class, DeclarationLowering::pragmaDirective)
            .lower(RULE_importDirective, ImportDirectiveContext.class, DeclarationLowering::importDirective)
            .lower(RULE_contractDefinition, ContractDefinitionContext.class, DeclarationLowering::contractDefinition)
            .lower(RULE_inheritanceSpecifier, InheritanceSpecifierContext.class, DeclarationLowering::inheritanceSpecifier)
            .lower(RULE_stateVariableDeclaration, StateVariableDeclarationContext.class, DeclarationLowering::stateVariableDeclaration)
            .lower(RULE_fileLevelConstant, FileLevelConstantContext.class, DeclarationLowering::fileLevelConstant)
            .lower(RULE_customErrorDefinition, CustomErrorDefinitionContext.class, DeclarationLowering::customErrorDefinition)
            .lower(RULE_typeDefinition, TypeDefinitionContext.class, DeclarationLowering::typeDefinition)
            .lower(RULE_usingForDeclaration, UsingForDeclarationContext.class, DeclarationLowering::usingForDeclaration)
            .lower(RULE_structDefinition, StructDefinitionContext.class, DeclarationLowering::structDefinition)
            .lower(RULE_modifierDefinition, ModifierDefinitionContext.class, DeclarationLowering::modifierDefinition)
            .lower(RULE_modifierInvocation, ModifierInvocationContext.class, DeclarationLowering::modifierInvocation)
            .lower(RULE_functionDefinition, FunctionDefinitionContext.class, DeclarationLowering::functionDefinition)
            .lower(RULE_returnParameters, ReturnParametersContext.class, DeclarationLowering::returnParameters)
            .lower(RULE_eventDefinition, EventDefinitionContext.class, DeclarationLowering::eventDefinition)
            .lower(RULE_enumValue, EnumValueContext.class, DeclarationLowering::enumValue)
            .lower(RULE_enumDefinition, EnumDefinitionContext.class, DeclarationLowering::enumDefinition)
            .lower(RULE_parameterList, ParameterListContext.class, DeclarationLowering::parameterList)
            .lower(RULE_parameter, ParameterContext.class, DeclarationLowering::parameter)
            .lower(RULE_eventParameterList, EventParameterListContext.class, DeclarationLowering::eventParameterList)
            .lower(RULE_eventParameter, EventParameterContext.class, DeclarationLowering::eventParameter)
            .lower(RULE_variableDeclaration, VariableDeclarationContext.class, DeclarationLowering::variableDeclaration)
            .lower(RULE_overrideSpecifier, OverrideSpecifierContext.class, DeclarationLowering::overrideSpecifier)
            .lower(RULE_identifier, IdentifierContext.class, DeclarationLowering::identifier)
            .passThrough(RULE_contractPart)
            .fragment(RULE_pragmaName, RULE_pragmaValue, RULE_version, RULE_versionOperator, RULE_versionConstraint,
                RULE_importDeclaration, RULE_importPath, RULE_usingForObject, RULE_usingForObjectDirective,
                RULE_userDefinableOperators, RULE_functionDescriptor, RULE_modifierList)
            // type names
            .lower(RULE_typeName, TypeNameContext.class, TypeNameLowering::typeName)
            .lower(RULE_elementaryTypeName, ElementaryTypeNameContext.class, TypeNameLowering::elementaryTypeName)
            .lower(RULE_userDefinedTypeName, UserDefinedTypeNameContext.class, TypeNameLowering::userDefinedTypeName)
            .lower(RULE_mapping, MappingContext.class, TypeNameLowering::mapping)
            .lower(RULE_functionTypeName, FunctionTypeNameContext.class, TypeNameLowering::functionTypeName)
            .lower(RULE_functionTypeParameterList, FunctionTypeParameterListContext.class, TypeNameLowering::functionTypeParameterList)
            .lower(RULE_functionTypeParameter, FunctionTypeParameterContext.class, TypeNameLowering::functionTypeParameter)
            .passThrough(RULE_mappingKey)
            .fragment(RULE_mappingKeyName, RULE_mappingValueName, RULE_storageLocation, RULE_stateMutability)
            // statements
            .lower(RULE_block, BlockContext.class, StatementLowering::block)
            .lower(RULE_expressionStatement, ExpressionStatementContext.class, StatementLowering::expressionStatement)
            .lower(RULE_ifStatement, IfStatementContext.class, StatementLowering::ifStatement)
            .lower(RULE_tryStatement, TryStatementContext.class, StatementLowering::tryStatement)
            .lower(RULE_catchClause, CatchClauseContext.class, StatementLowering::catchClause)
            .lower(RULE_whileStatement, WhileStatementContext.class, StatementLowering::whileStatement)
            .lower(RULE_uncheckedStatement, UncheckedStatementContext.class, StatementLowering::uncheckedStatement)
            .lower(RULE_forStatement, ForStatementContext.class, StatementLowering::forStatement)
            .lower(RULE_inlineAssemblyStatement, InlineAssemblyStatementContext.class, StatementLowering::inlineAssemblyStatement)
            .lower(RULE_doWhileStatement, DoWhileStatementContext.class, StatementLowering::doWhileStatement)
            .lower(RULE_continueStatement, ContinueStatementContext.class, StatementLowering::continueStatement)
            .lower(RULE_breakStatement, BreakStatementContext.class, StatementLowering::breakStatement)
            .lower(RULE_returnStatement, ReturnStatementContext.class, StatementLowering::returnStatement)
            .lower(RULE_throwStatement, ThrowStatementContext.class, StatementLowering::throwStatement)
            .lower(RULE_emitStatement, EmitStatementContext.class, StatementLowering::emitStatement)
            .lower(RULE_revertStatement, RevertStatementContext.class, StatementLowering::revertStatement)
            .lower(RULE_variableDeclarationStatement, VariableDeclarationStatementContext.class, StatementLowering::variableDeclarationStatement)
            .lower(RULE_variableDeclarationList, VariableDeclarationListContext.class, StatementLowering::variableDeclarationList)
            .lower(RULE_identifierList, IdentifierListContext.class, StatementLowering::identifierList)
            .passThrough(RULE_statement, RULE_simpleStatement)
            .fragment(RULE_inlineAssemblyStatementFlag)
            // expressions
            .lower(RULE_expression, ExpressionContext.class, ExpressionLowering::expression)
            .lower(RULE_primaryExpression, PrimaryExpressionContext.class, ExpressionLowering::primaryExpression)
            .lower(RULE_expressionList, ExpressionListContext.class, ExpressionLowering::expressionList)
            .lower(RULE_nameValueList, NameValueListContext.class, ExpressionLowering::nameValueList)
            .lower(RULE_functionCall, FunctionCallContext.class, ExpressionLowering::functionCall)
            .lower(RULE_tupleExpression, TupleExpressionContext.class, ExpressionLowering::tupleExpression)
            .lower(RULE_numberLiteral, NumberLiteralContext.class, ExpressionLowering::numberLiteral)
            .lower(RULE_hexLiteral, HexLiteralContext.class, ExpressionLowering::hexLiteral)
            .lower(RULE_stringLiteral, StringLiteralContext.class, ExpressionLowering::stringLiteral)
            .fragment(RULE_nameValue, RULE_functionCallArguments)
            // inline assembly
            .lower(RULE_assemblyBlock, AssemblyBlockContext.class, AssemblyLowering::assemblyBlock)
            .lower(RULE_assemblyItem, AssemblyItemContext.class, AssemblyLowering::assemblyItem)
            .lower(RULE_assemblyMember, AssemblyMemberContext.class, AssemblyLowering::assemblyMember)
            .lower(RULE_assemblyCall, AssemblyCallContext.class, AssemblyLowering::assemblyCall)
            .lower(RULE_assemblyLocalDefinition, AssemblyLocalDefinitionContext.class, AssemblyLowering::assemblyLocalDefinition)
            .lower(RULE_assemblyAssignment, AssemblyAssignmentContext.class, AssemblyLowering::assemblyAssignment)
            .lower(RULE_assemblyIdentifierList, AssemblyIdentifierListContext.class, AssemblyLowering::assemblyIdentifierList)
            .lower(RULE_assemblyStackAssignment, AssemblyStackAssignmentContext.class, AssemblyLowering::assemblyStackAssignment)
            .lower(RULE_labelDefinition, LabelDefinitionContext.class, AssemblyLowering::labelDefinition)
            .lower(RULE_assemblySwitch, AssemblySwitchContext.class, AssemblyLowering::assemblySwitch)
            .lower(RULE_assemblyCase, AssemblyCaseContext.class, AssemblyLowering::assemblyCase)
            .lower(RULE_assemblyFunctionDefinition, AssemblyFunctionDefinitionContext.class, AssemblyLowering::assemblyFunctionDefinition)
            .lower(RULE_assemblyFor, AssemblyForContext.class, AssemblyLowering::assemblyFor)
            .lower(RULE_assemblyIf, AssemblyIfContext.class, AssemblyLowering::assemblyIf)
            .lower(RULE_assemblyLiteral, AssemblyLiteralContext.class, AssemblyLowering::assemblyLiteral)
            .passThrough(RULE_assemblyExpression)
            .fragment(RULE_assemblyIdentifierOrList, RULE_assemblyFunctionReturns)
            .build();
    }

    public static final class Builder {
        private final String[] ruleNames;
        private final Entry[] entries;

        private Builder(String[] ruleNames) {
            this.ruleNames = ruleNames.clone();
            this.entries = new Entry[ruleNames.length];
        }

        @SuppressWarnings("unchecked")
        public <C extends ParserRuleContext> Builder lower(int ruleIndex, Class<C> contextType, RuleHandler<? super C> handler) {
            RuleHandler<ParserRuleContext> checked = (visitor, ctx) -> ((RuleHandler<C>) handler).lower(visitor, contextType.cast(ctx));
            return put(new Entry(ruleIndex, name(ruleIndex), EntryKind.LOWERED, contextType, checked));
        }

        public Builder passThrough(int... ruleIndexes) {
            for (int ruleIndex : ruleIndexes) {
                put(new Entry(ruleIndex, name(ruleIndex), EntryKind.PASS_THROUGH, ParserRuleContext.class, null));
            }
            return this;
        }

        public Builder fragment(int... ruleIndexes) {
            for (int ruleIndex : ruleIndexes) {
                put(new Entry(ruleIndex, name(ruleIndex), EntryKind.FRAGMENT, ParserRuleContext.class, null));
            }
            return this;
        }

        private Builder put(Entry entry) {
            if (entries[entry.ruleIndex()] != null) {
                throw new IllegalStateException("Rule '" + entry.ruleName() + "' is registered twice");
            }
            entries[entry.ruleIndex()] = entry;
            return this;
        }

        private String name(int ruleIndex) {
            if (ruleIndex < 0 || ruleIndex >= ruleNames.length) {
                throw new IllegalArgumentException("Unknown rule index " + ruleIndex);
            }
            return ruleNames[ruleIndex];
        }

        /**
         * @throws IllegalStateException if some rule has no entry
         */
        public DispatchTable build() {
            List<String> missing = new ArrayList<>();
            for (int i = 0; i < entries.length; i++) {
                if (entries[i] == null) {
                    missing.add(ruleNames[i]);
                }
            }
            if (!missing.isEmpty()) {
                throw new IllegalStateException("Dispatch table has no entry for rules " + missing);
            }
            return buildPartial();
        }

        DispatchTable buildPartial() {
            return new DispatchTable(ruleNames, entries.clone());
        }
    }
}
