package com.solparser.lower;

import com.solparser.ast.ElementaryTypeName;
import com.solparser.ast.StateMutability;
import com.solparser.ast.TypeName;
import com.solparser.ast.Visibility;

import java.util.List;

/**
 * Resolves declaration attributes from the keywords written in a declaration.
 *
 * <p>Mutability priority is {@code constant > payable > view > pure}; no candidate means
 * {@link StateMutability#DEFAULT}. A {@code payable} in type position ({@code address payable})
 * is a candidate but not a declared keyword, so it never makes a declaration conflicting.</p>
 *
 * <p>Visibility priority for conflicting keywords is
 * {@code external > internal > public > private}.</p>
 */
public final class AttributeResolver {

    static final List<StateMutability> MUTABILITY_PRIORITY = List.of(
        StateMutability.CONSTANT,
        StateMutability.PAYABLE,
        StateMutability.VIEW,
        StateMutability.PURE);

    static final List<Visibility> VISIBILITY_PRIORITY = List.of(
        Visibility.EXTERNAL,
        Visibility.INTERNAL,
        Visibility.PUBLIC,
        Visibility.PRIVATE);

    private AttributeResolver() {
    }

    /**
     * @param value       the resolved attribute
     * @param conflicting whether more than one keyword was written
     */
    public record Resolution<T>(T value, boolean conflicting) {
    }

    public static Resolution<StateMutability> mutability(List<StateMutability> declared, boolean payableType) {
        for (StateMutability candidate : MUTABILITY_PRIORITY) {
            if (declared.contains(candidate) || (payableType && candidate == StateMutability.PAYABLE)) {
                return new Resolution<>(candidate, declared.size() > 1);
            }
        }
        return new Resolution<>(StateMutability.DEFAULT, declared.size() > 1);
    }

    public static Resolution<Visibility> visibility(List<Visibility> declared, Visibility fallback) {
        for (Visibility candidate : VISIBILITY_PRIORITY) {
            if (declared.contains(candidate)) {
                return new Resolution<>(candidate, declared.size() > 1);
            }
        }
        return new Resolution<>(fallback, false);
    }

    /**
     * Whether a declaration's type is {@code address payable}.
     */
    public static boolean isPayableType(TypeName typeName) {
        return typeName instanceof ElementaryTypeName elementary
            && elementary.stateMutability() == StateMutability.PAYABLE;
    }
}
