package com.solparser.lower;

import com.solparser.ast.StateMutability;
import com.solparser.ast.Visibility;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AttributeResolverTest {

    private static final List<StateMutability> KEYWORDS = List.of(
        StateMutability.PURE, StateMutability.VIEW, StateMutability.PAYABLE, StateMutability.CONSTANT);

    @Test
    void testMutabilityOverEveryKeywordSubset() throws Exception {
        int checked = 0;
        for (int mask = 0; mask < (1 << KEYWORDS.size()); mask++) {
            List<StateMutability> declared = new ArrayList<>();
            for (int bit = 0; bit < KEYWORDS.size(); bit++) {
                if ((mask & (1 << bit)) != 0) {
                    declared.add(KEYWORDS.get(bit));
                }
            }
            for (boolean payableType : new boolean[]{false, true}) {
                AttributeResolver.Resolution<StateMutability> resolution =
                    AttributeResolver.mutability(declared, payableType);
                assertEquals(expected(declared, payableType), resolution.value(), declared + " payableType=" + payableType);
                assertEquals(declared.size() > 1, resolution.conflicting(), declared + " payableType=" + payableType);
                checked++;
            }
        }
        assertEquals(32, checked);
        System.out.println("✓ Mutability resolved for all " + checked + " combinations");
    }

    private static StateMutability expected(List<StateMutability> declared, boolean payableType) {
        if (declared.contains(StateMutability.CONSTANT)) {
            return StateMutability.CONSTANT;
        }
        if (declared.contains(StateMutability.PAYABLE) || payableType) {
            return StateMutability.PAYABLE;
        }
        if (declared.contains(StateMutability.VIEW)) {
            return StateMutability.VIEW;
        }
        if (declared.contains(StateMutability.PURE)) {
            return StateMutability.PURE;
        }
        return StateMutability.DEFAULT;
    }

    @Test
    void testPayableTypeAloneIsNotAConflict() throws Exception {
        AttributeResolver.Resolution<StateMutability> resolution =
            AttributeResolver.mutability(List.of(StateMutability.PAYABLE), true);
        assertEquals(StateMutability.PAYABLE, resolution.value());
        assertFalse(resolution.conflicting());
    }

    @Test
    void testVisibility() throws Exception {
        assertEquals(Visibility.INTERNAL, AttributeResolver.visibility(List.of(), Visibility.INTERNAL).value());
        assertFalse(AttributeResolver.visibility(List.of(), Visibility.INTERNAL).conflicting());

        AttributeResolver.Resolution<Visibility> single = AttributeResolver.visibility(List.of(Visibility.PRIVATE), Visibility.PUBLIC);
        assertEquals(Visibility.PRIVATE, single.value());
        assertFalse(single.conflicting());

        AttributeResolver.Resolution<Visibility> conflict =
            AttributeResolver.visibility(List.of(Visibility.PRIVATE, Visibility.PUBLIC, Visibility.INTERNAL), Visibility.PUBLIC);
        assertEquals(Visibility.INTERNAL, conflict.value());
        assertTrue(conflict.conflicting());

        assertEquals(Visibility.EXTERNAL,
            AttributeResolver.visibility(List.of(Visibility.PUBLIC, Visibility.EXTERNAL), Visibility.PUBLIC).value());
    }
}
