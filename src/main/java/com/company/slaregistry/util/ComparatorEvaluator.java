package com.company.slaregistry.util;

import com.company.slaregistry.domain.enums.ComparatorKind;

public class ComparatorEvaluator {

    /**
     * Judge an observed value against an SLA target.
     *
     * @param observed Reported metric value
     * @param target SLA target value
     * @param kind How the observed value is compared with the target
     * @return true when the observation satisfies the rule
     */
    public static boolean evaluate(long observed, long target, ComparatorKind kind) {
        switch (kind) {
            case LT:
                return observed < target;
            case LE:
                return observed <= target;
            case EQ:
                return observed == target;
            case NE:
                return observed != target;
            case GE:
                return observed >= target;
            case GT:
                return observed > target;
            default:
                throw new IllegalStateException("Unhandled comparator " + kind);
        }
    }

    /**
     * Render the rule as text for logs, e.g. "36 <= 24"
     */
    public static String describe(long observed, long target, ComparatorKind kind) {
        return String.format("%d %s %d", observed, kind.getSymbol(), target);
    }
}
