package nl.bytesoflife.fedoralicense.expression;

import java.util.Objects;

/**
 * Expression tree of a Fedora license string. Both license string formats
 * produce this same shape; chains of one operator lean to the right.
 */
public sealed interface LicenseExpression
        permits LicenseExpression.Identifier, LicenseExpression.And, LicenseExpression.Or {

    record Identifier(String token) implements LicenseExpression {
        public Identifier {
            Objects.requireNonNull(token, "token");
            if (token.isEmpty()) {
                throw new IllegalArgumentException("License identifier must not be empty");
            }
        }

        @Override
        public String toString() {
            return token;
        }
    }

    record And(LicenseExpression left, LicenseExpression right) implements LicenseExpression {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "AND(" + left + ", " + right + ")";
        }
    }

    record Or(LicenseExpression left, LicenseExpression right) implements LicenseExpression {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "OR(" + left + ", " + right + ")";
        }
    }
}
