package io.stencil.core.render;

import io.stencil.core.context.ContextResolver;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.context.ContextValues;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.error.ErrorSink;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.logging.Logger;

/// Evaluates the expression of an `{% if %}` tag to a boolean.
///
/// ### Grammar
/// `LEFT OP RIGHT` or a bare `PATH`, where `OP` is the first {@link ComparisonOperator}
/// (in declaration order) found anywhere in the expression.
/// - `LEFT` is always a context path.
/// - `RIGHT` is, in order of preference: a quoted string literal, a number, `true`/`false`,
///   a context path that resolves, or else the literal text itself.
/// - A bare path is tested for truthiness: null, `false`, zero, empty strings, empty
///   sequences and empty mappings are false.
///
/// ### Comparison
/// Two numeric operands (numbers or numeric strings) compare numerically. Otherwise `==` and
/// `!=` compare display forms (structured values compare structurally), and ordering
/// operators compare two strings lexicographically. Ordering anything else is a type mismatch:
/// it evaluates to false and a recoverable `TYPE` diagnostic is reported.
///
/// A condition that cannot be evaluated is false. Evaluation never throws, in strict mode
/// too.
///
/// @implNote The operator scan does not skip quoted text, so a literal such as `'a>b'` on the
/// right-hand side splits at its `>`.
public final class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    private final ErrorSink errors;

    /// Creates an evaluator reporting type mismatches to the given sink.
    ///
    /// @param errors diagnostic sink, not null
    public ConditionEvaluator(ErrorSink errors) {
        this.errors = errors;
    }

    /// Evaluates an expression against a context.
    ///
    /// @param expression condition text, not null
    /// @param context scope to resolve paths in, not null
    /// @param position template offset of the conditional, for diagnostics
    /// @return whether the condition holds
    public boolean evaluate(String expression, ContextValue context, int position) {
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            int index = expression.indexOf(operator.symbol());
            if (index < 0) {
                continue;
            }
            String left = expression.substring(0, index).trim();
            String right = expression.substring(index + operator.symbol().length()).trim();

            Optional<ContextValue> leftValue = ContextResolver.resolve(context, left);
            if (leftValue.isEmpty()) {
                logger.fine(() -> "Condition operand not found: " + left);
                return false;
            }
            ContextValue rightValue = parseOperand(right, context);
            return compare(operator, leftValue.get(), rightValue, expression, position);
        }

        return ContextResolver.resolve(context, expression.trim())
                .map(ConditionEvaluator::isTruthy)
                .orElse(false);
    }

    /// Returns whether a value counts as true in a bare condition.
    ///
    /// @param value the value, not null
    /// @return truthiness
    public static boolean isTruthy(ContextValue value) {
        if (value instanceof Scalar scalar) {
            Object raw = scalar.value();
            if (raw == null) {
                return false;
            }
            if (raw instanceof Boolean b) {
                return b;
            }
            if (raw instanceof Number number) {
                double d = number.doubleValue();
                return d != 0 && !Double.isNaN(d);
            }
            return !((String) raw).isEmpty();
        }
        return !value.isEmpty();
    }

    private ContextValue parseOperand(String text, ContextValue context) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return Scalar.of(text.substring(1, text.length() - 1));
            }
        }
        if (ContextValues.parseNumber(text).isPresent()) {
            return Scalar.of(new BigDecimal(text));
        }
        if ("true".equals(text)) {
            return Scalar.TRUE;
        }
        if ("false".equals(text)) {
            return Scalar.FALSE;
        }
        return ContextResolver.resolve(context, text).orElseGet(() -> Scalar.of(text));
    }

    private boolean compare(
            ComparisonOperator operator,
            ContextValue left,
            ContextValue right,
            String expression,
            int position) {
        if (left instanceof Scalar l && right instanceof Scalar r) {
            Optional<Double> ln = l.asDouble();
            Optional<Double> rn = r.asDouble();
            if (ln.isPresent() && rn.isPresent()) {
                Optional<BigDecimal> ld = decimal(l);
                Optional<BigDecimal> rd = decimal(r);
                if (ld.isPresent() && rd.isPresent()) {
                    return operator.matches(ld.get().compareTo(rd.get()));
                }
                return operator.matches(Double.compare(ln.get(), rn.get()));
            }
            if (!operator.isOrdering()) {
                boolean equal =
                        l.isNull() || r.isNull()
                                ? l.isNull() && r.isNull()
                                : l.asText().equals(r.asText());
                return operator == ComparisonOperator.EQ ? equal : !equal;
            }
            if (l.isString() && r.isString()) {
                return operator.matches(((String) l.value()).compareTo((String) r.value()));
            }
        } else if (!operator.isOrdering()) {
            boolean equal = left.equals(right);
            return operator == ComparisonOperator.EQ ? equal : !equal;
        }

        errors.add(
                ErrorRecord.recoverable(
                        ErrorKind.TYPE,
                        "Cannot compare operands of '" + expression + "' with " + operator.symbol(),
                        null,
                        position));
        return false;
    }

    /// Exact decimal view of a numeric scalar, so that `0` equals `-0` and longs beyond
    /// double precision stay distinct. Empty for NaN and infinities.
    private static Optional<BigDecimal> decimal(Scalar scalar) {
        Object value = scalar.value();
        if (value instanceof BigDecimal d) {
            return Optional.of(d);
        }
        if (value instanceof BigInteger i) {
            return Optional.of(new BigDecimal(i));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(BigDecimal.valueOf(number.longValue()));
        }
        if (value instanceof String s && ContextValues.parseNumber(s).isPresent()) {
            return Optional.of(new BigDecimal(s.trim()));
        }
        return Optional.empty();
    }
}
