package com.chemked.data.quantity;

import com.chemked.data.quantity.grammar.UnitExpressionBaseVisitor;
import com.chemked.data.quantity.grammar.UnitExpressionLexer;
import com.chemked.data.quantity.grammar.UnitExpressionParser;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import javax.measure.Unit;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import tech.units.indriya.AbstractUnit;
import tech.units.indriya.function.MultiplyConverter;

/**
 * Turns unit expressions such as {@code cm**3}, {@code 1/ms}, {@code kg m^-3} or {@code 1.0 / second}
 * into {@link Unit} instances. Parsed expressions are cached; the cache only ever holds immutable
 * units.
 */
public final class UnitParser {

    private static final Map<String, Unit<?>> CACHE = new ConcurrentHashMap<>();

    private UnitParser() {}

    /**
     * Parse a unit expression. A blank expression is the dimensionless unit.
     *
     * @throws UnitFormatException if the expression is malformed or names an unknown unit
     */
    public static Unit<?> parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            return AbstractUnit.ONE;
        }
        Unit<?> cached = CACHE.get(trimmed);
        if (cached != null) {
            return cached;
        }
        Unit<?> unit = parseUncached(trimmed);
        CACHE.put(trimmed, unit);
        return unit;
    }

    private static Unit<?> parseUncached(String expression) {
        ThrowingErrorListener listener = new ThrowingErrorListener(expression);
        UnitExpressionLexer lexer = new UnitExpressionLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        UnitExpressionParser parser = new UnitExpressionParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        UnitExpressionParser.UnitExpressionContext context = parser.unitExpression();
        return new UnitBuildingVisitor(expression).visit(context.product());
    }

    private static final class UnitBuildingVisitor extends UnitExpressionBaseVisitor<Unit<?>> {
        private final String expression;

        UnitBuildingVisitor(String expression) {
            this.expression = expression;
        }

        @Override
        public Unit<?> visitProduct(UnitExpressionParser.ProductContext ctx) {
            Unit<?> result = visit(ctx.factor());
            for (UnitExpressionParser.ProductTailContext tail : ctx.productTail()) {
                if (tail instanceof UnitExpressionParser.DivideTailContext divide) {
                    result = result.divide(visit(divide.factor()));
                } else if (tail instanceof UnitExpressionParser.MultiplyTailContext multiply) {
                    result = result.multiply(visit(multiply.factor()));
                } else if (tail instanceof UnitExpressionParser.JuxtaposeTailContext juxtapose) {
                    result = result.multiply(visit(juxtapose.factor()));
                }
            }
            return result;
        }

        @Override
        public Unit<?> visitFactor(UnitExpressionParser.FactorContext ctx) {
            Unit<?> base = visit(ctx.atom());
            if (ctx.exponent() == null) {
                return base;
            }
            return power(base, exponent(ctx.exponent()));
        }

        @Override
        public Unit<?> visitNamedUnit(UnitExpressionParser.NamedUnitContext ctx) {
            String name = ctx.IDENTIFIER().getText();
            Unit<?> unit =
                    UnitRegistry.lookup(name)
                            .orElseThrow(
                                    () ->
                                            new UnitFormatException(
                                                    expression,
                                                    "Unknown unit '" + name + "' in '" + expression + "'"));
            if (ctx.INTEGER() != null) {
                // "cm3" is shorthand for cm**3
                unit = power(unit, Integer.parseInt(ctx.INTEGER().getText()));
            }
            return unit;
        }

        @Override
        public Unit<?> visitScaleFactor(UnitExpressionParser.ScaleFactorContext ctx) {
            double factor = Double.parseDouble(ctx.getText());
            if (factor == 1.0) {
                return AbstractUnit.ONE;
            }
            if (factor == 0.0) {
                throw new UnitFormatException(expression, "Zero scale factor in '" + expression + "'");
            }
            return AbstractUnit.ONE.transform(MultiplyConverter.of(factor));
        }

        @Override
        public Unit<?> visitGroupedUnit(UnitExpressionParser.GroupedUnitContext ctx) {
            return visit(ctx.product());
        }

        private static int exponent(UnitExpressionParser.ExponentContext ctx) {
            int value = Integer.parseInt(ctx.INTEGER().getText());
            if (ctx.sign != null && ctx.sign.getType() == UnitExpressionParser.MINUS) {
                return -value;
            }
            return value;
        }

        private static Unit<?> power(Unit<?> unit, int exponent) {
            if (exponent == 0) {
                return AbstractUnit.ONE;
            }
            if (exponent < 0) {
                return unit.pow(-exponent).inverse();
            }
            return unit.pow(exponent);
        }
    }
}
