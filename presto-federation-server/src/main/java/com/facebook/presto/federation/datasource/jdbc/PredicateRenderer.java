/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.facebook.presto.federation.datasource.jdbc;

import com.facebook.presto.federation.protocol.BetweenPredicate;
import com.facebook.presto.federation.protocol.BoolExpressionPredicate;
import com.facebook.presto.federation.protocol.ColumnExpression;
import com.facebook.presto.federation.protocol.ComparisonPredicate;
import com.facebook.presto.federation.protocol.ConjunctionPredicate;
import com.facebook.presto.federation.protocol.DisjunctionPredicate;
import com.facebook.presto.federation.protocol.Expression;
import com.facebook.presto.federation.protocol.ExpressionVisitor;
import com.facebook.presto.federation.protocol.InPredicate;
import com.facebook.presto.federation.protocol.IsNotNullPredicate;
import com.facebook.presto.federation.protocol.IsNullPredicate;
import com.facebook.presto.federation.protocol.NegationPredicate;
import com.facebook.presto.federation.protocol.NullExpression;
import com.facebook.presto.federation.protocol.Predicate;
import com.facebook.presto.federation.protocol.PredicateVisitor;
import com.facebook.presto.federation.protocol.RegexpPredicate;
import com.facebook.presto.federation.protocol.ValueExpression;
import com.google.common.collect.ImmutableList;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.lang.String.join;
import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * Renders predicates into SQL for one dialect, binding literal values as statement arguments.
 * <p>
 * The operands of a top level conjunction are rendered independently: an operand the dialect cannot express
 * is left out and reported, and the rest still narrows the scan. Anywhere else a single unsupported part
 * makes the enclosing predicate unsupported.
 */
public class PredicateRenderer
        implements PredicateVisitor<String>, ExpressionVisitor<String>
{
    private final SqlDialect dialect;
    private final List<Object> arguments = new ArrayList<>();

    private PredicateRenderer(SqlDialect dialect)
    {
        this.dialect = requireNonNull(dialect, "dialect is null");
    }

    public static RenderedPredicate render(SqlDialect dialect, Predicate predicate)
    {
        PredicateRenderer renderer = new PredicateRenderer(dialect);
        List<Predicate> operands = predicate instanceof ConjunctionPredicate
                ? ((ConjunctionPredicate) predicate).getOperands()
                : ImmutableList.of(predicate);

        List<String> rendered = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Predicate operand : operands) {
            int argumentCount = renderer.arguments.size();
            try {
                rendered.add(operand.accept(renderer));
            }
            catch (UnsupportedPredicateException e) {
                renderer.arguments.subList(argumentCount, renderer.arguments.size()).clear();
                errors.add(e.getMessage());
            }
        }

        Optional<String> clause;
        if (rendered.isEmpty()) {
            clause = Optional.empty();
        }
        else if (rendered.size() == 1) {
            clause = Optional.of(rendered.get(0));
        }
        else {
            clause = Optional.of("(" + join(" AND ", rendered) + ")");
        }
        return new RenderedPredicate(clause, renderer.arguments, errors);
    }

    @Override
    public String visitComparison(ComparisonPredicate predicate)
    {
        String left = predicate.getLeft().accept(this);
        String right = predicate.getRight().accept(this);
        return format("(%s %s %s)", left, predicate.getOperator().getSymbol(), right);
    }

    @Override
    public String visitConjunction(ConjunctionPredicate predicate)
    {
        return junction(predicate.getOperands(), " AND ");
    }

    @Override
    public String visitDisjunction(DisjunctionPredicate predicate)
    {
        return junction(predicate.getOperands(), " OR ");
    }

    @Override
    public String visitNegation(NegationPredicate predicate)
    {
        return format("(NOT %s)", predicate.getOperand().accept(this));
    }

    @Override
    public String visitIsNull(IsNullPredicate predicate)
    {
        return format("(%s IS NULL)", predicate.getValue().accept(this));
    }

    @Override
    public String visitIsNotNull(IsNotNullPredicate predicate)
    {
        return format("(%s IS NOT NULL)", predicate.getValue().accept(this));
    }

    @Override
    public String visitIn(InPredicate predicate)
    {
        if (predicate.getSet().isEmpty()) {
            throw new UnsupportedPredicateException("IN with an empty set");
        }
        String value = predicate.getValue().accept(this);
        List<String> set = new ArrayList<>();
        for (Expression expression : predicate.getSet()) {
            set.add(expression.accept(this));
        }
        return format("(%s IN (%s))", value, join(", ", set));
    }

    @Override
    public String visitBetween(BetweenPredicate predicate)
    {
        String value = predicate.getValue().accept(this);
        String least = predicate.getLeast().accept(this);
        String greatest = predicate.getGreatest().accept(this);
        return format("(%s BETWEEN %s AND %s)", value, least, greatest);
    }

    @Override
    public String visitBoolExpression(BoolExpressionPredicate predicate)
    {
        if (!(predicate.getValue() instanceof ColumnExpression)) {
            throw new UnsupportedPredicateException("boolean expression over " + predicate.getValue());
        }
        return predicate.getValue().accept(this);
    }

    @Override
    public String visitRegexp(RegexpPredicate predicate)
    {
        String value = predicate.getValue().accept(this);
        String pattern = predicate.getPattern().accept(this);
        return dialect.renderRegexp(value, pattern)
                .orElseThrow(() -> new UnsupportedPredicateException("regular expression match"));
    }

    @Override
    public String visitColumn(ColumnExpression expression)
    {
        return dialect.quoteIdentifier(expression.getName());
    }

    @Override
    public String visitValue(ValueExpression expression)
    {
        arguments.add(toJdbcValue(expression));
        return "?";
    }

    @Override
    public String visitNull(NullExpression expression)
    {
        return "NULL";
    }

    private String junction(List<Predicate> operands, String operator)
    {
        if (operands.isEmpty()) {
            throw new UnsupportedPredicateException("empty operand list of " + operator.trim());
        }
        List<String> rendered = new ArrayList<>();
        for (Predicate operand : operands) {
            rendered.add(operand.accept(this));
        }
        if (rendered.size() == 1) {
            return rendered.get(0);
        }
        return "(" + join(operator, rendered) + ")";
    }

    private static Object toJdbcValue(ValueExpression expression)
    {
        Object value = expression.getValue();
        if (value == null) {
            throw new UnsupportedPredicateException("untyped null literal");
        }
        switch (expression.getType()) {
            case BOOL:
                return value instanceof Boolean ? value : ((Number) value).longValue() != 0;
            case INT8:
            case INT16:
            case INT32:
            case UINT8:
            case UINT16:
                return ((Number) value).intValue();
            case INT64:
            case UINT32:
            case UINT64:
                return ((Number) value).longValue();
            case FLOAT:
                return ((Number) value).floatValue();
            case DOUBLE:
                return ((Number) value).doubleValue();
            case STRING:
            case UTF8:
            case JSON:
                return String.valueOf(value);
            case DATE:
                return LocalDate.ofEpochDay(((Number) value).longValue());
            case DATETIME:
                return LocalDateTime.ofEpochSecond(((Number) value).longValue(), 0, UTC);
            case TIMESTAMP:
                long micros = ((Number) value).longValue();
                return LocalDateTime.ofEpochSecond(Math.floorDiv(micros, 1_000_000), (int) Math.floorMod(micros, 1_000_000) * 1_000, UTC);
            default:
                throw new UnsupportedPredicateException("literal of type " + expression.getType());
        }
    }

    private static class UnsupportedPredicateException
            extends RuntimeException
    {
        UnsupportedPredicateException(String what)
        {
            super("unsupported predicate: " + what);
        }
    }
}
