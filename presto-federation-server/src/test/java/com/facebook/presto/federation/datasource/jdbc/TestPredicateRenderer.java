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
import com.facebook.presto.federation.protocol.InPredicate;
import com.facebook.presto.federation.protocol.IsNullPredicate;
import com.facebook.presto.federation.protocol.NegationPredicate;
import com.facebook.presto.federation.protocol.Predicate;
import com.facebook.presto.federation.protocol.PrimitiveTypeId;
import com.facebook.presto.federation.protocol.RegexpPredicate;
import com.facebook.presto.federation.protocol.ValueExpression;
import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.util.Optional;

import static com.facebook.presto.federation.protocol.ComparisonPredicate.Operator.EQUAL;
import static com.facebook.presto.federation.protocol.ComparisonPredicate.Operator.GREATER_THAN;
import static com.facebook.presto.federation.protocol.ComparisonPredicate.Operator.LESS_THAN_OR_EQUAL;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class TestPredicateRenderer
{
    private static final SqlDialect POSTGRESQL = new PostgreSqlDialect();
    private static final SqlDialect MYSQL = new MySqlDialect();

    @Test
    public void testComparison()
    {
        RenderedPredicate rendered = PredicateRenderer.render(POSTGRESQL, new ComparisonPredicate(GREATER_THAN, column("id"), int64(10)));

        assertEquals(rendered.getClause(), Optional.of("(\"id\" > ?)"));
        assertEquals(rendered.getArguments(), ImmutableList.of(10L));
        assertTrue(rendered.getErrors().isEmpty());
    }

    @Test
    public void testNestedPredicates()
    {
        Predicate predicate = new DisjunctionPredicate(ImmutableList.of(
                new NegationPredicate(new IsNullPredicate(column("name"))),
                new InPredicate(column("id"), ImmutableList.of(int64(1), int64(2))),
                new BetweenPredicate(column("day"), value(PrimitiveTypeId.DATE, 0), value(PrimitiveTypeId.DATE, 1))));

        RenderedPredicate rendered = PredicateRenderer.render(MYSQL, predicate);

        assertEquals(
                rendered.getClause().get(),
                "((NOT (`name` IS NULL)) OR (`id` IN (?, ?)) OR (`day` BETWEEN ? AND ?))");
        assertEquals(rendered.getArguments(), ImmutableList.of(1L, 2L, LocalDate.of(1970, 1, 1), LocalDate.of(1970, 1, 2)));
    }

    @Test
    public void testUnsupportedConjunctionOperandIsDropped()
    {
        Predicate predicate = new ConjunctionPredicate(ImmutableList.of(
                new ComparisonPredicate(EQUAL, column("name"), value(PrimitiveTypeId.UTF8, "a")),
                new RegexpPredicate(column("name"), value(PrimitiveTypeId.UTF8, "^a.*")),
                new ComparisonPredicate(LESS_THAN_OR_EQUAL, column("id"), int64(5))));

        RenderedPredicate rendered = PredicateRenderer.render(POSTGRESQL, predicate);

        assertEquals(rendered.getClause(), Optional.of("((\"name\" = ?) AND (\"id\" <= ?))"));
        assertEquals(rendered.getArguments(), ImmutableList.of("a", 5L));
        assertEquals(rendered.getErrors().size(), 1);
        assertTrue(rendered.getErrors().get(0).contains("regular expression"), rendered.getErrors().get(0));
    }

    @Test
    public void testUnsupportedPartMakesDisjunctionUnsupported()
    {
        Predicate predicate = new DisjunctionPredicate(ImmutableList.of(
                new ComparisonPredicate(EQUAL, column("id"), int64(1)),
                new RegexpPredicate(column("name"), value(PrimitiveTypeId.UTF8, "x"))));

        RenderedPredicate rendered = PredicateRenderer.render(POSTGRESQL, predicate);

        assertEquals(rendered.getClause(), Optional.empty());
        assertTrue(rendered.getArguments().isEmpty());
        assertEquals(rendered.getErrors().size(), 1);
    }

    @Test
    public void testDialectSpecificRegexp()
    {
        RenderedPredicate rendered = PredicateRenderer.render(MYSQL, new RegexpPredicate(column("name"), value(PrimitiveTypeId.UTF8, "^a")));

        assertEquals(rendered.getClause(), Optional.of("(`name` REGEXP ?)"));
        assertEquals(rendered.getArguments(), ImmutableList.of("^a"));
    }

    @Test
    public void testBoolExpression()
    {
        assertEquals(PredicateRenderer.render(POSTGRESQL, new BoolExpressionPredicate(column("flag"))).getClause(), Optional.of("\"flag\""));
        assertEquals(PredicateRenderer.render(POSTGRESQL, new BoolExpressionPredicate(int64(1))).getErrors().size(), 1);
    }

    @Test
    public void testQuotedIdentifier()
    {
        RenderedPredicate rendered = PredicateRenderer.render(POSTGRESQL, new IsNullPredicate(column("odd\"name")));
        assertEquals(rendered.getClause(), Optional.of("(\"odd\"\"name\" IS NULL)"));
    }

    private static Expression column(String name)
    {
        return new ColumnExpression(name);
    }

    private static Expression int64(long value)
    {
        return value(PrimitiveTypeId.INT64, value);
    }

    private static Expression value(PrimitiveTypeId type, Object value)
    {
        return new ValueExpression(type, value);
    }
}
