package com.megaproject.megaproject.query;

import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.column.TableSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.megaproject.megaproject.query.Expressions.cast;
import static com.megaproject.megaproject.query.Expressions.column;
import static com.megaproject.megaproject.query.Expressions.dateFromYear;
import static com.megaproject.megaproject.query.Expressions.daysBetween;
import static com.megaproject.megaproject.query.Expressions.eq;
import static com.megaproject.megaproject.query.Expressions.isNull;
import static com.megaproject.megaproject.query.Expressions.literal;
import static com.megaproject.megaproject.query.Expressions.safeDivide;
import static com.megaproject.megaproject.query.Expressions.typedNull;
import static com.megaproject.megaproject.query.Expressions.when;
import static com.megaproject.megaproject.query.Expressions.yearOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SqlDialectTest {

    private final SqlDialect postgres = new PostgresSqlDialect();
    private final SqlDialect h2 = new H2SqlDialect();

    @Test
    void shouldRenderSelectWithJoinAndWhere() {
        SelectQuery query = SelectQuery.builder()
                .item(column("p", "project_id"), "project_id")
                .item(cast(column("r", "year"), SemanticType.INTEGER), "year")
                .from(new FromItem.Table("raw_unverified", "rail", "p"))
                .join(JoinClause.left(new FromItem.Table("reference", "exchange_rates", "r"),
                        eq(column("r", "country_iso3"), literal("USA"))))
                .where(isNull(column("p", "sample")))
                .build();

        assertEquals("SELECT \"p\".\"project_id\" AS \"project_id\", CAST(\"r\".\"year\" AS INTEGER) AS \"year\" "
                        + "FROM \"raw_unverified\".\"rail\" AS \"p\" "
                        + "LEFT JOIN \"reference\".\"exchange_rates\" AS \"r\" ON (\"r\".\"country_iso3\" = 'USA') "
                        + "WHERE \"p\".\"sample\" IS NULL",
                postgres.render(query));
    }

    @Test
    void shouldRenderUnionAllOfDerivedTables() {
        SelectQuery inner = SelectQuery.builder()
                .item(typedNull(SemanticType.FLOAT), "x_millions")
                .build();
        SelectQuery outer = SelectQuery.builder()
                .item(column("d", "x_millions"), "x_millions")
                .from(new FromItem.Derived(inner, "d"))
                .build();

        assertEquals("SELECT \"d\".\"x_millions\" AS \"x_millions\" "
                        + "FROM (SELECT CAST(NULL AS DOUBLE PRECISION) AS \"x_millions\") AS \"d\" UNION ALL "
                        + "SELECT CAST(NULL AS DOUBLE PRECISION) AS \"x_millions\"",
                h2.render(new UnionQuery(List.of(outer, inner))));
    }

    @Test
    void shouldRejectMisalignedUnionBranches() {
        SelectQuery first = SelectQuery.builder().item(literal(1), "a").build();
        SelectQuery second = SelectQuery.builder().item(literal(1), "b").build();
        assertThrows(IllegalArgumentException.class, () -> new UnionQuery(List.of(first, second)));
    }

    @Test
    void shouldRenderDateFunctionsPerDialect() {
        SqlExpression year = column("t", "start_x_year");
        SqlExpression date = column("t", "start_x_date");

        assertEquals("SELECT MAKE_DATE(\"t\".\"start_x_year\", 7, 2) AS \"d\"",
                postgres.render(SelectQuery.builder().item(dateFromYear(year, 7, 2), "d").build()));
        assertEquals("SELECT CAST(CAST(\"t\".\"start_x_year\" AS VARCHAR) || '-07-02' AS DATE) AS \"d\"",
                h2.render(SelectQuery.builder().item(dateFromYear(year, 7, 2), "d").build()));
        assertEquals("SELECT CAST(EXTRACT(YEAR FROM \"t\".\"start_x_date\") AS INTEGER) AS \"y\"",
                h2.render(SelectQuery.builder().item(yearOf(date), "y").build()));
        assertEquals("SELECT DATEDIFF(DAY, \"t\".\"a\", \"t\".\"b\") AS \"n\"",
                h2.render(SelectQuery.builder().item(daysBetween(column("t", "a"), column("t", "b")), "n").build()));
        assertEquals("SELECT (CAST(\"t\".\"b\" AS DATE) - CAST(\"t\".\"a\" AS DATE)) AS \"n\"",
                postgres.render(SelectQuery.builder().item(daysBetween(column("t", "a"), column("t", "b")), "n").build()));
    }

    @Test
    void shouldGuardDivisionAndEscapeLiterals() {
        SqlExpression ratio = safeDivide(column("t", "act"), column("t", "est"));
        SqlExpression label = when(isNull(ratio), literal("it's unknown")).otherwise(literal(2.5));

        assertEquals("SELECT CASE WHEN (\"t\".\"act\" / NULLIF(\"t\".\"est\", 0)) IS NULL "
                        + "THEN 'it''s unknown' ELSE 2.5 END AS \"v\"",
                postgres.render(SelectQuery.builder().item(label, "v").build()));
    }

    @Test
    void shouldRenderKeyedTableDdl() {
        TableSchema schema = TableSchema.of(List.of("project_id", "sample", "start_x_date", "is_open"));
        assertEquals("CREATE TABLE \"raw_verified\".\"rail\" (\"project_id\" VARCHAR NOT NULL, "
                        + "\"sample\" VARCHAR NOT NULL, \"start_x_date\" DATE, \"is_open\" BOOLEAN, "
                        + "PRIMARY KEY (\"project_id\", \"sample\"))",
                postgres.createTable("raw_verified", "rail", schema, List.of("project_id", "sample")));
        assertEquals("INSERT INTO \"raw_verified\".\"rail\" (\"project_id\", \"sample\") VALUES (?, ?)",
                postgres.insert("raw_verified", "rail", List.of("project_id", "sample")));
    }

    @Test
    void shouldRenderKeyedRecordStatements() {
        List<String> key = List.of("project_id", "sample");
        assertEquals("UPDATE \"raw_verified\".\"rail\" SET \"name\" = ?, \"is_open\" = ? "
                        + "WHERE \"project_id\" = ? AND \"sample\" = ?",
                postgres.updateByKey("raw_verified", "rail", List.of("name", "is_open"), key));
        assertEquals("DELETE FROM \"raw_verified\".\"rail\" WHERE \"project_id\" = ? AND \"sample\" = ?",
                postgres.deleteByKey("raw_verified", "rail", key));
    }
}
