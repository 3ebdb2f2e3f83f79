package org.carball.docsim.parser;

import org.carball.docsim.model.query.FilterPredicate;
import org.carball.docsim.model.query.JoinPredicate;
import org.carball.docsim.model.query.ParsedQuery;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryParserTest {

    @Test
    void shouldParseSingleCollectionQuery() {
        // When
        ParsedQuery parsed = QueryParser.parse("SELECT description FROM Product WHERE categorie = 'smartphone';");

        // Then
        assertThat(parsed.selectFields()).containsExactly("description");
        assertThat(parsed.baseCollection()).isEqualTo("Product");
        assertThat(parsed.hasJoin()).isFalse();
        assertThat(parsed.filters()).containsExactly(new FilterPredicate("Product", "categorie", "smartphone"));
    }

    @Test
    void shouldResolveAliasesInJoinQuery() {
        // When
        ParsedQuery parsed = QueryParser.parse(
                "SELECT ol.quantity, p.price FROM OrderLine ol JOIN Product p ON ol.IDP = p.IDP "
                        + "WHERE p.brand = 'apple' AND ol.IDC = 125;");

        // Then
        assertThat(parsed.selectFields()).containsExactly("OrderLine.quantity", "Product.price");
        assertThat(parsed.aliases())
                .containsEntry("", "OrderLine")
                .containsEntry("ol", "OrderLine")
                .containsEntry("p", "Product")
                .containsEntry("Product", "Product");
        assertThat(parsed.join()).isEqualTo(new JoinPredicate("OrderLine", "IDP", "Product", "IDP"));
        assertThat(parsed.filters()).containsExactly(
                new FilterPredicate("Product", "brand", "apple"),
                new FilterPredicate("OrderLine", "IDC", 125L));
        assertThat(parsed.filtersOn("OrderLine")).hasSize(1);
    }

    @Test
    void shouldOrientJoinWithFromCollectionOnTheLeft() {
        // When
        ParsedQuery parsed = QueryParser.parse("SELECT * FROM A JOIN B ON B.x = A.y");

        // Then
        assertThat(parsed.selectFields()).isEmpty();
        assertThat(parsed.join()).isEqualTo(new JoinPredicate("A", "y", "B", "x"));
    }

    @Test
    void shouldTypeLiterals() {
        // When
        ParsedQuery parsed = QueryParser.parse("SELECT a FROM T WHERE i = 42 AND d = 2.5 AND s = \"raw\" AND q = 'x'");

        // Then
        assertThat(parsed.filters()).extracting(FilterPredicate::value)
                .containsExactly(42L, 2.5, "\"raw\"", "x");
    }

    @Test
    void shouldTreatUnknownQualifierAsNestedPath() {
        // When
        ParsedQuery parsed = QueryParser.parse("SELECT items.qty FROM Orders WHERE items.sku = 'A1'");

        // Then
        assertThat(parsed.selectFields()).containsExactly("items.qty");
        assertThat(parsed.filters()).containsExactly(new FilterPredicate("Orders", "items.sku", "A1"));
    }

    @Test
    void shouldParseGroupByWithAggregateFunctions() {
        // When
        ParsedQuery parsed = QueryParser.parse(
                "SELECT s.IDW, COUNT(*) AS nb, SUM(quantity) FROM Stock s WHERE IDP = 42 GROUP BY s.IDW;");

        // Then
        assertThat(parsed.hasGroupBy()).isTrue();
        assertThat(parsed.groupBy()).containsExactly("Stock.IDW");
        assertThat(parsed.selectFields()).containsExactly("Stock.IDW", "nb", "SUM(quantity)");
        assertThat(parsed.filters()).containsExactly(new FilterPredicate("Stock", "IDP", 42L));
    }

    @Test
    void shouldRejectTextWithoutSelectFrom() {
        // When/Then
        assertThatThrownBy(() -> QueryParser.parse("UPDATE Product SET price = 1"))
                .isInstanceOf(QueryParseException.class)
                .hasMessageStartingWith("Unsupported query")
                .hasMessageContaining("UPDATE Product SET price = 1");
        assertThatThrownBy(() -> QueryParser.parse("SELECT a"))
                .isInstanceOf(QueryParseException.class);
        assertThatThrownBy(() -> QueryParser.parse("  "))
                .isInstanceOf(QueryParseException.class);
    }

    @Test
    void shouldRejectNonEqualityPredicates() {
        // When/Then
        assertThatThrownBy(() -> QueryParser.parse("SELECT a FROM T WHERE price > 10"))
                .isInstanceOf(QueryParseException.class);
    }

    @Test
    void shouldRejectGroupByCombinedWithJoin() {
        // When/Then
        assertThatThrownBy(() -> QueryParser.parse(
                "SELECT p.brand FROM OrderLine ol JOIN Product p ON ol.IDP = p.IDP GROUP BY p.brand"))
                .isInstanceOf(UnsupportedQueryException.class)
                .hasMessageContaining("GROUP BY cannot be combined with JOIN");
    }

    @Test
    void shouldRejectSelfJoinAndUnqualifiedJoinFields() {
        // When/Then
        assertThatThrownBy(() -> QueryParser.parse("SELECT a FROM T t1 JOIN T t2 ON t1.x = t2.x"))
                .isInstanceOf(UnsupportedQueryException.class);
        assertThatThrownBy(() -> QueryParser.parse("SELECT a FROM A JOIN B ON x = B.y"))
                .isInstanceOf(QueryParseException.class)
                .hasMessageContaining("must be qualified");
    }
}
