package io.intellixity.vellum.persistence.jdbc.translate;

import io.intellixity.vellum.persistence.jdbc.Customers;
import io.intellixity.vellum.persistence.jdbc.PlainSqlDialect;
import io.intellixity.vellum.persistence.mapping.EntityKey;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.query.*;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static io.intellixity.vellum.persistence.query.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class ExpressionTranslatorTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final String COLUMNS = "Id, Name, Value, Version, CreatedTime, LastWriteTime";

  private static ExpressionTranslator translator(EntityMapping<?> mapping) {
    return new ExpressionTranslator(mapping, new PlainSqlDialect(), CLOCK);
  }

  private final ExpressionTranslator plain = translator(Customers.plain());

  @Test
  void equalityBecomesOneParameter() {
    TranslatedPredicate tp = plain.translatePredicate(eq("name", "John Doe"));
    assertEquals("(Name = @p0)", tp.sql());
    assertEquals(Map.of("@p0", "John Doe"), tp.parameters());
  }

  @Test
  void containsWrapsThePatternInWildcards() {
    TranslatedPredicate tp = plain.translatePredicate(contains("Name", "Smith"));
    assertEquals("(Name LIKE @p0)", tp.sql());
    assertEquals("%Smith%", tp.parameters().get("@p0"));
    assertEquals("Sm%", plain.translatePredicate(startsWith("Name", "Sm")).parameters().get("@p0"));
    assertEquals("%th", plain.translatePredicate(endsWith("Name", "th")).parameters().get("@p0"));
  }

  @Test
  void parametersAreNumberedInWalkOrder() {
    Predicate p = or(and(gt("value", 10), contains("name", "a")), not(in("id", 1L, 2L, 3L)));
    TranslatedPredicate tp = plain.translatePredicate(p);

    assertEquals("(((Value > @p0) AND (Name LIKE @p1)) OR (NOT (Id IN (@p2, @p3, @p4))))", tp.sql());
    assertEquals(List.of("@p0", "@p1", "@p2", "@p3", "@p4"), List.copyOf(tp.parameters().keySet()));
    assertEquals(List.of(10, "%a%", 1L, 2L, 3L), List.copyOf(tp.parameters().values()));
  }

  @Test
  void translationIsRepeatable() {
    Predicate p = and(eq("name", "x"), le("value", 5));
    TranslatedPredicate first = plain.translatePredicate(p);
    TranslatedPredicate second = plain.translatePredicate(p);
    assertEquals(first, second);
    assertEquals("@p0", second.parameters().keySet().iterator().next());
  }

  @Test
  void nullComparisonsBecomeNullChecks() {
    assertEquals("(Name IS NULL)", plain.translatePredicate(eq("name", null)).sql());
    assertEquals("(Name IS NOT NULL)", plain.translatePredicate(ne("name", null)).sql());
    assertEquals("(Value IS NOT NULL)", plain.translatePredicate(isNotNull("value")).sql());
    assertTrue(plain.translatePredicate(eq("name", null)).parameters().isEmpty());
  }

  @Test
  void relationalNullIsUnsupported() {
    UnsupportedExpressionException e = assertThrows(UnsupportedExpressionException.class,
        () -> plain.translatePredicate(lt("value", null)));
    assertEquals("Comparison", e.nodeKind());
  }

  @Test
  void emptyInListMatchesNothing() {
    TranslatedPredicate tp = plain.translatePredicate(in("id", List.of()));
    assertEquals("(1 = 0)", tp.sql());
    assertTrue(tp.parameters().isEmpty());
  }

  @Test
  void unsupportedShapesAreRejected() {
    assertThrows(UnsupportedExpressionException.class, () -> plain.translatePredicate(eq("missing", 1)));
    assertThrows(UnsupportedExpressionException.class, () -> plain.translatePredicate(contains("value", "1")));
    assertThrows(UnsupportedExpressionException.class, () -> plain.translatePredicate(in("id", 1L, null)));
    assertThrows(UnsupportedExpressionException.class, () -> plain.translatePredicate(eq("name", new Object())));
    assertThrows(UnsupportedExpressionException.class,
        () -> plain.translatePredicate(new Comparison(Literal.NULL, Operator.EQ, Literal.NULL)));
  }

  @Test
  void fieldToFieldComparisonUsesNoParameters() {
    TranslatedPredicate tp = plain.translatePredicate(compareFields("CreatedTime", Operator.LT, "LastWriteTime"));
    assertEquals("(CreatedTime < LastWriteTime)", tp.sql());
    assertTrue(tp.parameters().isEmpty());
  }

  @Test
  void idAliasResolvesToTheSingleKey() {
    assertEquals("(Id = @p0)", plain.translatePredicate(eq("Key", 5L)).sql());
  }

  @Test
  void orderByRendersEveryKey() {
    assertEquals("ORDER BY Name ASC, Value DESC", plain.translateOrderBy(OrderBy.by("name").thenByDescending("value")));
    assertEquals("", plain.translateOrderBy(null));
    assertThrows(UnsupportedExpressionException.class, () -> plain.translateOrderBy(OrderBy.by("nope")));
  }

  @Test
  void selectCombinesPredicateOrderingAndPaging() {
    SelectOptions o = SelectOptions.defaults().withOrderBy(OrderBy.by("name")).withPage(20, 10);
    TranslatedPredicate tp = plain.translateSelect(eq("name", "John Doe"), o);
    assertEquals("SELECT " + COLUMNS + " FROM Customers WHERE (Name = @p0) ORDER BY Name ASC LIMIT 10 OFFSET 20", tp.sql());
    assertEquals(1, tp.parameters().size());
  }

  @Test
  void selectByKeyUsesColumnParameters() {
    TranslatedPredicate tp = plain.translateSelect(EntityKey.of("Id", 7L), null, null);
    assertEquals("SELECT " + COLUMNS + " FROM Customers WHERE Id = @Id", tp.sql());
    assertEquals(Map.of("@Id", 7L), tp.parameters());
  }

  @Test
  void softDeletedRowsAreHiddenUnlessRequested() {
    ExpressionTranslator t = translator(Customers.softDeleting());
    assertEquals("SELECT " + COLUMNS + ", IsDeleted FROM Customers WHERE IsDeleted = FALSE",
        t.translateSelect(null, SelectOptions.defaults()).sql());
    assertEquals("SELECT " + COLUMNS + ", IsDeleted FROM Customers",
        t.translateSelect(null, SelectOptions.defaults().withIncludeDeleted(true)).sql());
  }

  @Test
  void expiredRowsAreHiddenUsingTheClock() {
    ExpressionTranslator t = translator(Customers.expiring(Duration.ofMinutes(5)));
    TranslatedPredicate tp = t.translateCount(gt("value", 1), null);
    assertEquals("SELECT COUNT(1) FROM Customers WHERE (Value > @p0)"
        + " AND (AbsoluteExpiration IS NULL OR AbsoluteExpiration > @now)", tp.sql());
    assertEquals(NOW, tp.parameters().get("@now"));

    TranslatedPredicate all = t.translateCount(null, SelectOptions.defaults().withIncludeExpired(true));
    assertEquals("SELECT COUNT(1) FROM Customers", all.sql());
    assertFalse(all.parameters().containsKey("@now"));
  }

  @Test
  void countIgnoresOrderingAndPaging() {
    SelectOptions o = SelectOptions.defaults().withOrderBy(OrderBy.by("name")).withLimit(3);
    assertEquals("SELECT COUNT(1) FROM Customers", plain.translateCount(null, o).sql());
  }
}
