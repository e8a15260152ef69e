package io.intellixity.vellum.persistence.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.StringJoiner;

import static io.intellixity.vellum.persistence.query.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class PredicatesTest {

  /** Renders a tree in a compact prefix form so shapes can be asserted as strings. */
  private static final PredicateVisitor<String> SHAPE = new PredicateVisitor<>() {
    @Override public String visit(Comparison c) { return operand(c.left()) + c.operator().sql() + operand(c.right()); }
    @Override public String visit(AndPredicate and) { return "and(" + and.left().accept(this) + "," + and.right().accept(this) + ")"; }
    @Override public String visit(OrPredicate or) { return "or(" + or.left().accept(this) + "," + or.right().accept(this) + ")"; }
    @Override public String visit(NotPredicate not) { return "not(" + not.operand().accept(this) + ")"; }
    @Override public String visit(StringMatch m) { return m.field().name() + "~" + m.kind().likePattern(String.valueOf(m.pattern().value())); }
    @Override public String visit(NullCheck n) { return n.field().name() + (n.isNull() ? " null" : " notnull"); }
    @Override public String visit(InList in) {
      StringJoiner j = new StringJoiner(",", in.field().name() + " in[", "]");
      for (Literal l : in.values()) j.add(String.valueOf(l.value()));
      return j.toString();
    }
  };

  private static String operand(Operand o) {
    return o instanceof FieldRef f ? f.name() : String.valueOf(((Literal) o).value());
  }

  @Test
  void andFoldsLeft() {
    Predicate p = and(eq("a", 1), gt("b", 2), le("c", 3));
    assertEquals("and(and(a=1,b>2),c<=3)", p.accept(SHAPE));
  }

  @Test
  void orAndNotCompose() {
    Predicate p = not(or(ne("a", "x"), isNull("b")));
    assertEquals("not(or(a<>x,b null))", p.accept(SHAPE));
  }

  @Test
  void stringMatchesBuildLikePatterns() {
    assertEquals("Name~%Smith%", contains("Name", "Smith").accept(SHAPE));
    assertEquals("Name~Sm%", startsWith("Name", "Sm").accept(SHAPE));
    assertEquals("Name~%th", endsWith("Name", "th").accept(SHAPE));
  }

  @Test
  void nullLiteralIsShared() {
    Comparison c = (Comparison) eq("a", null);
    assertSame(Literal.NULL, c.right());
    assertTrue(((Literal) c.right()).isNull());
  }

  @Test
  void fieldComparisonsKeepBothSidesAsFields() {
    Comparison c = (Comparison) compareFields("CreatedTime", Operator.LT, "LastWriteTime");
    assertInstanceOf(FieldRef.class, c.right());
    assertTrue(Operator.LT.isRelational());
    assertFalse(Operator.NE.isRelational());
  }

  @Test
  void inListCopiesValues() {
    assertEquals("Id in[1,2,3]", in("Id", 1, 2, 3).accept(SHAPE));
    assertEquals("Id in[]", in("Id", List.of()).accept(SHAPE));
    assertEquals("Id in[null]", in("Id", (Object) null).accept(SHAPE));
  }

  @Test
  void orderByAppendsKeys() {
    OrderBy ob = OrderBy.by("Name").thenByDescending("Value");
    assertEquals(List.of(new OrderBy.Key("Name", OrderBy.Direction.ASC), new OrderBy.Key("Value", OrderBy.Direction.DESC)),
        ob.keys());
    assertEquals(OrderBy.by("Name").thenByDescending("Value"), ob);
    assertEquals(OrderBy.Direction.ASC, new OrderBy.Key("x", null).direction());
  }

  @Test
  void selectOptionsValidatePaging() {
    SelectOptions o = SelectOptions.defaults().withPage(20, 10);
    assertEquals(20, o.offset());
    assertEquals(10, o.limit());
    assertFalse(o.includeDeleted());
    assertTrue(o.withIncludeDeleted(true).includeDeleted());

    assertThrows(IllegalArgumentException.class, () -> SelectOptions.defaults().withLimit(0));
    assertThrows(IllegalArgumentException.class, () -> SelectOptions.defaults().withOffset(-1));
  }
}
