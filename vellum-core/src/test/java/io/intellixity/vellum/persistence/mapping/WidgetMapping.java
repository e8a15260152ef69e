package io.intellixity.vellum.persistence.mapping;

/** Listed in the test {@code META-INF/vellum.factories}. */
public final class WidgetMapping implements MappingProvider<WidgetMapping.Widget> {
  public record Widget(String code, String label) {}

  @Override
  public Class<Widget> type() { return Widget.class; }

  @Override
  public EntityMapping.Builder<Widget> describe() {
    return EntityMapping.builder(Widget.class, "Widgets")
        .key("code", ColumnType.TEXT, Widget::code, c -> c.size(32))
        .column("label", ColumnType.TEXT, Widget::label)
        .reader(row -> new Widget(row.getString("Code"), row.getString("Label")));
  }
}
