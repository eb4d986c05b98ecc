package org.cfgconv.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ValueTest {

    @Test
    void testUnwrapProducesPlainObjects() {
        Map<String, Value> fields = new LinkedHashMap<>();
        fields.put("z", new Value.Int64(1));
        fields.put("a", new Value.ListVal(List.of(new Value.Bool(false), new Value.Identifier("name"))));

        Object unwrapped = new Value.Struct(fields).unwrap();

        assertThat(unwrapped).isInstanceOf(LinkedHashMap.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) unwrapped;
        assertThat(map).containsExactly(Map.entry("z", 1L), Map.entry("a", List.of(false, "name")));
    }

    @Test
    void testCompoundValuesCopyTheirInput() {
        List<Value> elements = new ArrayList<>(List.of(new Value.Int64(1)));
        Map<String, Value> fields = new LinkedHashMap<>(Map.of("x", new Value.Int64(1)));

        Value.ListVal list = new Value.ListVal(elements);
        Value.Struct struct = new Value.Struct(fields);
        elements.add(new Value.Int64(2));
        fields.put("y", new Value.Int64(2));

        assertThat(list.elements()).hasSize(1);
        assertThat(struct.fields()).containsOnlyKeys("x");
        assertThatThrownBy(() -> list.elements().add(new Value.Int64(3)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> struct.fields().put("z", new Value.Int64(3)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testDocumentRebindingKeepsFirstPosition() {
        Document document = new Document();
        document.put("a", new Value.Int64(1));
        document.put("b", new Value.Int64(2));
        document.put("a", new Value.Text("again"));

        assertThat(document.entries()).containsExactly(
                Map.entry("a", new Value.Text("again")),
                Map.entry("b", new Value.Int64(2)));
        assertThat(document.unwrap()).containsExactly(Map.entry("a", "again"), Map.entry("b", 2L));
        assertThat(document.get("missing")).isEmpty();
    }
}
