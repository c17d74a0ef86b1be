package cronarchy.scheduler.service;

import cronarchy.scheduler.exceptions.StorageException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArgsCodecTest {

    @Test
    void emptyList() {
        assertEquals("[]", ArgsCodec.serialize(List.of()));
        assertEquals(List.of(), ArgsCodec.deserialize("[]"));
    }

    @Test
    void nullListIsStoredAsEmpty() {
        assertEquals("[]", ArgsCodec.serialize(null));
    }

    @Test
    void blankStoredValueIsEmpty() {
        assertEquals(List.of(), ArgsCodec.deserialize(""));
        assertEquals(List.of(), ArgsCodec.deserialize(null));
    }

    @Test
    void singleValue() {
        List<Object> args = List.of("newsletter");

        assertEquals(args, ArgsCodec.deserialize(ArgsCodec.serialize(args)));
    }

    @Test
    void mixedValuesKeepOrderAndValue() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("limit", 10);
        options.put("dryRun", true);
        options.put("maxBytes", 5_000_000_000L);
        List<Object> args = Arrays.asList(42, 42L, 1.5f, 2.5, new BigDecimal("0.10"), "user@example.com",
                false, null, List.of(1L, 2, 3), options);

        List<Object> restored = ArgsCodec.deserialize(ArgsCodec.serialize(args));

        // Long and Integer are never equal, so this also checks the number types
        assertEquals(args, restored);
    }

    @Test
    void numberTypesSurviveRoundTrip() {
        List<Object> restored = ArgsCodec.deserialize(ArgsCodec.serialize(List.of(42L, 1.5f, "x")));

        assertEquals(List.of(42L, 1.5f, "x"), restored);
        Long id = (Long) restored.get(0);
        Float ratio = (Float) restored.get(1);
        assertEquals(42L, id);
        assertEquals(1.5f, ratio);
    }

    @Test
    void nestedNumberTypesSurviveRoundTrip() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ids", List.of(7L, 8L));

        List<Object> restored = ArgsCodec.deserialize(ArgsCodec.serialize(List.of(payload)));

        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) restored.get(0);
        assertEquals(List.of(7L, 8L), map.get("ids"));
    }

    @Test
    void plainJsonTypesAreStoredWithoutWrappers() {
        assertEquals("[42,\"weekly\",2.5,true,null]",
                ArgsCodec.serialize(Arrays.asList(42, "weekly", 2.5, true, null)));
    }

    @Test
    void beansAreStoredAsMaps() {
        List<Object> restored = ArgsCodec.deserialize(ArgsCodec.serialize(List.of(new Recipient("ann", 3))));

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("name", "ann");
        expected.put("visits", 3);
        assertEquals(List.of(expected), restored);
    }

    record Recipient(String name, int visits) {
    }

    @Test
    void mapKeysAreSortedSoEqualArgsSerializeEqually() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("b", 1);
        a.put("a", 2);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("a", 2);
        b.put("b", 1);

        assertEquals(ArgsCodec.serialize(List.of(a)), ArgsCodec.serialize(List.of(b)));
        assertEquals("[[\"java.util.LinkedHashMap\",{\"a\":2,\"b\":1}]]", ArgsCodec.serialize(List.of(a)));
    }

    @Test
    void sparseMappingIsFlattenedInKeyOrder() {
        List<Object> args = ArgsCodec.deserialize("{\"10\":\"c\",\"2\":\"b\",\"0\":\"a\"}");

        assertEquals(List.of("a", "b", "c"), args);
    }

    @Test
    void nonNumericMappingKeyRejected() {
        assertThrows(StorageException.class, () -> ArgsCodec.deserialize("{\"x\":1}"));
    }

    @Test
    void scalarRejected() {
        assertThrows(StorageException.class, () -> ArgsCodec.deserialize("17"));
    }

    @Test
    void invalidJsonRejected() {
        assertThrows(StorageException.class, () -> ArgsCodec.deserialize("[1,"));
    }

    @Test
    void deserializedListIsMutable() {
        List<Object> args = ArgsCodec.deserialize("[1]");
        args.add(2);

        assertEquals(new ArrayList<>(List.of(1, 2)), args);
    }
}
