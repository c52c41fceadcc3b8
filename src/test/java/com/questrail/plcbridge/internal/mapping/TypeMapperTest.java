package com.questrail.plcbridge.internal.mapping;

import com.questrail.plcbridge.api.PrimitiveType;
import com.questrail.plcbridge.api.VariableKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeMapperTest {

    @Test
    void literalTypeOverridesDeclaredKind() {
        assertEquals(VariableKind.NUMBER, TypeMapper.resolveKind(VariableKind.TEXT, 42));
        assertEquals(VariableKind.NUMBER, TypeMapper.resolveKind(VariableKind.BOOLEAN, 1.5));
        assertEquals(VariableKind.BOOLEAN, TypeMapper.resolveKind(VariableKind.NUMBER, true));
        assertEquals(VariableKind.TEXT, TypeMapper.resolveKind(VariableKind.TEXT, "42"));
        assertEquals(VariableKind.STRUCTURED, TypeMapper.resolveKind(VariableKind.STRUCTURED, Map.of("a", 1)));
    }

    @Test
    void primitiveTypes() {
        assertEquals(PrimitiveType.DOUBLE, TypeMapper.primitiveTypeOf(VariableKind.NUMBER));
        assertEquals(PrimitiveType.BOOLEAN, TypeMapper.primitiveTypeOf(VariableKind.BOOLEAN));
        assertEquals(PrimitiveType.STRING, TypeMapper.primitiveTypeOf(VariableKind.TEXT));
        assertEquals(PrimitiveType.STRING, TypeMapper.primitiveTypeOf(VariableKind.STRUCTURED));
    }

    @Test
    void numbersBecomeDoubles() {
        assertEquals(42.0, TypeMapper.toPrimitive(42, VariableKind.NUMBER));
        assertEquals(3.5, TypeMapper.toPrimitive("3.5", VariableKind.NUMBER));
        assertTrue(((Double) TypeMapper.toPrimitive("abc", VariableKind.NUMBER)).isNaN());
    }

    @Test
    void booleanTextForms() {
        assertEquals(true, TypeMapper.toPrimitive("on", VariableKind.BOOLEAN));
        assertEquals(true, TypeMapper.toPrimitive("1", VariableKind.BOOLEAN));
        assertEquals(true, TypeMapper.toPrimitive(" Yes ", VariableKind.BOOLEAN));
        assertEquals(false, TypeMapper.toPrimitive("off", VariableKind.BOOLEAN));
        assertEquals(false, TypeMapper.toPrimitive(0, VariableKind.BOOLEAN));
    }

    @Test
    void untemplatedStructuredValuesRenderAsJson() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("a", 1);
        value.put("b", List.of(true, false));

        assertEquals("{\"a\":1,\"b\":[true,false]}", TypeMapper.toPrimitive(value, VariableKind.STRUCTURED));
    }

    @Test
    void nullStaysNull() {
        assertNull(TypeMapper.toPrimitive(null, VariableKind.NUMBER));
        assertNull(TypeMapper.toDomain(null, VariableKind.NUMBER));
        assertNull(TypeMapper.toDomain(null, VariableKind.TEXT));
    }

    @Test
    void commandValuesConvertBackToDomain() {
        assertEquals(12.0, TypeMapper.toDomain(12L, VariableKind.NUMBER));
        assertEquals(true, TypeMapper.toDomain("true", VariableKind.BOOLEAN));
        assertEquals("7", TypeMapper.toDomain(7, VariableKind.TEXT));
        assertEquals(Map.of("a", 1), TypeMapper.toDomain("{\"a\":1}", VariableKind.STRUCTURED));
        assertEquals("not json", TypeMapper.toDomain("not json", VariableKind.STRUCTURED));
    }

    @Test
    void unknownTargetsKeepRuntimeShape() {
        assertEquals(true, TypeMapper.inferDomain(true));
        assertEquals(5L, TypeMapper.inferDomain(5L));
        assertEquals("x", TypeMapper.inferDomain("x"));
        assertEquals("[1, 2]", TypeMapper.inferDomain(List.of(1, 2)));
    }

    @Test
    void memberMapRejectsScalars() {
        assertThrows(IllegalArgumentException.class, () -> TypeMapper.asMemberMap(5));
        assertThrows(IllegalArgumentException.class, () -> TypeMapper.asMemberMap("[1,2]"));
        assertEquals(Map.of("x", true), TypeMapper.asMemberMap("{\"x\":true}"));
    }
}
