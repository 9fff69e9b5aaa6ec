package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentValueTest {

    @Test
    void shouldCloseUnionOverJsonShapes() {
        assertTrue(ArgumentValue.class.isSealed());

        Set<Class<?>> permitted = Arrays.stream(ArgumentValue.class.getPermittedSubclasses())
                .collect(Collectors.toSet());

        assertEquals(Set.of(
                ArgumentValue.NullValue.class,
                ArgumentValue.BoolValue.class,
                ArgumentValue.NumberValue.class,
                ArgumentValue.StringValue.class,
                ArgumentValue.ArrayValue.class,
                ArgumentValue.ObjectValue.class), permitted);
    }

    @Test
    void shouldClassifyRawJacksonValues() {
        assertSame(ArgumentValue.NullValue.INSTANCE, ArgumentValue.of(null));
        assertInstanceOf(ArgumentValue.BoolValue.class, ArgumentValue.of(true));
        assertInstanceOf(ArgumentValue.NumberValue.class, ArgumentValue.of(3L));
        assertInstanceOf(ArgumentValue.StringValue.class, ArgumentValue.of("x"));
        assertInstanceOf(ArgumentValue.ArrayValue.class, ArgumentValue.of(List.of(1, 2)));
        assertInstanceOf(ArgumentValue.ArrayValue.class, ArgumentValue.of(new Object[] { "a" }));
        assertInstanceOf(ArgumentValue.ObjectValue.class, ArgumentValue.of(Map.of("k", "v")));
    }

    @Test
    void shouldReportTypeNamesForEveryShape() {
        assertEquals("null", ArgumentValue.of(null).typeName());
        assertEquals("boolean", ArgumentValue.of(false).typeName());
        assertEquals("number", ArgumentValue.of(2.5d).typeName());
        assertEquals("string", ArgumentValue.of("s").typeName());
        assertEquals("array", ArgumentValue.of(List.of()).typeName());
        assertEquals("object", ArgumentValue.of(Map.of()).typeName());
    }

    @Test
    void shouldReturnAlreadyClassifiedValueUnchanged() {
        ArgumentValue value = new ArgumentValue.StringValue("kept");

        assertSame(value, ArgumentValue.of(value));
    }
}
