package me.golemcore.agent.domain.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ArgumentValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentCoercerTest {

    private final ArgumentCoercer coercer = new ArgumentCoercer(new ObjectMapper());

    @Test
    void shouldParseIntegralStringAsLong() {
        ArgumentValue value = coercer.coerceValue(new ArgumentValue.StringValue("42"), ArgumentType.NUMBER);

        assertEquals(new ArgumentValue.NumberValue(42L), value);
    }

    @Test
    void shouldParseDecimalStringAsDouble() {
        ArgumentValue value = coercer.coerceValue(new ArgumentValue.StringValue("2.5"), ArgumentType.NUMBER);

        assertEquals(new ArgumentValue.NumberValue(2.5d), value);
    }

    @Test
    void shouldLeaveNonNumericStringUnchanged() {
        ArgumentValue input = new ArgumentValue.StringValue("abc");

        assertSame(input, coercer.coerceValue(input, ArgumentType.NUMBER));
    }

    @Test
    void shouldCoerceBooleanStrings() {
        assertEquals(new ArgumentValue.BoolValue(true),
                coercer.coerceValue(new ArgumentValue.StringValue("yes"), ArgumentType.BOOLEAN));
        assertEquals(new ArgumentValue.BoolValue(true),
                coercer.coerceValue(new ArgumentValue.StringValue("1"), ArgumentType.BOOLEAN));
        assertEquals(new ArgumentValue.BoolValue(false),
                coercer.coerceValue(new ArgumentValue.StringValue("nope"), ArgumentType.BOOLEAN));
    }

    @Test
    void shouldSplitCommaSeparatedArray() {
        ArgumentValue value = coercer.coerceValue(new ArgumentValue.StringValue("a, b ,c"), ArgumentType.ARRAY);

        assertEquals(List.of("a", "b", "c"), value.unwrap());
    }

    @Test
    void shouldParseJsonObjectAndKeepInvalidText() {
        ArgumentValue parsed = coercer.coerceValue(new ArgumentValue.StringValue("{\"k\":1}"), ArgumentType.OBJECT);
        ArgumentValue invalid = new ArgumentValue.StringValue("{not json");

        assertEquals(Map.of("k", 1), parsed.unwrap());
        assertSame(invalid, coercer.coerceValue(invalid, ArgumentType.OBJECT));
    }

    @Test
    void shouldOnlyConvertStrings() {
        ArgumentValue number = new ArgumentValue.NumberValue(1);

        assertSame(number, coercer.coerceValue(number, ArgumentType.BOOLEAN));
    }

    @Test
    void shouldCoerceMapAgainstSpecs() {
        List<ArgumentSpec> specs = List.of(
                ArgumentSpec.builder().name("limit").type(ArgumentType.NUMBER).build(),
                ArgumentSpec.builder().name("flag").type(ArgumentType.BOOLEAN).build(),
                ArgumentSpec.builder().name("name").type(ArgumentType.STRING).build());

        Map<String, Object> result = coercer.coerce(specs, Map.of("limit", "7", "flag", "true", "name", "x",
                "extra", "5"));

        assertEquals(7L, result.get("limit"));
        assertEquals(true, result.get("flag"));
        assertEquals("x", result.get("name"));
        assertEquals("5", result.get("extra"));
        assertTrue(ArgumentValidator.validate(specs.subList(0, 2), Map.of("limit", result.get("limit"))).valid());
        assertFalse(result.containsKey("missing"));
    }
}
