package me.cogbot.domain.service;

import me.cogbot.domain.exception.ValueConversionException;
import me.cogbot.domain.model.ReseedPolicy;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ValueCodecTest {

    private final ValueCodec codec = ValueCodec.standard();

    @Test
    void render_usesPlainTextForScalars() {
        assertEquals("abc", codec.render("abc"));
        assertEquals("42", codec.render(42));
        assertEquals("1.5", codec.render(1.5));
        assertEquals("1", codec.render(true));
        assertEquals("0", codec.render(false));
        assertEquals("100", codec.render(new BigDecimal("1E+2")));
        assertEquals("x", codec.render('x'));
        assertEquals("ALWAYS", codec.render(ReseedPolicy.ALWAYS));
        assertEquals("2026-01-02T03:04:05Z", codec.render(Instant.parse("2026-01-02T03:04:05Z")));
    }

    @Test
    void render_writesStructuredValuesAsJson() {
        assertEquals("[1,2]", codec.render(List.of(1, 2)));
        assertEquals("{\"a\":1}", codec.render(Map.of("a", 1)));
    }

    @Test
    void render_rejectsNull() {
        assertThrows(ValueConversionException.class, () -> codec.render(null));
    }

    @Test
    void parse_readsScalars() {
        assertEquals(42, codec.parse("42", Integer.class));
        assertEquals(42L, codec.parse(" 42 ", long.class));
        assertEquals(1.5, codec.parse("1.5", Double.class));
        assertTrue(codec.parse("1", Boolean.class));
        assertTrue(codec.parse("true", boolean.class));
        assertFalse(codec.parse("0", Boolean.class));
        assertEquals('x', codec.parse("x", Character.class));
        assertEquals(ReseedPolicy.ONCE, codec.parse("ONCE", ReseedPolicy.class));
        UUID id = UUID.randomUUID();
        assertEquals(id, codec.parse(id.toString(), UUID.class));
        assertEquals(Instant.parse("2026-01-02T03:04:05Z"), codec.parse("2026-01-02T03:04:05Z", Instant.class));
        assertNull(codec.parse(null, Integer.class));
    }

    @Test
    void parse_readsJson() {
        assertEquals(List.of(1, 2), codec.parse("[1,2]", List.class));
        assertEquals(Map.of("a", "b"), codec.parse("{\"a\":\"b\"}", Map.class));
    }

    @Test
    void parse_wrapsMalformedInput() {
        assertThrows(ValueConversionException.class, () -> codec.parse("abc", Integer.class));
        assertThrows(ValueConversionException.class, () -> codec.parse("maybe", Boolean.class));
        assertThrows(ValueConversionException.class, () -> codec.parse("xy", Character.class));
        assertThrows(ValueConversionException.class, () -> codec.parse("SOMETIMES", ReseedPolicy.class));
        assertThrows(ValueConversionException.class, () -> codec.parse("{broken", Map.class));
    }
}
