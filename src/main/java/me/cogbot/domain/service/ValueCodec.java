/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.cogbot.domain.service;

import me.cogbot.domain.exception.ValueConversionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Converts values to and from the text stored in key-value tables.
 *
 * <p>
 * Rendering rules:
 * <ul>
 * <li>booleans are stored as {@code "1"} / {@code "0"}</li>
 * <li>strings, numbers, characters, enums (by name), UUIDs and java.time values
 * use their canonical text form</li>
 * <li>anything else is written as JSON</li>
 * </ul>
 * Reading applies the inverse for the requested type.
 */
public final class ValueCodec {

    private static final ValueCodec STANDARD = new ValueCodec(defaultObjectMapper());

    private final ObjectMapper objectMapper;

    public ValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Codec backed by a private {@link ObjectMapper}, used where no Spring bean is
     * available (schema declarations, tests).
     */
    public static ValueCodec standard() {
        return STANDARD;
    }

    public String render(Object value) {
        if (value == null) {
            throw new ValueConversionException("Cannot store null, delete the key instead");
        }
        if (value instanceof Boolean bool) {
            return bool ? "1" : "0";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Character
                || value instanceof UUID || value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValueConversionException(
                    "Cannot convert value of type " + value.getClass().getName() + " to text", e);
        }
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    public <T> T parse(String text, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (text == null) {
            return null;
        }
        Class<?> target = wrap(type);
        try {
            Object result;
            if (target == String.class || target == Object.class) {
                result = text;
            } else if (target == Boolean.class) {
                result = parseBoolean(text);
            } else if (target == Integer.class) {
                result = Integer.valueOf(text.trim());
            } else if (target == Long.class) {
                result = Long.valueOf(text.trim());
            } else if (target == Short.class) {
                result = Short.valueOf(text.trim());
            } else if (target == Byte.class) {
                result = Byte.valueOf(text.trim());
            } else if (target == Double.class) {
                result = Double.valueOf(text.trim());
            } else if (target == Float.class) {
                result = Float.valueOf(text.trim());
            } else if (target == BigDecimal.class) {
                result = new BigDecimal(text.trim());
            } else if (target == BigInteger.class) {
                result = new BigInteger(text.trim());
            } else if (target == Character.class) {
                if (text.length() != 1) {
                    throw new ValueConversionException("Expected a single character but got '" + text + "'");
                }
                result = text.charAt(0);
            } else if (target == UUID.class) {
                result = UUID.fromString(text.trim());
            } else if (target.isEnum()) {
                result = Enum.valueOf((Class<? extends Enum>) target, text.trim());
            } else {
                result = readJson(text, target);
            }
            return (T) result;
        } catch (IllegalArgumentException e) {
            if (e instanceof ValueConversionException conversion) {
                throw conversion;
            }
            throw new ValueConversionException("Cannot read '" + text + "' as " + type.getSimpleName(), e);
        }
    }

    private Object readJson(String text, Class<?> target) {
        try {
            if (TemporalAccessor.class.isAssignableFrom(target)) {
                // java.time values are stored unquoted
                return objectMapper.readValue(objectMapper.writeValueAsString(text), target);
            }
            return objectMapper.readValue(text, target);
        } catch (JsonProcessingException e) {
            throw new ValueConversionException("Cannot read '" + text + "' as " + target.getSimpleName(), e);
        }
    }

    private static Boolean parseBoolean(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return Boolean.TRUE;
        }
        if ("false".equals(normalized)) {
            return Boolean.FALSE;
        }
        return Long.parseLong(normalized) != 0;
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        if (type == char.class) {
            return Character.class;
        }
        throw new ValueConversionException("Unsupported type: " + type);
    }

    /**
     * Mapper with {@code java.time} support, ISO dates and lenient reads of
     * unknown properties. Shared with the application context.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
