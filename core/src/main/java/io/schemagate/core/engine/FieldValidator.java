package io.schemagate.core.engine;

import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.FieldValidation;
import io.schemagate.core.model.SchemaField;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a single value against a field's type and constraints.
 *
 * <p>
 * Invalid data never raises: every violation becomes one message in the
 * returned list, so a caller can report all problems of a record at once.
 * A type mismatch is reported alone, since the remaining checks would be
 * meaningless for a value of the wrong type.
 *
 * <p>
 * Thread-safe. Compiled patterns are cached.
 */
public final class FieldValidator {

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    /**
     * Validates {@code value} against {@code field}.
     *
     * @param field field definition
     * @param value candidate value; a {@code null} value fails the type check
     * @return violations, empty if the value is acceptable
     */
    public List<String> validateValue(SchemaField field, Object value) {
        Objects.requireNonNull(field, "field must not be null");
        List<String> errors = new ArrayList<>();
        if (!matchesType(field.type(), value)) {
            errors.add("Field '" + field.name() + "' has wrong type: expected " + field.type().wireName() + ", got "
                    + describeType(value));
            return errors;
        }
        FieldValidation rules = field.validation();
        if (field.type() == FieldType.STRING) {
            checkString(field.name(), value.toString(), rules, errors);
        }
        if (field.type().isNumeric()) {
            checkRange(field.name(), ((Number) value).doubleValue(), rules, errors);
        }
        if (rules.allowedValues() != null
                && !rules.allowedValues().isEmpty()
                && !isAllowed(value, rules.allowedValues())) {
            errors.add("Field '" + field.name() + "' value is not one of the allowed values: " + rules.allowedValues());
        }
        return errors;
    }

    static boolean matchesType(FieldType type, Object value) {
        if (value == null) {
            return false;
        }
        return switch (type) {
            case STRING -> value instanceof CharSequence;
            case INTEGER -> value instanceof Byte
                    || value instanceof Short
                    || value instanceof Integer
                    || value instanceof Long
                    || value instanceof BigInteger;
            case FLOAT -> value instanceof Float || value instanceof Double || value instanceof BigDecimal;
            case BOOLEAN -> value instanceof Boolean;
            case DATETIME -> value instanceof TemporalAccessor
                    || (value instanceof CharSequence text && isIsoDateTime(text.toString()));
            case LIST -> value instanceof List || value.getClass().isArray();
            case MAP -> value instanceof Map;
            case FREEFORM -> value instanceof Map || value instanceof List || value instanceof CharSequence;
        };
    }

    /**
     * Accepts ISO-8601 date-times with or without offset or zone, instants,
     * and plain dates. A space is tolerated in place of the {@code T}
     * separator.
     */
    static boolean isIsoDateTime(String text) {
        String normalized = text.trim().replace(' ', 'T');
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(normalized);
            return true;
        } catch (DateTimeParseException e) {
            // not a date-time; a plain date is still acceptable
        }
        try {
            LocalDate.parse(normalized);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private void checkString(String name, String text, FieldValidation rules, List<String> errors) {
        int length = text.codePointCount(0, text.length());
        if (rules.minLength() != null && length < rules.minLength()) {
            errors.add("Field '" + name + "' is shorter than the minimum length " + rules.minLength());
        }
        if (rules.maxLength() != null && length > rules.maxLength()) {
            errors.add("Field '" + name + "' exceeds the maximum length " + rules.maxLength());
        }
        if (rules.pattern() != null && !rules.pattern().isEmpty()) {
            Pattern pattern;
            try {
                pattern = patternCache.computeIfAbsent(rules.pattern(), Pattern::compile);
            } catch (PatternSyntaxException e) {
                errors.add("Field '" + name + "' has an invalid pattern '" + rules.pattern() + "': "
                        + e.getDescription());
                return;
            }
            Matcher matcher = pattern.matcher(text);
            if (!matcher.lookingAt()) {
                errors.add("Field '" + name + "' does not match pattern: " + rules.pattern());
            }
        }
    }

    private static void checkRange(String name, double value, FieldValidation rules, List<String> errors) {
        if (rules.minValue() != null && value < rules.minValue()) {
            errors.add("Field '" + name + "' is below the minimum value " + rules.minValue());
        }
        if (rules.maxValue() != null && value > rules.maxValue()) {
            errors.add("Field '" + name + "' exceeds the maximum value " + rules.maxValue());
        }
    }

    private static boolean isAllowed(Object value, List<Object> allowed) {
        for (Object candidate : allowed) {
            if (sameValue(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameValue(Object value, Object candidate) {
        if (value instanceof Number a && candidate instanceof Number b) {
            if (!Double.isFinite(a.doubleValue()) || !Double.isFinite(b.doubleValue())) {
                return a.doubleValue() == b.doubleValue();
            }
            return toDecimal(a).compareTo(toDecimal(b)) == 0;
        }
        if (value instanceof CharSequence a && candidate instanceof CharSequence b) {
            return a.toString().equals(b.toString());
        }
        return Objects.equals(value, candidate);
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static String describeType(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
