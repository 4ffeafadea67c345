package com.minicrm.backend.rules;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Typed operand of a rule. The set of variants is closed: number, string, date,
 * boolean and arrays of those.
 */
public abstract class RuleValue {

    private RuleValue() {
    }

    /**
     * Value as the MongoDB driver expects it inside a query document.
     */
    public abstract Object toBson();

    /**
     * Value as it appears in the JSON rule definition.
     */
    public abstract Object toJson();

    public static NumberValue number(double value) {
        return new NumberValue(value);
    }

    public static StringValue string(String value) {
        return new StringValue(value);
    }

    public static DateValue date(Instant value) {
        return new DateValue(value);
    }

    public static BoolValue bool(boolean value) {
        return new BoolValue(value);
    }

    public static ArrayValue array(List<? extends RuleValue> values) {
        return new ArrayValue(List.copyOf(values));
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class NumberValue extends RuleValue {

        private final double value;

        private NumberValue(double value) {
            this.value = value;
        }

        public boolean isWholeNumber() {
            return value == Math.rint(value) && !Double.isInfinite(value);
        }

        @Override
        public Object toBson() {
            return value;
        }

        @Override
        public Object toJson() {
            return isWholeNumber() ? (Object) (long) value : (Object) value;
        }

        @Override
        public String toString() {
            return String.valueOf(toJson());
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class StringValue extends RuleValue {

        private final String value;

        private StringValue(String value) {
            this.value = value;
        }

        @Override
        public Object toBson() {
            return value;
        }

        @Override
        public Object toJson() {
            return value;
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class DateValue extends RuleValue {

        private final Instant value;

        private DateValue(Instant value) {
            this.value = value;
        }

        @Override
        public Object toBson() {
            return Date.from(value);
        }

        @Override
        public Object toJson() {
            return value.toString();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class BoolValue extends RuleValue {

        private final boolean value;

        private BoolValue(boolean value) {
            this.value = value;
        }

        @Override
        public Object toBson() {
            return value;
        }

        @Override
        public Object toJson() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class ArrayValue extends RuleValue {

        private final List<RuleValue> values;

        private ArrayValue(List<RuleValue> values) {
            this.values = values;
        }

        public int size() {
            return values.size();
        }

        public RuleValue get(int index) {
            return values.get(index);
        }

        @Override
        public Object toBson() {
            return values.stream().map(RuleValue::toBson).collect(Collectors.toList());
        }

        @Override
        public Object toJson() {
            return values.stream().map(RuleValue::toJson).collect(Collectors.toList());
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
