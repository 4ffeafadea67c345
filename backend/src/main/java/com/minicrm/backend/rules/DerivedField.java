package com.minicrm.backend.rules;

import org.bson.Document;

import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Fields computed at query time from the customer record and its joined order history.
 * Each expression is self-contained so any subset can be materialized in one
 * {@code $addFields} stage.
 */
public enum DerivedField {

    ORDER_COUNT("orderCount", true) {
        @Override
        public Object expression(Instant now) {
            return new Document("$size", ORDERS_REF);
        }
    },
    AVERAGE_ORDER_VALUE("averageOrderValue", true) {
        @Override
        public Object expression(Instant now) {
            return conditional(
                    new Document("$gt", List.of(new Document("$size", ORDERS_REF), 0)),
                    new Document("$avg", ORDERS_REF + ".amount"));
        }
    },
    LAST_ORDER_DATE("lastOrderDate", true) {
        @Override
        public Object expression(Instant now) {
            return lastOrderDate();
        }
    },
    LAST_ORDER_DAYS_AGO("lastOrderDaysAgo", true) {
        @Override
        public Object expression(Instant now) {
            return daysSince(lastOrderDate(), now);
        }
    },
    DAYS_SINCE_LAST_VISIT("daysSinceLastVisit", false) {
        @Override
        public Object expression(Instant now) {
            return daysSince("$lastVisit", now);
        }
    },
    REGISTRATION_DAYS_AGO("registrationDaysAgo", false) {
        @Override
        public Object expression(Instant now) {
            return daysSince("$registrationDate", now);
        }
    };

    public static final String ORDERS_COLLECTION = "orders";
    public static final String ORDERS_ALIAS = "_orders";
    public static final long MILLIS_PER_DAY = 86_400_000L;

    private static final String ORDERS_REF = "$" + ORDERS_ALIAS;

    private final String fieldName;
    private final boolean requiresOrders;

    DerivedField(String fieldName, boolean requiresOrders) {
        this.fieldName = fieldName;
        this.requiresOrders = requiresOrders;
    }

    public String getFieldName() {
        return fieldName;
    }

    public boolean requiresOrders() {
        return requiresOrders;
    }

    /**
     * Aggregation expression computing this field as of {@code now}.
     */
    public abstract Object expression(Instant now);

    private static Document lastOrderDate() {
        return new Document("$max", ORDERS_REF + ".orderDate");
    }

    /**
     * Whole days elapsed since {@code dateExpression}, rounded up, or null when the date is absent.
     */
    static Document daysSince(Object dateExpression, Instant now) {
        Document elapsed = new Document("$subtract", List.of(Date.from(now), dateExpression));
        Document days = new Document("$ceil", new Document("$divide", List.of(elapsed, MILLIS_PER_DAY)));
        return conditional(new Document("$eq", List.of(new Document("$type", dateExpression), "date")), days);
    }

    /**
     * {@code $cond} yielding {@code then} when {@code condition} holds and null otherwise.
     */
    private static Document conditional(Document condition, Document then) {
        return new Document("$cond", new Document()
                .append("if", condition)
                .append("then", then)
                .append("else", null));
    }

    /**
     * The {@code $lookup} stage joining a customer to its orders.
     */
    public static Document orderLookupStage() {
        return new Document("$lookup", new Document()
                .append("from", ORDERS_COLLECTION)
                .append("localField", "customerId")
                .append("foreignField", "customerId")
                .append("as", ORDERS_ALIAS));
    }
}
