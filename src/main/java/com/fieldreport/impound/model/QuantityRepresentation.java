package com.fieldreport.impound.model;

/**
 * How a record's box count arrived: as a JSON number or as a numeric string.
 * The store keeps the integer; this tag lets views hand the value back the same way.
 */
public enum QuantityRepresentation {
    NUMERIC,
    TEXT;

    public Object render(int quantity) {
        return this == TEXT ? Integer.toString(quantity) : quantity;
    }

    public static QuantityRepresentation of(Object raw) {
        return raw instanceof CharSequence ? TEXT : NUMERIC;
    }
}
