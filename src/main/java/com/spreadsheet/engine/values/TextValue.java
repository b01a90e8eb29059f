package com.spreadsheet.engine.values;

import java.util.Objects;

/**
 * A text cell value.
 */
public final class TextValue extends Value {

    private final String text;

    public TextValue(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public ValueType getType() {
        return ValueType.TEXT;
    }

    @Override
    public Object toJson() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TextValue)) {
            return false;
        }
        return text.equals(((TextValue) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
