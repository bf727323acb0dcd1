package com.noodles.opgraph.core;

/**
 * Holds the most recent value an operator produced for one output field.
 */
public final class OutputCell {
    private final String name;
    private Object value;

    OutputCell(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Object value() {
        return value;
    }

    public void set(Object value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "OutputCell[" + name + "=" + value + "]";
    }
}
