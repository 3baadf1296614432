package org.sheetcalc.engine.execution;

@FunctionalInterface
public interface ValueChangedListener {

    void valueChanged(ValueChangedEvent event);
}
