package com.synclab.laddersim.engine.state;

/**
 * Read access to one generation of simulation values. Absent entries return {@code null}.
 */
public interface StateView {

    Boolean tag(String name);

    Double numeric(String name);

    TimerState timer(String name);

    CounterState counter(String name);
}
