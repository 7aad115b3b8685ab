package com.codeharness.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class EventTypes {

    private EventTypes() {}

    /** Payload: {@code message}, {@code severity}. */
    public static final String COMPILE_PROGRESS = "compile.progress";
    /** Payload: {@code success}. Fires exactly once per {@code compileAll()}. */
    public static final String COMPILE_COMPLETED = "compile.completed";
    /** Payload: {@code testNumber}. */
    public static final String TEST_STARTED = "test.started";
    /** Payload: {@code testNumber}, {@code passed}, {@code record}. */
    public static final String TEST_COMPLETED = "test.completed";
    /** Payload: {@code completed}, {@code total}. */
    public static final String RUN_PROGRESS = "run.progress";
    /** Payload: {@code allPassed}, {@code summary}. Fires exactly once per run. */
    public static final String RUN_COMPLETED = "run.completed";
}
