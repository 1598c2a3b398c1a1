package io.dense63.logging;

import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.util.List;

/**
 * Logger that appends every call, at every level, to a shared event list.
 */
public final class RecordingLogger extends LegacyAbstractLogger {

    private final transient List<Event> sink;

    RecordingLogger(String name, List<Event> sink) {
        this.name = name;
        this.sink = sink;
    }

    @Override
    public boolean isTraceEnabled() {
        return true;
    }

    @Override
    public boolean isDebugEnabled() {
        return true;
    }

    @Override
    public boolean isInfoEnabled() {
        return true;
    }

    @Override
    public boolean isWarnEnabled() {
        return true;
    }

    @Override
    public boolean isErrorEnabled() {
        return true;
    }

    @Override
    protected String getFullyQualifiedCallerName() {
        return null;
    }

    @Override
    protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
                                               Object[] arguments, Throwable throwable) {
        sink.add(new Event(name, level, MessageFormatter.basicArrayFormat(messagePattern, arguments)));
    }

    public record Event(String logger, Level level, String message) {
    }
}
