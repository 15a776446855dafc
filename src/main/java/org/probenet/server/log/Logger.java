package org.probenet.server.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.FormattedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

/**
 * Thin facade over Log4j {@link ExtendedLogger} keeping the caller location intact.
 */
public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public void error(Object message) {
        log(Level.ERROR, message, null);
    }

    public void error(Object message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    public void error(Object message, Object... params) {
        log(Level.ERROR, message.toString(), params);
    }

    public void warn(Object message) {
        log(Level.WARN, message, null);
    }

    public void warn(Object message, Throwable t) {
        log(Level.WARN, message, t);
    }

    public void warn(Object message, Object... params) {
        log(Level.WARN, message.toString(), params);
    }

    public void info(Object message) {
        log(Level.INFO, message, null);
    }

    public void info(Object message, Object... params) {
        log(Level.INFO, message.toString(), params);
    }

    public void debug(Object message) {
        log(Level.DEBUG, message, null);
    }

    public void debug(Object message, Throwable t) {
        log(Level.DEBUG, message, t);
    }

    public void debug(Object message, Object... params) {
        log(Level.DEBUG, message.toString(), params);
    }

    private void log(Level level, Object message, Throwable t) {
        delegate.logIfEnabled(FQCN, level, null, message, t);
    }

    private void log(Level level, String message, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, new FormattedMessage(message, params), null);
    }
}
