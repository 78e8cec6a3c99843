package org.pulsecheck.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above without declaring it.
 * <p>
 * Events can be permitted with {@link AllowLog} or required with {@link ExpectLog}, on the
 * class or the test method. Permitted and expected events are suppressed from the output.
 * Events logged by probe worker threads are captured as well, since the filter is installed
 * on the shared logger context for the whole test class.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingTurboFilter filter = new CapturingTurboFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingTurboFilter filter = filter(context);
        if (filter != null) {
            filter.rules = resolveRules(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (CapturedEvent event : events) {
                if (!rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects()) {
            long count = events.stream()
                .filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern()))
                .count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingTurboFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingTurboFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingTurboFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
            .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        return new Rules(
            fail != null ? fail.level() : LogLevel.WARN,
            fail != null && fail.disabled(),
            collect(context, AllowLog.class),
            collect(context, ExpectLog.class));
    }

    private static <A extends Annotation> List<A> collect(ExtensionContext context, Class<A> type) {
        List<A> result = new ArrayList<>();
        context.getTestClass().ifPresent(c -> result.addAll(Arrays.asList(c.getAnnotationsByType(type))));
        context.getTestMethod().ifPresent(m -> result.addAll(Arrays.asList(m.getAnnotationsByType(type))));
        return result;
    }

    private static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.loggerName())
            && Pattern.matches(messagePattern, event.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
        boolean permits(CapturedEvent event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingTurboFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            Rules current = rules;
            // decide() is also consulted by isXxxEnabled() checks, which carry no format
            if (format == null || !level.isGreaterOrEqual(toLogback(current.minLevel()))) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
