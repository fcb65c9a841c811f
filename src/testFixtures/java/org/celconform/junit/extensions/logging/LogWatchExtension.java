package org.celconform.junit.extensions.logging;

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

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fails a test on unexpected WARN/ERROR log events and on missing expected ones.
 * <p>
 * Rules come from {@link FailOnLog}, {@link AllowLog} and {@link ExpectLog} on the test class
 * and method. Allowed and expected events are captured and suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.rules = resolveRules(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        ValidationRules rules = filter.rules;
        List<CapturedEvent> events = new ArrayList<>(filter.events);
        filter.events.clear();

        StringBuilder failures = new StringBuilder();
        if (!rules.disabled()) {
            for (CapturedEvent event : events) {
                if (event.level().isGreaterOrEqual(CapturedEvent.toLogback(rules.minLevel()))
                        && !rules.isAllowed(event) && !rules.isExpected(event)) {
                    failures.append("Unexpected log: ").append(event).append('\n');
                }
            }
        }
        for (ExpectLog expected : rules.expects()) {
            long count = events.stream()
                    .filter(e -> e.matches(expected.level(), expected.loggerPattern(), expected.messagePattern()))
                    .count();
            if (count < expected.occurrences()) {
                failures.append(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d%n",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (failures.length() > 0) {
            throw new AssertionError(failures.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static ValidationRules resolveRules(ExtensionContext context) {
        Optional<AnnotatedElement> method = context.getTestMethod().map(m -> m);
        Optional<AnnotatedElement> type = context.getTestClass().map(c -> c);
        FailOnLog fail = method.map(m -> m.getAnnotation(FailOnLog.class))
                .orElseGet(() -> type.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new ValidationRules(minLevel, disabled,
                collect(type, method, AllowLog.class), collect(type, method, ExpectLog.class));
    }

    private static <A extends java.lang.annotation.Annotation> List<A> collect(
            Optional<AnnotatedElement> type, Optional<AnnotatedElement> method, Class<A> annotation) {
        List<A> merged = new ArrayList<>();
        type.ifPresent(t -> merged.addAll(Arrays.asList(t.getAnnotationsByType(annotation))));
        method.ifPresent(m -> merged.addAll(Arrays.asList(m.getAnnotationsByType(annotation))));
        return merged;
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile ValidationRules rules;

        private CapturingFilter(ValidationRules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Level.INFO is the lowest level any rule can name.
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            ValidationRules current = rules;
            if (current.isAllowed(event) || current.isExpected(event)) {
                return FilterReply.DENY;
            }
            return FilterReply.NEUTRAL;
        }
    }
}
