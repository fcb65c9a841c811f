package org.celconform.junit.extensions.logging;

import java.util.List;

/**
 * The log rules in effect for one test: class-level annotations merged with method-level ones.
 */
record ValidationRules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

    ValidationRules {
        allows = List.copyOf(allows);
        expects = List.copyOf(expects);
    }

    boolean isAllowed(CapturedEvent event) {
        return allows.stream().anyMatch(a -> event.matches(a.level(), a.loggerPattern(), a.messagePattern()));
    }

    boolean isExpected(CapturedEvent event) {
        return expects.stream().anyMatch(e -> event.matches(e.level(), e.loggerPattern(), e.messagePattern()));
    }
}
