package org.celconform.eval.cel;

import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelIssue;
import dev.cel.common.CelOptions;
import dev.cel.common.CelValidationException;
import dev.cel.common.types.SimpleType;
import dev.cel.compiler.CelCompiler;
import dev.cel.compiler.CelCompilerBuilder;
import dev.cel.compiler.CelCompilerFactory;
import dev.cel.runtime.CelEvaluationException;
import dev.cel.runtime.CelRuntime;
import dev.cel.runtime.CelRuntimeFactory;
import org.celconform.eval.spi.EvaluationException;
import org.celconform.eval.spi.ICompiledExpression;
import org.celconform.eval.spi.IExpressionEvaluator;
import org.celconform.translate.TypeAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link IExpressionEvaluator} backed by the CEL Java runtime.
 * <p>
 * Parse, check and evaluation failures all surface as {@link EvaluationException}s. Their
 * messages are rewritten into the phrasings the conformance suite uses where the CEL error
 * code or message identifies the failure; otherwise the first CEL issue is reported as is,
 * e.g. {@code undeclared reference to 'x' (in container '')}.
 * <p>
 * The CEL runtime raises the same error code and message ({@code / by zero}) for division and
 * for modulus by zero, so both are reported as {@code divide by zero}. A fixture expecting
 * {@code modulus by zero} therefore only passes under the {@code any} error match policy.
 * <p>
 * {@link TypeAnnotation.Prebuilt} annotations are declared as {@code dyn} variables and their
 * instances are added to every activation.
 */
public final class CelExpressionEvaluator implements IExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(CelExpressionEvaluator.class);

    private static final Map<String, String> MESSAGES_BY_ERROR_CODE = Map.of(
            // Also raised for modulus by zero.
            "DIVIDE_BY_ZERO", "divide by zero",
            "NUMERIC_OVERFLOW", "return error for overflow",
            "OVERLOAD_NOT_FOUND", "no matching overload");

    private static final List<Map.Entry<String, String>> MESSAGES_BY_FRAGMENT = List.of(
            Map.entry("by zero", "divide by zero"),
            Map.entry("overflow", "return error for overflow"),
            Map.entry("no matching overload", "no matching overload"));

    private final CelOptions options;
    private final CelRuntime runtime;
    private final AnnotationTypeResolver typeResolver = new AnnotationTypeResolver();

    public CelExpressionEvaluator() {
        this.options = CelOptions.current()
                .enableUnsignedLongs(true)
                .build();
        this.runtime = CelRuntimeFactory.standardCelRuntimeBuilder()
                .setOptions(options)
                .build();
    }

    @Override
    public ICompiledExpression compile(String expression, Map<String, TypeAnnotation> annotations, String container,
                                       boolean checkEnabled) throws EvaluationException {
        CelCompilerBuilder builder = CelCompilerFactory.standardCelCompilerBuilder().setOptions(options);
        if (container != null && !container.isBlank()) {
            builder.setContainer(container);
        }
        Map<String, Object> prebuilt = new LinkedHashMap<>();
        for (Map.Entry<String, TypeAnnotation> entry : annotations.entrySet()) {
            if (entry.getValue() instanceof TypeAnnotation.Prebuilt instance) {
                builder.addVar(entry.getKey(), SimpleType.DYN);
                prebuilt.put(entry.getKey(), instance.instance());
            } else {
                TypeAnnotation.Declared declared = (TypeAnnotation.Declared) entry.getValue();
                builder.addVar(entry.getKey(), typeResolver.resolve(declared.text()));
            }
        }
        CelCompiler compiler = builder.build();

        CelAbstractSyntaxTree ast;
        try {
            ast = checkEnabled ? compiler.compile(expression).getAst() : compiler.parse(expression).getAst();
        } catch (CelValidationException e) {
            throw new EvaluationException(firstIssue(e), e);
        }

        CelRuntime.Program program;
        try {
            program = runtime.createProgram(ast);
        } catch (CelEvaluationException e) {
            throw new EvaluationException(canonicalMessage(e), e);
        }
        return new CompiledCelExpression(program, Collections.unmodifiableMap(prebuilt));
    }

    private static String firstIssue(CelValidationException e) {
        List<CelIssue> issues = e.getErrors();
        if (issues.isEmpty()) {
            return e.getMessage();
        }
        return issues.get(0).getMessage();
    }

    static String canonicalMessage(CelEvaluationException e) {
        String byCode = e.getErrorCode() == null ? null : MESSAGES_BY_ERROR_CODE.get(e.getErrorCode().name());
        if (byCode != null) {
            return byCode;
        }
        String message = e.getMessage() == null ? "" : e.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> fragment : MESSAGES_BY_FRAGMENT) {
            if (lower.contains(fragment.getKey())) {
                return fragment.getValue();
            }
        }
        return message;
    }

    private static final class CompiledCelExpression implements ICompiledExpression {
        private final CelRuntime.Program program;
        private final Map<String, Object> prebuilt;

        private CompiledCelExpression(CelRuntime.Program program, Map<String, Object> prebuilt) {
            this.program = program;
            this.prebuilt = prebuilt;
        }

        @Override
        public Object evaluate(Map<String, Object> activation) throws EvaluationException {
            Map<String, Object> merged = new LinkedHashMap<>(prebuilt);
            merged.putAll(activation);
            try {
                return program.eval(merged);
            } catch (CelEvaluationException e) {
                LOG.debug("CEL evaluation failed with {}: {}", e.getErrorCode(), e.getMessage());
                throw new EvaluationException(canonicalMessage(e), e);
            }
        }
    }
}
