package org.celconform.translate;

import org.celconform.fixture.TypeBinding;
import org.celconform.fixture.TypeKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a fixture's type-environment declarations into the annotation map handed to the
 * evaluator.
 * <p>
 * The builder does not check that the named types exist or agree with each other; that is
 * the evaluator's job when it compiles the expression.
 */
public final class TypeEnvironmentBuilder {

    /**
     * Builds the annotation map. A name declared twice keeps its last annotation.
     *
     * @param bindings The declarations, in fixture order.
     * @return An insertion-ordered map of name to annotation.
     */
    public Map<String, TypeAnnotation> build(List<TypeBinding> bindings) {
        Map<String, TypeAnnotation> annotations = new LinkedHashMap<>();
        for (TypeBinding binding : bindings) {
            annotations.put(binding.name(), annotate(binding));
        }
        return annotations;
    }

    /**
     * @param binding One declaration.
     * @return Its annotation.
     */
    public TypeAnnotation annotate(TypeBinding binding) {
        if (binding instanceof TypeBinding.Prebuilt prebuilt) {
            return new TypeAnnotation.Prebuilt(prebuilt.instance());
        }
        TypeBinding.Declared declared = (TypeBinding.Declared) binding;
        if (declared.kind() == TypeKind.MAP_TYPE) {
            return new TypeAnnotation.Declared("Map[" + String.join(", ", declared.typeIdentifiers()) + "]");
        }
        return new TypeAnnotation.Declared(declared.typeIdentifiers().get(0));
    }
}
