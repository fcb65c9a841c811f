package org.celconform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import org.celconform.errors.ErrorCategory;
import org.celconform.errors.ErrorClassifier;
import org.celconform.errors.ErrorMatchPolicy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of the {@code celconform} configuration block.
 *
 * @param errorMatch   The error match strictness ({@code celconform.error-match}).
 * @param errorAliases Alternative error phrasings and their categories ({@code celconform.error-aliases}).
 */
public record ConformanceSettings(ErrorMatchPolicy errorMatch, Map<String, ErrorCategory> errorAliases) {

    static final String ERROR_MATCH_PATH = "celconform.error-match";
    static final String ERROR_ALIASES_PATH = "celconform.error-aliases";

    public ConformanceSettings {
        errorAliases = Map.copyOf(errorAliases);
    }

    /**
     * @return The settings from {@link ConfigLoader#load()}.
     */
    public static ConformanceSettings load() {
        return from(ConfigLoader.load());
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The configuration, with the reference defaults as fallback.
     * @return The settings.
     * @throws ConfigException.BadValue if the policy or an alias category is not recognized.
     */
    public static ConformanceSettings from(Config config) {
        ErrorMatchPolicy policy;
        try {
            policy = ErrorMatchPolicy.parse(config.getString(ERROR_MATCH_PATH));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(ERROR_MATCH_PATH, e.getMessage(), e);
        }

        // Alias keys are free text with spaces, so read them as an object rather than as paths.
        ConfigObject aliasObject = config.getObject(ERROR_ALIASES_PATH);
        Map<String, ErrorCategory> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : aliasObject.entrySet()) {
            String identifier = String.valueOf(entry.getValue().unwrapped());
            ErrorCategory category = ErrorCategory.fromIdentifier(identifier).orElseThrow(() ->
                    new ConfigException.BadValue(entry.getValue().origin(), ERROR_ALIASES_PATH,
                            "Unknown error category '" + identifier + "' for alias '" + entry.getKey() + "'"));
            aliases.put(entry.getKey(), category);
        }
        return new ConformanceSettings(policy, aliases);
    }

    /**
     * @return A classifier using the configured alias table.
     */
    public ErrorClassifier newClassifier() {
        return new ErrorClassifier(errorAliases);
    }
}
