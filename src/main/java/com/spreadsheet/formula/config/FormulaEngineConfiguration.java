package com.spreadsheet.formula.config;

import com.spreadsheet.formula.functions.FormulaFunction;
import com.spreadsheet.formula.functions.FunctionHelpers;
import com.spreadsheet.formula.functions.FunctionRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Shared engine beans. Every FormulaFunction bean in the context
 * ends up in the registry.
 */
@Configuration
public class FormulaEngineConfiguration {

    @Bean
    public FunctionHelpers functionHelpers(FormulaProperties properties) {
        return new FunctionHelpers(Locale.forLanguageTag(properties.getCollationLocale()));
    }

    @Bean
    public FunctionRegistry functionRegistry(ObjectProvider<FormulaFunction> functions, FormulaProperties properties) {
        return new FunctionRegistry(functions.orderedStream().collect(Collectors.toList()),
                properties.getCompatibilityPrefixes());
    }
}
