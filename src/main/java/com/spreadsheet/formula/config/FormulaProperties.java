package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Settings under the "formula." prefix:
 * - formula.collation-locale: language tag of the locale used to order text
 * - formula.compatibility-prefixes: function name prefixes ignored on lookup
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {
    private String collationLocale = "en-US";
    private List<String> compatibilityPrefixes = new ArrayList<>(Arrays.asList("_xlfn.", "_xlws."));

    public String getCollationLocale() {
        return collationLocale;
    }

    public void setCollationLocale(String collationLocale) {
        this.collationLocale = collationLocale;
    }

    public List<String> getCompatibilityPrefixes() {
        return compatibilityPrefixes;
    }

    public void setCompatibilityPrefixes(List<String> compatibilityPrefixes) {
        this.compatibilityPrefixes = compatibilityPrefixes == null ? new ArrayList<>() : compatibilityPrefixes;
    }
}
