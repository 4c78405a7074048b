package com.skyfuse.weather.model;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Maps free-form provider condition text (e.g. "Patchy light rain", "Partly cloudy")
 * onto a {@link WeatherCondition}.
 *
 * The text is first cleaned of provider modifiers, then matched against an ordered rule list.
 * The first rule whose keyword matches decides, so "cloudy with rain" is CLOUDY, not rain.
 */
public final class ConditionClassifier {

    private static final List<Rewrite> REWRITES = List.of(
            new Rewrite("shower", ""),
            new Rewrite("at times", ""),
            new Rewrite("slight", "light"),
            new Rewrite("fall", ""),
            new Rewrite("partly", "partially"),
            new Rewrite("patchy", "light"),
            new Rewrite("violent", "heavy")
    );

    private static final List<Rule> RULES = List.of(
            new Rule(text -> text.contains("clear") || text.contains("sunny"), text -> WeatherCondition.CLEAR),
            new Rule(text -> text.contains("cloudy"), text -> text.contains("partially")
                    ? WeatherCondition.PARTIALLY_CLOUDY
                    : WeatherCondition.CLOUDY),
            new Rule(text -> text.contains("drizzle"), text -> WeatherCondition.DRIZZLE),
            new Rule(text -> text.contains("rain"), text -> byIntensity(text,
                    WeatherCondition.LIGHT_RAIN, WeatherCondition.MODERATE_RAIN, WeatherCondition.HEAVY_RAIN)),
            new Rule(text -> text.contains("snow"), text -> byIntensity(text,
                    WeatherCondition.LIGHT_SNOW, WeatherCondition.MODERATE_SNOW, WeatherCondition.HEAVY_SNOW)),
            new Rule(text -> text.contains("mist"), text -> WeatherCondition.MIST),
            new Rule(text -> text.contains("fog"), text -> WeatherCondition.FOG),
            new Rule(text -> text.contains("overcast"), text -> WeatherCondition.OVERCAST)
    );

    private ConditionClassifier() {}

    public static WeatherCondition classify(String conditionText) {
        if (conditionText == null || conditionText.isBlank()) return WeatherCondition.UNRECOGNIZED;

        String cleaned = clean(conditionText);
        for (Rule rule : RULES) {
            if (rule.matches().test(cleaned)) {
                return rule.resolve().apply(cleaned);
            }
        }
        return WeatherCondition.UNRECOGNIZED;
    }

    // Rewrites are applied in declaration order; later ones see the output of earlier ones.
    static String clean(String conditionText) {
        String cleaned = conditionText.toLowerCase(Locale.ROOT);
        for (Rewrite rewrite : REWRITES) {
            cleaned = cleaned.replace(rewrite.target(), rewrite.replacement());
        }
        return cleaned.trim();
    }

    private static WeatherCondition byIntensity(String text,
                                                WeatherCondition light,
                                                WeatherCondition moderate,
                                                WeatherCondition heavy) {
        if (text.contains("light")) return light;
        if (text.contains("moderate")) return moderate;
        if (text.contains("heavy")) return heavy;
        return moderate;
    }

    private record Rewrite(String target, String replacement) {}

    private record Rule(Predicate<String> matches, Function<String, WeatherCondition> resolve) {}
}
