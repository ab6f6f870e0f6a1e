package com.scorebook.core.normalize;

import com.scorebook.core.model.Base;
import com.scorebook.core.model.OutcomeKind;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/** Un {@link RuleConfig.RuleDef} con el pattern compilado y el destino del bateador parseado. */
record CompiledRule(
        String id,
        OutcomeKind kind,
        Pattern pattern,
        double confidence,
        Base batterBase,
        boolean batterOut,
        boolean batterStaysAtBat,
        AdvancePolicy advance,
        boolean error,
        String notation
) {
    static CompiledRule compile(RuleConfig.RuleDef def) {
        Objects.requireNonNull(def.id, "rule id");
        Objects.requireNonNull(def.kind, "kind of rule " + def.id);
        Objects.requireNonNull(def.pattern, "pattern of rule " + def.id);
        String batter = def.batter == null ? "OUT" : def.batter.trim().toUpperCase(Locale.ROOT);
        boolean atBat = batter.equals("AT_BAT");
        boolean out = batter.equals("OUT");
        Base base = atBat || out ? null : Base.valueOf(batter);
        if (atBat == def.kind.endsPlateAppearance()) {
            throw new IllegalArgumentException("Rule " + def.id + ": batter AT_BAT must be used exactly for between-pitch kinds");
        }
        return new CompiledRule(def.id, def.kind,
                Pattern.compile(def.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                def.confidence, base, out, atBat,
                def.advance == null ? AdvancePolicy.HOLD : def.advance,
                def.error, def.notation);
    }
}
