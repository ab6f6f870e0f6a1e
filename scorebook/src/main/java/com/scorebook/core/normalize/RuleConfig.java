package com.scorebook.core.normalize;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scorebook.core.model.OutcomeKind;

import java.util.List;

/** Forma YAML de un archivo de reglas. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RuleConfig {
    public List<RuleDef> rules;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RuleDef {
        public String id;
        public OutcomeKind kind;
        public String pattern;                          // regex, sin distinguir mayúsculas
        public double confidence = 1.0;
        public String batter = "OUT";                   // FIRST | SECOND | THIRD | HOME | OUT | AT_BAT
        public AdvancePolicy advance = AdvancePolicy.HOLD;
        public boolean error;                           // el avance de corredores es por falla defensiva
        public String notation;                         // plantilla: ${relay} ${fielder} ${errorFielder}
    }
}
