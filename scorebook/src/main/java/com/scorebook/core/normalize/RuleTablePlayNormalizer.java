package com.scorebook.core.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.scorebook.config.ScorebookConfig;
import com.scorebook.core.model.PlayContext;
import com.scorebook.core.model.PlayEvent;
import com.scorebook.core.model.RawPlay;
import com.scorebook.core.spi.PlayNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Clasifica el texto de la jugada con una tabla ordenada de reglas regex cargada desde YAML. Las reglas se
 * prueban de arriba hacia abajo: primero la frase más específica ("lines into a double play" antes que "lines out").
 * <p>
 * Campos de cada regla:
 * - kind (obligatorio): variante de resultado
 * - pattern (obligatorio): regex, case-insensitive
 * - confidence: un match por debajo del mínimo configurado no cuenta
 * - batter: FIRST..HOME, OUT, o AT_BAT para eventos entre lanzamientos
 * - advance: política de corredores si el texto no los detalla
 * - error: el movimiento de corredores es por falla defensiva
 * - notation: código de planilla con placeholders ${relay} ${fielder} ${errorFielder}
 */
public class RuleTablePlayNormalizer implements PlayNormalizer {
    private static final Logger log = LoggerFactory.getLogger(RuleTablePlayNormalizer.class);
    private static final Logger unknownPlays = LoggerFactory.getLogger("com.scorebook.unknown-plays");

    private static final Pattern PARENTHETICAL = Pattern.compile("\\(.*?\\)");
    private static final Pattern BLANKS = Pattern.compile("\\s+");

    private final List<CompiledRule> rules;
    private final double minConfidence;
    private final AdvancementResolver resolver = new AdvancementResolver();

    public RuleTablePlayNormalizer(InputStream yaml, double minConfidence) {
        this(List.of(yaml), minConfidence);
    }

    public RuleTablePlayNormalizer(List<InputStream> yamls, double minConfidence) {
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        List<CompiledRule> list = new ArrayList<>();
        for (InputStream yaml : yamls) {
            try {
                RuleConfig cfg = om.readValue(yaml, RuleConfig.class);
                list.addAll(compile(cfg));
            } catch (IOException e) {
                throw new UncheckedIOException("Error loading play rules", e);
            }
        }
        if (list.isEmpty()) throw new IllegalArgumentException("No play rules loaded");
        this.rules = List.copyOf(list);
        this.minConfidence = minConfidence;
        log.info("Loaded {} play rules (min confidence {})", rules.size(), minConfidence);
    }

    /** Carga del classpath cada recurso de reglas que nombra la config. */
    public static RuleTablePlayNormalizer fromConfig(ScorebookConfig config) {
        List<InputStream> streams = new ArrayList<>();
        try {
            for (String resource : config.rules) {
                InputStream in = RuleTablePlayNormalizer.class.getClassLoader().getResourceAsStream(resource);
                if (in == null) throw new IllegalArgumentException("Rules resource not found: " + resource);
                streams.add(in);
            }
            return new RuleTablePlayNormalizer(streams, config.minRuleConfidence);
        } finally {
            for (InputStream in : streams) {
                try { in.close(); } catch (IOException e) { log.warn("Could not close rules stream: {}", e.toString()); }
            }
        }
    }

    @Override
    public PlayEvent normalize(RawPlay raw, PlayContext context) {
        String text = clean(raw.description());
        CompiledRule weak = null;
        if (!text.isEmpty()) {
            for (CompiledRule r : rules) {
                if (!r.pattern().matcher(text).find()) continue;
                if (r.confidence() < minConfidence) {
                    if (weak == null) weak = r;
                    continue;
                }
                PlayEvent event = resolver.resolve(r, raw, context, text);
                log.debug("{} [{}] -> {}", raw.label(), r.id(), event);
                return event;
            }
        }

        unknownPlays.warn("{}", raw.description());
        String detail = weak == null ? null
                : "only rule '" + weak.id() + "' matched, confidence " + weak.confidence() + " < " + minConfidence;
        throw new UnrecognizedPlayPatternException(raw.description(), detail, AdvancementResolver.fallback(raw, context));
    }

    public int ruleCount() { return rules.size(); }

    static String clean(String description) {
        if (description == null) return "";
        String s = PARENTHETICAL.matcher(description).replaceAll("");
        return BLANKS.matcher(s).replaceAll(" ").trim();
    }

    private static List<CompiledRule> compile(RuleConfig cfg) {
        List<CompiledRule> list = new ArrayList<>();
        if (cfg == null || cfg.rules == null) return list;
        for (var def : cfg.rules) list.add(CompiledRule.compile(def));
        return list;
    }
}
