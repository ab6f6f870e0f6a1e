package com.scorebook.core.normalize;

import com.scorebook.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Convierte la plantilla de la regla en un {@link PlayEvent} concreto: destino del bateador, movimiento de
 * cada corredor del contexto, fielders, RBI y notación.
 * <p>
 * Si la descripción detalla corredores ("Freeman to 3rd.") se usa eso, y los no mencionados sólo se mueven
 * si están forzados. Si no nombra ninguno se aplica la {@link AdvancePolicy} de la regla.
 */
final class AdvancementResolver {
    private static final Logger log = LoggerFactory.getLogger(AdvancementResolver.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final Set<OutcomeKind> NO_RBI =
            EnumSet.of(OutcomeKind.DOUBLE_PLAY, OutcomeKind.TRIPLE_PLAY, OutcomeKind.ERROR);

    PlayEvent resolve(CompiledRule rule, RawPlay raw, PlayContext ctx, String text) {
        List<Runner> runners = ctx.baseState().runners();
        boolean atBat = rule.batterStaysAtBat();

        Base batterDest = rule.batterBase();
        boolean batterOut = rule.batterOut();
        boolean batterMisplay = rule.kind().reachesOnMisplay();

        // --- movimientos detallados ---
        Map<String, RunnerClause> explicit = new LinkedHashMap<>();
        for (RunnerClause c : RunnerClauses.parse(text)) {
            String who = identify(c.name(), runners, atBat ? null : raw);
            if (who == null) {
                log.debug("Ignoring clause for unknown player '{}' in: {}", c.name(), text);
            } else if (who.equals(raw.batterId()) && !atBat) {
                batterOut = c.out();
                batterDest = c.out() ? null : c.base();
                batterMisplay |= c.onMisplay();
            } else {
                explicit.put(who, c);
            }
        }

        // --- por defecto ---
        Map<String, Base> targets = new HashMap<>();
        Set<String> outs = new LinkedHashSet<>();
        List<String> policyOuts = new ArrayList<>();
        applyPolicy(rule.advance(), runners, targets, policyOuts);
        if (explicit.isEmpty()) {
            outs.addAll(policyOuts);
        } else {
            for (Runner r : runners) targets.put(r.playerId(), r.base());
            int expected = expectedOuts(rule.kind());
            int recorded = (batterOut ? 1 : 0) + (int) explicit.values().stream().filter(RunnerClause::out).count();
            for (String id : policyOuts) {
                if (recorded >= expected) break;
                if (explicit.containsKey(id)) continue;
                outs.add(id);
                recorded++;
            }
        }
        for (var en : explicit.entrySet()) {
            if (en.getValue().out()) outs.add(en.getKey());
            else targets.put(en.getKey(), en.getValue().base());
        }
        applyForces(runners, batterDest, targets, outs, explicit.keySet());

        // --- armado ---
        List<RunnerAdvance> advances = new ArrayList<>(runners.size());
        for (Runner r : runners) {
            String id = r.playerId();
            if (outs.contains(id)) {
                advances.add(RunnerAdvance.out(r));
                continue;
            }
            Base to = targets.get(id);
            boolean moved = to != r.base();
            RunnerClause c = explicit.get(id);
            boolean misplay = moved && (rule.error() || (c != null && c.onMisplay()));
            advances.add(RunnerAdvance.to(r, to, misplay));
        }

        List<Integer> fielders = Fielders.parse(text);
        Integer errorFielder = Fielders.errorFielder(text);
        int errors = Fielders.errorCount(text);
        if (rule.kind() == OutcomeKind.CATCHER_INTERFERENCE) {
            // se anota como error del receptor (E2) aunque el texto no diga "error"
            errors = Math.max(errors, 1);
            if (errorFielder == null) errorFielder = 2;
        }

        int rbi = 0;
        if (rule.kind().endsPlateAppearance() && !NO_RBI.contains(rule.kind())) {
            for (RunnerAdvance a : advances) if (a.scores() && !a.onMisplay()) rbi++;
            if (batterDest == Base.HOME && !batterMisplay) rbi++;
        }

        return PlayEvent.builder()
                .kind(rule.kind())
                .batter(raw.batterId(), raw.batterName())
                .batterDestination(batterDest)
                .batterOut(batterOut)
                .batterOnMisplay(batterDest != null && batterMisplay)
                .advances(advances)
                .fielders(fielders)
                .errorFielder(errorFielder)
                .errors(errors)
                .rbi(rbi)
                .cleanOuts(errors == 0)
                .ruleId(rule.id())
                .confidence(rule.confidence())
                .notation(notation(rule.notation(), fielders, errorFielder))
                .description(raw.description())
                .build();
    }

    /** Out genérico con todos los corredores quietos; se usa cuando ninguna regla reconoce el texto. */
    static PlayEvent fallback(RawPlay raw, PlayContext ctx) {
        List<RunnerAdvance> holds = new ArrayList<>();
        for (Runner r : ctx.baseState().runners()) holds.add(RunnerAdvance.hold(r));
        return PlayEvent.builder()
                .kind(OutcomeKind.GENERIC_OUT)
                .batter(raw.batterId(), raw.batterName())
                .batterOut(true)
                .advances(holds)
                .confidence(0.0)
                .fallback(true)
                .notation("-")
                .description(raw.description())
                .build();
    }

    // ===== Políticas =====

    private static void applyPolicy(AdvancePolicy policy, List<Runner> runners,
                                    Map<String, Base> targets, List<String> outs) {
        for (Runner r : runners) {
            Base t = switch (policy) {
                case PLUS_ONE -> r.base().plus(1);
                case PLUS_TWO -> r.base().plus(2);
                case SCORE_ALL -> Base.HOME;
                case SAC_FLY -> r.base() == Base.THIRD ? Base.HOME : r.base();
                default -> r.base();
            };
            targets.put(r.playerId(), t);
        }
        if (runners.isEmpty()) return;
        Runner lead = runners.get(runners.size() - 1);
        switch (policy) {
            case FORCE_OUT_LEAD -> {
                Runner forced = null;
                for (Runner r : runners) {
                    if (r.base().number() == (forced == null ? 1 : forced.base().number() + 1)) forced = r;
                    else break;
                }
                outs.add((forced != null ? forced : lead).playerId());
            }
            case DOUBLE_PLAY -> outs.add(runners.get(0).base() == Base.FIRST
                    ? runners.get(0).playerId() : lead.playerId());
            case LINE_DOUBLE_PLAY, CAUGHT_STEALING -> outs.add(lead.playerId());
            case TRIPLE_PLAY -> runners.stream().limit(2).forEach(r -> outs.add(r.playerId()));
            case STEAL -> targets.put(lead.playerId(), lead.base().plus(1));
            default -> { }
        }
    }

    /** Empuja a los corredores forzados por el bateador (o por el corredor de atrás); los detallados mantienen su base. */
    private static void applyForces(List<Runner> runners, Base batterDest, Map<String, Base> targets,
                                    Set<String> outs, Set<String> explicit) {
        int chain = batterDest == null ? 0 : batterDest.number();
        for (Runner r : runners) {
            String id = r.playerId();
            if (outs.contains(id)) continue;
            if (r.base().number() > chain) continue;
            Base t = targets.get(id);
            if (!explicit.contains(id) && t.number() <= chain) t = Base.of(Math.min(4, chain + 1));
            targets.put(id, t);
            chain = t.number();
        }
    }

    private static int expectedOuts(OutcomeKind kind) {
        return switch (kind) {
            case DOUBLE_PLAY -> 2;
            case TRIPLE_PLAY -> 3;
            case FIELDERS_CHOICE, CAUGHT_STEALING -> 1;
            default -> 0;
        };
    }

    /** Primero nombres exactos, después apellidos; corredores antes que el bateador. */
    private static String identify(String written, List<Runner> runners, RawPlay batter) {
        String w = RunnerClauses.normalizeName(written);
        for (Runner r : runners) {
            if (w.equals(RunnerClauses.normalizeName(r.name())) || w.equals(RunnerClauses.normalizeName(r.playerId()))) {
                return r.playerId();
            }
        }
        if (batter != null && (w.equals(RunnerClauses.normalizeName(batter.batterName()))
                || w.equals(RunnerClauses.normalizeName(batter.batterId())))) {
            return batter.batterId();
        }
        for (Runner r : runners) {
            if (RunnerClauses.names(written, r.name(), r.playerId())) return r.playerId();
        }
        if (batter != null && RunnerClauses.names(written, batter.batterName(), batter.batterId())) {
            return batter.batterId();
        }
        return null;
    }

    // ===== Notación =====

    static String notation(String template, List<Integer> fielders, Integer errorFielder) {
        if (template == null || template.isBlank()) return "-";
        Map<String, String> ctx = new HashMap<>();
        ctx.put("fielder", fielders.isEmpty() ? "" : String.valueOf(fielders.get(0)));
        ctx.put("relay", relay(fielders));
        ctx.put("errorFielder", errorFielder == null ? "" : String.valueOf(errorFielder));
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(ctx.getOrDefault(m.group(1), "")));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String relay(List<Integer> fielders) {
        if (fielders.isEmpty()) return "";
        if (fielders.size() == 1) return fielders.get(0) + "U";
        StringJoiner j = new StringJoiner("-");
        for (Integer f : fielders) j.add(String.valueOf(f));
        return j.toString();
    }
}
