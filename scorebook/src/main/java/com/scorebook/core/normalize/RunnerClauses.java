package com.scorebook.core.normalize;

import com.scorebook.core.model.Base;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extrae los movimientos de corredores detallados ("Freeman to 3rd.", "Betts scores.", "Judge out at 2nd.")
 * de una descripción. Los nombres salen tal cual están escritos; asociarlos a corredores lo hace el llamador.
 */
final class RunnerClauses {
    private RunnerClauses(){}

    private static final String NAME = "(?<name>\\p{L}[\\p{L}.'\\- ]*?)";
    private static final String BASE = "(?<base>1st|2nd|3rd|home)";

    private static final Pattern SCORES = Pattern.compile("(?i)^" + NAME + "\\s+scores\\b");
    private static final Pattern ADVANCES = Pattern.compile(
            "(?i)^" + NAME + "\\s+(?:to|advances to|moves to|takes)\\s+" + BASE + "\\b");
    private static final Pattern STEALS = Pattern.compile(
            "(?i)^" + NAME + "\\s+steals\\s+" + BASE + "\\b");
    private static final Pattern OUT = Pattern.compile(
            "(?i)^" + NAME + "\\s+(?:out at|thrown out at|tagged out at|forced out at|out stretching at"
            + "|doubled off|picked off and caught stealing|caught stealing|picked off at|picked off)\\s+" + BASE + "\\b");

    // un punto tras sufijo o inicial ("Bobby Witt Jr.", "J. Smith") no corta la oración
    private static final Pattern SENTENCE = Pattern.compile(
            "(?<=\\.)(?<!\\b(?:Jr|Sr|II|III|IV|\\p{Lu})\\.)\\s+");
    private static final Set<String> SUFFIXES = Set.of("jr", "sr", "ii", "iii", "iv");
    private static final Pattern SEGMENT = Pattern.compile(",\\s+|\\s+and\\s+");
    private static final Pattern MISPLAY = Pattern.compile("(?i)\\berror\\b|passed ball");

    static List<RunnerClause> parse(String text) {
        List<RunnerClause> out = new ArrayList<>();
        for (String sentence : SENTENCE.split(text)) {
            boolean misplay = MISPLAY.matcher(sentence).find();
            boolean found = false;
            for (String segment : SEGMENT.split(strip(sentence))) {
                RunnerClause c = match(segment.trim());
                if (c == null) continue;
                out.add(misplay ? c.withMisplay() : c);
                found = true;
            }
            // "Soto to 3rd.  Throwing error by catcher Smith.": el error se carga al movimiento anterior
            if (!found && misplay && !out.isEmpty()) {
                out.set(out.size() - 1, out.get(out.size() - 1).withMisplay());
            }
        }
        return out;
    }

    private static RunnerClause match(String segment) {
        Matcher m = SCORES.matcher(segment);
        if (m.find()) return new RunnerClause(m.group("name").trim(), Base.HOME, false, false);
        m = OUT.matcher(segment);
        if (m.find()) return new RunnerClause(m.group("name").trim(), Base.parse(m.group("base")), true, false);
        m = ADVANCES.matcher(segment);
        if (m.find()) return new RunnerClause(m.group("name").trim(), Base.parse(m.group("base")), false, false);
        m = STEALS.matcher(segment);
        if (m.find()) return new RunnerClause(m.group("name").trim(), Base.parse(m.group("base")), false, false);
        return null;
    }

    private static String strip(String sentence) {
        String s = sentence.trim();
        return s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
    }

    /** Minúsculas, sin acentos, espacios simples. */
    static String normalizeName(String name) {
        String n = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return n.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9 ]", " ").replaceAll("\\s+", " ").trim();
    }

    /** Último token que no sea sufijo (Jr, Sr, II...). */
    static String lastName(String name) {
        String[] tokens = normalizeName(name).split(" ");
        for (int i = tokens.length - 1; i > 0; i--) {
            if (!SUFFIXES.contains(tokens[i])) return tokens[i];
        }
        return tokens[0];
    }

    /** True si {@code written} nombra plausiblemente a {@code fullName} (o {@code playerId}). */
    static boolean names(String written, String fullName, String playerId) {
        String w = normalizeName(written);
        if (w.isEmpty()) return false;
        if (w.equals(normalizeName(playerId))) return true;
        if (fullName == null) return false;
        String full = normalizeName(fullName);
        return w.equals(full) || lastName(written).equals(lastName(fullName));
    }
}
