package org.mbasiconjava.frontend.astnode;

import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A parsed program: lines in ascending order plus the per-letter default
 * types that DEFINT/DEFSNG/DEFDBL/DEFSTR established while parsing.
 * <p>
 * Instances are immutable; the engine only reads them.
 */
public final class Program {
    private final List<Line> lines;
    private final VarType[] defaultTypes = new VarType[26];

    public Program(List<Line> lines) {
        this(lines, Map.of());
    }

    public Program(List<Line> lines, Map<Character, VarType> defaultTypes) {
        List<Line> sorted = new ArrayList<>(lines);
        sorted.sort((a, b) -> Integer.compare(a.number(), b.number()));
        this.lines = Collections.unmodifiableList(sorted);
        Arrays.fill(this.defaultTypes, VarType.SINGLE);
        defaultTypes.forEach((letter, type) -> {
            char c = Character.toLowerCase(letter);
            if (c >= 'a' && c <= 'z') {
                this.defaultTypes[c - 'a'] = type;
            }
        });
    }

    public static Program of(Line... lines) {
        return new Program(Arrays.asList(lines));
    }

    public List<Line> lines() {
        return lines;
    }

    /**
     * Default type for untyped names starting with the given letter.
     */
    public VarType defaultType(char letter) {
        char c = Character.toLowerCase(letter);
        if (c < 'a' || c > 'z') {
            return VarType.SINGLE;
        }
        return defaultTypes[c - 'a'];
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
