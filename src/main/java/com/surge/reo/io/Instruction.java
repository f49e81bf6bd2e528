package com.surge.reo.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One parsed line of the SODG construction language, e.g.
 * {@code BIND(ν0, $ν1, foo);}.
 *
 * @param op   upper-case opcode
 * @param args raw arguments, trimmed and unquoted
 * @param line 1-based line number in the source
 * @param text the original line
 */
public record Instruction(Op op, List<String> args, int line, String text) {

    private static final Pattern LINE = Pattern.compile("^([A-Z]+)\\s*\\((.*)\\)\\s*;\\s*$");

    /** The three primitive construction instructions. */
    public enum Op {
        ADD(1),
        BIND(3),
        PUT(2);

        private final int arity;

        Op(int arity) {
            this.arity = arity;
        }

        public int arity() {
            return arity;
        }

        static Op of(String name) {
            return switch (name) {
                case "ADD" -> ADD;
                case "BIND" -> BIND;
                case "PUT", "DATA" -> PUT;
                default -> null;
            };
        }
    }

    /**
     * Parses one non-blank, non-comment line.
     *
     * @throws AssemblyException MALFORMED_INSTRUCTION on a syntax error
     */
    public static Instruction parse(String text, int line) {
        Matcher m = LINE.matcher(text.trim());
        if (!m.matches())
            throw AssemblyException.malformed(line, text.trim(), "can't parse the instruction");
        Op op = Op.of(m.group(1));
        if (op == null)
            throw AssemblyException.malformed(line, text.trim(), "unknown instruction " + m.group(1));
        // The last argument of PUT may hold commas (string/a,b), so limit the split.
        String[] parts = m.group(2).split(",", op.arity());
        if (parts.length != op.arity())
            throw AssemblyException.malformed(line, text.trim(),
                    op + " expects " + op.arity() + " arguments, got " + parts.length);
        List<String> args = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            // PUT payloads keep inner spacing; everything else is a bare token
            String arg = op == Op.PUT && i == 1 ? unquote(parts[i].strip()) : unquote(parts[i].trim()).trim();
            if (arg.isEmpty())
                throw AssemblyException.malformed(line, text.trim(), "argument no." + (i + 1) + " is empty");
            // one instruction per line
            if (!(op == Op.PUT && i == 1) && arg.matches(".*[();].*"))
                throw AssemblyException.malformed(line, text.trim(), "unexpected '" + arg + "'");
            args.add(arg);
        }
        return new Instruction(op, Collections.unmodifiableList(args), line, text.trim());
    }

    private static String unquote(String s) {
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '\'' || first == '"') && first == last)
                return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
