package com.surge.reo;

/**
 * SODG programs shared by the tests.
 */
public final class Programs {

    private Programs() {
    }

    /** {@code int} with native {@code inc}; {@code foo = instance.inc} where {@code instance = int(41)}. */
    public static final String INC = String.join("\n",
            "# int and its increment",
            "ADD($int);",
            "BIND(ν0, $int, int);",
            "ADD($inc);",
            "BIND($int, $inc, inc);",
            "ADD($l);",
            "BIND($inc, $l, λ);",
            "PUT($l, string/inc);",
            "",
            "# instance = int(41)",
            "ADD($i);",
            "BIND(ν0, $i, instance);",
            "BIND($i, $int, π);",
            "ADD($d);",
            "BIND($i, $d, Δ);",
            "PUT($d, 00-00-00-00-00-00-00-29);",
            "",
            "# foo = instance.inc",
            "ADD($foo);",
            "BIND(ν0, $foo, foo);",
            "ADD($b);",
            "BIND($foo, $b, β);",
            "PUT($b, string/Φ.instance.inc);");

    /** {@code six = int(6)}; {@code foo = six.times(six.inc)}. */
    public static final String TIMES = String.join("\n",
            "ADD($int);",
            "BIND(ν0, $int, int);",
            "ADD($inc);",
            "BIND($int, $inc, inc);",
            "ADD($l1);",
            "BIND($inc, $l1, λ);",
            "PUT($l1, string/inc);",
            "ADD($times);",
            "BIND($int, $times, times);",
            "ADD($l2);",
            "BIND($times, $l2, λ);",
            "PUT($l2, string/times);",
            "ADD($six);",
            "BIND(ν0, $six, six);",
            "BIND($six, $int, π);",
            "ADD($d);",
            "BIND($six, $d, Δ);",
            "PUT($d, int/6);",
            "ADD($foo);",
            "BIND(ν0, $foo, foo);",
            "ADD($callee);",
            "BIND($foo, $callee, ε);",
            "ADD($cl);",
            "BIND($callee, $cl, β);",
            "PUT($cl, string/Φ.six.times);",
            "ADD($arg);",
            "BIND($foo, $arg, α0);",
            "ADD($al);",
            "BIND($arg, $al, β);",
            "PUT($al, string/Φ.six.inc);");

    /** {@code foo} with a literal 42 under {@code Δ}. */
    public static final String LITERAL = String.join("\n",
            "ADD($foo);",
            "BIND(ν0, $foo, foo);",
            "ADD($d);",
            "BIND($foo, $d, Δ);",
            "PUT($d, 00-00-00-00-00-00-00-2A);");

    /** {@code bar} with a literal 7 under {@code Δ}. */
    public static final String OTHER = String.join("\n",
            "ADD($bar);",
            "BIND(ν0, $bar, bar);",
            "ADD($d);",
            "BIND($bar, $d, Δ);",
            "PUT($d, int/7);");

    /** {@code a} refers to {@code b} and {@code b} back to {@code a}. */
    public static final String CYCLE = String.join("\n",
            "ADD($a);",
            "BIND(ν0, $a, a);",
            "ADD($la);",
            "BIND($a, $la, β);",
            "PUT($la, string/Φ.b);",
            "ADD($b);",
            "BIND(ν0, $b, b);",
            "ADD($lb);",
            "BIND($b, $lb, β);",
            "PUT($lb, string/Φ.a);");

    /** {@code say = stdout(msg)}. */
    public static final String HELLO = String.join("\n",
            "ADD($stdout);",
            "BIND(ν0, $stdout, stdout);",
            "ADD($l);",
            "BIND($stdout, $l, λ);",
            "PUT($l, string/stdout);",
            "ADD($msg);",
            "BIND(ν0, $msg, msg);",
            "PUT($msg, string/hello);",
            "ADD($say);",
            "BIND(ν0, $say, say);",
            "ADD($callee);",
            "BIND($say, $callee, ε);",
            "ADD($cl);",
            "BIND($callee, $cl, β);",
            "PUT($cl, string/Φ.stdout);",
            "ADD($arg);",
            "BIND($say, $arg, α0);",
            "ADD($al);",
            "BIND($arg, $al, β);",
            "PUT($al, string/Φ.msg);");
}
