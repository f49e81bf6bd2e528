package com.surge.reo.engine;

import com.surge.reo.api.Attr;
import com.surge.reo.api.Data;
import com.surge.reo.api.DataizationListener;
import com.surge.reo.api.Locator;
import com.surge.reo.api.SodgException;
import com.surge.reo.fn.NativeRegistry;
import com.surge.reo.fn.NativeRegistry.NativeMetadata;
import com.surge.reo.graph.Graph;
import com.surge.reo.graph.Vertex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Computes the value ("dataizes") of a vertex of a {@link Graph}.
 *
 * A vertex is evaluated by looking at its own edges, in this order:
 *
 * 1. {@code λ}: call the native named by the payload of its target, in the
 * context of the vertex being dataized. The receiver is the parent of that
 * context; positional arguments are its {@code α0}, {@code α1}, ... attributes.
 *
 * 2. {@code Δ}: the value of the target (normally a vertex with a payload).
 * A {@code Δ} inherited through {@code π} is materialized on the copy first,
 * so it is evaluated with the copy as its parent.
 *
 * 3. A payload on the vertex itself is its value.
 *
 * 4. {@code β}: the target's payload is a {@link Locator}; the value is the
 * value of the object it points to.
 *
 * 5. {@code ε}: an application. A new copy is made of the callee with the
 * {@code αN} edges of the application bound to it, and the value is the value
 * of that copy.
 *
 * 6. {@code π}: the vertex is a copy; evaluate what it copies, keeping the
 * copy as the context so its own bindings (arguments, data) are seen.
 *
 * Copy with context: an attribute reached through a {@code π} chain is
 * materialized on the object asking for it. A fresh vertex with
 * {@code π → original} and {@code ρ → object} is bound under the same name,
 * so {@code int(41).inc} and {@code int(6).inc} are different vertices and
 * each memoizes its own value. Inside such an attribute {@code ξ} denotes the
 * object holding it, which is the copy rather than the original.
 *
 * A chain of expressions deeper than the thread stack fails with
 * {@code TOO_DEEP}; the vertices it had in progress are marked failed.
 *
 * Memoization lives on the vertex. A vertex is dataized at most once: after
 * success its value is returned from the cache, after failure it stays
 * failed. A vertex met again while it is being dataized is a genuine cycle and
 * fails with {@code CYCLIC_DATAIZATION} instead of looping.
 *
 * The graph is mutated here only by materialized copies and cache writes.
 * All public methods are synchronized on the dataizer; share one dataizer per
 * graph when several threads evaluate.
 */
public final class Dataizer {
    private static final Logger log = LogManager.getLogger(Dataizer.class);

    /** A vertex together with the object it was reached from. */
    private record Bound(int vertex, int holder) {
    }

    private final Graph graph;
    private final NativeRegistry natives;
    private DataizationListener listener;

    // (expression, context) -> copy made for that application
    private final Map<Long, Integer> applications = new HashMap<>();
    // holders learned while resolving, for vertices without ρ
    private final Map<Integer, Integer> parents = new HashMap<>();
    // expression vertices being resolved into objects
    private final Set<Integer> resolving = new HashSet<>();
    private int dataized;

    public Dataizer(Graph graph, NativeRegistry natives) {
        this.graph = graph;
        this.natives = natives;
    }

    public Dataizer(Graph graph) {
        this(graph, NativeRegistry.standard());
    }

    public void setListener(DataizationListener listener) {
        this.listener = listener;
    }

    public Graph graph() {
        return graph;
    }

    /**
     * Dataizes the object at the locator, resolved from the root. A single
     * name such as {@code foo} is a root-level object.
     *
     * @throws DataizationException if the object can't be found or evaluated
     * @throws IllegalArgumentException if the locator is malformed
     */
    public synchronized byte[] dataize(String locator) {
        Locator loc = Locator.parse(locator);
        int start = dataized;
        notifyStart(Graph.ROOT);
        try {
            Bound target = locate(loc, Graph.ROOT, -1);
            byte[] value = dataize(target.vertex(), target.holder());
            log.debug("{} dataized to {} bytes", loc, value.length);
            notifyEnd(target.vertex(), start);
            return value;
        } catch (StackOverflowError e) {
            throw failed(Graph.ROOT, DataizationException.tooDeep(Graph.ROOT, e));
        } catch (SodgException e) {
            throw failed(Graph.ROOT, e);
        }
    }

    /**
     * Dataizes the vertex with the given id.
     *
     * @throws DataizationException if the vertex can't be evaluated
     * @throws com.surge.reo.graph.GraphException if there is no such vertex
     */
    public synchronized byte[] dataize(int vertex) {
        graph.vertex(vertex);
        int start = dataized;
        notifyStart(vertex);
        try {
            byte[] value = dataize(vertex, parentOf(vertex));
            notifyEnd(vertex, start);
            return value;
        } catch (StackOverflowError e) {
            throw failed(vertex, DataizationException.tooDeep(vertex, e));
        } catch (SodgException e) {
            throw failed(vertex, e);
        }
    }

    private SodgException failed(int vertex, SodgException e) {
        if (e instanceof DataizationException
                && ((DataizationException) e).kind() == DataizationException.Kind.TOO_DEEP)
            recover(vertex);
        notifyError(vertex, e);
        return e;
    }

    /**
     * After the stack ran out, unwinding may have skipped some bookkeeping:
     * nothing is in progress between two public calls.
     */
    private void recover(int vertex) {
        resolving.clear();
        for (int id : graph.ids()) {
            Vertex vx = graph.vertex(id);
            if (vx.status() == Vertex.Status.IN_PROGRESS)
                vx.status(Vertex.Status.FAILED);
        }
        log.warn("Dataization from ν{} ran out of stack", vertex);
    }

    /** Number of vertices memoized by this dataizer so far. */
    public synchronized int dataizedCount() {
        return dataized;
    }

    // ── Evaluation ──────────────────────────────────────────────────

    private byte[] dataize(int v, int holder) {
        Vertex vx = graph.vertex(v);
        switch (vx.status()) {
            case CACHED:
                return vx.cached();
            case FAILED:
                throw DataizationException.previouslyFailed(v);
            case IN_PROGRESS:
                throw DataizationException.cyclic(v);
            default:
                break;
        }
        vx.status(Vertex.Status.IN_PROGRESS);
        byte[] value;
        try {
            value = evaluate(v, v, holder, new HashSet<>());
        } catch (StackOverflowError e) {
            vx.status(Vertex.Status.FAILED);
            throw DataizationException.tooDeep(v, e);
        } catch (RuntimeException e) {
            vx.status(Vertex.Status.FAILED);
            throw e;
        }
        vx.cache(value);
        dataized++;
        log.trace("ν{} ➞ {} bytes", v, value.length);
        if (listener != null)
            listener.onVertexDataized(v, value);
        return value;
    }

    /**
     * Evaluates {@code body} as if it were {@code self}: edges are read from
     * the body, attributes and arguments from self.
     */
    private byte[] evaluate(int body, int self, int holder, Set<Integer> chain) {
        OptionalInt lambda = graph.attr(body, Attr.LAMBDA);
        if (lambda.isPresent())
            return call(text(lambda.getAsInt()), self, holder);
        OptionalInt delta = graph.attr(body, Attr.DELTA);
        if (delta.isPresent()) {
            if (body == self)
                return dataize(delta.getAsInt(), self);
            // inherited through π: each copy gets and caches its own Δ
            int own = materialize(self, Attr.DELTA, delta.getAsInt());
            return dataize(own, self);
        }
        Optional<byte[]> data = graph.data(body);
        if (data.isPresent())
            return data.get();
        OptionalInt beta = graph.attr(body, Attr.BETA);
        if (beta.isPresent()) {
            Bound target = locate(locator(body, beta.getAsInt()), self, holder);
            return dataize(target.vertex(), target.holder());
        }
        if (graph.attr(body, Attr.EPSILON).isPresent()) {
            int copy = apply(body, self, holder);
            return dataize(copy, parentOf(copy));
        }
        OptionalInt pi = graph.attr(body, Attr.PI);
        if (pi.isPresent()) {
            if (!chain.add(body))
                throw DataizationException.cyclic(body);
            return evaluate(pi.getAsInt(), self, holder, chain);
        }
        throw DataizationException.attributeNotFound(self, Attr.DELTA);
    }

    private byte[] call(String name, int self, int holder) {
        NativeMetadata meta = natives.lookup(name)
                .orElseThrow(() -> DataizationException.unknownNative(self, name));
        List<byte[]> args = new ArrayList<>(meta.width());
        if (meta.receiver()) {
            int receiver = rho(self, holder);
            if (receiver < 0)
                throw DataizationException.attributeNotFound(self, Attr.RHO);
            args.add(dataize(receiver, parentOf(receiver)));
        }
        // left to right, so side effects of arguments happen in order
        for (int i = 0; i < meta.arity(); i++) {
            String alpha = Attr.alpha(i);
            Bound arg = attr(self, holder, alpha)
                    .orElseThrow(() -> DataizationException.attributeNotFound(self, alpha));
            args.add(dataize(arg.vertex(), arg.holder()));
        }
        if (listener != null)
            listener.onNativeInvoked(self, name, args.size());
        log.trace("λ{} at ν{} with {} args", name, self, args.size());
        try {
            return meta.fn().apply(args);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw DataizationException.typeMismatch(self, name, e);
        }
    }

    /**
     * Makes (once per context) the copy an application stands for:
     * {@code π → callee}, {@code ρ → callee's parent}, {@code ξ → scope} and
     * the application's {@code αN} edges. The scope is the object holding the
     * application; arguments are resolved there.
     */
    private int apply(int expr, int self, int holder) {
        long key = ((long) expr << 32) | (self & 0xFFFFFFFFL);
        Integer known = applications.get(key);
        if (known != null)
            return known;
        int calleeExpr = graph.attr(expr, Attr.EPSILON).getAsInt();
        int scope = holder >= 0 ? holder : self;
        Bound callee = object(new Bound(calleeExpr, scope));
        int copy = graph.nextId();
        graph.add(copy);
        graph.bind(copy, callee.vertex(), Attr.PI);
        int parent = rho(callee.vertex(), callee.holder());
        if (parent >= 0) {
            graph.bind(copy, parent, Attr.RHO);
            parents.put(copy, parent);
        }
        graph.bind(copy, scope, Attr.XI);
        for (Map.Entry<String, Integer> e : graph.kids(expr).entrySet()) {
            if (Attr.isAlpha(e.getKey()))
                graph.bind(copy, e.getValue(), e.getKey());
        }
        applications.put(key, copy);
        log.trace("ν{} is a copy of ν{} applied in ν{}", copy, callee.vertex(), scope);
        return copy;
    }

    // ── Resolution ──────────────────────────────────────────────────

    private Bound locate(Locator loc, int self, int holder) {
        List<String> segs = loc.segments();
        String head = loc.head();
        Bound cur;
        int vertex = Locator.vertex(head);
        if (Locator.isRoot(head)) {
            cur = new Bound(Graph.ROOT, -1);
        } else if (Attr.XI.equals(head)) {
            int scope = scope(self, holder);
            if (scope < 0)
                throw DataizationException.attributeNotFound(self, Attr.XI);
            cur = new Bound(scope, parentOf(scope));
        } else if (Attr.RHO.equals(head)) {
            int parent = rho(self, holder);
            if (parent < 0)
                throw DataizationException.attributeNotFound(self, Attr.RHO);
            cur = new Bound(parent, parentOf(parent));
        } else if (vertex >= 0) {
            if (!graph.contains(vertex))
                throw DataizationException.attributeNotFound(self, head);
            cur = object(new Bound(vertex, parentOf(vertex)));
        } else if (Attr.DELTA.equals(head)) {
            return new Bound(self, holder);
        } else {
            cur = object(lookup(self, holder, head));
        }
        for (int i = 1; i < segs.size(); i++) {
            String seg = segs.get(i);
            if (Attr.DELTA.equals(seg) && i == segs.size() - 1)
                break;
            if (Attr.RHO.equals(seg)) {
                int parent = rho(cur.vertex(), cur.holder());
                if (parent < 0)
                    throw DataizationException.attributeNotFound(cur.vertex(), Attr.RHO);
                cur = new Bound(parent, parentOf(parent));
                continue;
            }
            Bound from = cur;
            cur = object(attr(from.vertex(), from.holder(), seg)
                    .orElseThrow(() -> DataizationException.attributeNotFound(from.vertex(), seg)));
        }
        return cur;
    }

    /**
     * Finds a name among the own edges of an expression, then in the object
     * holding it, moving outwards through parents until the root.
     */
    private Bound lookup(int self, int holder, String name) {
        if (graph.attr(self, name).isPresent())
            return attr(self, holder, name).orElseThrow();
        int cur = scope(self, holder);
        if (cur < 0)
            throw DataizationException.attributeNotFound(self, name);
        int h = parentOf(cur);
        for (int steps = 0; steps <= graph.size(); steps++) {
            Optional<Bound> found = attr(cur, h, name);
            if (found.isPresent())
                return found.get();
            int parent = rho(cur, h);
            if (parent < 0)
                break;
            h = parentOf(parent);
            cur = parent;
        }
        throw DataizationException.attributeNotFound(self, name);
    }

    /**
     * Turns an expression ({@code β} or {@code ε}, possibly behind a
     * {@code π} chain) into the object it denotes. Plain objects are returned
     * as they are.
     */
    private Bound object(Bound b) {
        int v = b.vertex();
        int body = expression(v);
        if (body < 0)
            return b;
        if (!resolving.add(v))
            throw DataizationException.cyclic(v);
        try {
            OptionalInt beta = graph.attr(body, Attr.BETA);
            if (beta.isPresent())
                return object(locate(locator(body, beta.getAsInt()), v, b.holder()));
            int copy = apply(body, v, b.holder());
            return new Bound(copy, parentOf(copy));
        } finally {
            resolving.remove(v);
        }
    }

    /** The object an expression sits in: what {@code ξ} denotes there. */
    private int scope(int self, int holder) {
        return holder >= 0 ? holder : rho(self, -1);
    }

    /** The vertex with {@code β} or {@code ε} that v stands for, or -1. */
    private int expression(int v) {
        Set<Integer> seen = new HashSet<>();
        int cur = v;
        while (seen.add(cur)) {
            if (graph.attr(cur, Attr.BETA).isPresent() || graph.attr(cur, Attr.EPSILON).isPresent())
                return cur;
            if (graph.attr(cur, Attr.LAMBDA).isPresent() || graph.attr(cur, Attr.DELTA).isPresent()
                    || graph.data(cur).isPresent())
                return -1;
            OptionalInt pi = graph.attr(cur, Attr.PI);
            if (pi.isEmpty())
                return -1;
            cur = pi.getAsInt();
        }
        return -1;
    }

    /**
     * The attribute {@code name} of object {@code o}. Own edges win; an
     * attribute found only through the {@code π} chain is materialized on
     * {@code o}.
     */
    private Optional<Bound> attr(int o, int holder, String name) {
        // an expression has no inherited attributes until it is resolved
        if (!Attr.isSystem(name) && graph.attr(o, name).isEmpty() && expression(o) >= 0) {
            if (resolving.contains(o))
                return Optional.empty();
            Bound resolved = object(new Bound(o, holder));
            o = resolved.vertex();
            holder = resolved.holder();
        }
        OptionalInt direct = graph.attr(o, name);
        if (direct.isPresent()) {
            int x = direct.getAsInt();
            int h = o;
            // arguments bound on a copy belong to the scope it was made in
            if (!Attr.isSystem(name) && graph.attr(o, Attr.PI).isPresent()) {
                OptionalInt scope = graph.attr(o, Attr.XI);
                h = scope.isPresent() ? scope.getAsInt() : rho(o, holder);
                if (h < 0)
                    h = o;
            }
            parents.putIfAbsent(x, h);
            return Optional.of(new Bound(x, h));
        }
        Set<Integer> seen = new HashSet<>();
        int proto = o;
        while (seen.add(proto)) {
            OptionalInt pi = graph.attr(proto, Attr.PI);
            if (pi.isEmpty())
                return Optional.empty();
            proto = pi.getAsInt();
            // only a prototype given by locator, e.g. π → β "Φ.org.eolang.int"
            if (expression(proto) >= 0)
                proto = object(new Bound(proto, o)).vertex();
            OptionalInt found = graph.attr(proto, name);
            if (found.isPresent()) {
                if (Attr.isSystem(name))
                    return Optional.of(new Bound(found.getAsInt(), proto));
                return Optional.of(new Bound(materialize(o, name, found.getAsInt()), o));
            }
        }
        throw DataizationException.cyclic(o);
    }

    private int materialize(int o, String name, int original) {
        int copy = graph.nextId();
        graph.add(copy);
        graph.bind(copy, original, Attr.PI);
        graph.bind(copy, o, Attr.RHO);
        graph.bind(o, copy, name);
        parents.put(copy, o);
        log.trace("ν{}.{} materialized as ν{}, a copy of ν{}", o, name, copy, original);
        return copy;
    }

    /** The parent of v: its {@code ρ} edge, else the holder it was reached from. */
    private int rho(int v, int holder) {
        OptionalInt rho = graph.attr(v, Attr.RHO);
        if (rho.isPresent())
            return rho.getAsInt();
        if (holder >= 0)
            return holder;
        return parentOf(v);
    }

    private int parentOf(int v) {
        OptionalInt rho = graph.attr(v, Attr.RHO);
        if (rho.isPresent())
            return rho.getAsInt();
        Integer known = parents.get(v);
        if (known != null)
            return known;
        if (v == Graph.ROOT)
            return -1;
        int h = graph.holder(v);
        if (h >= 0)
            parents.put(v, h);
        return h;
    }

    private Locator locator(int expr, int target) {
        String text = text(target);
        try {
            return Locator.parse(text);
        } catch (IllegalArgumentException e) {
            throw DataizationException.badLocator(expr, text, e);
        }
    }

    private String text(int v) {
        return Data.toString(graph.data(v).orElse(new byte[0]));
    }

    // ── Listener plumbing ───────────────────────────────────────────

    private void notifyStart(int vertex) {
        if (listener != null)
            listener.onDataizationStart(vertex);
    }

    private void notifyEnd(int vertex, int start) {
        if (listener != null)
            listener.onDataizationEnd(vertex, dataized - start);
    }

    private void notifyError(int vertex, Throwable error) {
        if (listener != null)
            listener.onDataizationError(vertex, error);
    }
}
