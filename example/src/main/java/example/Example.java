package example;

import com.obsidiandynamics.qcheck.*;

import java.util.*;

public class Example {
  private interface Expr {
    int eval(Map<String, Integer> env);
  }

  private static final class Lit implements Expr {
    final int value;

    Lit(int value) {
      this.value = value;
    }

    @Override
    public int eval(Map<String, Integer> env) {
      return value;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  private static final class Var implements Expr {
    final String name;

    Var(String name) {
      this.name = name;
    }

    @Override
    public int eval(Map<String, Integer> env) {
      return env.get(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private static final class Add implements Expr {
    final Expr left;

    final Expr right;

    Add(Expr left, Expr right) {
      this.left = left;
      this.right = right;
    }

    @Override
    public int eval(Map<String, Integer> env) {
      return left.eval(env) + right.eval(env);
    }

    @Override
    public String toString() {
      return "(" + left + " + " + right + ")";
    }
  }

  public static void main(String[] args) {
    // Integers are symmetric under negation; this one passes.
    Checker.check(Arbitraries.int32(), x -> -(-x) == x, new Checker.Options() {{
      reporter = Reporters.console();
      maxTrials = 10;
    }});

    // Reversing a list is not the identity. The reported counterexample is shrunk.
    Checker.check(Arbitraries.int32().array(),
                  xs -> {
                    final var reversed = new ArrayList<>(xs);
                    Collections.reverse(reversed);
                    return reversed.equals(xs);
                  },
                  new Checker.Options() {{
                    seed = 42L;
                    reporter = Reporters.console();
                  }});

    // A recursive arbitrary: expressions over literals, variables and addition.
    final var expr = Arbitraries.<Expr>forward();
    final Arbitrary<Lit> lit = Arbitraries.int32().map(Lit::new, l -> l.value);
    final Arbitrary<Var> variable = Arbitraries.elements("x", "y", "z").map(Var::new, v -> v.name);
    final Arbitrary<Add> add = Arbitraries.tuple(expr, expr).map(t -> new Add(t.get(0), t.get(1)), a -> Tuple.of(a.left, a.right));
    expr.define(Arbitraries.sum(Branch.<Expr>of(lit, e -> e instanceof Lit),
                                Branch.<Expr>of(variable, e -> e instanceof Var),
                                Branch.<Expr>of(add, e -> e instanceof Add)));

    // Claims that no expression evaluates above 50; the search reports a small one that does.
    final var env = Map.of("x", 1, "y", 2, "z", 3);
    final var result = Checker.check(expr, Show.any(), e -> e.eval(env) <= 50, new Checker.Options() {{
      seed = 7L;
      reporter = Reporters.silent();
    }});
    System.out.format("expression check: %s, minimal counterexample: %s%n", result.getKind(), result.getMinFail());

    // Named fields: claims a point never strays 20 or more from the origin; both fields shrink.
    final Arbitrary<Struct> point = Arbitraries.struct(Map.of("x", Arbitraries.int32(), "y", Arbitraries.int32()));
    final var pointResult = Checker.check(point, p -> Math.abs(p.<Integer>get("x")) + Math.abs(p.<Integer>get("y")) < 20,
                                          new Checker.Options() {{
                                            seed = 11L;
                                            reporter = Reporters.silent();
                                          }});
    System.out.format("point check: %s, minimal counterexample: %s%n", pointResult.getKind(), pointResult.getMinFail());

    // The default reporter turns a failure into an AssertionError.
    try {
      Checker.check(Arbitraries.string(), Property.asserting(s -> {
        if (s.length() > 3) throw new IllegalStateException("too long: " + s.length());
      }));
    } catch (TestFailureError e) {
      System.out.format("caught:%n%s", e.getMessage());
    }
  }
}
