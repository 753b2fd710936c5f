/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.symbolic.compile;

import static java.util.Objects.requireNonNull;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.function.BiConsumer;
import net.hydromatic.symbolic.ast.Expr;

/** Implementations of {@link Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static ConfigurableTracer nullTracer() {
    return ConfigurableTracerImpl.INITIAL;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static ConfigurableTracer printTracer(PrintWriter w) {
    final PrintTracer p = new PrintTracer(w);
    return ConfigurableTracerImpl.INITIAL
        .withPassHandler(p::onPass)
        .withRewriteHandler(p::onRewrite)
        .withRuleSkippedHandler(p::onRuleSkipped)
        .withRuleRejectedHandler(p::onRuleRejected)
        .withPassLimitHandler(p::onPassLimit);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static ConfigurableTracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream));
  }

  /** Implementation of {@link Tracer} that writes to a {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void print(String s) {
      w.println(s);
      w.flush();
    }

    @Override
    public void onPass(int pass, Expr.Node node) {
      print("pass " + pass + " " + node);
    }

    @Override
    public void onRewrite(Rule rule, Expr.Node before, Expr.Node after) {
      print("rewrite " + rule.name + " " + before + " -> " + after);
    }

    @Override
    public void onRuleSkipped(String name, String reason) {
      print("skip " + name + ": " + reason);
    }

    @Override
    public void onRuleRejected(String name, RuleBuildException e) {
      print("reject " + name + ": " + e.getMessage());
    }

    @Override
    public void onPassLimit(int limit, Expr.Node node) {
      print("pass limit " + limit + " reached " + node);
    }
  }

  /** Tracer that allows each of its methods to be modified using a handler. */
  public interface ConfigurableTracer extends Tracer {
    /** Sets handler for {@link #onPass(int, Expr.Node)}. */
    ConfigurableTracer withPassHandler(BiConsumer<Integer, Expr.Node> handler);

    /** Sets handler for {@link #onRewrite(Rule, Expr.Node, Expr.Node)}. */
    ConfigurableTracer withRewriteHandler(
        TriConsumer<Rule, Expr.Node, Expr.Node> handler);

    /** Sets handler for {@link #onRuleSkipped(String, String)}. */
    ConfigurableTracer withRuleSkippedHandler(
        BiConsumer<String, String> handler);

    /** Sets handler for {@link #onRuleRejected(String, RuleBuildException)}. */
    ConfigurableTracer withRuleRejectedHandler(
        BiConsumer<String, RuleBuildException> handler);

    /** Sets handler for {@link #onPassLimit(int, Expr.Node)}. */
    ConfigurableTracer withPassLimitHandler(
        BiConsumer<Integer, Expr.Node> handler);
  }

  /**
   * Consumer that accepts three arguments.
   *
   * @param <T> First argument type
   * @param <U> Second argument type
   * @param <V> Third argument type
   */
  @FunctionalInterface
  public interface TriConsumer<T, U, V> {
    void accept(T t, U u, V v);
  }

  /**
   * Implementation of {@link ConfigurableTracer} that has a field for each
   * handler.
   */
  private static class ConfigurableTracerImpl implements ConfigurableTracer {
    static final ConfigurableTracerImpl INITIAL =
        new ConfigurableTracerImpl(
            (pass, node) -> {},
            (rule, before, after) -> {},
            (name, reason) -> {},
            (name, e) -> {},
            (limit, node) -> {});

    private final BiConsumer<Integer, Expr.Node> passHandler;
    private final TriConsumer<Rule, Expr.Node, Expr.Node> rewriteHandler;
    private final BiConsumer<String, String> ruleSkippedHandler;
    private final BiConsumer<String, RuleBuildException> ruleRejectedHandler;
    private final BiConsumer<Integer, Expr.Node> passLimitHandler;

    private ConfigurableTracerImpl(
        BiConsumer<Integer, Expr.Node> passHandler,
        TriConsumer<Rule, Expr.Node, Expr.Node> rewriteHandler,
        BiConsumer<String, String> ruleSkippedHandler,
        BiConsumer<String, RuleBuildException> ruleRejectedHandler,
        BiConsumer<Integer, Expr.Node> passLimitHandler) {
      this.passHandler = requireNonNull(passHandler);
      this.rewriteHandler = requireNonNull(rewriteHandler);
      this.ruleSkippedHandler = requireNonNull(ruleSkippedHandler);
      this.ruleRejectedHandler = requireNonNull(ruleRejectedHandler);
      this.passLimitHandler = requireNonNull(passLimitHandler);
    }

    @Override
    public ConfigurableTracer withPassHandler(
        BiConsumer<Integer, Expr.Node> passHandler) {
      return new ConfigurableTracerImpl(
          passHandler,
          rewriteHandler,
          ruleSkippedHandler,
          ruleRejectedHandler,
          passLimitHandler);
    }

    @Override
    public ConfigurableTracer withRewriteHandler(
        TriConsumer<Rule, Expr.Node, Expr.Node> rewriteHandler) {
      return new ConfigurableTracerImpl(
          passHandler,
          rewriteHandler,
          ruleSkippedHandler,
          ruleRejectedHandler,
          passLimitHandler);
    }

    @Override
    public ConfigurableTracer withRuleSkippedHandler(
        BiConsumer<String, String> ruleSkippedHandler) {
      return new ConfigurableTracerImpl(
          passHandler,
          rewriteHandler,
          ruleSkippedHandler,
          ruleRejectedHandler,
          passLimitHandler);
    }

    @Override
    public ConfigurableTracer withRuleRejectedHandler(
        BiConsumer<String, RuleBuildException> ruleRejectedHandler) {
      return new ConfigurableTracerImpl(
          passHandler,
          rewriteHandler,
          ruleSkippedHandler,
          ruleRejectedHandler,
          passLimitHandler);
    }

    @Override
    public ConfigurableTracer withPassLimitHandler(
        BiConsumer<Integer, Expr.Node> passLimitHandler) {
      return new ConfigurableTracerImpl(
          passHandler,
          rewriteHandler,
          ruleSkippedHandler,
          ruleRejectedHandler,
          passLimitHandler);
    }

    @Override
    public void onPass(int pass, Expr.Node node) {
      passHandler.accept(pass, node);
    }

    @Override
    public void onRewrite(Rule rule, Expr.Node before, Expr.Node after) {
      rewriteHandler.accept(rule, before, after);
    }

    @Override
    public void onRuleSkipped(String name, String reason) {
      ruleSkippedHandler.accept(name, reason);
    }

    @Override
    public void onRuleRejected(String name, RuleBuildException e) {
      ruleRejectedHandler.accept(name, e);
    }

    @Override
    public void onPassLimit(int limit, Expr.Node node) {
      passLimitHandler.accept(limit, node);
    }
  }
}

// End Tracers.java
