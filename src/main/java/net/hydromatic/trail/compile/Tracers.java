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
package net.hydromatic.trail.compile;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.IrWriter;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the blocks of a given
   * pass, then calls the underlying tracer. */
  public static Tracer withOnBlocks(Tracer tracer, int pass,
      Consumer<List<Ir.Block>> consumer) {
    final int expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override
      public void onBlocks(int pass, List<Ir.Block> blocks) {
        if (pass == expectedPass) {
          consumer.accept(blocks);
        }
        super.onBlocks(pass, blocks);
      }
    };
  }

  /** Returns a tracer that performs the given action on the blocks of every
   * pass, then calls the underlying tracer. */
  public static Tracer withOnAllBlocks(Tracer tracer,
      BiConsumer<Integer, List<Ir.Block>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBlocks(int pass, List<Ir.Block> blocks) {
        consumer.accept(pass, blocks);
        super.onBlocks(pass, blocks);
      }
    };
  }

  /** Returns a tracer that prints the blocks of every pass, at most
   * {@code printLength} blocks each, then calls the underlying tracer. */
  public static Tracer withPrinter(Tracer tracer, Consumer<String> printer,
      int printLength) {
    return withOnAllBlocks(tracer, (pass, blocks) ->
        printer.accept(
            new IrWriter()
                .append(pass < 0 ? "lowered" : "pass " + pass)
                .append(":\n")
                .blocks(blocks, printLength)
                .toString()));
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onBlocks(int pass, List<Ir.Block> blocks) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onBlocks(int pass, List<Ir.Block> blocks) {
      tracer.onBlocks(pass, blocks);
    }
  }
}

// End Tracers.java
