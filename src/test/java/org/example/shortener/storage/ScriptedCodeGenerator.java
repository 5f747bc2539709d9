package org.example.shortener.storage;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import org.example.shortener.util.CodeGenerator;

/**
 * Test generator that hands out scripted codes first and falls back to a counter afterwards.
 * Thread-safe.
 */
final class ScriptedCodeGenerator implements CodeGenerator {

  private final Deque<String> script;
  private final AtomicInteger fallback = new AtomicInteger();
  private final AtomicInteger calls = new AtomicInteger();

  ScriptedCodeGenerator(String... codes) {
    this.script = new ArrayDeque<>(Arrays.asList(codes));
  }

  /** @return generator that returns {@code code} on every call */
  static CodeGenerator constant(String code) {
    return length -> code;
  }

  @Override
  public synchronized String generate(int length) {
    calls.incrementAndGet();
    String next = script.poll();
    if (next != null) return next;
    String n = Integer.toString(fallback.incrementAndGet(), 36);
    StringBuilder sb = new StringBuilder("z");
    while (sb.length() + n.length() < length) sb.append('0');
    return sb.append(n).toString();
  }

  int calls() {
    return calls.get();
  }
}
