package fsa.codegen;

/**
 * Acceptance check compiled down to JVM bytecode.
 *
 * @see AcceptorCompiler
 */
public interface CompiledAcceptor {

  /**
   * Does the compiled automaton accept the whole input?
   *
   * @param input input string
   * @return whether the input is accepted
   */
  boolean accepts(CharSequence input);
}
