package fsa.codegen;

import fsa.Automaton;
import fsa.Closures;
import fsa.transform.SubsetConstruction;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles automata into JVM classes implementing {@link CompiledAcceptor}.
 *
 * <p>The generated class has no state: one instance per compiled automaton is
 * enough and can be shared between threads. A compiled acceptor accepts
 * exactly the inputs that a simulation of the automaton accepts.
 */
public final class AcceptorCompiler {

  private static final Logger LOG = LoggerFactory.getLogger(AcceptorCompiler.class);

  /**
   * Internal name of generated classes. This must be in the same package as
   * this class since classes are defined as hidden classes nestled here.
   */
  static final String GENERATED_CLASS_NAME = "fsa/codegen/GeneratedAcceptor";

  private AcceptorCompiler() { }

  /**
   * Compile an automaton into a loaded acceptor.
   *
   * @param automaton automaton to compile (an NFA is converted to a DFA first)
   * @return acceptor backed by a freshly defined hidden class
   * @throws IllegalStateException if the automaton has no initial state
   */
  public static CompiledAcceptor compile(Automaton automaton) {
    final byte[] classBytes = generateClass(
      automaton,
      GENERATED_CLASS_NAME,
      Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC
    );

    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      return (CompiledAcceptor) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to load compiled acceptor", error);
    }
  }

  /**
   * Code generator for a class implementing {@link CompiledAcceptor}.
   *
   * @param automaton automaton to compile (an NFA is converted to a DFA first)
   * @param className internal name of the class to generate
   * @param classFlags class flags to set (visibility, `final`, `synthetic` etc.)
   * @return bytes of the class file
   * @throws IllegalStateException if the automaton has no initial state
   */
  public static byte[] generateClass(Automaton automaton, String className, int classFlags) {
    final Automaton dfa = SubsetConstruction.convert(automaton);
    if (dfa.initialState().isEmpty()) {
      throw new IllegalStateException("cannot compile an automaton without initial state");
    }

    // Only reachable states get a block, and the initial state comes first
    final List<String> states = new ArrayList<>(Closures.reachable(dfa));

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V11,
      Opcodes.ACC_SUPER | classFlags,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.COMPILEDACCEPTOR_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` method
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new AcceptorMethodCodegen(mv, dfa, states).visitAcceptor();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    final byte[] classBytes = cw.toByteArray();
    LOG.debug("compiled {} DFA states into {} bytes of class {}", states.size(), classBytes.length, className);
    return classBytes;
  }
}
