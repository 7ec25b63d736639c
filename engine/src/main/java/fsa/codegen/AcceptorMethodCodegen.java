package fsa.codegen;

import fsa.Automaton;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Generates the body of {@link CompiledAcceptor#accepts(CharSequence)} for a
 * DFA.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * method: every state is a block, and a transition is a jump to the block of
 * its target. Each block first checks whether the input is exhausted (in
 * which case it returns whether the state is accepting), then reads the next
 * character and branches on it. A character without a transition jumps to the
 * failure block.
 */
class AcceptorMethodCodegen extends BytecodeHelpers {

  /**
   * DFA for which code is generated.
   */
  private final Automaton dfa;

  /**
   * Offset of the receiver ({@code this}).
   */
  private final int thisLocal = 0;

  /**
   * Offset of the {@code CharSequence} argument.
   */
  private final int inputLocal = 1;

  /**
   * Offset of the {@code int} local holding the offset of the current
   * character.
   */
  private final int offsetLocal = 2;

  /**
   * Offset of the {@code int} local caching the input length.
   */
  private final int lengthLocal = 3;

  /**
   * Labels associated with the reachable DFA states, initial state first.
   */
  private final Map<String, Label> stateLabels;

  private final Label returnSuccess = new Label();
  private final Label returnFailure = new Label();

  /**
   * @param mv method visitor for the {@code accepts} method
   * @param dfa deterministic automaton with an initial state
   * @param states states to generate blocks for, initial state first
   */
  AcceptorMethodCodegen(MethodVisitor mv, Automaton dfa, List<String> states) {
    super(mv);
    this.dfa = dfa;

    final var labels = new LinkedHashMap<String, Label>();
    for (String state : states) {
      labels.put(state, new Label());
    }
    this.stateLabels = labels;
  }

  public void visitAcceptor() {
    initializeLocals();

    // Lay out the blocks for each state (the first one is the initial state)
    for (Map.Entry<String, Label> entry : stateLabels.entrySet()) {
      mv.visitLabel(entry.getValue());
      final String state = entry.getKey();

      // increment the offset and, if it reaches the length, return whether we are accepting
      mv.visitIincInsn(offsetLocal, 1);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
      mv.visitJumpInsn(Opcodes.IF_ICMPGE, dfa.isFinal(state) ? returnSuccess : returnFailure);

      // get the next character
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      Method.CHARAT_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);

      visitTransitions(state);
    }

    // Final blocks
    mv.visitLabel(returnSuccess);
    mv.visitInsn(Opcodes.ICONST_1);
    mv.visitInsn(Opcodes.IRETURN);

    mv.visitLabel(returnFailure);
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
  }

  /**
   * Cache the input length and start the offset just before the input.
   */
  private void initializeLocals() {
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    Method.LENGTH_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);

    visitConstantInt(-1);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);
  }

  /**
   * Branch on the character at the top of the stack to the block of the
   * target state.
   *
   * @param state state whose transitions are generated
   */
  private void visitTransitions(String state) {

    // Sorted since the switch instructions require ascending keys
    final var branches = new TreeMap<Character, Label>();
    for (Map.Entry<Character, Set<String>> entry : dfa.outgoing(state).entrySet()) {
      final String target = entry.getValue().iterator().next();
      branches.put(entry.getKey(), stateLabels.get(target));
    }

    final int[] values = new int[branches.size()];
    final Label[] labels = new Label[branches.size()];
    int i = 0;
    for (Map.Entry<Character, Label> branch : branches.entrySet()) {
      values[i] = branch.getKey();
      labels[i] = branch.getValue();
      i++;
    }

    visitLookupBranch(returnFailure, values, labels);
  }
}
