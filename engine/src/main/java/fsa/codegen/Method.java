package fsa.codegen;

import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Helper class to simplify codegen around declaring and calling methods.
 *
 * @param name name of the method
 * @param typ type of the method (does not include the receiver)
 * @param invokeSort one of the {@code Opcodes.INVOKE*} codes
 */
record Method(
  String name,
  MethodType typ,
  int invokeSort
) {

  // Class name constants
  public static final String COMPILEDACCEPTOR_CLASS_NAME = Type.getInternalName(CompiledAcceptor.class);
  public static final String OBJECT_CLASS_NAME = Type.getInternalName(Object.class);
  public static final String CHARSEQUENCE_CLASS_NAME = Type.getInternalName(CharSequence.class);

  // Method name constants
  public static final Method EMPTYINIT_M = new Method(
    "<init>",
    MethodType.methodType(void.class),
    Opcodes.INVOKESPECIAL
  );
  public static final Method ACCEPTS_M = new Method(
    "accepts",
    MethodType.methodType(boolean.class, CharSequence.class),
    Opcodes.INVOKEINTERFACE
  );
  public static final Method LENGTH_M = new Method(
    "length",
    MethodType.methodType(int.class),
    Opcodes.INVOKEINTERFACE
  );
  public static final Method CHARAT_M = new Method(
    "charAt",
    MethodType.methodType(char.class, int.class),
    Opcodes.INVOKEINTERFACE
  );

  /**
   * Start this method on an existing class visitor.
   *
   * @param cv class on which the method is started
   * @param accessFlags access flags for the method (`static` or not is computed)
   * @return method visitor for this method
   */
  public MethodVisitor newMethod(ClassVisitor cv, int accessFlags) {
    int staticFlag = (invokeSort == Opcodes.INVOKESTATIC) ? Opcodes.ACC_STATIC : 0;
    return cv.visitMethod(
      accessFlags | staticFlag,
      name,
      typ.descriptorString(),
      null, // signature
      null  // exceptions
    );
  }

  /**
   * Invoke this method inside another method body.
   *
   * @param mv method inside of which this method is called
   * @param className name of the class on which this method is defined
   */
  public void invokeMethod(MethodVisitor mv, String className) {
    mv.visitMethodInsn(
      invokeSort,
      className,
      name,
      typ.descriptorString(),
      invokeSort == Opcodes.INVOKEINTERFACE
    );
  }
}
