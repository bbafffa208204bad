package exm.ftn.common.lang;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public class Intrinsics {

  public static enum Group {
    CONVERSION, NUMERIC, CHARACTER, MATH, LEXICAL_COMPARISON;
  }

  /**
   * Fortran 77 intrinsic functions recognised by the front end
   */
  public static enum IntrinsicFunction {
    // conversion functions
    INT(Group.CONVERSION),
    REAL(Group.CONVERSION),
    DBLE(Group.CONVERSION),
    CMPLX(Group.CONVERSION),
    ICHAR(Group.CONVERSION),
    CHAR(Group.CONVERSION),

    AINT(Group.NUMERIC), // truncation of real
    ANINT(Group.NUMERIC), // nearest whole number
    NINT(Group.NUMERIC), // nearest integer
    ABS(Group.NUMERIC),
    MOD(Group.NUMERIC),
    SIGN(Group.NUMERIC),
    DIM(Group.NUMERIC), // positive difference
    DPROD(Group.NUMERIC), // real * real => double prec
    MAX(Group.NUMERIC),
    MIN(Group.NUMERIC),
    AIMAG(Group.NUMERIC), // imaginary part of complex
    CONJG(Group.NUMERIC),

    LEN(Group.CHARACTER),
    INDEX(Group.CHARACTER), // location of substring a in b

    SQRT(Group.MATH),
    EXP(Group.MATH),
    LOG(Group.MATH),
    LOG10(Group.MATH),
    SIN(Group.MATH),
    COS(Group.MATH),
    TAN(Group.MATH),
    ASIN(Group.MATH),
    ACOS(Group.MATH),
    ATAN(Group.MATH),
    ATAN2(Group.MATH),
    SINH(Group.MATH),
    COSH(Group.MATH),
    TANH(Group.MATH),

    LGE(Group.LEXICAL_COMPARISON),
    LGT(Group.LEXICAL_COMPARISON),
    LLE(Group.LEXICAL_COMPARISON),
    LLT(Group.LEXICAL_COMPARISON);

    public final Group group;

    private IntrinsicFunction(Group group) {
      this.group = group;
    }
  }

  private static final Map<String, IntrinsicFunction> byName =
          new HashMap<String, IntrinsicFunction>();

  static {
    for (IntrinsicFunction f: IntrinsicFunction.values()) {
      byName.put(f.name(), f);
    }
  }

  /**
   * @param name function name, any case
   * @return the intrinsic, or null if not an intrinsic
   */
  public static IntrinsicFunction lookup(String name) {
    return byName.get(name.toUpperCase(Locale.ROOT));
  }

  /**
   * Number of arguments intrinsic takes, or -1 if variable (MAX, MIN)
   */
  public static int arity(IntrinsicFunction f) {
    switch (f) {
      case MAX:
      case MIN:
        return -1;
      case MOD:
      case SIGN:
      case DIM:
      case DPROD:
      case INDEX:
      case ATAN2:
      case LGE:
      case LGT:
      case LLE:
      case LLT:
        return 2;
      case CMPLX:
        // CMPLX(x) or CMPLX(x, y)
        return -1;
      default:
        return 1;
    }
  }

  /**
   * @return true if the intrinsic can be called with argCount arguments
   */
  public static boolean acceptsArgCount(IntrinsicFunction f, int argCount) {
    int arity = arity(f);
    if (arity >= 0) {
      return argCount == arity;
    } else if (f == IntrinsicFunction.CMPLX) {
      return argCount == 1 || argCount == 2;
    } else {
      return argCount >= 2;
    }
  }
}
