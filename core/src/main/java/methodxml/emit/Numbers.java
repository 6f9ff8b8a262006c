//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats numeric literal values for {@code Number} elements. The text never depends on the
 * default locale. Doubles are written with 17 significant digits and floats with the shortest
 * digits that parse back to the same float, so that a reader recovers the exact bits; the default
 * formatting of either type does not guarantee that. All other values use their plain string
 * form.
 */
public class Numbers {

  /** Formats {@code value}, which is usually a boxed primitive. */
  public static String format (Object value) {
    if (value instanceof Double) return formatDouble((Double)value);
    if (value instanceof Float) return formatFloat((Float)value);
    if (value instanceof BigDecimal) return ((BigDecimal)value).toPlainString();
    return String.valueOf(value);
  }

  /** Formats {@code value} with 17 significant digits, trailing zeros dropped. */
  public static String formatDouble (double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) return Double.toString(value);
    if (value == 0) return zero(Double.doubleToRawLongBits(value) < 0);
    return layout(new BigDecimal(value).round(DOUBLE_CONTEXT), DOUBLE_DIGITS);
  }

  /** Formats {@code value} with the fewest digits that round-trip. */
  public static String formatFloat (float value) {
    if (Float.isNaN(value) || Float.isInfinite(value)) return Float.toString(value);
    if (value == 0) return zero(Float.floatToRawIntBits(value) < 0);
    BigDecimal exact = new BigDecimal(value);
    for (int digits = 1; digits < FLOAT_DIGITS; digits++) {
      BigDecimal rounded = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
      if (Float.parseFloat(rounded.toString()) == value) return layout(rounded, FLOAT_DIGITS);
    }
    return layout(exact.round(FLOAT_CONTEXT), FLOAT_DIGITS);
  }

  private static String zero (boolean negative) {
    return negative ? "-0" : "0";
  }

  // plain notation for decimal exponents in (-5, maxDigits), d.dddE+XX otherwise
  private static String layout (BigDecimal value, int maxDigits) {
    BigDecimal v = value.stripTrailingZeros();
    int exponent = v.precision() - v.scale() - 1;
    if (exponent > -5 && exponent < maxDigits) return v.toPlainString();

    String digits = v.unscaledValue().abs().toString();
    StringBuilder sb = new StringBuilder(digits.length() + 8);
    if (v.signum() < 0) sb.append('-');
    sb.append(digits.charAt(0));
    if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
    sb.append('E').append(exponent < 0 ? '-' : '+');
    int magnitude = Math.abs(exponent);
    if (magnitude < 10) sb.append('0');
    sb.append(magnitude);
    return sb.toString();
  }

  private static final int DOUBLE_DIGITS = 17;
  private static final int FLOAT_DIGITS = 9;
  private static final MathContext DOUBLE_CONTEXT =
    new MathContext(DOUBLE_DIGITS, RoundingMode.HALF_EVEN);
  private static final MathContext FLOAT_CONTEXT =
    new MathContext(FLOAT_DIGITS, RoundingMode.HALF_EVEN);

  private Numbers () {} // no instances
}
